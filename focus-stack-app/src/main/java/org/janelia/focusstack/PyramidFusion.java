package org.janelia.focusstack;

import ij.process.ImageProcessor;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.janelia.focusstack.fusion.FusionSelector;
import org.janelia.focusstack.image.MultiChannelImage;
import org.janelia.focusstack.pyramid.Pyramid;
import org.janelia.focusstack.pyramid.PyramidBuilder;
import org.janelia.focusstack.util.ProcessTimer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fuses a focus stack (images of one scene taken at different focus distances) into a single
 * image that is sharp everywhere.
 *
 * The stack is decomposed into Laplacian pyramids.  The coarsest (base) band is fused by
 * local deviation and every detail band is fused by region energy.  The fused pyramid is then
 * collapsed back to full resolution.
 *
 * Instances only hold immutable configuration, so one instance can fuse many stacks concurrently.
 */
public class PyramidFusion {

    private final FusionParameters parameters;
    private final FusionSelector baseBandSelector;
    private final FusionSelector detailBandSelector;

    public PyramidFusion() {
        this(new FusionParameters());
    }

    public PyramidFusion(final FusionParameters parameters)
            throws IllegalArgumentException {
        parameters.validate();
        this.parameters = parameters;
        this.baseBandSelector = new FusionSelector(parameters.buildBaseBandMeasure());
        this.detailBandSelector = new FusionSelector(parameters.buildDetailBandMeasure());
    }

    public FusionParameters getParameters() {
        return parameters;
    }

    /**
     * Converts the specified ImageJ processors to 3-channel floating point images and fuses them.
     *
     * @throws FusionException
     *   if the stack is empty, the images differ in size, or the images are too small.
     */
    public MultiChannelImage fuseProcessors(final List<? extends ImageProcessor> processors)
            throws FusionException {

        validateProcessorDimensions(processors);

        final List<MultiChannelImage> images = new ArrayList<>(processors.size());
        for (final ImageProcessor ip : processors) {
            images.add(MultiChannelImage.fromImageProcessor(ip));
        }

        return fuse(images);
    }

    /**
     * @param  images  focus stack ordered by stack index (ties in quality favor lower indexes).
     *
     * @return fused image with the same dimensions and channel count as the stack images.
     *
     * @throws FusionException
     *   if the stack is empty, the images differ in size, or the images are too small.
     */
    public MultiChannelImage fuse(final List<MultiChannelImage> images)
            throws FusionException {

        validateDimensions(images);

        final MultiChannelImage first = images.get(0);
        final int depth = computeDepth(first.getWidth(), first.getHeight(), parameters.getMinSize());

        LOG.info("fuse: entry, fusing {} images of size {} with depth {}", images.size(), first, depth);

        final ProcessTimer timer = new ProcessTimer();

        final Pyramid pyramid = PyramidBuilder.decomposeLaplacian(images, depth);

        LOG.debug("fuse: decomposed {}", pyramid);

        final List<MultiChannelImage> fusedLevels = fusePyramid(pyramid);

        LOG.debug("fuse: fused {} levels", fusedLevels.size());

        final MultiChannelImage fused = PyramidBuilder.collapse(fusedLevels);

        LOG.info("fuse: exit, fused {} images in {}", images.size(), timer);

        return fused;
    }

    /**
     * @return one fused image per pyramid level (finest first).
     */
    public List<MultiChannelImage> fusePyramid(final Pyramid pyramid) {
        final MultiChannelImage[] fusedLevels = new MultiChannelImage[pyramid.getLevelCount()];
        final int depth = pyramid.getDepth();

        fusedLevels[depth] = baseBandSelector.fuse(pyramid.getBaseBand());
        for (int level = depth - 1; level >= 0; level--) {
            fusedLevels[level] = detailBandSelector.fuse(pyramid.getLevel(level));
        }

        return Arrays.asList(fusedLevels);
    }

    /**
     * @return floor(log2(min(width, height) / minSize)).
     *
     * @throws ImageTooSmallException
     *   if the smallest side is less than minSize (depth would be negative).
     */
    public static int computeDepth(final int width,
                                   final int height,
                                   final int minSize)
            throws ImageTooSmallException {

        final long smallestSide = Math.min(width, height);
        if (smallestSide < minSize) {
            throw new ImageTooSmallException("smallest image side " + smallestSide +
                                             " is less than the minimum pyramid size " + minSize);
        }

        int depth = 0;
        long levelSize = (long) minSize * 2;
        while (levelSize <= smallestSide) {
            depth++;
            levelSize *= 2;
        }
        return depth;
    }

    private static void validateDimensions(final List<MultiChannelImage> images)
            throws FusionException {
        if ((images == null) || images.isEmpty()) {
            throw new FusionException("no images to fuse");
        }
        final MultiChannelImage first = images.get(0);
        for (int i = 1; i < images.size(); i++) {
            final MultiChannelImage image = images.get(i);
            if (! first.hasSameDimensions(image)) {
                throw new DimensionMismatchException("image " + i + " is " + image + " but image 0 is " + first);
            }
        }
    }

    private static void validateProcessorDimensions(final List<? extends ImageProcessor> processors)
            throws FusionException {
        if ((processors == null) || processors.isEmpty()) {
            throw new FusionException("no images to fuse");
        }
        final ImageProcessor first = processors.get(0);
        for (int i = 1; i < processors.size(); i++) {
            final ImageProcessor ip = processors.get(i);
            if ((ip.getWidth() != first.getWidth()) || (ip.getHeight() != first.getHeight())) {
                throw new DimensionMismatchException("image " + i + " is " + ip.getWidth() + "x" + ip.getHeight() +
                                                     " but image 0 is " + first.getWidth() + "x" + first.getHeight());
            }
        }
    }

    private static final Logger LOG = LoggerFactory.getLogger(PyramidFusion.class);
}
