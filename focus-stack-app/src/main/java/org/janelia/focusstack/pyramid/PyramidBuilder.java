package org.janelia.focusstack.pyramid;

import ij.process.FloatProcessor;

import java.util.List;

import org.janelia.focusstack.image.FloatImageOps;
import org.janelia.focusstack.image.MultiChannelImage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds Gaussian and Laplacian pyramids over an image stack and collapses fused pyramids
 * back to full resolution.
 *
 * Whenever an expanded (2x upsampled) image is larger than the finer level it is combined with,
 * the expanded image is cropped to the top-left region of the finer level.
 * Images are never resized by interpolation.
 */
public class PyramidBuilder {

    /**
     * @param  images  source stack (all images must have identical dimensions).
     * @param  depth   number of downsampled levels to build (must be non-negative).
     *
     * @return pyramid with depth + 1 levels where level 0 is the source stack.
     */
    public static Pyramid decomposeGaussian(final List<MultiChannelImage> images,
                                            final int depth) {
        validateDepth(depth);
        if (images.isEmpty()) {
            throw new IllegalArgumentException("cannot build a pyramid for an empty image stack");
        }

        final MultiChannelImage[][] levels = new MultiChannelImage[depth + 1][];
        levels[0] = images.toArray(new MultiChannelImage[0]);

        for (int level = 1; level <= depth; level++) {
            final MultiChannelImage[] finer = levels[level - 1];
            final MultiChannelImage[] coarser = new MultiChannelImage[finer.length];
            for (int stackIndex = 0; stackIndex < finer.length; stackIndex++) {
                coarser[stackIndex] = downsample(finer[stackIndex]);
            }
            levels[level] = coarser;
            LOG.debug("decomposeGaussian: built level {} with image size {}", level, coarser[0]);
        }

        return new Pyramid(levels);
    }

    /**
     * @param  images  source stack (all images must have identical dimensions).
     * @param  depth   number of detail levels to build (must be non-negative).
     *
     * @return pyramid with depth + 1 levels where levels 0 to depth - 1 hold band-pass detail
     *         (0 is the finest) and level depth holds the unchanged Gaussian base band.
     */
    public static Pyramid decomposeLaplacian(final List<MultiChannelImage> images,
                                             final int depth) {

        final Pyramid gaussian = decomposeGaussian(images, depth);
        final int stackSize = gaussian.getStackSize();

        final MultiChannelImage[][] levels = new MultiChannelImage[depth + 1][];
        levels[depth] = gaussian.getBaseBand().toArray(new MultiChannelImage[0]);

        for (int level = depth - 1; level >= 0; level--) {
            final MultiChannelImage[] laplacianLevel = new MultiChannelImage[stackSize];
            for (int stackIndex = 0; stackIndex < stackSize; stackIndex++) {
                final MultiChannelImage gaussianImage = gaussian.getImage(level, stackIndex);
                final MultiChannelImage expanded = expand(gaussian.getImage(level + 1, stackIndex),
                                                          gaussianImage.getWidth(),
                                                          gaussianImage.getHeight());
                laplacianLevel[stackIndex] = subtract(gaussianImage, expanded);
            }
            levels[level] = laplacianLevel;
        }

        return new Pyramid(levels);
    }

    /**
     * Reconstructs a full resolution image from a fused (one image per level) Laplacian pyramid.
     *
     * @param  fusedLevels  fused images ordered from finest (index 0) to coarsest.
     *
     * @return reconstructed image with the dimensions of level 0.
     */
    public static MultiChannelImage collapse(final List<MultiChannelImage> fusedLevels) {
        if (fusedLevels.isEmpty()) {
            throw new IllegalArgumentException("cannot collapse an empty pyramid");
        }

        MultiChannelImage image = fusedLevels.get(fusedLevels.size() - 1);
        for (int level = fusedLevels.size() - 2; level >= 0; level--) {
            final MultiChannelImage detail = fusedLevels.get(level);
            final MultiChannelImage expanded = expand(image, detail.getWidth(), detail.getHeight());
            image = add(expanded, detail);
        }
        return image;
    }

    private static MultiChannelImage downsample(final MultiChannelImage image) {
        final FloatProcessor[] channels = new FloatProcessor[image.getChannelCount()];
        for (int c = 0; c < channels.length; c++) {
            channels[c] = FloatImageOps.downsample2x(image.getChannel(c));
        }
        return new MultiChannelImage(channels);
    }

    private static MultiChannelImage expand(final MultiChannelImage image,
                                            final int targetWidth,
                                            final int targetHeight) {
        final FloatProcessor[] channels = new FloatProcessor[image.getChannelCount()];
        for (int c = 0; c < channels.length; c++) {
            final FloatProcessor upsampled = FloatImageOps.upsample2x(image.getChannel(c));
            channels[c] = FloatImageOps.cropToSize(upsampled, targetWidth, targetHeight);
        }
        return new MultiChannelImage(channels);
    }

    private static MultiChannelImage subtract(final MultiChannelImage a,
                                              final MultiChannelImage b) {
        final FloatProcessor[] channels = new FloatProcessor[a.getChannelCount()];
        for (int c = 0; c < channels.length; c++) {
            channels[c] = FloatImageOps.subtract(a.getChannel(c), b.getChannel(c));
        }
        return new MultiChannelImage(channels);
    }

    private static MultiChannelImage add(final MultiChannelImage a,
                                         final MultiChannelImage b) {
        final FloatProcessor[] channels = new FloatProcessor[a.getChannelCount()];
        for (int c = 0; c < channels.length; c++) {
            channels[c] = FloatImageOps.add(a.getChannel(c), b.getChannel(c));
        }
        return new MultiChannelImage(channels);
    }

    private static void validateDepth(final int depth) {
        if (depth < 0) {
            throw new IllegalArgumentException("pyramid depth must be non-negative but was " + depth);
        }
    }

    private static final Logger LOG = LoggerFactory.getLogger(PyramidBuilder.class);
}
