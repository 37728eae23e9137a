package org.janelia.focusstack.fusion;

import ij.process.FloatProcessor;

import java.util.List;

import org.janelia.focusstack.image.MultiChannelImage;
import org.janelia.focusstack.measure.QualityMeasure;

/**
 * Fuses one pyramid level by picking, for every pixel and channel, the source value from the
 * stack member with the highest quality measure value.
 *
 * Ties resolve to the lowest stack index.
 */
public class FusionSelector {

    private final QualityMeasure qualityMeasure;

    public FusionSelector(final QualityMeasure qualityMeasure) {
        this.qualityMeasure = qualityMeasure;
    }

    public QualityMeasure getQualityMeasure() {
        return qualityMeasure;
    }

    /**
     * @param  images  stack of images with identical dimensions (one pyramid level).
     *
     * @return fused image with the same dimensions and channel count as the stack images.
     */
    public MultiChannelImage fuse(final List<MultiChannelImage> images) {
        if (images.isEmpty()) {
            throw new IllegalArgumentException("cannot fuse an empty image stack");
        }

        final int channelCount = images.get(0).getChannelCount();
        final FloatProcessor[] fusedChannels = new FloatProcessor[channelCount];
        for (int c = 0; c < channelCount; c++) {
            fusedChannels[c] = fuseChannel(images, c);
        }
        return new MultiChannelImage(fusedChannels);
    }

    /**
     * @return fused pixels for one channel of the stack.
     */
    public FloatProcessor fuseChannel(final List<MultiChannelImage> images,
                                      final int channel) {
        final FloatProcessor[] sources = new FloatProcessor[images.size()];
        final FloatProcessor[] qualityMaps = new FloatProcessor[images.size()];
        for (int i = 0; i < sources.length; i++) {
            sources[i] = images.get(i).getChannel(channel);
            qualityMaps[i] = qualityMeasure.computeQualityMap(sources[i]);
        }
        return select(qualityMaps, sources);
    }

    /**
     * @param  qualityMaps  one quality map per stack member (identical dimensions).
     *
     * @return per-pixel index of the first stack member with the maximum quality value.
     */
    public static int[] selectIndices(final FloatProcessor[] qualityMaps) {
        final int pixelCount = qualityMaps[0].getPixelCount();
        final int[] bestIndexes = new int[pixelCount];
        final float[] bestValues = ((float[]) qualityMaps[0].getPixels()).clone();

        for (int i = 1; i < qualityMaps.length; i++) {
            if (qualityMaps[i].getPixelCount() != pixelCount) {
                throw new IllegalArgumentException("quality map " + i + " has " + qualityMaps[i].getPixelCount() +
                                                   " pixels but map 0 has " + pixelCount + " pixels");
            }
            final float[] values = (float[]) qualityMaps[i].getPixels();
            for (int p = 0; p < pixelCount; p++) {
                if (values[p] > bestValues[p]) {
                    bestValues[p] = values[p];
                    bestIndexes[p] = i;
                }
            }
        }
        return bestIndexes;
    }

    /**
     * @return processor holding, for every pixel, the source value at the best quality index.
     */
    public static FloatProcessor select(final FloatProcessor[] qualityMaps,
                                        final FloatProcessor[] sources) {
        if (qualityMaps.length != sources.length) {
            throw new IllegalArgumentException(qualityMaps.length + " quality maps provided for " +
                                               sources.length + " sources");
        }

        final int[] bestIndexes = selectIndices(qualityMaps);
        final float[][] sourcePixels = new float[sources.length][];
        for (int i = 0; i < sources.length; i++) {
            sourcePixels[i] = (float[]) sources[i].getPixels();
        }

        final float[] fused = new float[bestIndexes.length];
        for (int p = 0; p < fused.length; p++) {
            fused[p] = sourcePixels[bestIndexes[p]][p];
        }
        return new FloatProcessor(sources[0].getWidth(), sources[0].getHeight(), fused);
    }

}
