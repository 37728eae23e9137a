package org.janelia.focusstack.client;

import ij.measure.Measurements;
import ij.plugin.filter.GaussianBlur;
import ij.process.ColorProcessor;
import ij.process.FloatProcessor;
import ij.process.ImageProcessor;
import ij.process.ImageStatistics;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drops blurry members from a focus stack before fusion.
 * <p>
 * The focus value of an image is derived from the spread of its Laplacian: the image is
 * converted to 8-bit luminance (0.299 R + 0.587 G + 0.114 B), smoothed with a small Gaussian
 * (sigma 1.1, comparable to a 5x5 kernel), filtered with a 5x5 Laplacian, and the population
 * standard deviation s of the result gives focus value (s / 25)^2.
 * <p>
 * Images with a focus value at or above the threshold are kept.  If that leaves fewer than
 * {@link #MINIMUM_STACK_SIZE} images, all images with a focus value of at least
 * {@link #FALLBACK_FRACTION} times the best focus value are kept instead.
 */
public class StackFilter implements Serializable {

    public static final int MINIMUM_STACK_SIZE = 5;
    public static final double FALLBACK_FRACTION = 0.66;

    private static final double RED_WEIGHT = 0.299;
    private static final double GREEN_WEIGHT = 0.587;
    private static final double BLUE_WEIGHT = 0.114;

    private static final double BLUR_SIGMA = 1.1;
    private static final double BLUR_ACCURACY = 0.01;

    private static final float[] LAPLACIAN_KERNEL = {
            2,  4,   4,  4, 2,
            4,  0,  -8,  0, 4,
            4, -8, -24, -8, 4,
            4,  0,  -8,  0, 4,
            2,  4,   4,  4, 2
    };

    private final double threshold;

    public StackFilter(final double threshold) {
        if (threshold < 0) {
            throw new IllegalArgumentException("threshold must be non-negative");
        }
        this.threshold = threshold;
    }

    public double getThreshold() {
        return threshold;
    }

    /**
     * @return focus value for the specified image (larger is sharper).
     */
    public static double computeFocusValue(final ImageProcessor ip) {
        final FloatProcessor laplacian = filterLaplacian(ip);
        final ImageStatistics statistics = ImageStatistics.getStatistics(laplacian, Measurements.STD_DEV, null);
        // ImageStatistics reports the sample deviation, the focus value uses the population variance
        final double pixelCount = statistics.pixelCount;
        final double populationVariance = statistics.stdDev * statistics.stdDev * (pixelCount - 1) / pixelCount;
        return populationVariance / (25.0 * 25.0);
    }

    /**
     * @return luminance of the image (rounded to 8 bits for RGB sources), smoothed and
     *         filtered with the 5x5 Laplacian.
     */
    static FloatProcessor filterLaplacian(final ImageProcessor ip) {
        final FloatProcessor gray = toGray(ip);
        new GaussianBlur().blurGaussian(gray, BLUR_SIGMA, BLUR_SIGMA, BLUR_ACCURACY);
        gray.convolve(LAPLACIAN_KERNEL, 5, 5);
        return gray;
    }

    static FloatProcessor toGray(final ImageProcessor ip) {
        final FloatProcessor gray;
        if (ip instanceof ColorProcessor) {
            final ColorProcessor weighted = (ColorProcessor) ip.duplicate();
            weighted.setRGBWeights(RED_WEIGHT, GREEN_WEIGHT, BLUE_WEIGHT);
            gray = weighted.convertToByte(false).convertToFloatProcessor();
        } else if (ip instanceof FloatProcessor) {
            gray = (FloatProcessor) ip.duplicate();
        } else {
            gray = ip.convertToFloatProcessor();
        }
        return gray;
    }

    /**
     * @return indexes (in stack order) of the images to keep.
     */
    public List<Integer> selectIndexes(final double[] focusValues) {
        final List<Integer> selected = new ArrayList<>();
        if (focusValues.length == 0) {
            return selected;
        }

        int maxIndex = 0;
        for (int i = 0; i < focusValues.length; i++) {
            if (focusValues[i] > focusValues[maxIndex]) {
                maxIndex = i;
            }
            if (focusValues[i] >= threshold) {
                selected.add(i);
            }
        }

        LOG.info("selectIndexes: max focus value {} at {}/{} ({}%)",
                 String.format("%.2f", focusValues[maxIndex]), maxIndex, focusValues.length,
                 100 * maxIndex / focusValues.length);

        if (selected.size() < MINIMUM_STACK_SIZE) {
            final double fallbackThreshold = focusValues[maxIndex] * FALLBACK_FRACTION;
            LOG.info("selectIndexes: only {} images reach threshold {}, keeping images with focus value >= {}",
                     selected.size(), threshold, String.format("%.2f", fallbackThreshold));
            selected.clear();
            for (int i = 0; i < focusValues.length; i++) {
                if (focusValues[i] >= fallbackThreshold) {
                    selected.add(i);
                }
            }
        }

        return selected;
    }

    /**
     * @return the images to keep (in stack order).
     */
    public List<ImageProcessor> filter(final List<ImageProcessor> images) {
        final double[] focusValues = new double[images.size()];
        final StringBuilder focusValuesText = new StringBuilder();
        for (int i = 0; i < focusValues.length; i++) {
            focusValues[i] = computeFocusValue(images.get(i));
            focusValuesText.append(String.format(" %.2f", focusValues[i]));
        }

        LOG.info("filter: focus values are{}", focusValuesText);

        final List<ImageProcessor> kept = new ArrayList<>();
        for (final Integer index : selectIndexes(focusValues)) {
            kept.add(images.get(index));
        }
        return kept;
    }

    private static final Logger LOG = LoggerFactory.getLogger(StackFilter.class);
}
