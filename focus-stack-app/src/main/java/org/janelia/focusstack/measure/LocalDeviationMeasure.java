package org.janelia.focusstack.measure;

import ij.process.FloatProcessor;

import org.janelia.focusstack.image.FloatImageOps;

/**
 * Computes the population variance of each pixel's square neighborhood ("deviation").
 *
 * The source is padded by (windowSize - 1) / 2 pixels with reflect 101 borders.
 * Running sums of values and squared values are kept per padded column (updated row by row)
 * and slid horizontally across each row, so every pixel costs a constant number of operations
 * regardless of the window size.
 */
public class LocalDeviationMeasure
        implements QualityMeasure {

    public static final int DEFAULT_WINDOW_SIZE = 5;

    private final int windowSize;

    public LocalDeviationMeasure() {
        this(DEFAULT_WINDOW_SIZE);
    }

    public LocalDeviationMeasure(final int windowSize) {
        if ((windowSize < 1) || (windowSize % 2 == 0)) {
            throw new IllegalArgumentException("windowSize must be a positive odd number but was " + windowSize);
        }
        this.windowSize = windowSize;
    }

    public int getWindowSize() {
        return windowSize;
    }

    @Override
    public FloatProcessor computeQualityMap(final FloatProcessor channel) {

        final int width = channel.getWidth();
        final int height = channel.getHeight();
        final int pad = (windowSize - 1) / 2;

        final FloatProcessor padded = FloatImageOps.padBorder(channel, pad, pad, pad, pad);
        final float[] paddedPixels = (float[]) padded.getPixels();
        final int paddedWidth = padded.getWidth();
        final double windowPixelCount = windowSize * windowSize;

        final double[] columnSums = new double[paddedWidth];
        final double[] columnSquareSums = new double[paddedWidth];
        final float[] deviations = new float[width * height];

        for (int y = 0; y < height; y++) {

            if (y == 0) {
                for (int windowRow = 0; windowRow < windowSize; windowRow++) {
                    addRow(paddedPixels, windowRow * paddedWidth, paddedWidth, columnSums, columnSquareSums, 1);
                }
            } else {
                addRow(paddedPixels, (y - 1) * paddedWidth, paddedWidth, columnSums, columnSquareSums, -1);
                addRow(paddedPixels, (y + windowSize - 1) * paddedWidth, paddedWidth, columnSums, columnSquareSums, 1);
            }

            double windowSum = 0.0;
            double windowSquareSum = 0.0;
            for (int windowColumn = 0; windowColumn < windowSize; windowColumn++) {
                windowSum += columnSums[windowColumn];
                windowSquareSum += columnSquareSums[windowColumn];
            }

            final int rowOffset = y * width;
            for (int x = 0; x < width; x++) {
                if (x > 0) {
                    final int leaving = x - 1;
                    final int entering = x + windowSize - 1;
                    windowSum += columnSums[entering] - columnSums[leaving];
                    windowSquareSum += columnSquareSums[entering] - columnSquareSums[leaving];
                }
                final double mean = windowSum / windowPixelCount;
                final double variance = (windowSquareSum / windowPixelCount) - (mean * mean);
                // rounding can leave a tiny negative residue for flat windows
                deviations[rowOffset + x] = (float) Math.max(0.0, variance);
            }
        }

        return new FloatProcessor(width, height, deviations);
    }

    private static void addRow(final float[] pixels,
                               final int rowOffset,
                               final int rowLength,
                               final double[] columnSums,
                               final double[] columnSquareSums,
                               final int sign) {
        for (int x = 0; x < rowLength; x++) {
            final double value = pixels[rowOffset + x];
            columnSums[x] += sign * value;
            columnSquareSums[x] += sign * value * value;
        }
    }

    @Override
    public String toString() {
        return "LocalDeviationMeasure{windowSize=" + windowSize + '}';
    }
}
