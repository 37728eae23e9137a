package org.janelia.focusstack.measure;

import ij.process.FloatProcessor;

import java.util.Arrays;
import java.util.Random;

import org.janelia.focusstack.image.FloatImageOps;
import org.junit.Assert;
import org.junit.Test;

/**
 * Tests the {@link LocalDeviationMeasure} class.
 */
public class LocalDeviationMeasureTest {

    @Test
    public void testConstantImageHasZeroDeviation() {
        final float[] pixels = new float[23 * 17];
        Arrays.fill(pixels, 87.5f);

        final FloatProcessor deviation =
                new LocalDeviationMeasure().computeQualityMap(new FloatProcessor(23, 17, pixels));

        Assert.assertEquals("invalid width", 23, deviation.getWidth());
        Assert.assertEquals("invalid height", 17, deviation.getHeight());
        for (final float value : (float[]) deviation.getPixels()) {
            Assert.assertEquals("constant image should have zero deviation", 0.0f, value, 0.0f);
        }
    }

    @Test
    public void testMatchesDirectWindowVariance() {
        final Random random = new Random(42);
        final int width = 31;
        final int height = 19;
        final float[] pixels = new float[width * height];
        for (int i = 0; i < pixels.length; i++) {
            pixels[i] = random.nextFloat() * 255.0f;
        }
        final FloatProcessor source = new FloatProcessor(width, height, pixels);

        for (final int windowSize : new int[] { 1, 3, 5, 7 }) {
            final FloatProcessor deviation = new LocalDeviationMeasure(windowSize).computeQualityMap(source);
            for (int y = 0; y < height; y++) {
                for (int x = 0; x < width; x++) {
                    Assert.assertEquals("invalid deviation for window " + windowSize + " at (" + x + "," + y + ")",
                                        directVariance(source, x, y, windowSize),
                                        deviation.getf(x, y),
                                        0.05);
                }
            }
        }
    }

    @Test
    public void testEdgeHasHigherDeviationThanFlatArea() {
        final int width = 20;
        final int height = 10;
        final float[] pixels = new float[width * height];
        for (int y = 0; y < height; y++) {
            for (int x = width / 2; x < width; x++) {
                pixels[y * width + x] = 100.0f;
            }
        }

        final FloatProcessor deviation = new LocalDeviationMeasure().computeQualityMap(
                new FloatProcessor(width, height, pixels));

        Assert.assertEquals("flat area should have zero deviation", 0.0f, deviation.getf(2, 5), 0.0f);
        Assert.assertTrue("edge should have positive deviation", deviation.getf(10, 5) > 0.0f);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testEvenWindowSizeFails() {
        new LocalDeviationMeasure(4);
    }

    private static double directVariance(final FloatProcessor source,
                                         final int centerX,
                                         final int centerY,
                                         final int windowSize) {
        final int radius = (windowSize - 1) / 2;
        final FloatProcessor padded = FloatImageOps.padBorder(source, radius, radius, radius, radius);
        double sum = 0.0;
        double squareSum = 0.0;
        for (int y = centerY; y < centerY + windowSize; y++) {
            for (int x = centerX; x < centerX + windowSize; x++) {
                final double value = padded.getf(x, y);
                sum += value;
                squareSum += value * value;
            }
        }
        final double count = windowSize * windowSize;
        final double mean = sum / count;
        return Math.max(0.0, (squareSum / count) - (mean * mean));
    }
}
