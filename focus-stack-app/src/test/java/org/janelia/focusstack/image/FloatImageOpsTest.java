package org.janelia.focusstack.image;

import ij.process.FloatProcessor;

import java.util.Arrays;

import org.junit.Assert;
import org.junit.Test;

/**
 * Tests the {@link FloatImageOps} class.
 */
public class FloatImageOpsTest {

    @Test
    public void testPadBorder() {
        final FloatProcessor image = new FloatProcessor(3, 2, new float[] {
                1, 2, 3,
                4, 5, 6 });

        final FloatProcessor padded = FloatImageOps.padBorder(image, 1, 1, 2, 0);

        Assert.assertEquals("invalid padded width", 5, padded.getWidth());
        Assert.assertEquals("invalid padded height", 4, padded.getHeight());
        final float[] expected = {
                6, 5, 4, 5, 6,
                3, 2, 1, 2, 3,
                6, 5, 4, 5, 6,
                3, 2, 1, 2, 3 };
        Assert.assertArrayEquals("invalid padded pixels", expected, (float[]) padded.getPixels(), 0.0f);
    }

    @Test
    public void testPadBorderWiderThanImage() {
        final FloatProcessor image = new FloatProcessor(2, 1, new float[] { 1, 2 });

        final FloatProcessor padded = FloatImageOps.padBorder(image, 2, 0, 3, 1);

        Assert.assertEquals("invalid padded width", 6, padded.getWidth());
        Assert.assertEquals("invalid padded height", 3, padded.getHeight());
        final float[] expectedRow = { 2, 1, 2, 1, 2, 1 };
        for (int y = 0; y < 3; y++) {
            for (int x = 0; x < expectedRow.length; x++) {
                Assert.assertEquals("reflection should repeat at (" + x + "," + y + ")",
                                    expectedRow[x], padded.getf(x, y), 0.0f);
            }
        }
    }

    @Test
    public void testConvolveMatchesDirectReflectedSum() {
        final FloatProcessor image = new FloatProcessor(7, 6);
        for (int i = 0; i < image.getPixelCount(); i++) {
            image.setf(i, (i * 37) % 11);
        }
        final GeneratingKernel kernel = GeneratingKernel.defaultKernel();

        final FloatProcessor filtered = FloatImageOps.convolve(image, kernel);
        final FloatProcessor padded = FloatImageOps.padBorder(image, 2, 2, 2, 2);

        for (int y = 0; y < image.getHeight(); y++) {
            for (int x = 0; x < image.getWidth(); x++) {
                double expected = 0.0;
                for (int i = 0; i < GeneratingKernel.SIZE; i++) {
                    for (int j = 0; j < GeneratingKernel.SIZE; j++) {
                        expected += kernel.getWeight(i, j) * padded.getf(x + j, y + i);
                    }
                }
                Assert.assertEquals("invalid filtered value at (" + x + "," + y + ")",
                                    expected, filtered.getf(x, y), 1e-4);
            }
        }
    }

    @Test
    public void testConvolveImpulse() {
        final FloatProcessor impulse = new FloatProcessor(9, 9);
        impulse.setf(4, 4, 1.0f);

        final GeneratingKernel kernel = GeneratingKernel.defaultKernel();
        final FloatProcessor filtered = FloatImageOps.convolve(impulse, kernel);

        for (int i = 0; i < GeneratingKernel.SIZE; i++) {
            for (int j = 0; j < GeneratingKernel.SIZE; j++) {
                Assert.assertEquals("impulse response should reproduce the kernel at (" + i + "," + j + ")",
                                    kernel.getWeight(i, j), filtered.getf(2 + j, 2 + i), 1e-7f);
            }
        }
        Assert.assertEquals("pixels outside the kernel footprint should be zero",
                            0.0f, filtered.getf(0, 0), 0.0f);
    }

    @Test
    public void testDownsampleSizes() {
        Assert.assertEquals(8, FloatImageOps.downsample2x(new FloatProcessor(16, 15)).getWidth());
        Assert.assertEquals(8, FloatImageOps.downsample2x(new FloatProcessor(16, 15)).getHeight());
        Assert.assertEquals(4, FloatImageOps.downsample2x(new FloatProcessor(7, 1)).getWidth());
        Assert.assertEquals(1, FloatImageOps.downsample2x(new FloatProcessor(7, 1)).getHeight());
    }

    @Test
    public void testResamplingPreservesConstantImages() {
        final float value = 123.25f;
        final FloatProcessor constant = constantImage(13, 10, value);

        final FloatProcessor downsampled = FloatImageOps.downsample2x(constant);
        assertAllPixels("downsampled", downsampled, value);

        final FloatProcessor upsampled = FloatImageOps.upsample2x(constant);
        Assert.assertEquals("invalid upsampled width", 26, upsampled.getWidth());
        Assert.assertEquals("invalid upsampled height", 20, upsampled.getHeight());
        assertAllPixels("upsampled", upsampled, value);
    }

    @Test
    public void testUpsampleKeepsSourceSamplesOfSmoothRamp() {
        final FloatProcessor ramp = new FloatProcessor(8, 8);
        for (int y = 0; y < 8; y++) {
            for (int x = 0; x < 8; x++) {
                ramp.setf(x, y, x);
            }
        }
        final FloatProcessor upsampled = FloatImageOps.upsample2x(ramp);
        // linear interior is reproduced exactly: even samples keep values, odd samples interpolate
        Assert.assertEquals(3.0f, upsampled.getf(6, 5), 1e-6f);
        Assert.assertEquals(3.5f, upsampled.getf(7, 5), 1e-6f);
    }

    @Test
    public void testCropToSize() {
        final FloatProcessor image = new FloatProcessor(4, 3, new float[] {
                1, 2, 3, 4,
                5, 6, 7, 8,
                9, 10, 11, 12 });

        Assert.assertSame("image with target size should be returned as is",
                          image, FloatImageOps.cropToSize(image, 4, 3));

        final FloatProcessor cropped = FloatImageOps.cropToSize(image, 3, 2);
        Assert.assertArrayEquals("invalid cropped pixels",
                                 new float[] { 1, 2, 3, 5, 6, 7 }, (float[]) cropped.getPixels(), 0.0f);
        Assert.assertEquals("source should not be modified", 4, image.getRoi().width);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testCropToLargerSizeFails() {
        FloatImageOps.cropToSize(new FloatProcessor(4, 4), 5, 4);
    }

    @Test
    public void testArithmetic() {
        final FloatProcessor a = new FloatProcessor(2, 1, new float[] { 5, -2 });
        final FloatProcessor b = new FloatProcessor(2, 1, new float[] { 3, 4 });

        Assert.assertArrayEquals(new float[] { 8, 2 }, (float[]) FloatImageOps.add(a, b).getPixels(), 0.0f);
        Assert.assertArrayEquals(new float[] { 2, -6 }, (float[]) FloatImageOps.subtract(a, b).getPixels(), 0.0f);
        Assert.assertArrayEquals(new float[] { 25, 4 }, (float[]) FloatImageOps.square(a).getPixels(), 0.0f);
        Assert.assertArrayEquals("inputs should not be modified",
                                 new float[] { 5, -2 }, (float[]) a.getPixels(), 0.0f);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testAddMismatchedSizesFails() {
        FloatImageOps.add(new FloatProcessor(2, 2), new FloatProcessor(2, 3));
    }

    static FloatProcessor constantImage(final int width,
                                        final int height,
                                        final float value) {
        final float[] pixels = new float[width * height];
        Arrays.fill(pixels, value);
        return new FloatProcessor(width, height, pixels);
    }

    private static void assertAllPixels(final String context,
                                        final FloatProcessor image,
                                        final float expected) {
        final float[] pixels = (float[]) image.getPixels();
        for (int i = 0; i < pixels.length; i++) {
            Assert.assertEquals(context + " pixel " + i + " changed", expected, pixels[i], 0.0f);
        }
    }
}
