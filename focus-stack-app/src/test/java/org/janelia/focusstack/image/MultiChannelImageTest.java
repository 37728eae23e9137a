package org.janelia.focusstack.image;

import ij.process.ByteProcessor;
import ij.process.ColorProcessor;
import ij.process.FloatProcessor;

import org.junit.Assert;
import org.junit.Test;

/**
 * Tests the {@link MultiChannelImage} class.
 */
public class MultiChannelImageTest {

    @Test
    public void testFromColorProcessor() {
        final ColorProcessor colorProcessor = new ColorProcessor(2, 1);
        colorProcessor.set(0, 0, (10 << 16) | (20 << 8) | 30);
        colorProcessor.set(1, 0, (255 << 16) | 128);

        final MultiChannelImage image = MultiChannelImage.fromImageProcessor(colorProcessor);

        Assert.assertEquals("invalid size", "2x1x3", image.toString());
        Assert.assertEquals("invalid red", 10.0f, image.getf(0, 0, 0), 0.0f);
        Assert.assertEquals("invalid green", 20.0f, image.getf(0, 0, 1), 0.0f);
        Assert.assertEquals("invalid blue", 30.0f, image.getf(0, 0, 2), 0.0f);
        Assert.assertEquals("invalid red", 255.0f, image.getf(1, 0, 0), 0.0f);
        Assert.assertEquals("invalid blue", 128.0f, image.getf(1, 0, 2), 0.0f);
    }

    @Test
    public void testFromGrayProcessor() {
        final ByteProcessor byteProcessor = new ByteProcessor(3, 2);
        byteProcessor.set(2, 1, 77);

        final MultiChannelImage image = MultiChannelImage.fromImageProcessor(byteProcessor);

        for (int c = 0; c < 3; c++) {
            Assert.assertEquals("gray value should be copied to channel " + c, 77.0f, image.getf(2, 1, c), 0.0f);
        }
        Assert.assertNotSame("channels should not share pixels",
                             image.getChannel(0).getPixels(), image.getChannel(1).getPixels());
    }

    @Test
    public void testToColorProcessorRoundsAndClamps() {
        final FloatProcessor red = new FloatProcessor(4, 1, new float[] { -12.0f, 99.5f, 254.4f, 300.0f });
        final FloatProcessor green = new FloatProcessor(4, 1, new float[] { 0.4f, 0.6f, 1.0f, 2.0f });
        final FloatProcessor blue = new FloatProcessor(4, 1, new float[] { 7.0f, 7.0f, 7.0f, 7.0f });

        final ColorProcessor colorProcessor = new MultiChannelImage(red, green, blue).toColorProcessor();

        final int[] expectedRed = { 0, 100, 254, 255 };
        final int[] expectedGreen = { 0, 1, 1, 2 };
        for (int x = 0; x < 4; x++) {
            final int rgb = colorProcessor.get(x, 0);
            Assert.assertEquals("invalid red at " + x, expectedRed[x], (rgb >> 16) & 0xff);
            Assert.assertEquals("invalid green at " + x, expectedGreen[x], (rgb >> 8) & 0xff);
            Assert.assertEquals("invalid blue at " + x, 7, rgb & 0xff);
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void testMismatchedChannelsFail() {
        new MultiChannelImage(new FloatProcessor(4, 4), new FloatProcessor(4, 5));
    }
}
