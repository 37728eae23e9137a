package org.janelia.focusstack.image;

import ij.process.ColorProcessor;
import ij.process.FloatProcessor;
import ij.process.ImageProcessor;

import java.util.Arrays;

/**
 * Floating point image with a fixed number of channels.
 * Each channel is held as an ImageJ {@link FloatProcessor} (flat float pixel array).
 *
 * Instances are never modified once the pipeline has produced them:
 * channel processors returned by {@link #getChannel} must be treated as read-only.
 */
public class MultiChannelImage {

    public static final int DEFAULT_CHANNEL_COUNT = 3;

    private final int width;
    private final int height;
    private final FloatProcessor[] channels;

    public MultiChannelImage(final FloatProcessor... channels) {
        if (channels.length == 0) {
            throw new IllegalArgumentException("image must have at least one channel");
        }
        this.width = channels[0].getWidth();
        this.height = channels[0].getHeight();
        for (int c = 1; c < channels.length; c++) {
            if ((channels[c].getWidth() != width) || (channels[c].getHeight() != height)) {
                throw new IllegalArgumentException(
                        "channel " + c + " is " + channels[c].getWidth() + "x" + channels[c].getHeight() +
                        " but channel 0 is " + width + "x" + height);
            }
        }
        this.channels = channels.clone();
    }

    /**
     * Converts an ImageJ processor to a 3-channel floating point image.
     * RGB pixels are split into red, green and blue channels.
     * Gray scale pixels (8-bit, 16-bit or float) are copied into every channel.
     */
    public static MultiChannelImage fromImageProcessor(final ImageProcessor ip) {
        final FloatProcessor[] channels = new FloatProcessor[DEFAULT_CHANNEL_COUNT];
        if (ip instanceof ColorProcessor) {
            final ColorProcessor colorProcessor = (ColorProcessor) ip;
            for (int c = 0; c < channels.length; c++) {
                channels[c] = colorProcessor.toFloat(c, null);
            }
        } else {
            final FloatProcessor gray = ip.convertToFloatProcessor();
            channels[0] = gray;
            for (int c = 1; c < channels.length; c++) {
                channels[c] = (FloatProcessor) gray.duplicate();
            }
        }
        return new MultiChannelImage(channels);
    }

    /**
     * @return image with a constant value in every channel.
     */
    public static MultiChannelImage filled(final int width,
                                           final int height,
                                           final int channelCount,
                                           final float value) {
        final FloatProcessor[] channels = new FloatProcessor[channelCount];
        for (int c = 0; c < channelCount; c++) {
            final float[] pixels = new float[width * height];
            Arrays.fill(pixels, value);
            channels[c] = new FloatProcessor(width, height, pixels);
        }
        return new MultiChannelImage(channels);
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public int getChannelCount() {
        return channels.length;
    }

    /**
     * @return processor for the specified channel (shared, do not modify).
     */
    public FloatProcessor getChannel(final int channel) {
        return channels[channel];
    }

    public float getf(final int x,
                      final int y,
                      final int channel) {
        return channels[channel].getf(x, y);
    }

    public boolean hasSameDimensions(final MultiChannelImage that) {
        return (width == that.width) && (height == that.height) && (channels.length == that.channels.length);
    }

    /**
     * Converts this image to 8-bit RGB, rounding and clamping every value to [0, 255].
     * Gray (single channel) images are written into all three color channels.
     */
    public ColorProcessor toColorProcessor() {
        final int pixelCount = width * height;
        final byte[][] rgb = new byte[DEFAULT_CHANNEL_COUNT][pixelCount];
        for (int c = 0; c < DEFAULT_CHANNEL_COUNT; c++) {
            final float[] source = (float[]) channels[Math.min(c, channels.length - 1)].getPixels();
            for (int i = 0; i < pixelCount; i++) {
                rgb[c][i] = (byte) clampToByte(source[i]);
            }
        }
        final ColorProcessor colorProcessor = new ColorProcessor(width, height);
        colorProcessor.setRGB(rgb[0], rgb[1], rgb[2]);
        return colorProcessor;
    }

    @Override
    public String toString() {
        return width + "x" + height + "x" + channels.length;
    }

    private static int clampToByte(final float value) {
        final int rounded = Math.round(value);
        return Math.max(0, Math.min(255, rounded));
    }

}
