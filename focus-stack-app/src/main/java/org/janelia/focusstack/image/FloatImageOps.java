package org.janelia.focusstack.image;

import ij.process.Blitter;
import ij.process.FloatProcessor;

import net.imglib2.Cursor;
import net.imglib2.FinalInterval;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.algorithm.convolution.kernel.Kernel1D;
import net.imglib2.algorithm.convolution.kernel.SeparableKernelConvolution;
import net.imglib2.img.array.ArrayImg;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.img.basictypeaccess.array.FloatArray;
import net.imglib2.type.numeric.real.FloatType;
import net.imglib2.view.Views;

/**
 * Single channel image primitives used by the pyramid and the quality measures.
 *
 * Processors are wrapped as imglib2 {@link ArrayImg}s (sharing the pixel array) and all border
 * handling uses {@link Views#extendMirrorSingle}, i.e. reflection without repeating the edge
 * pixel: ... 2 1 | 0 1 2 ... n-1 | n-2 n-3 ...
 * None of the methods modify their inputs.
 */
public class FloatImageOps {

    private static final double[] DOWNSAMPLE_HALF_KERNEL = GeneratingKernel.binomialKernel().getHalfKernel();

    // zero insertion halves the mean along each axis
    private static final double[] UPSAMPLE_HALF_KERNEL = GeneratingKernel.binomialKernel().getScaledHalfKernel(2.0);

    private FloatImageOps() {
    }

    /**
     * @return copy of the image padded on each side by the specified number of pixels.
     */
    public static FloatProcessor padBorder(final FloatProcessor image,
                                           final int top,
                                           final int bottom,
                                           final int left,
                                           final int right) {
        final FinalInterval paddedInterval = new FinalInterval(
                new long[] { -left, -top },
                new long[] { image.getWidth() - 1 + right, image.getHeight() - 1 + bottom });
        return toProcessor(Views.interval(Views.extendMirrorSingle(wrap(image)), paddedInterval));
    }

    /**
     * Convolves the image with a 5x5 generating kernel, one separable pass per axis.
     *
     * @return filtered image with the same dimensions as the source.
     */
    public static FloatProcessor convolve(final FloatProcessor image,
                                          final GeneratingKernel kernel) {
        return convolve(image, kernel.getHalfKernel());
    }

    /**
     * Low-pass filters the image with the binomial kernel and keeps every other row and column.
     * Odd dimensions round up, so a 2x upsample of the result always covers the source.
     *
     * @return image with dimensions ((width + 1) / 2, (height + 1) / 2).
     */
    public static FloatProcessor downsample2x(final FloatProcessor image) {
        final FloatProcessor smoothed = convolve(image, DOWNSAMPLE_HALF_KERNEL);
        return toProcessor(Views.subsample(wrap(smoothed), 2));
    }

    /**
     * Inserts zero rows and columns between source pixels and interpolates them with the
     * binomial kernel scaled by 4 (so that constant images stay constant).
     *
     * @return image with dimensions (2 * width, 2 * height).
     */
    public static FloatProcessor upsample2x(final FloatProcessor image) {
        final int width = image.getWidth();
        final int height = image.getHeight();
        final int scaledWidth = 2 * width;

        final float[] source = (float[]) image.getPixels();
        final float[] inserted = new float[scaledWidth * 2 * height];
        for (int y = 0; y < height; y++) {
            final int sourceRowOffset = y * width;
            final int insertedRowOffset = 2 * y * scaledWidth;
            for (int x = 0; x < width; x++) {
                inserted[insertedRowOffset + 2 * x] = source[sourceRowOffset + x];
            }
        }

        return convolve(new FloatProcessor(scaledWidth, 2 * height, inserted), UPSAMPLE_HALF_KERNEL);
    }

    /**
     * @return the top-left width x height region of the image
     *         (or the image itself if it already has those dimensions).
     */
    public static FloatProcessor cropToSize(final FloatProcessor image,
                                            final int width,
                                            final int height) {
        if ((image.getWidth() == width) && (image.getHeight() == height)) {
            return image;
        }
        if ((image.getWidth() < width) || (image.getHeight() < height)) {
            throw new IllegalArgumentException(
                    "cannot crop " + image.getWidth() + "x" + image.getHeight() +
                    " image to larger size " + width + "x" + height);
        }
        final FloatProcessor cropSource = (FloatProcessor) image.duplicate();
        cropSource.setRoi(0, 0, width, height);
        return (FloatProcessor) cropSource.crop();
    }

    public static FloatProcessor add(final FloatProcessor a,
                                     final FloatProcessor b) {
        return combine(a, b, Blitter.ADD);
    }

    /**
     * @return a - b
     */
    public static FloatProcessor subtract(final FloatProcessor a,
                                          final FloatProcessor b) {
        return combine(a, b, Blitter.SUBTRACT);
    }

    public static FloatProcessor square(final FloatProcessor image) {
        final FloatProcessor squared = (FloatProcessor) image.duplicate();
        squared.sqr();
        return squared;
    }

    private static FloatProcessor combine(final FloatProcessor a,
                                          final FloatProcessor b,
                                          final int blitterMode) {
        if ((a.getWidth() != b.getWidth()) || (a.getHeight() != b.getHeight())) {
            throw new IllegalArgumentException(
                    "cannot combine " + a.getWidth() + "x" + a.getHeight() + " image with " +
                    b.getWidth() + "x" + b.getHeight() + " image");
        }
        final FloatProcessor result = (FloatProcessor) a.duplicate();
        result.copyBits(b, 0, 0, blitterMode);
        return result;
    }

    private static FloatProcessor convolve(final FloatProcessor image,
                                           final double[] halfKernel) {
        final int width = image.getWidth();
        final int height = image.getHeight();
        final float[] target = new float[width * height];
        SeparableKernelConvolution.convolve(Kernel1D.symmetric(new double[][] { halfKernel, halfKernel }),
                                            Views.extendMirrorSingle(wrap(image)),
                                            ArrayImgs.floats(target, width, height));
        return new FloatProcessor(width, height, target);
    }

    private static ArrayImg<FloatType, FloatArray> wrap(final FloatProcessor image) {
        return ArrayImgs.floats((float[]) image.getPixels(), image.getWidth(), image.getHeight());
    }

    private static FloatProcessor toProcessor(final RandomAccessibleInterval<FloatType> interval) {
        final int width = (int) interval.dimension(0);
        final int height = (int) interval.dimension(1);
        final float[] pixels = new float[width * height];
        final Cursor<FloatType> cursor = Views.flatIterable(interval).cursor();
        for (int i = 0; i < pixels.length; i++) {
            pixels[i] = cursor.next().get();
        }
        return new FloatProcessor(width, height, pixels);
    }

}
