package org.janelia.focusstack.image;

import java.io.Serializable;

/**
 * Symmetric, separable 5x5 low-pass "generating kernel" built from the one dimensional tap
 * <pre>
 *     [ 0.25 - a/2, 0.25, a, 0.25, 0.25 - a/2 ]
 * </pre>
 * The two dimensional weights are the outer product of the tap with itself.
 *
 * With {@code a = 0.4} the kernel is used to aggregate region energy.
 * With {@code a = 0.375} the tap is the binomial [1 4 6 4 1] / 16 used by the pyramid
 * down and up sampling operations.
 */
public class GeneratingKernel
        implements Serializable {

    public static final int SIZE = 5;
    public static final int RADIUS = SIZE / 2;

    public static final double DEFAULT_A = 0.4;
    public static final double BINOMIAL_A = 0.375;

    private final double a;
    private final float[] tap;
    private final float[] weights;
    private final double[] halfKernel;

    public GeneratingKernel(final double a) {
        this.a = a;

        final double outer = 0.25 - (a / 2.0);
        final double[] tapValues = { outer, 0.25, a, 0.25, outer };
        this.halfKernel = new double[] { a, 0.25, outer };

        this.tap = new float[SIZE];
        this.weights = new float[SIZE * SIZE];
        for (int i = 0; i < SIZE; i++) {
            this.tap[i] = (float) tapValues[i];
            for (int j = 0; j < SIZE; j++) {
                this.weights[i * SIZE + j] = (float) (tapValues[i] * tapValues[j]);
            }
        }
    }

    public static GeneratingKernel defaultKernel() {
        return new GeneratingKernel(DEFAULT_A);
    }

    public static GeneratingKernel binomialKernel() {
        return new GeneratingKernel(BINOMIAL_A);
    }

    public double getA() {
        return a;
    }

    /**
     * @return copy of the one dimensional tap.
     */
    public float[] getTap() {
        return tap.clone();
    }

    /**
     * @return weight for kernel row {@code i} and column {@code j} (both in [0, 5)).
     */
    public float getWeight(final int i,
                           final int j) {
        return weights[i * SIZE + j];
    }

    /**
     * @return copy of the tap from the center outwards ({@code [a, 0.25, 0.25 - a/2]}),
     *         the form expected by imglib2's symmetric separable convolution.
     */
    public double[] getHalfKernel() {
        return halfKernel.clone();
    }

    /**
     * @return copy of the half kernel with every weight multiplied by the specified factor.
     */
    public double[] getScaledHalfKernel(final double factor) {
        final double[] scaled = new double[halfKernel.length];
        for (int i = 0; i < scaled.length; i++) {
            scaled[i] = halfKernel[i] * factor;
        }
        return scaled;
    }

    @Override
    public String toString() {
        return "GeneratingKernel{a=" + a + '}';
    }
}
