package org.janelia.focusstack.image;

import org.junit.Assert;
import org.junit.Test;

/**
 * Tests the {@link GeneratingKernel} class.
 */
public class GeneratingKernelTest {

    @Test
    public void testDefaultKernel() {
        final GeneratingKernel kernel = GeneratingKernel.defaultKernel();
        final float[] tap = kernel.getTap();

        Assert.assertArrayEquals("invalid tap",
                                 new float[] { 0.05f, 0.25f, 0.4f, 0.25f, 0.05f }, tap, 1e-7f);

        double sum = 0.0;
        for (int i = 0; i < GeneratingKernel.SIZE; i++) {
            for (int j = 0; j < GeneratingKernel.SIZE; j++) {
                final float weight = kernel.getWeight(i, j);
                Assert.assertEquals("weight (" + i + "," + j + ") is not the outer product of the tap",
                                    tap[i] * tap[j], weight, 1e-7f);
                Assert.assertEquals("kernel is not symmetric at (" + i + "," + j + ")",
                                    kernel.getWeight(j, i), weight, 0.0f);
                sum += weight;
            }
        }
        Assert.assertEquals("weights should sum to 1", 1.0, sum, 1e-6);
    }

    @Test
    public void testBinomialKernel() {
        final float[] tap = GeneratingKernel.binomialKernel().getTap();
        final float[] expected = { 1 / 16f, 4 / 16f, 6 / 16f, 4 / 16f, 1 / 16f };
        Assert.assertArrayEquals("binomial tap should be exact", expected, tap, 0.0f);
    }

    @Test
    public void testTapsSumToOneForAnyA() {
        for (final double a : new double[] { 0.3, 0.375, 0.4, 0.6 }) {
            double sum = 0.0;
            for (final float t : new GeneratingKernel(a).getTap()) {
                sum += t;
            }
            Assert.assertEquals("taps for a=" + a + " should sum to 1", 1.0, sum, 1e-6);
        }
    }

}
