package org.janelia.focusstack.measure;

import ij.process.FloatProcessor;

import org.janelia.focusstack.image.FloatImageOps;
import org.janelia.focusstack.image.GeneratingKernel;

/**
 * Locally weighted detail energy: squared band-pass coefficients convolved with a
 * {@link GeneratingKernel}.
 */
public class RegionEnergyMeasure
        implements QualityMeasure {

    private final GeneratingKernel kernel;

    public RegionEnergyMeasure() {
        this(GeneratingKernel.defaultKernel());
    }

    public RegionEnergyMeasure(final GeneratingKernel kernel) {
        this.kernel = kernel;
    }

    @Override
    public FloatProcessor computeQualityMap(final FloatProcessor channel) {
        return FloatImageOps.convolve(FloatImageOps.square(channel), kernel);
    }

    @Override
    public String toString() {
        return "RegionEnergyMeasure{kernel=" + kernel + '}';
    }
}
