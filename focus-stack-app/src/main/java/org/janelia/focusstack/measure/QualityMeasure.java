package org.janelia.focusstack.measure;

import ij.process.FloatProcessor;

import java.io.Serializable;

/**
 * Common interface for per-pixel quality (sharpness) measures used to pick the best source
 * image at each pixel.
 */
public interface QualityMeasure
        extends Serializable {

    /**
     * @param  channel  single channel source pixels (not modified).
     *
     * @return map with the same dimensions as the source where larger values indicate more
     *         local detail.
     */
    FloatProcessor computeQualityMap(final FloatProcessor channel);

}
