package org.janelia.focusstack.client.parameter;

import com.beust.jcommander.Parameter;

import java.io.File;
import java.io.Serializable;

import org.janelia.focusstack.FusionParameters;
import org.janelia.focusstack.PyramidFusion;
import org.janelia.focusstack.image.GeneratingKernel;
import org.janelia.focusstack.measure.LocalDeviationMeasure;

/**
 * Parameters for fusing stacks with a {@link PyramidFusion}.
 */
public class PyramidFusionParameters implements Serializable {

    @Parameter(
            names = "--fusionParametersJson",
            description = "JSON file with fusion parameters (overrides all other fusion options)")
    public String fusionParametersJson;

    @Parameter(
            names = "--minSize",
            description = "Smallest side length (in pixels) allowed for the coarsest pyramid level")
    public int minSize = FusionParameters.DEFAULT_MIN_SIZE;

    @Parameter(
            names = "--deviationKernelSize",
            description = "Window size (odd) for the local deviation used to fuse the base band")
    public int deviationKernelSize = LocalDeviationMeasure.DEFAULT_WINDOW_SIZE;

    @Parameter(
            names = "--generatingKernelA",
            description = "Center tap of the generating kernel used to aggregate detail band region energy")
    public double generatingKernelA = GeneratingKernel.DEFAULT_A;

    public FusionParameters buildFusionParameters()
            throws IllegalArgumentException {
        final FusionParameters fusionParameters;
        if (fusionParametersJson == null) {
            fusionParameters = new FusionParameters(minSize, deviationKernelSize, generatingKernelA);
        } else {
            fusionParameters = FusionParameters.fromJsonFile(new File(fusionParametersJson));
        }
        fusionParameters.validate();
        return fusionParameters;
    }

}
