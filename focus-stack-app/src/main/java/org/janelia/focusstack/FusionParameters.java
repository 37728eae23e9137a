package org.janelia.focusstack;

import java.io.File;
import java.io.IOException;
import java.io.Reader;
import java.io.Serializable;
import java.nio.file.Files;

import org.janelia.focusstack.image.GeneratingKernel;
import org.janelia.focusstack.json.JsonUtils;
import org.janelia.focusstack.measure.LocalDeviationMeasure;
import org.janelia.focusstack.measure.QualityMeasure;
import org.janelia.focusstack.measure.RegionEnergyMeasure;

/**
 * Configuration for {@link PyramidFusion}.
 */
public class FusionParameters
        implements Serializable {

    public static final int DEFAULT_MIN_SIZE = 32;

    /** Smallest allowed side length (in pixels) for the coarsest pyramid level. */
    private int minSize;

    /** Window size for the base band deviation measure (must be odd). */
    private int deviationKernelSize;

    /** Center tap of the generating kernel used to aggregate region energy. */
    private double generatingKernelA;

    public FusionParameters() {
        this(DEFAULT_MIN_SIZE, LocalDeviationMeasure.DEFAULT_WINDOW_SIZE, GeneratingKernel.DEFAULT_A);
    }

    public FusionParameters(final int minSize,
                            final int deviationKernelSize,
                            final double generatingKernelA) {
        this.minSize = minSize;
        this.deviationKernelSize = deviationKernelSize;
        this.generatingKernelA = generatingKernelA;
    }

    public int getMinSize() {
        return minSize;
    }

    public int getDeviationKernelSize() {
        return deviationKernelSize;
    }

    public double getGeneratingKernelA() {
        return generatingKernelA;
    }

    /**
     * @throws IllegalArgumentException
     *   if any parameter is out of range.
     */
    public void validate()
            throws IllegalArgumentException {
        if (minSize < 1) {
            throw new IllegalArgumentException("minSize must be positive but was " + minSize);
        }
        if ((deviationKernelSize < 1) || (deviationKernelSize % 2 == 0)) {
            throw new IllegalArgumentException("deviationKernelSize must be a positive odd number but was " +
                                               deviationKernelSize);
        }
        if ((generatingKernelA <= 0.0) || (generatingKernelA >= 1.0)) {
            throw new IllegalArgumentException("generatingKernelA must be in the open interval (0, 1) but was " +
                                               generatingKernelA);
        }
    }

    /**
     * @return measure used to fuse the base band.
     */
    public QualityMeasure buildBaseBandMeasure() {
        return new LocalDeviationMeasure(deviationKernelSize);
    }

    /**
     * @return measure used to fuse all detail bands.
     */
    public QualityMeasure buildDetailBandMeasure() {
        return new RegionEnergyMeasure(new GeneratingKernel(generatingKernelA));
    }

    public String toJson() {
        return JSON_HELPER.toJson(this);
    }

    @Override
    public String toString() {
        return "{minSize=" + minSize +
               ", deviationKernelSize=" + deviationKernelSize +
               ", generatingKernelA=" + generatingKernelA + '}';
    }

    public static FusionParameters fromJson(final Reader json)
            throws IllegalArgumentException {
        return JSON_HELPER.fromJson(json);
    }

    /**
     * @throws IllegalArgumentException
     *   if the file cannot be read or parsed.
     */
    public static FusionParameters fromJsonFile(final File jsonFile)
            throws IllegalArgumentException {
        if (! jsonFile.canRead()) {
            throw new IllegalArgumentException("fusion parameters json file " + jsonFile.getAbsolutePath() +
                                               " is not readable");
        }
        try (final Reader reader = Files.newBufferedReader(jsonFile.toPath())) {
            return fromJson(reader);
        } catch (final IOException e) {
            throw new IllegalArgumentException("failed to read " + jsonFile.getAbsolutePath(), e);
        }
    }

    private static final JsonUtils.Helper<FusionParameters> JSON_HELPER =
            new JsonUtils.Helper<>(FusionParameters.class);
}
