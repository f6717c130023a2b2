package com.jointcalc.io;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.jointcalc.vdi.Resilience;
import com.jointcalc.vdi.StressEvaluator;
import com.jointcalc.vdi.SurfaceCriterion;

import lombok.Data;

/**
 * Named constants of the calculation. Bound from JSON by
 * {@link CalculationConfigLoader}; fields missing from the document keep the
 * defaults below.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public final class CalculationConfig {
    /** Substitute cone half-angle, degrees. */
    private double coneAngleDeg = Resilience.DEFAULT_CONE_ANGLE_DEG;
    /** Shear strength as a fraction of the tensile basis (von Mises). */
    private double shearStrengthFactor = SurfaceCriterion.DEFAULT_SHEAR_STRENGTH_FACTOR;
    private double marginalThreshold = StressEvaluator.DEFAULT_MARGINAL_THRESHOLD;
    private double overloadThreshold = StressEvaluator.DEFAULT_OVERLOAD_THRESHOLD;
    /** Flank half-angle assumed when a bolt does not state one. */
    private double defaultFlankAngleDeg = 30.0;
    /** Smallest dW/dh for which the substitute cone is accepted. */
    private double minBearingToHoleRatio = Resilience.DEFAULT_MIN_BEARING_TO_HOLE_RATIO;
    /** Batch pool size; 0 means one thread per available processor. */
    private int batchThreads;

    /**
     * @throws IllegalArgumentException if a value is out of range.
     */
    public CalculationConfig validate() {
        if (!(coneAngleDeg > 0.0 && coneAngleDeg < 90.0))
            throw new IllegalArgumentException("coneAngleDeg must be in (0, 90): " + coneAngleDeg);
        if (!(shearStrengthFactor > 0.0 && shearStrengthFactor <= 1.0))
            throw new IllegalArgumentException("shearStrengthFactor must be in (0, 1]: " + shearStrengthFactor);
        if (!(marginalThreshold > 0.0 && marginalThreshold <= overloadThreshold))
            throw new IllegalArgumentException("marginalThreshold must be in (0, overloadThreshold]: "
                    + marginalThreshold + " / " + overloadThreshold);
        if (!(defaultFlankAngleDeg > 0.0 && defaultFlankAngleDeg < 90.0))
            throw new IllegalArgumentException("defaultFlankAngleDeg must be in (0, 90): " + defaultFlankAngleDeg);
        if (!(minBearingToHoleRatio >= 1.0))
            throw new IllegalArgumentException("minBearingToHoleRatio must be >= 1: " + minBearingToHoleRatio);
        if (batchThreads < 0)
            throw new IllegalArgumentException("batchThreads must be >= 0: " + batchThreads);
        return this;
    }

    public int effectiveBatchThreads() {
        return batchThreads > 0 ? batchThreads : Runtime.getRuntime().availableProcessors();
    }
}
