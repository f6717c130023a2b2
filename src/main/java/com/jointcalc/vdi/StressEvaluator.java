package com.jointcalc.vdi;

import com.jointcalc.model.ErrorKind;
import com.jointcalc.model.Fields;
import com.jointcalc.model.Stage;
import com.jointcalc.model.UtilizationClass;

public final class StressEvaluator {
    public static final double DEFAULT_MARGINAL_THRESHOLD = 0.9;
    public static final double DEFAULT_OVERLOAD_THRESHOLD = 1.0;

    private StressEvaluator() {
    }

    public static double boltStress(double boltForce, double stressArea) {
        Require.positive(stressArea, ErrorKind.INVALID_GEOMETRY, Stage.STRESS, "As");
        return boltForce / stressArea;
    }

    /** Bolt stress over yield strength. Below 0.9 is acceptable for static loads. */
    public static double utilizationFactor(double boltStress, double rp02) {
        Require.positive(rp02, ErrorKind.INVALID_MATERIAL, Stage.STRESS, Fields.MAT_RP02);
        return boltStress / rp02;
    }

    public static UtilizationClass classify(double utilization) {
        return classify(utilization, DEFAULT_MARGINAL_THRESHOLD, DEFAULT_OVERLOAD_THRESHOLD);
    }

    public static UtilizationClass classify(double utilization, double marginalThreshold, double overloadThreshold) {
        if (utilization >= overloadThreshold)
            return UtilizationClass.OVERLOAD;
        if (utilization >= marginalThreshold)
            return UtilizationClass.MARGINAL;
        return UtilizationClass.OK;
    }
}
