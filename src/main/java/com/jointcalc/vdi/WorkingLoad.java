package com.jointcalc.vdi;

import com.jointcalc.model.ErrorKind;
import com.jointcalc.model.JointCalculationException;
import com.jointcalc.model.Stage;

/**
 * Bolt and clamping force once the operating load is applied.
 */
public final class WorkingLoad {
    private WorkingLoad() {
    }

    /** {@code FSB = FV + Phi · FA}. */
    public static double boltForceWorking(double preload, double axialLoad, double phi) {
        return preload + phi * axialLoad;
    }

    /**
     * {@code FKB = FV - (1 - Phi) · FA}. A result at or below zero means the
     * joint opens under load; callers report that as a warning.
     */
    public static double clampingForceWorking(double preload, double axialLoad, double phi) {
        return preload - (1.0 - phi) * axialLoad;
    }

    /** Rejects compressive (negative) operating loads. */
    public static double requireTensile(double load, String field) {
        if (!(load >= 0.0))
            throw new JointCalculationException(ErrorKind.INVALID_LOAD_CASE, Stage.WORKING_LOAD, field,
                    field + " must be a tensile load >= 0, was " + Require.fmt(load));
        return load;
    }
}
