package com.jointcalc.model;

import java.util.Locale;

/**
 * Outcome of the combined tensile and shear interaction check.
 */
public record SurfaceCriterionResult(double tensileRatio, double shearRatio, double combined) {

    public boolean passed() {
        return combined <= 1.0;
    }

    /** Plain text summary in the layout of the classic validation report. */
    public String describe() {
        return String.format(Locale.ROOT,
                "Tensile Ratio : %.4f%nShear Ratio : %.4f%nCombined : %.4f%nSurface Failure Criteria : %s",
                tensileRatio, shearRatio, combined, passed() ? "OK" : "NG");
    }
}
