package com.jointcalc.model;

/**
 * External forces seen by the combined surface criterion.
 *
 * @param fx    Transverse force in x, N.
 * @param fy    Transverse force in y, N.
 * @param fz    Axial force, N.
 * @param basis Strength basis.
 */
public record SurfaceLoad(double fx, double fy, double fz, StrengthBasis basis) {

    public SurfaceLoad {
        if (basis == null)
            basis = StrengthBasis.YIELD;
    }

    /** Pure axial load: no transverse forces, {@code Fz = FA}, yield basis. */
    public static SurfaceLoad axial(LoadCase loadCase) {
        return new SurfaceLoad(0.0, 0.0, loadCase.axialLoad(), StrengthBasis.YIELD);
    }
}
