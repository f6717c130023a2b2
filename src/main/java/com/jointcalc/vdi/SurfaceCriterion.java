package com.jointcalc.vdi;

import com.jointcalc.model.ErrorKind;
import com.jointcalc.model.Fields;
import com.jointcalc.model.Stage;
import com.jointcalc.model.SurfaceCriterionResult;

/**
 * Combined tensile and shear interaction check on the nominal bolt section:
 * <pre>
 * tensile = [((Fclamp + Fz) · 4/(π·d²)) / basis]²
 * shear   = [(√(Fx² + Fy²) · 4/(π·d²)) / (k · basis)]²
 * </pre>
 * The joint fails when {@code tensile + shear > 1}. Evaluated independently of
 * the utilization factor.
 */
public final class SurfaceCriterion {
    public static final double DEFAULT_SHEAR_STRENGTH_FACTOR = 0.577;

    private SurfaceCriterion() {
    }

    public static double tensileRatio(double clampForce, double fz, double d, double basis) {
        checkSection(d, basis);
        double stress = (clampForce + fz) * 4.0 / (Math.PI * d * d);
        double ratio = stress / basis;
        return ratio * ratio;
    }

    public static double shearRatio(double fx, double fy, double d, double basis, double shearStrengthFactor) {
        checkSection(d, basis);
        double stress = Math.sqrt(fx * fx + fy * fy) * 4.0 / (Math.PI * d * d);
        double ratio = stress / (shearStrengthFactor * basis);
        return ratio * ratio;
    }

    public static SurfaceCriterionResult evaluate(double clampForce, double fx, double fy, double fz,
            double d, double basis) {
        return evaluate(clampForce, fx, fy, fz, d, basis, DEFAULT_SHEAR_STRENGTH_FACTOR);
    }

    public static SurfaceCriterionResult evaluate(double clampForce, double fx, double fy, double fz,
            double d, double basis, double shearStrengthFactor) {
        double tensile = tensileRatio(clampForce, fz, d, basis);
        double shear = shearRatio(fx, fy, d, basis, shearStrengthFactor);
        return new SurfaceCriterionResult(tensile, shear, tensile + shear);
    }

    private static void checkSection(double d, double basis) {
        Require.positive(d, ErrorKind.INVALID_GEOMETRY, Stage.SURFACE_CRITERION, Fields.BOLT_D);
        Require.positive(basis, ErrorKind.INVALID_MATERIAL, Stage.SURFACE_CRITERION, "strengthBasis");
    }
}
