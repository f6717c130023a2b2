package com.jointcalc.classic;

import com.jointcalc.model.StrengthBasis;
import com.jointcalc.model.SurfaceCriterionResult;
import com.jointcalc.vdi.SurfaceCriterion;
import com.jointcalc.vdi.ThreadGeometry;

import java.util.Locale;

/**
 * Classic single-stage torque and clamping estimates.
 *
 * <p>
 * Independent of the VDI 2230 pipeline; only the stress area and the surface
 * criterion are shared with it.
 */
public final class ClassicTorqueCalc {
    private ClassicTorqueCalc() {
    }

    public static double stressArea(double d2, double d3) {
        return ThreadGeometry.stressArea(d2, d3);
    }

    /**
     * General torque equation in N·m:
     * {@code F · (P/(2π) + d2·u1/(2·cos α) + u2·dKm/2) / 1000} with
     * {@code dKm = (d0 + b0)/2}.
     *
     * @param axialLoad Preload, N.
     * @param d2        Pitch diameter, mm.
     * @param d0        Bearing surface inner diameter, mm.
     * @param b0        Bearing surface outer diameter, mm.
     * @param u1        Thread friction.
     * @param u2        Head/nut friction.
     * @param alphaDeg  Flank angle, degrees.
     * @param pitch     Thread pitch, mm.
     */
    public static double torque(double axialLoad, double d2, double d0, double b0,
            double u1, double u2, double alphaDeg, double pitch) {
        double thread = pitch / (2.0 * Math.PI) + d2 * u1 / (2.0 * Math.cos(Math.toRadians(alphaDeg)));
        double meanBearing = (d0 + b0) / 2.0;
        double head = u2 * meanBearing / 2.0;
        return axialLoad * (thread + head) / 1000.0;
    }

    /** Axial load carried at the allowed stress, N. */
    public static double loadAxial(double allowedStress, double stressArea) {
        return allowedStress * stressArea;
    }

    /**
     * Short-form clamping force {@code T / (K · d)} in N.
     *
     * @param torque   Applied torque, N·m.
     * @param coef     Torque coefficient K, typically 0.15 to 0.20.
     * @param boltSize Nominal diameter, mm.
     */
    public static double clampingFromTorque(double torque, double coef, double boltSize) {
        if (!(coef > 0.0) || !(boltSize > 0.0))
            throw new IllegalArgumentException("torque coefficient and bolt size must be > 0");
        return torque / (coef * boltSize * 0.001);
    }

    /**
     * Surface failure check of a bolt with a known clamp force.
     *
     * @param uts   Ultimate tensile strength, MPa.
     * @param ys    Yield strength, MPa.
     * @param d     Nominal bolt diameter, mm.
     * @param basis Strength the stresses are compared against.
     */
    public static BoltValidation validateBolt(double clampForce, double fx, double fy, double fz,
            double uts, double ys, double d, StrengthBasis basis) {
        double strength = basis == StrengthBasis.UTS ? uts : ys;
        SurfaceCriterionResult result = SurfaceCriterion.evaluate(clampForce, fx, fy, fz, d, strength);
        return new BoltValidation(clampForce, fx, fy, fz, uts, ys, d, result);
    }

    /**
     * Inputs and outcome of {@link #validateBolt}.
     */
    public record BoltValidation(double clampForce, double fx, double fy, double fz,
            double uts, double ys, double d, SurfaceCriterionResult result) {

        public boolean passed() {
            return result.passed();
        }

        /** Plain-text report, last line {@code Surface Failure Criteria : OK} or {@code : NG}. */
        public String describe() {
            String nl = System.lineSeparator();
            return "Surface Failure Criteria" + nl + nl
                    + "ForceX : " + num(fx) + " N" + nl
                    + "ForceY : " + num(fy) + " N" + nl
                    + "ForceZ : " + num(fz) + " N" + nl + nl
                    + "Calculated Clamping Force : " + num(clampForce) + " N" + nl + nl
                    + "Yield Strength/UTS : " + num(ys) + "/" + num(uts) + " MPa" + nl
                    + "Bolt Diameter : M" + num(d) + " mm" + nl + nl
                    + "Tensile/Max Stress : " + String.format(Locale.ROOT, "%.3f", result.tensileRatio()) + nl
                    + "Shear/Max Stress : " + String.format(Locale.ROOT, "%.3f", result.shearRatio()) + nl + nl
                    + "Surface Failure Criteria : " + (passed() ? "OK" : "NG");
        }

        private static String num(double v) {
            return v == Math.rint(v) && Math.abs(v) < 1e15
                    ? Long.toString((long) v)
                    : String.format(Locale.ROOT, "%.3f", v);
        }
    }
}
