package com.jointcalc.vdi;

import com.jointcalc.model.ErrorKind;
import com.jointcalc.model.Fields;
import com.jointcalc.model.JointCalculationException;
import com.jointcalc.model.Stage;

/**
 * Elastic resilience (compliance, mm/N) of the bolt and of the clamped parts.
 *
 * <p>
 * The clamped parts are modelled with the VDI 2230 substitute cone: a frustum
 * that widens from the bearing diameter at the cone half-angle. The model only
 * holds while the bearing face is clearly wider than the hole, so thin rings
 * are rejected before the logarithm is evaluated.
 */
public final class Resilience {
    public static final double DEFAULT_CONE_ANGLE_DEG = 33.0;
    public static final double DEFAULT_MIN_BEARING_TO_HOLE_RATIO = 1.1;

    private Resilience() {
    }

    /**
     * {@code deltaBolt = lK / (As · E_B)}.
     *
     * @throws JointCalculationException INVALID_GEOMETRY for a non-positive
     *                                   length, area or modulus.
     */
    public static double boltResilience(double lK, double stressArea, double boltModulus) {
        Require.positive(lK, ErrorKind.INVALID_GEOMETRY, Stage.RESILIENCE, Fields.STACK_LK);
        Require.positive(stressArea, ErrorKind.INVALID_GEOMETRY, Stage.RESILIENCE, "As");
        Require.positive(boltModulus, ErrorKind.INVALID_GEOMETRY, Stage.RESILIENCE, Fields.MAT_EB);
        return lK / (stressArea * boltModulus);
    }

    /** Clamped-parts resilience with a 33° cone and the default ring check. */
    public static double clampedPartsResilience(double lK, double dW, double dh, double clampedModulus) {
        return clampedPartsResilience(lK, dW, dh, clampedModulus,
                DEFAULT_CONE_ANGLE_DEG, DEFAULT_MIN_BEARING_TO_HOLE_RATIO);
    }

    /**
     * Substitute cone resilience
     * {@code deltaP = (lK/E_P) · ln[(DA² + dW² - dh²)/(DA² - dW² + dh²)] / (π · dW)}
     * with {@code DA = dW + lK · tan(coneAngle)}.
     *
     * @param minBearingToHoleRatio smallest accepted {@code dW/dh}
     * @throws JointCalculationException INVALID_GEOMETRY if the stack dimensions
     *                                   are inconsistent, the logarithm argument
     *                                   is not positive, or the result is not a
     *                                   positive finite number.
     */
    public static double clampedPartsResilience(double lK, double dW, double dh, double clampedModulus,
            double coneAngleDeg, double minBearingToHoleRatio) {
        Require.positive(lK, ErrorKind.INVALID_GEOMETRY, Stage.RESILIENCE, Fields.STACK_LK);
        Require.positive(dW, ErrorKind.INVALID_GEOMETRY, Stage.RESILIENCE, Fields.STACK_DW);
        Require.positive(dh, ErrorKind.INVALID_GEOMETRY, Stage.RESILIENCE, Fields.STACK_DH);
        Require.positive(clampedModulus, ErrorKind.INVALID_GEOMETRY, Stage.RESILIENCE, Fields.STACK_EP);

        double da = substituteConeDiameter(lK, dW, coneAngleDeg);
        double numerator = da * da + dW * dW - dh * dh;
        double denominator = da * da - dW * dW + dh * dh;
        if (!(denominator > 0.0) || !(numerator > 0.0))
            throw new JointCalculationException(ErrorKind.INVALID_GEOMETRY, Stage.RESILIENCE, Fields.STACK_DH,
                    "substitute cone logarithm argument not positive (" + Require.fmt(numerator) + "/"
                            + Require.fmt(denominator) + "), hole dh=" + Require.fmt(dh)
                            + " exceeds the effective cone");

        if (!(dW > dh))
            throw new JointCalculationException(ErrorKind.INVALID_GEOMETRY, Stage.RESILIENCE, Fields.STACK_DW,
                    "bearing diameter dW=" + Require.fmt(dW) + " must exceed hole diameter dh=" + Require.fmt(dh));
        if (dW / dh < minBearingToHoleRatio)
            throw new JointCalculationException(ErrorKind.INVALID_GEOMETRY, Stage.RESILIENCE, Fields.STACK_DW,
                    "bearing ring too thin for the substitute cone: dW/dh=" + Require.fmt(dW / dh)
                            + " below " + Require.fmt(minBearingToHoleRatio));

        double deltaP = (lK / clampedModulus) * Math.log(numerator / denominator) / (Math.PI * dW);
        return Require.finitePositiveResult(deltaP, Stage.RESILIENCE, "deltaP");
    }

    /** Outer diameter of the substitute cone at the far end of the clamped length. */
    public static double substituteConeDiameter(double lK, double dW, double coneAngleDeg) {
        return dW + lK * Math.tan(Math.toRadians(coneAngleDeg));
    }
}
