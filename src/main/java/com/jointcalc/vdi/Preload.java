package com.jointcalc.vdi;

import com.jointcalc.model.ErrorKind;
import com.jointcalc.model.Fields;
import com.jointcalc.model.JointCalculationException;
import com.jointcalc.model.Stage;

/**
 * Preload model: required, assembly and residual preload, settling loss and
 * the tightening torque that produces the assembly preload.
 */
public final class Preload {
    private Preload() {
    }

    /**
     * Preload lost to surface settling, {@code fZ / (deltaBolt + deltaP)}.
     *
     * @param embedding Settling amount fZ in mm (3 to 5 µm for machined steel).
     */
    public static double embeddingLoss(double embedding, double deltaBolt, double deltaP) {
        Require.nonNegative(embedding, ErrorKind.INVALID_LOAD_CASE, Stage.EMBEDDING, Fields.LOAD_EMBEDDING);
        return embedding / resilienceSum(deltaBolt, deltaP, Stage.EMBEDDING);
    }

    /**
     * {@code FV_min = (FA + FZ) / (nInterfaces · (1 - Phi))}.
     *
     * @throws JointCalculationException INVALID_LOAD_FACTOR for {@code Phi >= 1}
     *                                   or negative Phi, INVALID_LOAD_CASE for
     *                                   fewer than one or a fractional number
     *                                   of interfaces.
     */
    public static double minimumPreload(double axialLoad, double additionalLoad, double phi, double interfaces) {
        if (!(interfaces >= 1.0) || interfaces != Math.rint(interfaces))
            throw new JointCalculationException(ErrorKind.INVALID_LOAD_CASE, Stage.PRELOAD, Fields.LOAD_INTERFACES,
                    "number of interfaces must be a whole number >= 1, was " + Require.fmt(interfaces));
        if (!(phi >= 0.0 && phi < 1.0))
            throw new JointCalculationException(ErrorKind.INVALID_LOAD_FACTOR, Stage.PRELOAD, "Phi",
                    "Phi=" + Require.fmt(phi) + " leaves no finite preload that keeps the joint clamped");
        return (axialLoad + additionalLoad) / (interfaces * (1.0 - phi));
    }

    /**
     * {@code FV_assembly = FMTab + (alphaP - alphaA) · deltaT · lK / (deltaBolt + deltaP)}.
     * A negative thermal term is kept as is.
     */
    public static double assemblyPreload(double tablePreload, double alphaBolt, double alphaClamped,
            double deltaT, double lK, double deltaBolt, double deltaP) {
        Require.nonNegative(tablePreload, ErrorKind.INVALID_LOAD_CASE, Stage.PRELOAD, Fields.LOAD_FM_TAB);
        double thermal = (alphaClamped - alphaBolt) * deltaT * lK / resilienceSum(deltaBolt, deltaP, Stage.PRELOAD);
        return tablePreload + thermal;
    }

    /** Assembly preload left after settling. */
    public static double residualPreload(double assemblyPreload, double embeddingLoss) {
        return assemblyPreload - embeddingLoss;
    }

    /**
     * VDI 2230 tightening torque in N·m:
     * {@code (FV · d2/2 · (P/(π·d2) + muG/cos α) + FV · muK · dKm/2) / 1000}.
     *
     * @param flankAngleDeg thread flank half-angle α in degrees
     */
    public static double tighteningTorque(double preload, double pitch, double d2, double flankAngleDeg,
            double muG, double muK, double dKm) {
        Require.openUnitInterval(muG, ErrorKind.INVALID_LOAD_CASE, Stage.TIGHTENING, Fields.FRICTION_MUG);
        Require.openUnitInterval(muK, ErrorKind.INVALID_LOAD_CASE, Stage.TIGHTENING, Fields.FRICTION_MUK);
        Require.positive(dKm, ErrorKind.INVALID_GEOMETRY, Stage.TIGHTENING, Fields.FRICTION_DKM);
        Require.positive(d2, ErrorKind.INVALID_GEOMETRY, Stage.TIGHTENING, Fields.BOLT_D2);
        double thread = preload * d2 * 0.5 * (pitch / (Math.PI * d2) + muG / Math.cos(Math.toRadians(flankAngleDeg)));
        double head = preload * muK * dKm * 0.5;
        return (thread + head) / 1000.0;
    }

    /** Tightening torque left for preload once the prevailing torque MGF of a locking element is overcome. */
    public static double effectivePreloadTorque(double tighteningTorque, double prevailingTorque) {
        return tighteningTorque - prevailingTorque;
    }

    private static double resilienceSum(double deltaBolt, double deltaP, Stage stage) {
        double sum = deltaBolt + deltaP;
        if (!(sum > 0.0))
            throw new JointCalculationException(ErrorKind.INVALID_LOAD_FACTOR, stage, "deltaBolt+deltaP",
                    "resilience sum must be > 0, was " + Require.fmt(sum));
        return sum;
    }
}
