package com.jointcalc.vdi;

import com.jointcalc.model.ErrorKind;
import com.jointcalc.model.JointCalculationException;
import com.jointcalc.model.Stage;

/**
 * Share of the external axial load taken by the bolt.
 */
public final class LoadDistribution {
    private LoadDistribution() {
    }

    /**
     * {@code Phi = deltaBolt / (deltaBolt + deltaP)}.
     *
     * @return Phi, strictly inside (0, 1).
     * @throws JointCalculationException INVALID_LOAD_FACTOR if either resilience
     *                                   is not positive.
     */
    public static double loadFactor(double deltaBolt, double deltaP) {
        double sum = deltaBolt + deltaP;
        if (!(sum > 0.0))
            throw new JointCalculationException(ErrorKind.INVALID_LOAD_FACTOR, Stage.LOAD_FACTOR, "Phi",
                    "resilience sum deltaBolt+deltaP must be > 0, was " + Require.fmt(sum));
        double phi = deltaBolt / sum;
        Require.openUnitInterval(phi, ErrorKind.INVALID_LOAD_FACTOR, Stage.LOAD_FACTOR, "Phi");
        return phi;
    }
}
