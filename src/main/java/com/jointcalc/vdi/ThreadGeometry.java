package com.jointcalc.vdi;

import com.jointcalc.model.BoltGeometry;
import com.jointcalc.model.ErrorKind;
import com.jointcalc.model.Fields;
import com.jointcalc.model.JointCalculationException;
import com.jointcalc.model.Stage;

/**
 * Geometry and stress-area primitives. Shared by the VDI 2230 pipeline and the
 * classic torque model.
 */
public final class ThreadGeometry {
    private ThreadGeometry() {
    }

    /**
     * Tensile stress area {@code As = π/4 · ((d2 + d3)/2)²}.
     *
     * @param d2 Pitch diameter, mm.
     * @param d3 Minor diameter, mm.
     * @return As in mm².
     * @throws JointCalculationException INVALID_GEOMETRY if a diameter is not
     *                                   positive or {@code d3 >= d2}.
     */
    public static double stressArea(double d2, double d3) {
        Require.positive(d2, ErrorKind.INVALID_GEOMETRY, Stage.GEOMETRY, Fields.BOLT_D2);
        Require.positive(d3, ErrorKind.INVALID_GEOMETRY, Stage.GEOMETRY, Fields.BOLT_D3);
        if (d3 >= d2)
            throw new JointCalculationException(ErrorKind.INVALID_GEOMETRY, Stage.GEOMETRY, Fields.BOLT_D3,
                    "minor diameter d3=" + Require.fmt(d3) + " must be below pitch diameter d2=" + Require.fmt(d2));
        double mean = (d2 + d3) / 2.0;
        return Math.PI / 4.0 * mean * mean;
    }

    /**
     * Stress area after checking the complete thread invariant
     * {@code d3 < d2 < d} and {@code P > 0}.
     */
    public static double stressArea(double d, double d2, double d3, double pitch) {
        Require.positive(pitch, ErrorKind.INVALID_GEOMETRY, Stage.GEOMETRY, Fields.BOLT_P);
        if (!(d2 < d))
            throw new JointCalculationException(ErrorKind.INVALID_GEOMETRY, Stage.GEOMETRY, Fields.BOLT_D2,
                    "pitch diameter d2=" + Require.fmt(d2) + " must be below nominal diameter d=" + Require.fmt(d));
        return stressArea(d2, d3);
    }

    public static double stressArea(BoltGeometry bolt) {
        return stressArea(bolt.d(), bolt.d2(), bolt.d3(), bolt.pitch());
    }

    /**
     * Eccentric loading factor {@code PhiN = 1 - (dW/dA)^n}.
     *
     * <p>
     * {@code n} picks the load introduction model and is taken as given.
     *
     * @throws JointCalculationException INVALID_GEOMETRY unless {@code dA > dW > 0}.
     */
    public static double eccentricLoadingFactor(double n, double dA, double dW) {
        Require.positive(dW, ErrorKind.INVALID_GEOMETRY, Stage.GEOMETRY, Fields.STACK_DW);
        if (!(dA > dW))
            throw new JointCalculationException(ErrorKind.INVALID_GEOMETRY, Stage.GEOMETRY, Fields.LOAD_DA,
                    "load introduction diameter dA=" + Require.fmt(dA) + " must exceed bearing diameter dW="
                            + Require.fmt(dW));
        return 1.0 - Math.pow(dW / dA, n);
    }
}
