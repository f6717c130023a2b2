package com.jointcalc.vdi;

import com.jointcalc.classic.ClassicTorqueCalc;
import com.jointcalc.model.ErrorKind;
import com.jointcalc.model.Fields;
import com.jointcalc.model.JointCalculationException;
import com.jointcalc.model.Stage;
import org.junit.Test;

import static org.junit.Assert.*;

public class PreloadTest {

    @Test
    public void testEmbeddingLoss() {
        assertEquals(1000.0, Preload.embeddingLoss(0.004, 3e-6, 1e-6), 1e-6);
        assertEquals(0.0, Preload.embeddingLoss(0.0, 3e-6, 1e-6), 0.0);
    }

    @Test
    public void testNegativeSettlingRejected() {
        try {
            Preload.embeddingLoss(-0.001, 3e-6, 1e-6);
            fail();
        } catch (JointCalculationException e) {
            assertEquals(ErrorKind.INVALID_LOAD_CASE, e.kind());
            assertEquals(Stage.EMBEDDING, e.stage());
            assertEquals(Fields.LOAD_EMBEDDING, e.field());
        }
    }

    @Test
    public void testMinimumPreload() {
        assertEquals(5000.0 / 0.7, Preload.minimumPreload(5000.0, 0.0, 0.3, 1), 1e-9);
        assertEquals((5000.0 + 1000.0) / (2 * 0.7), Preload.minimumPreload(5000.0, 1000.0, 0.3, 2), 1e-9);
    }

    @Test
    public void testFullyFlexibleJointHasNoMinimumPreload() {
        try {
            Preload.minimumPreload(5000.0, 0.0, 1.0, 1);
            fail("Phi = 1 must be rejected");
        } catch (JointCalculationException e) {
            assertEquals(ErrorKind.INVALID_LOAD_FACTOR, e.kind());
            assertEquals("Phi", e.field());
        }
    }

    @Test
    public void testInterfaceCountMustBeWholeAndPositive() {
        for (double n : new double[] { 0.0, -1.0, 1.5 }) {
            try {
                Preload.minimumPreload(5000.0, 0.0, 0.3, n);
                fail("interfaces=" + n);
            } catch (JointCalculationException e) {
                assertEquals(ErrorKind.INVALID_LOAD_CASE, e.kind());
                assertEquals(Fields.LOAD_INTERFACES, e.field());
            }
        }
    }

    @Test
    public void testAssemblyPreloadKeepsNegativeThermalTerm() {
        // steel bolt in aluminium plates, cooled by 40 K
        double fv = Preload.assemblyPreload(20000.0, 11.5e-6, 23e-6, -40.0, 40.0, 3e-6, 1e-6);
        assertEquals(20000.0 - 4600.0, fv, 1e-6);

        double warm = Preload.assemblyPreload(20000.0, 11.5e-6, 23e-6, 40.0, 40.0, 3e-6, 1e-6);
        assertEquals(24600.0, warm, 1e-6);

        assertEquals(20000.0, Preload.assemblyPreload(20000.0, 11.5e-6, 11.5e-6, 80.0, 40.0, 3e-6, 1e-6), 0.0);
    }

    @Test
    public void testThermalLossMayExceedTablePreload() {
        double fv = Preload.assemblyPreload(1000.0, 11.5e-6, 23e-6, -40.0, 40.0, 3e-6, 1e-6);
        assertTrue(fv < 0.0);
    }

    @Test
    public void testResidualPreload() {
        assertEquals(19000.0, Preload.residualPreload(20000.0, 1000.0), 0.0);
    }

    @Test
    public void testTighteningTorqueM10() {
        double ma = Preload.tighteningTorque(25000.0, 1.5, 9.026, 30.0, 0.12, 0.12, 13.5);
        assertEquals(41.85, ma, 0.01);
    }

    @Test
    public void testTighteningTorqueAgreesWithClassicEquation() {
        // classic form with bearing diameters 11 and 16 has the same mean bearing diameter 13.5
        double vdi = Preload.tighteningTorque(25000.0, 1.5, 9.026, 30.0, 0.14, 0.10, 13.5);
        double classic = ClassicTorqueCalc.torque(25000.0, 9.026, 11.0, 16.0, 0.14, 0.10, 30.0, 1.5);
        assertEquals(classic, vdi, 1e-9);
    }

    @Test
    public void testTighteningTorqueRejectsFrictionOutsideUnitInterval() {
        ThreadGeometryTest.assertField(Fields.FRICTION_MUG,
                () -> Preload.tighteningTorque(25000.0, 1.5, 9.026, 30.0, 0.0, 0.12, 13.5));
        ThreadGeometryTest.assertField(Fields.FRICTION_MUK,
                () -> Preload.tighteningTorque(25000.0, 1.5, 9.026, 30.0, 0.12, 1.0, 13.5));
        ThreadGeometryTest.assertField(Fields.FRICTION_DKM,
                () -> Preload.tighteningTorque(25000.0, 1.5, 9.026, 30.0, 0.12, 0.12, 0.0));
    }

    @Test
    public void testEffectivePreloadTorque() {
        assertEquals(38.85, Preload.effectivePreloadTorque(41.85, 3.0), 1e-9);
    }
}
