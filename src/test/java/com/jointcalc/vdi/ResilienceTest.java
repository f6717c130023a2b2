package com.jointcalc.vdi;

import com.jointcalc.model.ErrorKind;
import com.jointcalc.model.Fields;
import com.jointcalc.model.JointCalculationException;
import com.jointcalc.model.Stage;
import org.junit.Test;

import static org.junit.Assert.*;

public class ResilienceTest {

    @Test
    public void testBoltResilience() {
        // 40 / (58 · 210000)
        double delta = Resilience.boltResilience(40.0, 58.0, 210000.0);
        assertEquals(3.2841e-6, delta, 1e-9);
        assertEquals(3.276e-6, delta, 0.01 * 3.276e-6);
    }

    @Test
    public void testBoltResilienceRejectsZeroModulusOrArea() {
        ThreadGeometryTest.assertField(Fields.MAT_EB, () -> Resilience.boltResilience(40.0, 58.0, 0.0));
        ThreadGeometryTest.assertField("As", () -> Resilience.boltResilience(40.0, 0.0, 210000.0));
        ThreadGeometryTest.assertField(Fields.STACK_LK, () -> Resilience.boltResilience(0.0, 58.0, 210000.0));
    }

    @Test
    public void testSubstituteCone() {
        double da = Resilience.substituteConeDiameter(40.0, 16.0, 33.0);
        assertEquals(16.0 + 40.0 * Math.tan(Math.toRadians(33.0)), da, 1e-12);

        double num = da * da + 16.0 * 16.0 - 11.0 * 11.0;
        double den = da * da - 16.0 * 16.0 + 11.0 * 11.0;
        double expected = (40.0 / 210000.0) * Math.log(num / den) / (Math.PI * 16.0);
        assertEquals(expected, Resilience.clampedPartsResilience(40.0, 16.0, 11.0, 210000.0), 1e-18);
        assertEquals(5.818e-7, expected, 1e-10);
    }

    @Test
    public void testThinBearingRingIsInvalidGeometry() {
        // dW=10, dh=9.5, lK=50
        try {
            Resilience.clampedPartsResilience(50.0, 10.0, 9.5, 210000.0);
            fail("thin ring must be rejected");
        } catch (JointCalculationException e) {
            assertEquals(ErrorKind.INVALID_GEOMETRY, e.kind());
            assertEquals(Stage.RESILIENCE, e.stage());
            assertEquals(Fields.STACK_DW, e.field());
        }
    }

    @Test
    public void testThinRingAcceptedWhenRatioRelaxed() {
        double deltaP = Resilience.clampedPartsResilience(50.0, 10.0, 9.5, 210000.0, 33.0, 1.0);
        assertTrue(deltaP > 0.0);
        assertFalse(Double.isNaN(deltaP));
    }

    @Test
    public void testNonPositiveLogArgumentIsInvalidGeometry() {
        // hole far outside the cone: DA² + dW² - dh² < 0
        try {
            Resilience.clampedPartsResilience(1.0, 2.0, 10.0, 210000.0);
            fail("negative log argument must be rejected");
        } catch (JointCalculationException e) {
            assertEquals(ErrorKind.INVALID_GEOMETRY, e.kind());
            assertEquals(Fields.STACK_DH, e.field());
            assertTrue(e.getMessage().contains("logarithm"));
        }
    }

    @Test
    public void testHoleWiderThanBearingIsInvalidGeometry() {
        ThreadGeometryTest.assertField(Fields.STACK_DW,
                () -> Resilience.clampedPartsResilience(40.0, 10.0, 12.0, 210000.0));
    }

    @Test
    public void testRejectsNonPositiveStackValues() {
        ThreadGeometryTest.assertField(Fields.STACK_LK, () -> Resilience.clampedPartsResilience(0.0, 16.0, 11.0, 210000.0));
        ThreadGeometryTest.assertField(Fields.STACK_DH, () -> Resilience.clampedPartsResilience(40.0, 16.0, 0.0, 210000.0));
        ThreadGeometryTest.assertField(Fields.STACK_EP, () -> Resilience.clampedPartsResilience(40.0, 16.0, 11.0, -1.0));
    }

    @Test
    public void testStifferPlatesLowerResilience() {
        double steel = Resilience.clampedPartsResilience(40.0, 16.0, 11.0, 210000.0);
        double aluminium = Resilience.clampedPartsResilience(40.0, 16.0, 11.0, 70000.0);
        assertEquals(3.0, aluminium / steel, 1e-9);
    }
}
