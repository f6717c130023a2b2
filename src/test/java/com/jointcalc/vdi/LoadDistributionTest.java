package com.jointcalc.vdi;

import com.jointcalc.model.BoltGeometry;
import com.jointcalc.model.ErrorKind;
import com.jointcalc.model.JointCalculationException;
import org.junit.Test;

import static org.junit.Assert.*;

public class LoadDistributionTest {

    @Test
    public void testLoadFactor() {
        assertEquals(0.686, LoadDistribution.loadFactor(3.28e-6, 1.5e-6), 0.001);
    }

    @Test
    public void testLoadFactorStrictlyInsideUnitIntervalForValidJoints() {
        double[] lengths = { 5.0, 20.0, 40.0, 120.0 };
        double[][] bearings = { { 16.0, 11.0 }, { 17.0, 10.5 }, { 30.0, 13.0 } };
        double[] nominal = { 8.0, 10.0, 16.0 };
        double[] pitch = { 1.25, 1.5, 2.0 };
        for (int i = 0; i < nominal.length; i++) {
            double as = ThreadGeometry.stressArea(BoltGeometry.isoMetric(nominal[i], pitch[i]));
            for (double lK : lengths) {
                for (double[] b : bearings) {
                    double deltaBolt = Resilience.boltResilience(lK, as, 210000.0);
                    double deltaP = Resilience.clampedPartsResilience(lK, b[0], b[1], 210000.0);
                    assertTrue(deltaBolt + deltaP > 0.0);
                    double phi = LoadDistribution.loadFactor(deltaBolt, deltaP);
                    assertTrue("Phi=" + phi, phi > 0.0 && phi < 1.0);
                }
            }
        }
    }

    @Test
    public void testFlexibleStackTakesMoreLoadIntoBolt() {
        assertTrue(LoadDistribution.loadFactor(3e-6, 1e-7) > LoadDistribution.loadFactor(3e-6, 1e-5));
    }

    @Test
    public void testDegenerateResiliencesAreInvalidLoadFactor() {
        for (double[] r : new double[][] { { 0.0, 0.0 }, { 0.0, 1e-6 }, { 1e-6, 0.0 }, { -1e-6, 1e-7 } }) {
            try {
                LoadDistribution.loadFactor(r[0], r[1]);
                fail("expected INVALID_LOAD_FACTOR for " + r[0] + ", " + r[1]);
            } catch (JointCalculationException e) {
                assertEquals(ErrorKind.INVALID_LOAD_FACTOR, e.kind());
                assertEquals("Phi", e.field());
            }
        }
    }
}
