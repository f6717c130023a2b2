package com.jointcalc.vdi;

import com.jointcalc.model.ErrorKind;
import com.jointcalc.model.JointCalculationException;
import com.jointcalc.model.UtilizationClass;
import org.junit.Test;

import static org.junit.Assert.*;

public class StressEvaluatorTest {

    @Test
    public void testStressAndUtilization() {
        double sigma = StressEvaluator.boltStress(16500.0, 58.0);
        assertEquals(284.48, sigma, 0.01);
        assertEquals(sigma / 640.0, StressEvaluator.utilizationFactor(sigma, 640.0), 1e-12);
    }

    @Test
    public void testUtilizationGrowsWithAxialLoad() {
        double previous = -1.0;
        for (double fa = 0.0; fa <= 40000.0; fa += 2500.0) {
            double fsb = WorkingLoad.boltForceWorking(20000.0, fa, 0.3);
            double u = StressEvaluator.utilizationFactor(StressEvaluator.boltStress(fsb, 58.0), 640.0);
            assertTrue(u > previous);
            previous = u;
        }
    }

    @Test
    public void testClassification() {
        assertEquals(UtilizationClass.OK, StressEvaluator.classify(0.0));
        assertEquals(UtilizationClass.OK, StressEvaluator.classify(0.8999));
        assertEquals(UtilizationClass.MARGINAL, StressEvaluator.classify(0.9));
        assertEquals(UtilizationClass.MARGINAL, StressEvaluator.classify(0.9999));
        assertEquals(UtilizationClass.OVERLOAD, StressEvaluator.classify(1.0));
        assertEquals(UtilizationClass.OVERLOAD, StressEvaluator.classify(1.7));
    }

    @Test
    public void testClassificationWithCustomThresholds() {
        assertEquals(UtilizationClass.MARGINAL, StressEvaluator.classify(0.85, 0.8, 0.95));
        assertEquals(UtilizationClass.OVERLOAD, StressEvaluator.classify(0.96, 0.8, 0.95));
    }

    @Test
    public void testZeroYieldIsInvalidMaterial() {
        try {
            StressEvaluator.utilizationFactor(300.0, 0.0);
            fail();
        } catch (JointCalculationException e) {
            assertEquals(ErrorKind.INVALID_MATERIAL, e.kind());
        }
    }
}
