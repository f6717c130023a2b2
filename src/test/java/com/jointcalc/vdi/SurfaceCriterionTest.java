package com.jointcalc.vdi;

import com.jointcalc.model.SurfaceCriterionResult;
import org.junit.Test;

import static org.junit.Assert.*;

public class SurfaceCriterionTest {

    @Test
    public void testPureTension() {
        SurfaceCriterionResult r = SurfaceCriterion.evaluate(20000.0, 0.0, 0.0, 5000.0, 10.0, 640.0);
        double stress = 25000.0 * 4.0 / (Math.PI * 100.0);
        assertEquals(Math.pow(stress / 640.0, 2), r.tensileRatio(), 1e-12);
        assertEquals(0.0, r.shearRatio(), 0.0);
        assertEquals(0.2474, r.combined(), 1e-4);
        assertTrue(r.passed());
    }

    @Test
    public void testShearUsesResultantOfTransverseForces() {
        double shear = SurfaceCriterion.shearRatio(3000.0, 4000.0, 10.0, 640.0, 0.577);
        double stress = 5000.0 * 4.0 / (Math.PI * 100.0);
        assertEquals(Math.pow(stress / (0.577 * 640.0), 2), shear, 1e-12);
        assertEquals(shear, SurfaceCriterion.shearRatio(5000.0, 0.0, 10.0, 640.0, 0.577), 1e-12);
    }

    @Test
    public void testCombinedAboveOneFails() {
        SurfaceCriterionResult r = SurfaceCriterion.evaluate(40000.0, 0.0, 0.0, 20000.0, 10.0, 640.0);
        assertEquals(1.4248, r.combined(), 1e-4);
        assertFalse(r.passed());
        assertTrue(r.describe().endsWith("Surface Failure Criteria : NG"));
    }

    @Test
    public void testExactlyOnePasses() {
        assertTrue(new SurfaceCriterionResult(0.6, 0.4, 1.0).passed());
        assertFalse(new SurfaceCriterionResult(0.6, 0.4000001, 1.0000001).passed());
    }

    @Test
    public void testUtsBasisIsMoreLenient() {
        double yield = SurfaceCriterion.evaluate(30000.0, 8000.0, 0.0, 10000.0, 10.0, 640.0).combined();
        double uts = SurfaceCriterion.evaluate(30000.0, 8000.0, 0.0, 10000.0, 10.0, 800.0).combined();
        assertEquals(yield * Math.pow(640.0 / 800.0, 2), uts, 1e-12);
    }
}
