package com.jointcalc.util;

import org.junit.Test;

import static org.junit.Assert.*;

public class ScalarCutoffsTest {

    @Test
    public void testExactComparesBits() {
        assertFalse(ScalarCutoffs.EXACT.hasChanged(0.686, 0.686));
        assertTrue(ScalarCutoffs.EXACT.hasChanged(0.686, Math.nextUp(0.686)));
        assertTrue(ScalarCutoffs.EXACT.hasChanged(0.0, -0.0));
    }

    @Test
    public void testRepeatedNaNIsNotAChange() {
        assertFalse(ScalarCutoffs.EXACT.hasChanged(Double.NaN, Double.NaN));
        assertTrue(ScalarCutoffs.EXACT.hasChanged(Double.NaN, 11.5e-6));
    }
}
