package com.jointcalc.util;

import com.jointcalc.api.ScalarCutoff;

/**
 * Standard implementations of ScalarCutoff.
 */
public final class ScalarCutoffs {
    private ScalarCutoffs() {
    }

    /**
     * Propagates if the bit patterns differ. Default for joint stages: identical
     * inputs give bit-identical outputs, so any difference is a real change.
     */
    public static final ScalarCutoff EXACT = (p, c) -> Double.doubleToRawLongBits(p) != Double.doubleToRawLongBits(c);
}
