package com.jointcalc.model;

/** Strength the surface criterion compares against. */
public enum StrengthBasis {
    /** Ultimate tensile strength Rm. */
    UTS,
    /** Yield strength Rp0.2. */
    YIELD
}
