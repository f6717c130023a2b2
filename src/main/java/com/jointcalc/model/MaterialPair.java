package com.jointcalc.model;

/**
 * Bolt and clamped-part material data.
 *
 * @param boltModulus  E_B, N/mm².
 * @param alphaBolt    Thermal expansion coefficient of the bolt alphaA, 1/K.
 * @param alphaClamped Thermal expansion coefficient of the clamped parts alphaP, 1/K.
 * @param rp02         Yield strength Rp0.2, N/mm².
 * @param rm           Ultimate tensile strength, N/mm².
 */
public record MaterialPair(double boltModulus, double alphaBolt, double alphaClamped, double rp02, double rm) {

    /** Steel bolt in steel plates, property class 8.8. */
    public static MaterialPair steel88() {
        return new MaterialPair(210000.0, 11.5e-6, 11.5e-6, 640.0, 800.0);
    }
}
