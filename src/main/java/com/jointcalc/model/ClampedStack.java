package com.jointcalc.model;

/**
 * The clamped plates under the bolt head.
 *
 * @param lK             Clamped length, mm.
 * @param dW             Bearing (washer) diameter, mm.
 * @param dh             Hole diameter, mm.
 * @param clampedModulus Modulus of elasticity of the clamped material E_P, N/mm².
 */
public record ClampedStack(double lK, double dW, double dh, double clampedModulus) {
}
