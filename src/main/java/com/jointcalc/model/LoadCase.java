package com.jointcalc.model;

/**
 * Operating loads and assembly conditions of one joint.
 *
 * @param axialLoad      Working axial load FA, N.
 * @param additionalLoad Additional external load FZ, N.
 * @param loadExponent   Eccentric loading exponent n (1 uniform pressure, 4 to 8 bending).
 * @param dA             Load introduction diameter, mm.
 * @param deltaT         Temperature change relative to assembly, K.
 * @param interfaces     Number of clamped interfaces, at least 1.
 * @param embedding      Settling amount fZ, mm.
 * @param tablePreload   Assembly preload FMTab from the torque tables, N.
 */
public record LoadCase(double axialLoad, double additionalLoad, double loadExponent, double dA,
        double deltaT, int interfaces, double embedding, double tablePreload) {
}
