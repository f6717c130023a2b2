package com.jointcalc.model;

/**
 * @param muG Thread friction coefficient.
 * @param muK Head/nut bearing friction coefficient.
 * @param dKm Mean bearing diameter for the head friction moment, mm.
 */
public record FrictionModel(double muG, double muK, double dKm) {
}
