package com.jointcalc.fn;

/**
 * Stage function with 2 inputs.
 *
 * <p>
 * Examples:
 * <ul>
 * <li>{@code ThreadGeometry::stressArea}</li>
 * <li>{@code LoadDistribution::loadFactor}</li>
 * </ul>
 */
@FunctionalInterface
public interface Fn2 {
    double apply(double a, double b);
}
