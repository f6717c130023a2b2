package com.jointcalc.fn;

/**
 * Stage function with 3 inputs, e.g. {@code Resilience::boltResilience}.
 */
@FunctionalInterface
public interface Fn3 {
    double apply(double a, double b, double c);
}
