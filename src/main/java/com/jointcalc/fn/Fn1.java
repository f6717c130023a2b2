package com.jointcalc.fn;

/**
 * Stage function with 1 input.
 */
@FunctionalInterface
public interface Fn1 {
    double apply(double a);
}
