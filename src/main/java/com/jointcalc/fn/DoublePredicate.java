package com.jointcalc.fn;

/**
 * Primitive predicate used by condition nodes.
 */
@FunctionalInterface
public interface DoublePredicate {
    boolean test(double value);
}
