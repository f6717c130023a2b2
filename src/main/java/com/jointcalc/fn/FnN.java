package com.jointcalc.fn;

/**
 * Stage function with N inputs.
 *
 * The input array is a scratch buffer reused across invocations. Implementations
 * must not keep a reference to it.
 */
@FunctionalInterface
public interface FnN {
    /**
     * @param inputs The input values in declaration order (read-only, transient).
     * @return The result.
     */
    double apply(double[] inputs);
}
