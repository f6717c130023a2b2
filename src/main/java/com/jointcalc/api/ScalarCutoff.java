package com.jointcalc.api;

/**
 * Decides whether a recomputed scalar differs enough from its previous value
 * to dirty the dependent stages.
 */
@FunctionalInterface
public interface ScalarCutoff {

    /**
     * @param previous The value from the previous stabilization cycle.
     * @param current  The newly computed value.
     * @return {@code true} if the change is significant; {@code false} otherwise.
     */
    boolean hasChanged(double previous, double current);
}
