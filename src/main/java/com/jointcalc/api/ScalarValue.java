package com.jointcalc.api;

/**
 * Interface for nodes that expose a primitive double value.
 *
 * All joint quantities are scalars in consistent units (mm, N, N/mm², 1/K).
 * Downstream stages read their inputs through doubleValue() so a stage
 * function sees plain doubles and never boxed values.
 */
public interface ScalarValue extends Node<Double> {

    /**
     * Returns the current value as a primitive double.
     *
     * @return The primitive double value of the node.
     */
    double doubleValue();
}
