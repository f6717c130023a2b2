package com.jointcalc.api;

/**
 * Represents an input field of a joint specification.
 *
 * Source nodes have no dependencies. Examples: the clamped length, the bolt
 * modulus of elasticity, the operating axial load.
 *
 * Usage Contract:
 * Updating a source node is a two-step process:
 *
 * 1. Modify State: call update(value).
 * 2. Notify Engine: call StabilizationEngine.markDirty(nodeId).
 *
 * Without step 2 the engine never visits the node or its dependents.
 * JointGraph.update(...) performs both steps.
 *
 * @param <T> The type of value accepted by this source node.
 */
public interface SourceNode<T> extends Node<T> {

    /**
     * Updates the value of this source node.
     *
     * @param value The new value to set.
     */
    void update(T value);
}
