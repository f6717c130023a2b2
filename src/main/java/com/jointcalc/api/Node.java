package com.jointcalc.api;

/**
 * A node in the joint calculation graph.
 *
 * Every input field of a joint (a bolt diameter, a friction coefficient, an
 * operating load) and every derived quantity (stress area, resilience, load
 * factor, working forces) is a node. Nodes are wired into a DAG whose edges
 * follow the data dependencies between calculation stages.
 *
 * Key Responsibilities:
 *
 * 1. Identity: Every node has a unique name within the graph, such as
 * "bolt.d2" or "deltaBolt". Names are used for wiring, for reporting the
 * offending quantity when a stage fails, and for diagnostics.
 *
 * 2. Computation: stabilize() recomputes the node from its inputs.
 *
 * 3. State Access: value() returns the current result.
 *
 * @param <T> The type of value held by this node (Double, Boolean).
 */
public interface Node<T> {

    /**
     * Returns the unique name of this node.
     *
     * @return The identifier used for wiring and error reporting.
     */
    String name();

    /**
     * Recomputes the node's value based on its inputs.
     *
     * Called by the StabilizationEngine during a pass when the node has been
     * marked dirty. A stage function that rejects its inputs throws from here;
     * the engine aborts the pass and reports this node as the failure point.
     *
     * Return Value Contract:
     * - true: the value changed, dependents are marked dirty.
     * - false: the value is unchanged, propagation stops on this branch.
     *
     * @return true if downstream dependents need to be recomputed.
     */
    boolean stabilize();

    /**
     * Returns the current value of the node.
     *
     * Only consistent after the engine has completed a stabilization pass.
     *
     * @return The current stabilized state of the node.
     */
    T value();
}
