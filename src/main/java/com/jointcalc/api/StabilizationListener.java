package com.jointcalc.api;

/**
 * Observability interface for the stabilization process.
 *
 * Listeners registered with the StabilizationEngine are told which stages were
 * recomputed in a pass and which one failed. They are the hook used for stage
 * tracing and for verifying that an input change only re-ran the dependent
 * stages.
 *
 * Callbacks run inside the stabilization loop and must stay lightweight.
 */
public interface StabilizationListener {

    /**
     * Called immediately before a stabilization pass begins.
     *
     * @param epoch The incrementing revision number of the graph state.
     */
    void onStabilizationStart(long epoch);

    /**
     * Called after a node has finished its stabilize() method.
     *
     * @param epoch         Current graph epoch.
     * @param topoIndex     The topological index of the node.
     * @param nodeName      The name of the node.
     * @param changed       true if the node's output changed and was propagated.
     * @param durationNanos Time spent in stabilize().
     */
    void onNodeStabilized(long epoch, int topoIndex, String nodeName, boolean changed, long durationNanos);

    /**
     * Called when a node fails to stabilize, either by throwing or by
     * evaluating to NaN.
     *
     * @param epoch     Current graph epoch.
     * @param topoIndex The topological index of the node.
     * @param nodeName  The name of the failing node.
     * @param error     The failure.
     */
    void onNodeError(long epoch, int topoIndex, String nodeName, Throwable error);

    /**
     * Called when the stabilization pass is complete, successful or not.
     *
     * @param epoch           Current graph epoch.
     * @param nodesStabilized Number of nodes re-evaluated this cycle.
     */
    void onStabilizationEnd(long epoch, int nodesStabilized);
}
