package com.jointcalc.engine;

import com.jointcalc.api.Node;
import com.jointcalc.api.ScalarValue;
import com.jointcalc.api.StabilizationListener;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Drives the recomputation of a joint calculation graph.
 *
 * Algorithm:
 *
 * 1. Mark Dirty: an updated input field is flagged in a boolean array.
 *
 * 2. Iterate: nodes are visited in topological order, so a stage always runs
 * after the stages it reads from.
 *
 * 3. Skip Clean: nodes that are not dirty are skipped. Changing the operating
 * load therefore never re-runs the resilience stages.
 *
 * 4. Recompute: dirty nodes run their stage function.
 *
 * 5. Propagate: if the value changed, the node's children are marked dirty.
 *
 * Fail Fast:
 * The first node that throws, or that evaluates to NaN or infinity, aborts
 * the pass. The listener is notified, the engine becomes unhealthy and a
 * {@link StabilizationException} naming the node is raised. An unhealthy
 * engine refuses to stabilize until {@link #resetHealth()} is called, so a
 * partially evaluated joint is never read as a valid result.
 */
public final class StabilizationEngine {
    private static final Logger log = LogManager.getLogger(StabilizationEngine.class);

    private final TopologicalOrder topology;

    // dirty[i] == true means node i needs to be re-evaluated
    private final boolean[] dirty;

    private boolean healthy = true;

    private int lastStabilizedCount;
    private long epoch;
    private StabilizationListener listener;

    public StabilizationEngine(TopologicalOrder topology) {
        this.topology = topology;
        this.dirty = new boolean[topology.nodeCount()];

        // Inputs start dirty so the first pass evaluates every stage.
        for (int i = 0; i < topology.nodeCount(); i++) {
            if (topology.isSource(i))
                dirty[i] = true;
        }
    }

    public void setListener(StabilizationListener listener) {
        this.listener = listener;
    }

    /** Marks a node as dirty by name. */
    public void markDirty(String nodeName) {
        dirty[topology.topoIndex(nodeName)] = true;
    }

    /** Marks a node as dirty by topological index. */
    public void markDirty(int topoIndex) {
        dirty[topoIndex] = true;
    }

    /**
     * Run one deterministic stabilization pass.
     *
     * @return The number of nodes that were recomputed.
     * @throws IllegalStateException  if the engine is already unhealthy.
     * @throws StabilizationException if a node failed during this pass.
     */
    public int stabilize() {
        if (!healthy) {
            throw new IllegalStateException(
                    "Graph is in unhealthy state due to previous errors. Manual reset required.");
        }

        epoch++;
        int stabilizedCount = 0;
        final int n = topology.nodeCount();
        final StabilizationListener l = this.listener;
        final boolean hasListener = l != null;

        if (hasListener)
            l.onStabilizationStart(epoch);

        String failedNode = null;
        Throwable firstError = null;

        try {
            for (int ti = 0; ti < n; ti++) {
                if (!dirty[ti])
                    continue;

                // Cleared before processing. A failing node is re-dirtied by
                // its inputs once they are corrected.
                dirty[ti] = false;

                Node<?> node = topology.node(ti);
                long nodeStart = hasListener ? System.nanoTime() : 0L;

                boolean changed;
                try {
                    changed = node.stabilize();
                } catch (RuntimeException e) {
                    failedNode = node.name();
                    firstError = e;
                    if (hasListener)
                        l.onNodeError(epoch, ti, node.name(), e);
                    break;
                }

                stabilizedCount++;

                if (node instanceof ScalarValue sv && !Double.isFinite(sv.doubleValue())) {
                    failedNode = node.name();
                    firstError = new IllegalStateException("Node evaluated to " + sv.doubleValue());
                    if (hasListener)
                        l.onNodeError(epoch, ti, node.name(), firstError);
                    break;
                }

                if (hasListener)
                    l.onNodeStabilized(epoch, ti, node.name(), changed, System.nanoTime() - nodeStart);

                if (changed) {
                    final int start = topology.childrenStart(ti);
                    final int end = topology.childrenEnd(ti);
                    for (int ci = start; ci < end; ci++)
                        dirty[topology.childAt(ci)] = true;
                }
            }
        } finally {
            this.lastStabilizedCount = stabilizedCount;
            if (hasListener)
                l.onStabilizationEnd(epoch, stabilizedCount);
        }

        if (firstError != null) {
            this.healthy = false;
            log.debug("Epoch {} aborted at node '{}': {}", epoch, failedNode, firstError.getMessage());
            throw new StabilizationException(failedNode, firstError);
        }

        return stabilizedCount;
    }

    public long epoch() {
        return epoch;
    }

    public boolean isHealthy() {
        return healthy;
    }

    public void resetHealth() {
        this.healthy = true;
    }

    public int lastStabilizedCount() {
        return lastStabilizedCount;
    }

    public int nodeCount() {
        return topology.nodeCount();
    }

    public TopologicalOrder topology() {
        return topology;
    }
}
