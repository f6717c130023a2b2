package com.jointcalc.util;

import com.jointcalc.api.StabilizationListener;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import lombok.extern.log4j.Log4j2;

/**
 * Records which nodes were recomputed in the most recent pass and traces them
 * to the log.
 *
 * <p>
 * The recorded list is what makes partial recomputation observable: after
 * changing only the operating load, the resilience nodes do not appear in it.
 */
@Log4j2
public final class StageTraceListener implements StabilizationListener {
    // shared so a batch of failing joints logs at most once per second
    private static final ErrorRateLimiter ERR_LIMITER = new ErrorRateLimiter(log, 1000);
    private final List<String> recomputed = new ArrayList<>();
    private String failedNode;
    private long stabilizeStartNanos;
    private long lastLatencyNanos;

    @Override
    public void onStabilizationStart(long epoch) {
        recomputed.clear();
        failedNode = null;
        stabilizeStartNanos = System.nanoTime();
    }

    @Override
    public void onNodeStabilized(long epoch, int topoIndex, String nodeName, boolean changed, long durationNanos) {
        recomputed.add(nodeName);
        if (log.isTraceEnabled())
            log.trace("epoch={} [{}] {} changed={} ({} ns)", epoch, topoIndex, nodeName, changed, durationNanos);
    }

    @Override
    public void onNodeError(long epoch, int topoIndex, String nodeName, Throwable error) {
        failedNode = nodeName;
        ERR_LIMITER.log(String.format("Joint calculation failed at node '%s': %s", nodeName, error.getMessage()), null);
    }

    @Override
    public void onStabilizationEnd(long epoch, int nodesStabilized) {
        lastLatencyNanos = System.nanoTime() - stabilizeStartNanos;
        log.debug("epoch={} recomputed {} node(s) in {} us", epoch, nodesStabilized, lastLatencyNanos / 1000);
    }

    /** Names of the nodes recomputed in the last pass, in evaluation order. */
    public List<String> lastRecomputed() {
        return Collections.unmodifiableList(new ArrayList<>(recomputed));
    }

    /** Node that failed in the last pass, or null. */
    public String lastFailedNode() {
        return failedNode;
    }

    public long lastLatencyNanos() {
        return lastLatencyNanos;
    }
}
