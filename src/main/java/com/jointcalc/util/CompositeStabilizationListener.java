package com.jointcalc.util;

import com.jointcalc.api.StabilizationListener;

import java.util.Arrays;

/**
 * Fans stabilization callbacks out to several listeners, e.g. the stage trace
 * logger and a caller-supplied recorder.
 */
public class CompositeStabilizationListener implements StabilizationListener {
    private StabilizationListener[] listeners = new StabilizationListener[0];

    public void addForComposite(StabilizationListener listener) {
        StabilizationListener[] next = Arrays.copyOf(listeners, listeners.length + 1);
        next[listeners.length] = listener;
        listeners = next;
    }

    public int size() {
        return listeners.length;
    }

    @Override
    public void onStabilizationStart(long epoch) {
        for (StabilizationListener l : listeners)
            l.onStabilizationStart(epoch);
    }

    @Override
    public void onNodeStabilized(long epoch, int topoIndex, String nodeName, boolean changed, long durationNanos) {
        for (StabilizationListener l : listeners)
            l.onNodeStabilized(epoch, topoIndex, nodeName, changed, durationNanos);
    }

    @Override
    public void onNodeError(long epoch, int topoIndex, String nodeName, Throwable error) {
        for (StabilizationListener l : listeners)
            l.onNodeError(epoch, topoIndex, nodeName, error);
    }

    @Override
    public void onStabilizationEnd(long epoch, int nodesStabilized) {
        for (StabilizationListener l : listeners)
            l.onStabilizationEnd(epoch, nodesStabilized);
    }
}
