package com.jointcalc.node;

import com.jointcalc.api.ScalarCutoff;

/**
 * A scalar node that delegates to a stage function.
 *
 * A rejected input is never degraded into NaN: the stage function's exception
 * reaches the engine, which aborts the pass and reports this node.
 */
public final class ScalarCalcNode extends ScalarNode {
    private final CalcFn fn;

    public ScalarCalcNode(String name, ScalarCutoff cutoff, CalcFn fn) {
        super(name, cutoff);
        this.fn = fn;
    }

    @Override
    protected double compute() {
        return fn.compute();
    }

    /** The computation logic. */
    @FunctionalInterface
    public interface CalcFn {
        double compute();
    }
}
