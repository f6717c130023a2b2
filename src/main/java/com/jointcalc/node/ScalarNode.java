package com.jointcalc.node;

import com.jointcalc.api.ScalarCutoff;
import com.jointcalc.api.ScalarValue;

/**
 * Base class for nodes that derive a single double from other nodes.
 *
 * stabilize() is final and owns the change detection; subclasses implement
 * compute(). If compute() throws, the previous value is kept and the exception
 * propagates to the engine.
 */
public abstract class ScalarNode implements ScalarValue {
    private final String name;
    private final ScalarCutoff cutoff;

    private double currentValue = Double.NaN;
    private double previousValue = Double.NaN;

    protected ScalarNode(String name, ScalarCutoff cutoff) {
        this.name = name;
        this.cutoff = cutoff;
    }

    @Override
    public final String name() {
        return name;
    }

    /**
     * @return The new calculated value.
     */
    protected abstract double compute();

    @Override
    public final boolean stabilize() {
        double next = compute();
        previousValue = currentValue;
        currentValue = next;

        if (Double.isNaN(previousValue))
            return true;

        return cutoff.hasChanged(previousValue, currentValue);
    }

    @Override
    public final Double value() {
        return currentValue;
    }

    @Override
    public final double doubleValue() {
        return currentValue;
    }

    /** Value from the previous stabilization cycle. */
    public final double previousDoubleValue() {
        return previousValue;
    }
}
