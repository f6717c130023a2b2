package com.jointcalc.node;

import com.jointcalc.api.ScalarCutoff;
import com.jointcalc.api.ScalarValue;
import com.jointcalc.api.SourceNode;
import com.jointcalc.util.ScalarCutoffs;

/**
 * An input field of a joint, e.g. "stack.lK" or "load.FA".
 *
 * When update(value) is called the caller must also mark the node dirty on the
 * engine so the new value is picked up by the next pass.
 */
public final class ScalarSourceNode implements SourceNode<Double>, ScalarValue {
    private final String name;
    private final ScalarCutoff cutoff;
    private double currentValue;
    private double previousValue = Double.NaN;
    private boolean initialized;

    public ScalarSourceNode(String name, double initialValue, ScalarCutoff cutoff) {
        this.name = name;
        this.cutoff = cutoff;
        this.currentValue = initialValue;
    }

    /** Creates an input with exact change detection. */
    public ScalarSourceNode(String name, double initialValue) {
        this(name, initialValue, ScalarCutoffs.EXACT);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public void update(Double value) {
        updateDouble(value);
    }

    public void updateDouble(double value) {
        this.currentValue = value;
    }

    @Override
    public boolean stabilize() {
        // First pass always propagates so every stage gets evaluated once.
        if (!initialized) {
            initialized = true;
            previousValue = currentValue;
            return true;
        }

        // Re-entering the same value (40.0 -> 40.0) stops propagation here.
        boolean changed = cutoff.hasChanged(previousValue, currentValue);
        if (changed)
            previousValue = currentValue;
        return changed;
    }

    @Override
    public Double value() {
        return currentValue;
    }

    @Override
    public double doubleValue() {
        return currentValue;
    }
}
