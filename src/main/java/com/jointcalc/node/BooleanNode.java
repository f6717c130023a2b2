package com.jointcalc.node;

import com.jointcalc.api.Node;

/**
 * Boolean diagnostic node, e.g. "clampLoss" (FKB &lt;= 0) or "overload".
 *
 * <p>
 * Propagates only when the condition flips. The first stabilization always
 * reports a change so consumers see the initial state even when it is
 * {@code false}.
 */
public final class BooleanNode implements Node<Boolean> {
    private final String name;
    private final BooleanCalcFn fn;

    private boolean currentValue;
    private boolean previousValue;
    private boolean initialized;

    public BooleanNode(String name, BooleanCalcFn fn) {
        this.name = name;
        this.fn = fn;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public boolean stabilize() {
        boolean next = fn.compute();
        previousValue = currentValue;
        currentValue = next;

        if (!initialized) {
            initialized = true;
            return true;
        }
        return currentValue != previousValue;
    }

    @Override
    public Boolean value() {
        return currentValue;
    }

    public boolean booleanValue() {
        return currentValue;
    }

    @FunctionalInterface
    public interface BooleanCalcFn {
        boolean compute();
    }
}
