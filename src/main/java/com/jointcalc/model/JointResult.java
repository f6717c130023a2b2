package com.jointcalc.model;

import java.util.List;
import java.util.Objects;

/**
 * Either a complete {@link DerivedState}, possibly annotated with non-fatal
 * warnings, or the single fatal {@link JointError} that aborted the evaluation.
 */
public final class JointResult {
    private final DerivedState state;
    private final List<JointError> warnings;
    private final JointError error;

    private JointResult(DerivedState state, List<JointError> warnings, JointError error) {
        this.state = state;
        this.warnings = warnings;
        this.error = error;
    }

    public static JointResult success(DerivedState state, List<JointError> warnings) {
        Objects.requireNonNull(state, "state");
        return new JointResult(state, List.copyOf(warnings), null);
    }

    public static JointResult failure(JointError error) {
        Objects.requireNonNull(error, "error");
        return new JointResult(null, List.of(), error);
    }

    public boolean isSuccess() {
        return state != null;
    }

    /**
     * @throws IllegalStateException if the evaluation failed.
     */
    public DerivedState state() {
        if (state == null)
            throw new IllegalStateException("No derived state, evaluation failed: " + error);
        return state;
    }

    /**
     * @throws IllegalStateException if the evaluation succeeded.
     */
    public JointError error() {
        if (error == null)
            throw new IllegalStateException("Evaluation succeeded");
        return error;
    }

    public List<JointError> warnings() {
        return warnings;
    }

    public boolean hasWarning(ErrorKind kind) {
        for (JointError w : warnings)
            if (w.kind() == kind)
                return true;
        return false;
    }

    @Override
    public String toString() {
        return isSuccess() ? "Success" + warnings + " " + state : "Failure " + error;
    }
}
