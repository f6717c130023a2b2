package com.jointcalc.model;

/**
 * Thrown by a stage function that rejects its inputs.
 */
public class JointCalculationException extends RuntimeException {
    private final JointError error;

    public JointCalculationException(ErrorKind kind, Stage stage, String field, String message) {
        this(new JointError(kind, stage, field, message));
    }

    public JointCalculationException(JointError error) {
        super(error.toString());
        this.error = error;
    }

    public JointError error() {
        return error;
    }

    public ErrorKind kind() {
        return error.kind();
    }

    public Stage stage() {
        return error.stage();
    }

    public String field() {
        return error.field();
    }
}
