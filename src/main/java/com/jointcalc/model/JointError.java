package com.jointcalc.model;

/**
 * A diagnosed problem: what kind, in which stage, and which field or derived
 * quantity caused it.
 *
 * @param kind    The classification.
 * @param stage   The stage that detected it.
 * @param field   The offending input field (see {@link Fields}) or derived node name.
 * @param message Human-readable detail including the offending value.
 */
public record JointError(ErrorKind kind, Stage stage, String field, String message) {

    public boolean isFatal() {
        return kind.isFatal();
    }

    @Override
    public String toString() {
        return kind + " in " + stage.label() + " [" + field + "]: " + message;
    }
}
