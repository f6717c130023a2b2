package com.jointcalc.model;

/**
 * Classification of joint calculation problems.
 *
 * <p>
 * Fatal kinds abort the evaluation; every downstream stage depends on the
 * rejected value. Warning kinds annotate a complete result, since a failing
 * design still needs its numbers to judge how far off it is.
 */
public enum ErrorKind {
    INVALID_GEOMETRY(true),
    INVALID_MATERIAL(true),
    INVALID_LOAD_FACTOR(true),
    INVALID_LOAD_CASE(true),
    CLAMP_LOSS_WARNING(false),
    OVERLOAD(false),
    PRELOAD_SHORTFALL(false);

    private final boolean fatal;

    ErrorKind(boolean fatal) {
        this.fatal = fatal;
    }

    public boolean isFatal() {
        return fatal;
    }
}
