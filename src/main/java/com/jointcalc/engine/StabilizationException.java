package com.jointcalc.engine;

/**
 * Raised when a stabilization pass aborts because a node failed.
 *
 * The cause is the exception thrown by the failing node's stage function, or
 * an {@link IllegalStateException} when the node evaluated to NaN.
 */
public class StabilizationException extends RuntimeException {
    private final String nodeName;

    public StabilizationException(String nodeName, Throwable cause) {
        super("Stabilization failed at node '" + nodeName + "'. Graph is now unhealthy.", cause);
        this.nodeName = nodeName;
    }

    /** Name of the first node that failed in the aborted pass. */
    public String nodeName() {
        return nodeName;
    }
}
