package io.probeflow.core.error;

/**
 * Reported when a sink's dedup policy throws or returns an invalid result.
 * The sink receives nothing for that record; other sinks are unaffected.
 */
public final class PolicyFailureException extends ProbeDispatchException {

    private static final long serialVersionUID = 1L;

    public PolicyFailureException(String message, Throwable cause, String sinkName) {
        super(message, cause, sinkName, null);
    }
}
