package io.probeflow.core.error;

/**
 * Abstract base for all probeflow exceptions. Never thrown directly; use the
 * concrete subclasses under {@link ProbeRegistrationException} or
 * {@link ProbeDispatchException}.
 */
public abstract class ProbeException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Phase in which the error occurred. */
    public enum Phase {
        REGISTRATION,
        DISPATCH
    }

    private final String sinkName;
    private final Phase phase;

    protected ProbeException(String message, String sinkName, Phase phase) {
        super(message);
        this.sinkName = sinkName;
        this.phase = phase;
    }

    protected ProbeException(String message, Throwable cause, String sinkName, Phase phase) {
        super(message, cause);
        this.sinkName = sinkName;
        this.phase = phase;
    }

    /** The sink involved, or {@code null} if none is. */
    public String sinkName() {
        return sinkName;
    }

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }

    /** The phase in which the error occurred. */
    public Phase phase() {
        return phase;
    }
}
