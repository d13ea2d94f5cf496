package io.probeflow.core.error;

/** Thrown when an operation references a sink name that is not registered. */
public final class UnknownSinkException extends ProbeRegistrationException {

    private static final long serialVersionUID = 1L;

    public UnknownSinkException(String message, String sinkName) {
        super(message, sinkName);
    }
}
