package io.probeflow.core.error;

/** Thrown when a sink is added under a name that is already registered. */
public final class DuplicateSinkException extends ProbeRegistrationException {

    private static final long serialVersionUID = 1L;

    public DuplicateSinkException(String message, String sinkName) {
        super(message, sinkName);
    }
}
