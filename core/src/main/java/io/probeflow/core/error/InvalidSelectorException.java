package io.probeflow.core.error;

/** Thrown when a selector is empty or contains a null or blank tag. */
public final class InvalidSelectorException extends ProbeRegistrationException {

    private static final long serialVersionUID = 1L;

    public InvalidSelectorException(String message) {
        super(message, null);
    }
}
