package io.probeflow.core.error;

/**
 * Abstract parent for registry mutation errors: adding sinks, subscribing,
 * swapping policies, compiling configured transforms. Always thrown
 * synchronously to the caller of the mutating operation.
 */
public abstract class ProbeRegistrationException extends ProbeException {

    private static final long serialVersionUID = 1L;

    protected ProbeRegistrationException(String message, String sinkName) {
        super(message, sinkName, Phase.REGISTRATION);
    }

    protected ProbeRegistrationException(String message, Throwable cause, String sinkName) {
        super(message, cause, sinkName, Phase.REGISTRATION);
    }
}
