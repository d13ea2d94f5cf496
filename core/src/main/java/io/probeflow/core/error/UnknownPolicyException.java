package io.probeflow.core.error;

/** Thrown when a named dedup policy is not registered in the policy registry. */
public final class UnknownPolicyException extends ProbeRegistrationException {

    private static final long serialVersionUID = 1L;

    public UnknownPolicyException(String message, String sinkName) {
        super(message, sinkName);
    }
}
