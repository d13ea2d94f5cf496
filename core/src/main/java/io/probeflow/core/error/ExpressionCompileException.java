package io.probeflow.core.error;

/** Thrown when a configured transform expression fails to compile. */
public final class ExpressionCompileException extends ProbeRegistrationException {

    private static final long serialVersionUID = 1L;

    public ExpressionCompileException(String message, Throwable cause, String sinkName) {
        super(message, cause, sinkName);
    }
}
