package io.probeflow.core.error;

/**
 * Thrown by a compiled transform expression when evaluation fails at
 * runtime. The router reports it as a {@link TransformFailureException}.
 */
public final class ExpressionEvalException extends ProbeDispatchException {

    private static final long serialVersionUID = 1L;

    public ExpressionEvalException(String message, Throwable cause) {
        super(message, cause, null, null);
    }
}
