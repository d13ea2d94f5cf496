package io.probeflow.core.error;

/**
 * Reported when a sink's accept function throws. Surfaced to the sink's
 * consumer loop only; the emitting thread never sees it.
 */
public final class SinkAcceptException extends ProbeDispatchException {

    private static final long serialVersionUID = 1L;

    public SinkAcceptException(String message, Throwable cause, String sinkName) {
        super(message, cause, sinkName, null);
    }
}
