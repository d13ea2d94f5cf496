package io.probeflow.core.error;

import io.probeflow.core.model.SubscriptionKey;

/**
 * Abstract parent for per-record dispatch errors. The router constructs these
 * to report a failure (log, metrics, listener) but never throws them out of
 * {@code emit} or out of a sink's consumer loop. Carries the subscription
 * involved, when there is one.
 */
public abstract class ProbeDispatchException extends ProbeException {

    private static final long serialVersionUID = 1L;

    private final transient SubscriptionKey subscription;

    protected ProbeDispatchException(String message, Throwable cause, String sinkName, SubscriptionKey subscription) {
        super(message, cause, sinkName, Phase.DISPATCH);
        this.subscription = subscription;
    }

    /** The subscription whose contribution failed, or {@code null}. */
    public SubscriptionKey subscription() {
        return subscription;
    }
}
