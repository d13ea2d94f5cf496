package io.probeflow.core.error;

import io.probeflow.core.model.SubscriptionKey;

/**
 * Reported when a subscription's transform throws. That subscription
 * contributes nothing for the record; its siblings are unaffected.
 */
public final class TransformFailureException extends ProbeDispatchException {

    private static final long serialVersionUID = 1L;

    public TransformFailureException(String message, Throwable cause, SubscriptionKey subscription) {
        super(message, cause, subscription.sinkName(), subscription);
    }
}
