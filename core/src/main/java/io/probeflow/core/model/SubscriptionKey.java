package io.probeflow.core.model;

import java.util.Objects;

/**
 * Identity of a subscription. At most one subscription exists per key.
 *
 * @param selector the required tags
 * @param sinkName the destination sink's name
 */
public record SubscriptionKey(Selector selector, String sinkName) {

    public SubscriptionKey {
        Objects.requireNonNull(selector, "selector must not be null");
        Objects.requireNonNull(sinkName, "sinkName must not be null");
    }

    @Override
    public String toString() {
        return selector + "->" + sinkName;
    }
}
