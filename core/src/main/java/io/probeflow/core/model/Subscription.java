package io.probeflow.core.model;

import io.probeflow.core.spi.RecordTransform;
import java.util.Objects;

/**
 * Binding of a {@link Selector} to a sink, with an optional transform.
 *
 * <p>
 * Refers to its sink by name only; the router resolves the name against the
 * same routing snapshot the subscription was found in. Immutable: updating a
 * subscription means registering a replacement under the same key.
 *
 * @param selector  the required tags
 * @param sinkName  the destination sink's name
 * @param transform the record transform, {@link RecordTransform#identity()} by
 *                  default
 */
public record Subscription(Selector selector, String sinkName, RecordTransform transform) {

    public Subscription {
        Objects.requireNonNull(selector, "selector must not be null");
        Objects.requireNonNull(sinkName, "sinkName must not be null");
        Objects.requireNonNull(transform, "transform must not be null");
    }

    /** Creates a subscription with the identity transform. */
    public static Subscription of(Selector selector, String sinkName) {
        return new Subscription(selector, sinkName, RecordTransform.identity());
    }

    public SubscriptionKey key() {
        return new SubscriptionKey(selector, sinkName);
    }

    public boolean matches(TagSet tags) {
        return selector.matches(tags);
    }

    @Override
    public String toString() {
        return "Subscription[" + selector + "->" + sinkName + "]";
    }
}
