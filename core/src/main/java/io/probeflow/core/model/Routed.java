package io.probeflow.core.model;

import java.util.Objects;

/**
 * A transformed record paired with the subscription that produced it. Dedup
 * policies receive and return these.
 *
 * @param subscription the producing subscription
 * @param record       the subscription's transformed record
 */
public record Routed(Subscription subscription, ProbeRecord record) {

    public Routed {
        Objects.requireNonNull(subscription, "subscription must not be null");
        Objects.requireNonNull(record, "record must not be null");
    }
}
