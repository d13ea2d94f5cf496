package io.probeflow.core.engine;

import io.probeflow.core.model.Subscription;
import io.probeflow.core.model.SubscriptionKey;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable snapshot of all registered sinks and subscriptions, plus the
 * {@link ActiveTagIndex} derived from them.
 *
 * <p>
 * This is the unit of atomic swap in {@link ProbeRouter}: every registry
 * mutation builds a new table and publishes it through an
 * {@link java.util.concurrent.atomic.AtomicReference}. Dispatches that
 * captured the old reference continue using it; new dispatches pick up the
 * new one. No dispatch ever sees a half-applied mutation.
 *
 * <p>
 * Thread-safe: all fields are final and collections are unmodifiable.
 */
final class RoutingTable {

    private static final RoutingTable EMPTY = new RoutingTable(Map.of(), List.of());

    private final Map<String, SinkHandle> sinks;
    /** Subscriptions in registration order; a replacement keeps its slot. */
    private final List<Subscription> subscriptions;
    private final Map<SubscriptionKey, Subscription> byKey;
    private final ActiveTagIndex index;

    private RoutingTable(Map<String, SinkHandle> sinks, List<Subscription> subscriptions) {
        this.sinks = sinks;
        this.subscriptions = subscriptions;
        Map<SubscriptionKey, Subscription> keyed = new LinkedHashMap<>();
        for (Subscription sub : subscriptions) {
            keyed.put(sub.key(), sub);
        }
        this.byKey = Collections.unmodifiableMap(keyed);
        this.index = ActiveTagIndex.build(subscriptions);
    }

    /** Creates an empty table with no sinks and no subscriptions. */
    static RoutingTable empty() {
        return EMPTY;
    }

    SinkHandle sink(String name) {
        return sinks.get(name);
    }

    Collection<SinkHandle> sinks() {
        return sinks.values();
    }

    Subscription subscription(SubscriptionKey key) {
        return byKey.get(key);
    }

    List<Subscription> subscriptions() {
        return subscriptions;
    }

    ActiveTagIndex index() {
        return index;
    }

    int sinkCount() {
        return sinks.size();
    }

    int subscriptionCount() {
        return subscriptions.size();
    }

    /** Returns a table with {@code handle} added, or replacing the handle of the same name. */
    RoutingTable withSink(SinkHandle handle) {
        Map<String, SinkHandle> updated = new LinkedHashMap<>(sinks);
        updated.put(handle.name(), handle);
        return new RoutingTable(Collections.unmodifiableMap(updated), subscriptions);
    }

    /** Returns a table without the named sink and without every subscription targeting it. */
    RoutingTable withoutSink(String name) {
        if (!sinks.containsKey(name)) {
            return this;
        }
        Map<String, SinkHandle> updated = new LinkedHashMap<>(sinks);
        updated.remove(name);
        List<Subscription> remaining = new ArrayList<>(subscriptions.size());
        for (Subscription sub : subscriptions) {
            if (!sub.sinkName().equals(name)) {
                remaining.add(sub);
            }
        }
        return new RoutingTable(Collections.unmodifiableMap(updated), Collections.unmodifiableList(remaining));
    }

    /**
     * Returns a table with {@code subscription} registered. An existing
     * subscription with the same key is replaced in its original slot.
     */
    RoutingTable withSubscription(Subscription subscription) {
        List<Subscription> updated = new ArrayList<>(subscriptions);
        SubscriptionKey key = subscription.key();
        int slot = -1;
        for (int i = 0; i < updated.size(); i++) {
            if (updated.get(i).key().equals(key)) {
                slot = i;
                break;
            }
        }
        if (slot >= 0) {
            updated.set(slot, subscription);
        } else {
            updated.add(subscription);
        }
        return new RoutingTable(sinks, Collections.unmodifiableList(updated));
    }

    /** Returns a table without the subscription under {@code key}, if any. */
    RoutingTable withoutSubscription(SubscriptionKey key) {
        if (!byKey.containsKey(key)) {
            return this;
        }
        List<Subscription> updated = new ArrayList<>(subscriptions);
        updated.removeIf(sub -> sub.key().equals(key));
        return new RoutingTable(sinks, Collections.unmodifiableList(updated));
    }
}
