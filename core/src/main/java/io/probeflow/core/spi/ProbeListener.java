package io.probeflow.core.spi;

import io.probeflow.core.model.SubscriptionKey;
import io.probeflow.core.model.TagSet;

/**
 * SPI for observability hooks on the routing engine.
 *
 * <p>
 * Adapters bridge these events to metrics or tracing systems; the core has no
 * telemetry dependencies of its own.
 *
 * <p>
 * All methods receive immutable event objects. Implementations MUST be
 * thread-safe and non-blocking: dispatch events arrive on emitting threads,
 * accept failures on sink consumer threads. Exceptions thrown by listeners are
 * caught by the router and logged; they do NOT affect routing.
 */
public interface ProbeListener {

    /**
     * Called after a record passed the exact match and was offered to its
     * sinks.
     *
     * @param event contains the record tags, matching subscription count and
     *              forwarded record count
     */
    void onRecordDispatched(RecordDispatchedEvent event);

    /**
     * Called when a subscription's transform throws.
     *
     * @param event contains the subscription key and error detail
     */
    void onTransformFailed(TransformFailedEvent event);

    /**
     * Called when a sink's dedup policy throws or returns an invalid result.
     *
     * @param event contains sink name, policy label and error detail
     */
    void onPolicyFailed(PolicyFailedEvent event);

    /**
     * Called on a sink's consumer thread when its accept function throws.
     *
     * @param event contains sink name, generation and error detail
     */
    void onSinkAcceptFailed(SinkAcceptFailedEvent event);

    /**
     * Called when a merge point discards a record (full queue under a drop
     * policy, or the sink was already closed).
     *
     * @param event contains sink name, generation and reason
     */
    void onRecordDropped(RecordDroppedEvent event);

    /**
     * Called when a sink is registered.
     *
     * @param event contains sink name, generation and policy label
     */
    void onSinkAdded(SinkAddedEvent event);

    /**
     * Called when a sink is removed.
     *
     * @param event contains sink name, generation and the number of
     *              subscriptions removed with it
     */
    void onSinkRemoved(SinkRemovedEvent event);

    // --- Event records ---

    /** Why a merge point discarded a record. */
    enum DropReason {
        QUEUE_FULL,
        EVICTED,
        SINK_CLOSED
    }

    /** Event emitted after a record was offered to its sinks. */
    record RecordDispatchedEvent(TagSet tags, int matchedSubscriptions, int forwardedRecords) {}

    /** Event emitted when a transform fails. */
    record TransformFailedEvent(SubscriptionKey subscription, String errorDetail) {}

    /** Event emitted when a dedup policy fails. */
    record PolicyFailedEvent(String sinkName, String policy, String errorDetail) {}

    /** Event emitted when a sink's accept function fails. */
    record SinkAcceptFailedEvent(String sinkName, long generation, String errorDetail) {}

    /** Event emitted when a record is dropped by a merge point. */
    record RecordDroppedEvent(String sinkName, long generation, DropReason reason) {}

    /** Event emitted when a sink is registered. */
    record SinkAddedEvent(String sinkName, long generation, String policy) {}

    /** Event emitted when a sink is removed. */
    record SinkRemovedEvent(String sinkName, long generation, int removedSubscriptions) {}
}
