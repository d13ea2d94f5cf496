package io.probeflow.core.engine;

/**
 * JMX MXBean interface for router metrics.
 *
 * <p>
 * Registered under ObjectName
 * {@code io.probeflow:type=RouterMetrics,instance=<instanceName>} when
 * {@code jmx-enabled} is set. All counters are thread-safe and lock-free.
 *
 * @see RouterMetrics
 */
public interface RouterMetricsMXBean {

    // --- Emission ---

    /** Calls to {@code emit}. */
    long getEmitCount();

    /** Emissions rejected by the pre-check without building the record. */
    long getShortCircuitCount();

    /** Emissions whose record body threw. */
    long getBodyFailureCount();

    /** Emissions that matched at least one subscription exactly. */
    long getDispatchCount();

    // --- Forwarding ---

    /** Records accepted into sink merge points. */
    long getForwardCount();

    /** Records handed to a sink's accept function without error. */
    long getDeliveredCount();

    /** Records discarded by merge points (full queue, eviction, closed sink). */
    long getDroppedCount();

    // --- Failures ---

    long getTransformFailureCount();

    long getPolicyFailureCount();

    long getSinkAcceptFailureCount();

    // --- Registry ---

    long getSinkCount();

    long getSubscriptionCount();

    /** Resets all counters. Registry gauges are not reset. */
    void resetMetrics();
}
