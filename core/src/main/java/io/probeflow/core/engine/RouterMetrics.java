package io.probeflow.core.engine;

import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;

/**
 * Thread-safe, lock-free implementation of {@link RouterMetricsMXBean}.
 *
 * <p>
 * All counters use {@link LongAdder} for contention-free concurrent updates
 * from emitting threads and sink consumer threads. The registry gauges are set
 * by the router after each registry mutation.
 */
public final class RouterMetrics implements RouterMetricsMXBean {

    private final LongAdder emitCount = new LongAdder();
    private final LongAdder shortCircuitCount = new LongAdder();
    private final LongAdder bodyFailureCount = new LongAdder();
    private final LongAdder dispatchCount = new LongAdder();

    private final LongAdder forwardCount = new LongAdder();
    private final LongAdder deliveredCount = new LongAdder();
    private final LongAdder droppedCount = new LongAdder();

    private final LongAdder transformFailureCount = new LongAdder();
    private final LongAdder policyFailureCount = new LongAdder();
    private final LongAdder sinkAcceptFailureCount = new LongAdder();

    private final AtomicLong sinkCount = new AtomicLong();
    private final AtomicLong subscriptionCount = new AtomicLong();

    // ── Increment methods (called by ProbeRouter) ──

    void recordEmit() {
        emitCount.increment();
    }

    void recordShortCircuit() {
        shortCircuitCount.increment();
    }

    void recordBodyFailure() {
        bodyFailureCount.increment();
    }

    void recordDispatch(int forwarded) {
        dispatchCount.increment();
        forwardCount.add(forwarded);
    }

    void recordDelivered() {
        deliveredCount.increment();
    }

    void recordDropped() {
        droppedCount.increment();
    }

    void recordTransformFailure() {
        transformFailureCount.increment();
    }

    void recordPolicyFailure() {
        policyFailureCount.increment();
    }

    void recordSinkAcceptFailure() {
        sinkAcceptFailureCount.increment();
    }

    void setRegistrySize(int sinks, int subscriptions) {
        sinkCount.set(sinks);
        subscriptionCount.set(subscriptions);
    }

    // ── MXBean interface ──

    @Override
    public long getEmitCount() {
        return emitCount.sum();
    }

    @Override
    public long getShortCircuitCount() {
        return shortCircuitCount.sum();
    }

    @Override
    public long getBodyFailureCount() {
        return bodyFailureCount.sum();
    }

    @Override
    public long getDispatchCount() {
        return dispatchCount.sum();
    }

    @Override
    public long getForwardCount() {
        return forwardCount.sum();
    }

    @Override
    public long getDeliveredCount() {
        return deliveredCount.sum();
    }

    @Override
    public long getDroppedCount() {
        return droppedCount.sum();
    }

    @Override
    public long getTransformFailureCount() {
        return transformFailureCount.sum();
    }

    @Override
    public long getPolicyFailureCount() {
        return policyFailureCount.sum();
    }

    @Override
    public long getSinkAcceptFailureCount() {
        return sinkAcceptFailureCount.sum();
    }

    @Override
    public long getSinkCount() {
        return sinkCount.get();
    }

    @Override
    public long getSubscriptionCount() {
        return subscriptionCount.get();
    }

    @Override
    public void resetMetrics() {
        emitCount.reset();
        shortCircuitCount.reset();
        bodyFailureCount.reset();
        dispatchCount.reset();
        forwardCount.reset();
        deliveredCount.reset();
        droppedCount.reset();
        transformFailureCount.reset();
        policyFailureCount.reset();
        sinkAcceptFailureCount.reset();
    }
}
