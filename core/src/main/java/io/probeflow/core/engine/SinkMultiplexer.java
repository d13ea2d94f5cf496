package io.probeflow.core.engine;

import io.probeflow.core.error.SinkAcceptException;
import io.probeflow.core.model.BackpressureMode;
import io.probeflow.core.model.ProbeRecord;
import io.probeflow.core.spi.ProbeListener.DropReason;
import io.probeflow.core.spi.SinkAdapter;
import java.time.Duration;
import java.util.concurrent.LinkedBlockingDeque;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Merge point of one sink: accepts records pushed concurrently by any number
 * of dispatching threads and delivers them, one at a time and in arrival
 * order, to the sink's {@link SinkAdapter} on a dedicated consumer thread.
 *
 * <p>
 * The queue is bounded. When it is full, {@link BackpressureMode} decides
 * whether the producer waits, the oldest record is evicted, or the incoming
 * one is discarded.
 *
 * <p>
 * {@link #close()} stops intake; the consumer keeps draining what is already
 * queued and then exits. A record offered after close is dropped.
 */
final class SinkMultiplexer {

    private static final Logger LOG = LoggerFactory.getLogger(SinkMultiplexer.class);

    /** MDC key holding the sink name while its accept function runs. */
    static final String MDC_SINK = "probe.sink";

    private static final long POLL_MS = 50;

    /** Callbacks into the owning router for metrics and listener events. */
    interface Events {
        void delivered(String sinkName);

        void acceptFailed(SinkAcceptException failure, long generation);

        void dropped(String sinkName, long generation, DropReason reason);
    }

    private final String sinkName;
    private final long generation;
    private final SinkAdapter adapter;
    private final BackpressureMode backpressure;
    private final LinkedBlockingDeque<ProbeRecord> queue;
    private final Events events;
    private final Thread consumer;

    /** Records queued or being delivered. */
    private final AtomicInteger pending = new AtomicInteger();

    private final Object drainMonitor = new Object();
    private volatile boolean closed;
    private volatile boolean terminated;

    SinkMultiplexer(
            String sinkName,
            long generation,
            SinkAdapter adapter,
            BackpressureMode backpressure,
            int capacity,
            String threadPrefix,
            Events events) {
        this.sinkName = sinkName;
        this.generation = generation;
        this.adapter = adapter;
        this.backpressure = backpressure;
        this.queue = new LinkedBlockingDeque<>(capacity);
        this.events = events;
        this.consumer = new Thread(this::drainLoop, threadPrefix + "-sink-" + sinkName + "-" + generation);
        this.consumer.setDaemon(true);
    }

    void start() {
        consumer.start();
    }

    /**
     * Enqueues a record for delivery. Blocks only under
     * {@link BackpressureMode#BLOCK} while the queue is full.
     *
     * @return {@code true} if the record was queued
     */
    boolean offer(ProbeRecord record) {
        if (closed) {
            events.dropped(sinkName, generation, DropReason.SINK_CLOSED);
            return false;
        }
        pending.incrementAndGet();
        boolean queued;
        switch (backpressure) {
            case DROP_NEWEST -> queued = offerOrDrop(record);
            case DROP_OLDEST -> queued = offerEvicting(record);
            default -> queued = offerBlocking(record);
        }
        if (queued && terminated && queue.remove(record)) {
            // Consumer exited between the closed check and the enqueue.
            release();
            events.dropped(sinkName, generation, DropReason.SINK_CLOSED);
            return false;
        }
        return queued;
    }

    private boolean offerOrDrop(ProbeRecord record) {
        if (queue.offerLast(record)) {
            return true;
        }
        release();
        events.dropped(sinkName, generation, DropReason.QUEUE_FULL);
        return false;
    }

    private boolean offerEvicting(ProbeRecord record) {
        while (!queue.offerLast(record)) {
            ProbeRecord evicted = queue.pollFirst();
            if (evicted != null) {
                release();
                events.dropped(sinkName, generation, DropReason.EVICTED);
            }
        }
        return true;
    }

    private boolean offerBlocking(ProbeRecord record) {
        try {
            while (!queue.offerLast(record, POLL_MS, TimeUnit.MILLISECONDS)) {
                if (closed) {
                    release();
                    events.dropped(sinkName, generation, DropReason.SINK_CLOSED);
                    return false;
                }
            }
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            release();
            events.dropped(sinkName, generation, DropReason.QUEUE_FULL);
            return false;
        }
    }

    private void drainLoop() {
        LOG.debug("probe.sink.consumer.started sink={} generation={}", sinkName, generation);
        while (true) {
            ProbeRecord next;
            try {
                next = queue.pollFirst(POLL_MS, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                if (closed) {
                    break;
                }
                continue;
            }
            if (next == null) {
                if (closed) {
                    break;
                }
                continue;
            }
            deliver(next);
        }
        terminated = true;
        ProbeRecord leftover;
        while ((leftover = queue.pollFirst()) != null) {
            release();
            events.dropped(sinkName, generation, DropReason.SINK_CLOSED);
        }
        LOG.debug("probe.sink.consumer.stopped sink={} generation={}", sinkName, generation);
    }

    private void deliver(ProbeRecord record) {
        MDC.put(MDC_SINK, sinkName);
        try {
            adapter.accept(record);
            events.delivered(sinkName);
        } catch (Exception e) {
            events.acceptFailed(
                    new SinkAcceptException("Sink '" + sinkName + "' failed to accept record: " + e, e, sinkName),
                    generation);
        } finally {
            MDC.remove(MDC_SINK);
            release();
        }
    }

    private void release() {
        if (pending.decrementAndGet() == 0) {
            synchronized (drainMonitor) {
                drainMonitor.notifyAll();
            }
        }
    }

    /**
     * Waits until every queued record has been delivered or dropped.
     *
     * @return {@code true} if drained within the timeout
     */
    boolean awaitDrained(Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        synchronized (drainMonitor) {
            while (pending.get() > 0) {
                long remainingMs = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
                if (remainingMs <= 0) {
                    return false;
                }
                drainMonitor.wait(remainingMs);
            }
        }
        return true;
    }

    /** Stops intake. Queued records are still delivered. Idempotent. */
    void close() {
        closed = true;
    }

    /**
     * Waits for the consumer thread to finish after {@link #close()}.
     *
     * @return {@code true} if the consumer exited within the timeout
     */
    boolean awaitTermination(Duration timeout) throws InterruptedException {
        consumer.join(Math.max(1, timeout.toMillis()));
        return !consumer.isAlive();
    }

    boolean isClosed() {
        return closed;
    }

    BackpressureMode backpressure() {
        return backpressure;
    }

    int queueDepth() {
        return queue.size();
    }

    String threadName() {
        return consumer.getName();
    }
}
