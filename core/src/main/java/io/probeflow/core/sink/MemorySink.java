package io.probeflow.core.sink;

import io.probeflow.core.model.ProbeRecord;
import io.probeflow.core.spi.SinkAdapter;
import java.util.ArrayDeque;
import java.util.List;

/**
 * Bounded in-memory sink. Keeps the most recent {@code capacity} records;
 * older ones are evicted as new ones arrive. Thread-safe.
 */
public final class MemorySink implements SinkAdapter {

    private final int capacity;
    private final ArrayDeque<ProbeRecord> buffer;
    private long accepted;

    public MemorySink(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive, got: " + capacity);
        }
        this.capacity = capacity;
        this.buffer = new ArrayDeque<>(Math.min(capacity, 1024));
    }

    @Override
    public synchronized void accept(ProbeRecord record) {
        if (buffer.size() == capacity) {
            buffer.pollFirst();
        }
        buffer.addLast(record);
        accepted++;
    }

    /** The retained records, oldest first. */
    public synchronized List<ProbeRecord> snapshot() {
        return List.copyOf(buffer);
    }

    public synchronized int size() {
        return buffer.size();
    }

    /** Number of records ever accepted, evicted ones included. */
    public synchronized long acceptedCount() {
        return accepted;
    }

    public synchronized void clear() {
        buffer.clear();
    }

    public int capacity() {
        return capacity;
    }
}
