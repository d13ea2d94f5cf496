package io.probeflow.core.instrument;

import io.probeflow.core.engine.ProbeRouter;
import io.probeflow.core.model.ProbeRecord;
import io.probeflow.core.model.TagSet;
import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * Mutable cell that emits a probe tagged {@code watch} and its name whenever
 * its value changes, carrying the {@code old} and {@code new} values. Setting
 * an equal value emits nothing. Thread-safe; value changes are serialized.
 */
public final class WatchedCell<T> {

    private final ProbeRouter router;
    private final String name;
    private final TagSet tags;
    private T value;

    public WatchedCell(ProbeRouter router, String name, T initial, String... extraTags) {
        this.router = Objects.requireNonNull(router, "router must not be null");
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.tags = TagSet.of(extraTags).plus(ProbeEvents.WATCH, name);
        this.value = initial;
    }

    public synchronized T get() {
        return value;
    }

    /**
     * Replaces the value. The probe is emitted after the cell's lock is
     * released, so a slow sink never blocks readers or other writers; probes
     * from racing writers may therefore reach the sink out of order.
     *
     * @return the previous value
     */
    public T set(T newValue) {
        T old;
        synchronized (this) {
            old = value;
            value = newValue;
        }
        emitChange(old, newValue);
        return old;
    }

    /**
     * Applies {@code fn} to the current value and stores the result. Only the
     * read and the write are atomic; the probe is emitted afterwards, as in
     * {@link #set}.
     *
     * @return the new value
     */
    public T update(UnaryOperator<T> fn) {
        T old;
        T next;
        synchronized (this) {
            old = value;
            next = fn.apply(old);
            value = next;
        }
        emitChange(old, next);
        return next;
    }

    private void emitChange(T old, T newValue) {
        if (Objects.equals(old, newValue)) {
            return;
        }
        router.emit(tags, () -> ProbeRecord.builder()
                .tags(tags)
                .put(ProbeEvents.NAME, name)
                .put(ProbeEvents.OLD, old)
                .put(ProbeEvents.NEW, newValue)
                .stamp()
                .build());
    }

    public TagSet tags() {
        return tags;
    }
}
