package io.probeflow.core.spi;

import io.probeflow.core.model.ProbeRecord;

/**
 * Per-subscription record transform. Must be pure: it receives an immutable
 * record and returns a new one, or {@code null} to contribute nothing for this
 * record.
 *
 * <p>
 * Implementations MUST be thread-safe: one transform is applied concurrently
 * by every emitting thread. Exceptions are caught by the router, reported, and
 * treated as "no contribution"; they never reach the emitting caller.
 */
@FunctionalInterface
public interface RecordTransform {

    /**
     * Transforms the record.
     *
     * @param record the record being dispatched
     * @return the record to forward, or {@code null} to skip
     */
    ProbeRecord apply(ProbeRecord record);

    /** The identity transform. */
    static RecordTransform identity() {
        return Identity.INSTANCE;
    }

    /** Singleton so that identity transforms compare equal. */
    enum Identity implements RecordTransform {
        INSTANCE;

        @Override
        public ProbeRecord apply(ProbeRecord record) {
            return record;
        }
    }
}
