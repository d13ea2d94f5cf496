package io.probeflow.core.model;

/**
 * What a sink's merge point does when its bounded queue is full.
 *
 * <ul>
 * <li>{@link #BLOCK}: the emitting thread waits for space (default).</li>
 * <li>{@link #DROP_OLDEST}: the oldest queued record is discarded.</li>
 * <li>{@link #DROP_NEWEST}: the incoming record is discarded.</li>
 * </ul>
 */
public enum BackpressureMode {
    BLOCK,
    DROP_OLDEST,
    DROP_NEWEST;

    /**
     * Parses a config value such as {@code "drop-oldest"} (case-insensitive,
     * dashes or underscores).
     *
     * @throws IllegalArgumentException if the value names no mode
     */
    public static BackpressureMode parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("backpressure mode must not be blank");
        }
        String normalized = value.trim().toUpperCase(java.util.Locale.ROOT).replace('-', '_');
        try {
            return valueOf(normalized);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(
                    "Unknown backpressure mode '" + value + "', expected one of block, drop-oldest, drop-newest");
        }
    }
}
