package io.probeflow.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable snapshot of program state produced by a probe.
 *
 * <p>
 * An ordered mapping from string key to arbitrary value. The tag set always
 * lives under the reserved key {@link #TAGS}; callers usually also supply
 * {@link #TS}, {@link #NS} and {@link #LINE} before the record reaches the
 * router. Transforms never mutate a record: {@link #with}, {@link #without}
 * and {@link #withTags} return new instances.
 *
 * <p>
 * Equality is structural over every field, the tag set included.
 */
public final class ProbeRecord {

    /** Reserved key holding the record's {@link TagSet}. */
    public static final String TAGS = "tags";
    /** Conventional key for the capture timestamp (epoch millis). */
    public static final String TS = "ts";
    /** Conventional key for the capturing thread's name. */
    public static final String THREAD = "thread";
    /** Conventional key for the emitting namespace (logger/class name). */
    public static final String NS = "ns";
    /** Conventional key for the source line number. */
    public static final String LINE = "line";

    private final Map<String, Object> fields;

    private ProbeRecord(Map<String, Object> fields) {
        this.fields = fields;
    }

    /** Creates a record holding only the given tags. */
    public static ProbeRecord of(TagSet tags) {
        return builder().tags(tags).build();
    }

    /**
     * Creates a record from a field map. A {@link #TAGS} entry, if present, must
     * be a {@link TagSet}; otherwise the record gets an empty tag set.
     *
     * @throws IllegalArgumentException if the {@code tags} entry is not a
     *                                  {@link TagSet}
     */
    public static ProbeRecord of(Map<String, ?> fields) {
        Objects.requireNonNull(fields, "fields must not be null");
        Builder builder = builder();
        fields.forEach((key, value) -> {
            if (TAGS.equals(key)) {
                if (!(value instanceof TagSet)) {
                    throw new IllegalArgumentException("'" + TAGS + "' must hold a TagSet, got: " + value);
                }
                builder.tags((TagSet) value);
            } else {
                builder.put(key, value);
            }
        });
        return builder.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /** The record's tags. Never null. */
    public TagSet tags() {
        return (TagSet) fields.get(TAGS);
    }

    /** The value under {@code key}, or null. */
    public Object get(String key) {
        return fields.get(key);
    }

    public boolean has(String key) {
        return fields.containsKey(key);
    }

    /** Unmodifiable view of all fields in insertion order, {@code tags} first. */
    public Map<String, Object> fields() {
        return fields;
    }

    /**
     * Returns a copy with {@code key} set to {@code value}.
     *
     * @throws IllegalArgumentException if {@code key} is {@code tags}; use
     *                                  {@link #withTags(TagSet)}
     */
    public ProbeRecord with(String key, Object value) {
        return toBuilder().put(key, value).build();
    }

    /** Returns a copy without {@code key}. The tag set cannot be removed. */
    public ProbeRecord without(String key) {
        if (TAGS.equals(key) || !fields.containsKey(key)) {
            return this;
        }
        Map<String, Object> copy = new LinkedHashMap<>(fields);
        copy.remove(key);
        return new ProbeRecord(Collections.unmodifiableMap(copy));
    }

    /** Returns a copy carrying the given tag set. */
    public ProbeRecord withTags(TagSet tags) {
        return toBuilder().tags(tags).build();
    }

    /** Returns a builder pre-populated with this record's fields. */
    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.fields.putAll(fields);
        return builder;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ProbeRecord)) return false;
        return fields.equals(((ProbeRecord) o).fields);
    }

    @Override
    public int hashCode() {
        return fields.hashCode();
    }

    @Override
    public String toString() {
        return "ProbeRecord" + fields;
    }

    /** Builder for {@link ProbeRecord}. Not thread-safe. */
    public static final class Builder {

        private final Map<String, Object> fields = new LinkedHashMap<>();

        Builder() {
            fields.put(TAGS, TagSet.empty());
        }

        public Builder tags(TagSet tags) {
            fields.put(TAGS, Objects.requireNonNull(tags, "tags must not be null"));
            return this;
        }

        public Builder tags(String... tags) {
            return tags(TagSet.of(tags));
        }

        /** Adds tags to those already set. */
        public Builder addTags(TagSet extra) {
            fields.put(TAGS, ((TagSet) fields.get(TAGS)).plus(extra));
            return this;
        }

        public Builder put(String key, Object value) {
            Objects.requireNonNull(key, "key must not be null");
            if (TAGS.equals(key)) {
                throw new IllegalArgumentException("use tags(...) to set '" + TAGS + "'");
            }
            fields.put(key, value);
            return this;
        }

        public Builder putAll(Map<String, ?> values) {
            values.forEach(this::put);
            return this;
        }

        public Builder ns(String ns) {
            return put(NS, ns);
        }

        public Builder line(int line) {
            return put(LINE, line);
        }

        /** Stamps the current time and thread name. */
        public Builder stamp() {
            put(TS, System.currentTimeMillis());
            return put(THREAD, Thread.currentThread().getName());
        }

        public ProbeRecord build() {
            return new ProbeRecord(Collections.unmodifiableMap(new LinkedHashMap<>(fields)));
        }
    }
}
