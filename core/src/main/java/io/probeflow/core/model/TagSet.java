package io.probeflow.core.model;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.Iterator;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Immutable set of routing tags carried by every {@link ProbeRecord}.
 *
 * <p>
 * Backed by a hash set, so membership tests are O(1) and subset tests are
 * O(size of the smaller side). Tags are plain strings; naming conventions
 * such as {@code "log"} or {@code "fn/enter"} belong to the caller.
 *
 * <p>
 * Thread-safe: the backing set is never exposed for mutation.
 */
public final class TagSet implements Iterable<String> {

    private static final TagSet EMPTY = new TagSet(Set.of());

    private final Set<String> tags;

    private TagSet(Set<String> tags) {
        this.tags = tags;
    }

    /** Returns the empty tag set. */
    public static TagSet empty() {
        return EMPTY;
    }

    /**
     * Creates a tag set from the given tags. Duplicates collapse.
     *
     * @throws NullPointerException if any tag is null
     */
    public static TagSet of(String... tags) {
        Objects.requireNonNull(tags, "tags must not be null");
        return of(Arrays.asList(tags));
    }

    /**
     * Creates a tag set from the given collection. Duplicates collapse.
     *
     * @throws NullPointerException if the collection or any tag is null
     */
    public static TagSet of(Collection<String> tags) {
        Objects.requireNonNull(tags, "tags must not be null");
        if (tags.isEmpty()) {
            return EMPTY;
        }
        Set<String> copy = new HashSet<>(tags.size() * 2);
        for (String tag : tags) {
            copy.add(Objects.requireNonNull(tag, "tag must not be null"));
        }
        return new TagSet(Collections.unmodifiableSet(copy));
    }

    /**
     * Union of several tag sets, used to merge call-site tags with ambient
     * context tags and with tags contributed by the record body.
     */
    public static TagSet union(TagSet... sets) {
        Objects.requireNonNull(sets, "sets must not be null");
        TagSet result = EMPTY;
        for (TagSet set : sets) {
            if (set != null) {
                result = result.plus(set);
            }
        }
        return result;
    }

    /** Returns a tag set containing this set's tags and the other set's tags. */
    public TagSet plus(TagSet other) {
        if (other == null || other.isEmpty() || tags.containsAll(other.tags)) {
            return this;
        }
        if (isEmpty()) {
            return other;
        }
        Set<String> merged = new HashSet<>(tags);
        merged.addAll(other.tags);
        return new TagSet(Collections.unmodifiableSet(merged));
    }

    /** Returns a tag set with the given tags added. */
    public TagSet plus(String... extra) {
        return plus(of(extra));
    }

    public boolean contains(String tag) {
        return tags.contains(tag);
    }

    /** True if every tag in {@code other} is also in this set. */
    public boolean containsAll(TagSet other) {
        return tags.containsAll(other.tags);
    }

    public boolean isEmpty() {
        return tags.isEmpty();
    }

    public int size() {
        return tags.size();
    }

    /** Unmodifiable view of the tags. */
    public Set<String> asSet() {
        return tags;
    }

    /** The tags in natural order, for stable rendering. */
    public Set<String> sorted() {
        return Collections.unmodifiableSet(new TreeSet<>(tags));
    }

    @Override
    public Iterator<String> iterator() {
        return tags.iterator();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TagSet)) return false;
        return tags.equals(((TagSet) o).tags);
    }

    @Override
    public int hashCode() {
        return tags.hashCode();
    }

    @Override
    public String toString() {
        return "#" + sorted();
    }
}
