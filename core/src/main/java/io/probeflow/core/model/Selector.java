package io.probeflow.core.model;

import io.probeflow.core.error.InvalidSelectorException;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Required-tag filter of a subscription. A selector matches a record when
 * every selector tag is present in the record's tag set (conjunction, not
 * exact match).
 *
 * <p>
 * A selector is never empty: a filter that matches everything is treated as
 * a configuration error.
 */
public final class Selector {

    private final TagSet tags;
    private final String anchor;

    private Selector(TagSet tags) {
        this.tags = tags;
        // Smallest tag in natural order; stable across runs so that the
        // active-tag index is deterministic.
        this.anchor = tags.sorted().iterator().next();
    }

    /**
     * Creates a selector from the given tags.
     *
     * @throws InvalidSelectorException if no tags are given or a tag is null or
     *                                  blank
     */
    public static Selector of(String... tags) {
        if (tags == null) {
            throw new InvalidSelectorException("selector tags must not be null");
        }
        return of(Arrays.asList(tags));
    }

    /**
     * Creates a selector from the given collection of tags.
     *
     * @throws InvalidSelectorException if the collection is empty or a tag is
     *                                  null or blank
     */
    public static Selector of(Collection<String> tags) {
        if (tags == null || tags.isEmpty()) {
            throw new InvalidSelectorException("selector must contain at least one tag");
        }
        for (String tag : tags) {
            if (tag == null || tag.isBlank()) {
                throw new InvalidSelectorException("selector tags must be non-blank, got: " + tags);
            }
        }
        return new Selector(TagSet.of(tags));
    }

    /**
     * Creates a selector from an existing tag set.
     *
     * @throws InvalidSelectorException if the tag set is empty or contains a
     *                                  blank tag
     */
    public static Selector of(TagSet tags) {
        Objects.requireNonNull(tags, "tags must not be null");
        return of(List.copyOf(tags.asSet()));
    }

    /** Subset test: true iff every selector tag is in {@code recordTags}. */
    public boolean matches(TagSet recordTags) {
        return recordTags != null && recordTags.containsAll(tags);
    }

    /** The required tags. */
    public TagSet tags() {
        return tags;
    }

    /**
     * The tag this selector is indexed under. Any tag set this selector
     * matches necessarily contains it.
     */
    public String anchor() {
        return anchor;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Selector)) return false;
        return tags.equals(((Selector) o).tags);
    }

    @Override
    public int hashCode() {
        return tags.hashCode();
    }

    @Override
    public String toString() {
        return tags.toString();
    }
}
