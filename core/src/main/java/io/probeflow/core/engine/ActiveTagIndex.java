package io.probeflow.core.engine;

import io.probeflow.core.model.Selector;
import io.probeflow.core.model.Subscription;
import io.probeflow.core.model.TagSet;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Index over the live subscriptions' selectors.
 *
 * <p>
 * Each selector is filed under its {@linkplain Selector#anchor() anchor tag}.
 * A tag set can only be matched by a selector whose anchor it contains, so
 * probing the buckets of the candidate's own tags finds every possible match:
 * the index has no false negatives. Lookups cost one hash probe per candidate
 * tag plus one subset test per selector filed under those tags.
 *
 * <p>
 * Immutable and thread-safe. Rebuilt as part of every {@link RoutingTable}
 * snapshot.
 */
final class ActiveTagIndex {

    private static final ActiveTagIndex EMPTY = new ActiveTagIndex(Map.of(), 0);

    /** Anchor tag → subscriptions filed under it, each list in registration order. */
    private final Map<String, List<Entry>> buckets;
    private final int size;

    private ActiveTagIndex(Map<String, List<Entry>> buckets, int size) {
        this.buckets = buckets;
        this.size = size;
    }

    static ActiveTagIndex empty() {
        return EMPTY;
    }

    /**
     * Builds an index over the given subscriptions; their list position is the
     * registration order used to sort matches.
     */
    static ActiveTagIndex build(List<Subscription> subscriptions) {
        if (subscriptions.isEmpty()) {
            return EMPTY;
        }
        Map<String, List<Entry>> buckets = new HashMap<>();
        for (int i = 0; i < subscriptions.size(); i++) {
            Subscription sub = subscriptions.get(i);
            buckets.computeIfAbsent(sub.selector().anchor(), k -> new ArrayList<>())
                    .add(new Entry(i, sub));
        }
        buckets.replaceAll((tag, entries) -> Collections.unmodifiableList(entries));
        return new ActiveTagIndex(Collections.unmodifiableMap(buckets), subscriptions.size());
    }

    /**
     * True if some live selector is a subset of {@code candidateTags}. This is
     * the emission-side pre-check: when it returns {@code false}, no record
     * carrying at least these tags could reach any sink through the candidate
     * tags alone.
     */
    boolean couldMatch(TagSet candidateTags) {
        if (size == 0 || candidateTags.isEmpty()) {
            return false;
        }
        for (String tag : candidateTags) {
            List<Entry> bucket = buckets.get(tag);
            if (bucket == null) {
                continue;
            }
            for (Entry entry : bucket) {
                if (entry.subscription().matches(candidateTags)) {
                    return true;
                }
            }
        }
        return false;
    }

    /** All subscriptions whose selector matches {@code tags}, in registration order. */
    List<Subscription> matching(TagSet tags) {
        if (size == 0 || tags.isEmpty()) {
            return List.of();
        }
        List<Entry> hits = null;
        for (String tag : tags) {
            List<Entry> bucket = buckets.get(tag);
            if (bucket == null) {
                continue;
            }
            for (Entry entry : bucket) {
                if (entry.subscription().matches(tags)) {
                    if (hits == null) {
                        hits = new ArrayList<>();
                    }
                    hits.add(entry);
                }
            }
        }
        if (hits == null) {
            return List.of();
        }
        hits.sort((a, b) -> Integer.compare(a.ordinal(), b.ordinal()));
        List<Subscription> result = new ArrayList<>(hits.size());
        for (Entry hit : hits) {
            result.add(hit.subscription());
        }
        return result;
    }

    /** Number of indexed subscriptions. */
    int size() {
        return size;
    }

    /** Number of distinct anchor tags. */
    int anchorCount() {
        return buckets.size();
    }

    private record Entry(int ordinal, Subscription subscription) {}
}
