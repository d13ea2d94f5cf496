package io.probeflow.core.engine;

import io.probeflow.core.model.BuiltinPolicy;
import io.probeflow.core.model.ProbeRecord;
import io.probeflow.core.model.Routed;
import io.probeflow.core.spi.DedupPolicy;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Implementations of the built-in dedup policies.
 *
 * <p>
 * Thread-safe: stateless utility class.
 */
public final class DedupPolicies {

    /** Forwards every candidate unchanged. */
    public static final DedupPolicy ALL = (record, candidates) -> candidates;

    /**
     * Forwards one candidate per distinct transformed record. Scans in
     * registration order, so the first subscription producing a value wins.
     * Equality is full structural equality, timestamps included.
     */
    public static final DedupPolicy UNIQUE = DedupPolicies::unique;

    /** Forwards only the first candidate in registration order. */
    public static final DedupPolicy FIRST = (record, candidates) ->
            candidates.isEmpty() ? List.of() : List.of(candidates.get(0));

    private DedupPolicies() {}

    /** Returns the implementation of a built-in policy. */
    public static DedupPolicy of(BuiltinPolicy policy) {
        return switch (policy) {
            case ALL -> ALL;
            case UNIQUE -> UNIQUE;
            case FIRST -> FIRST;
        };
    }

    private static List<Routed> unique(ProbeRecord record, List<Routed> candidates) {
        if (candidates.size() < 2) {
            return candidates;
        }
        Set<ProbeRecord> seen = new HashSet<>();
        List<Routed> survivors = new ArrayList<>(candidates.size());
        for (Routed candidate : candidates) {
            if (seen.add(candidate.record())) {
                survivors.add(candidate);
            }
        }
        return survivors;
    }
}
