package io.probeflow.core.spi;

import io.probeflow.core.model.ProbeRecord;
import io.probeflow.core.model.Routed;
import java.util.List;

/**
 * Decides which of the transformed records produced for one sink by one
 * emission are actually forwarded.
 *
 * <p>
 * Implementations MUST be pure and total: no side effects, no mutation of the
 * inputs, and a result for every input. Exceptions are caught by the router
 * and the sink receives nothing for that record.
 */
@FunctionalInterface
public interface DedupPolicy {

    /**
     * Selects the records to forward.
     *
     * @param record     the record as emitted, before any transform
     * @param candidates the sink's matching subscriptions paired with their
     *                   transformed records, in registration order; transforms
     *                   that failed or returned {@code null} are absent
     * @return the pairs to forward, in forwarding order
     */
    List<Routed> select(ProbeRecord record, List<Routed> candidates);
}
