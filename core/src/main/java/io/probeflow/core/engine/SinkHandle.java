package io.probeflow.core.engine;

import io.probeflow.core.model.PolicyExpression;
import io.probeflow.core.model.SinkInfo;
import io.probeflow.core.spi.DedupPolicy;
import io.probeflow.core.spi.SinkAdapter;

/**
 * A registered sink as held by a {@link RoutingTable} snapshot.
 *
 * <p>
 * Immutable: swapping the policy produces a new handle sharing the same
 * merge point and generation, so a dispatch that captured the old snapshot
 * finishes under the old policy.
 */
record SinkHandle(
        String name,
        long generation,
        SinkAdapter adapter,
        PolicyExpression policyExpression,
        DedupPolicy policy,
        SinkMultiplexer multiplexer) {

    SinkHandle withPolicy(PolicyExpression expression, DedupPolicy resolved) {
        return new SinkHandle(name, generation, adapter, expression, resolved, multiplexer);
    }

    SinkInfo info() {
        return new SinkInfo(name, generation, policyExpression, multiplexer.backpressure(), multiplexer.queueDepth());
    }
}
