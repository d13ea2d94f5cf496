package io.probeflow.core.model;

/**
 * Read-only snapshot of a registered sink.
 *
 * @param name        the sink's registered name
 * @param generation  unique per registration; a sink removed and re-added
 *                    under the same name gets a new generation
 * @param policy      the dedup policy in effect
 * @param backpressure the merge point's full-queue behaviour
 * @param queueDepth  records waiting in the merge point when the snapshot was
 *                    taken
 */
public record SinkInfo(
        String name, long generation, PolicyExpression policy, BackpressureMode backpressure, int queueDepth) {}
