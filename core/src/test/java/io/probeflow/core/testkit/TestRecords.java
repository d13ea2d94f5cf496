package io.probeflow.core.testkit;

import io.probeflow.core.model.ProbeRecord;

/** Factory helpers for records used across tests. */
public final class TestRecords {

    private TestRecords() {}

    public static ProbeRecord tagged(String... tags) {
        return ProbeRecord.builder().tags(tags).build();
    }

    public static ProbeRecord withField(String key, Object value, String... tags) {
        return ProbeRecord.builder().tags(tags).put(key, value).build();
    }
}
