package io.probeflow.core.testkit;

import io.probeflow.core.model.ProbeRecord;
import io.probeflow.core.spi.SinkAdapter;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/** Unbounded sink that keeps every record it accepts, for assertions. */
public final class CollectingSink implements SinkAdapter {

    private final List<ProbeRecord> records = new CopyOnWriteArrayList<>();

    @Override
    public void accept(ProbeRecord record) {
        records.add(record);
    }

    public List<ProbeRecord> records() {
        return List.copyOf(records);
    }

    public int size() {
        return records.size();
    }
}
