package io.probeflow.core.spi;

import io.probeflow.core.model.ProbeRecord;

/**
 * Terminal consumer of records, registered with the router under a unique
 * name.
 *
 * <p>
 * The router serializes calls per sink (one consumer thread per sink), so an
 * implementation need not be reentrant for itself, but different sinks run
 * concurrently. Returning normally signals the record was handled; throwing
 * signals an error, which the router reports and then moves on to the next
 * record.
 */
@FunctionalInterface
public interface SinkAdapter {

    /**
     * Handles one record.
     *
     * @param record the record to handle
     * @throws Exception if the record could not be handled
     */
    void accept(ProbeRecord record) throws Exception;
}
