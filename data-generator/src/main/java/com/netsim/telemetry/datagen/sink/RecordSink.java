package com.netsim.telemetry.datagen.sink;

import com.netsim.telemetry.shared.model.record.TelemetryRecord;

import java.util.List;

/**
 * Destination for one table's rows.
 *
 * The generator calls {@link #emit} repeatedly with bounded batches, then
 * {@link #finish} once the table is complete (also for zero rows), and
 * {@link #close} in every case. The sink owns each batch once emit returns.
 */
public interface RecordSink extends AutoCloseable {

    /**
     * @throws com.netsim.telemetry.shared.error.SinkWriteException if the batch
     *         could not be accepted; earlier batches stay written
     */
    void emit(List<? extends TelemetryRecord> batch);

    /**
     * Signals that every row of {@code tableName} has been emitted.
     */
    void finish(String tableName);

    /**
     * Releases resources. Safe to call more than once and after a failure.
     */
    @Override
    default void close() {
    }
}
