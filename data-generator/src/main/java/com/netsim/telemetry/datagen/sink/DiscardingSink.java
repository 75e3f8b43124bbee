package com.netsim.telemetry.datagen.sink;

import com.netsim.telemetry.shared.model.record.TelemetryRecord;

import java.util.List;

/**
 * Counts and drops rows. Backs the {@code none} sink type, which runs the full
 * pipeline without writing anything (timing runs, request validation).
 */
public class DiscardingSink implements RecordSink {

    private long rows;

    @Override
    public void emit(List<? extends TelemetryRecord> batch) {
        rows += batch.size();
    }

    @Override
    public void finish(String tableName) {
    }

    public long getRows() {
        return rows;
    }
}
