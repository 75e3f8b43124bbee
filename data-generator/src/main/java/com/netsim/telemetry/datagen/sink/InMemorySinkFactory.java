package com.netsim.telemetry.datagen.sink;

import com.netsim.telemetry.shared.model.record.TableType;
import com.netsim.telemetry.shared.model.record.TelemetryRecord;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Keeps every emitted row in memory, per table. For tests and small previews
 * only: memory grows with the row count.
 */
public class InMemorySinkFactory implements SinkFactory {

    private final Map<TableType, InMemorySink> sinks = Collections.synchronizedMap(new EnumMap<>(TableType.class));

    @Override
    public RecordSink open(TableType table, String outputName) {
        InMemorySink sink = new InMemorySink(outputName);
        sinks.put(table, sink);
        return sink;
    }

    public boolean isOpened(TableType table) {
        return sinks.containsKey(table);
    }

    public InMemorySink sink(TableType table) {
        InMemorySink sink = sinks.get(table);
        if (sink == null) {
            throw new IllegalStateException("No sink was opened for table " + table.getTableName());
        }
        return sink;
    }

    @SuppressWarnings("unchecked")
    public <R extends TelemetryRecord> List<R> rows(TableType table) {
        return (List<R>) sink(table).getRows();
    }

    public static class InMemorySink implements RecordSink {

        private final String outputName;
        private final List<TelemetryRecord> rows = new ArrayList<>();
        private final List<Integer> batchSizes = new ArrayList<>();
        private String finishedTable;
        private boolean closed;

        InMemorySink(String outputName) {
            this.outputName = outputName;
        }

        @Override
        public void emit(List<? extends TelemetryRecord> batch) {
            rows.addAll(batch);
            batchSizes.add(batch.size());
        }

        @Override
        public void finish(String tableName) {
            this.finishedTable = tableName;
        }

        @Override
        public void close() {
            closed = true;
        }

        public String getOutputName() { return outputName; }
        public List<TelemetryRecord> getRows() { return rows; }
        public List<Integer> getBatchSizes() { return batchSizes; }
        public boolean isFinished() { return finishedTable != null; }
        public String getFinishedTable() { return finishedTable; }
        public boolean isClosed() { return closed; }
    }
}
