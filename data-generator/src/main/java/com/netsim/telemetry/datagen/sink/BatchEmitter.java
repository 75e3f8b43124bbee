package com.netsim.telemetry.datagen.sink;

import com.netsim.telemetry.datagen.engine.GenerationListener;
import com.netsim.telemetry.shared.error.SinkWriteException;
import com.netsim.telemetry.shared.model.record.TableType;
import com.netsim.telemetry.shared.model.record.TelemetryRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Buffers rows for one table and hands them to the sink in fixed-size batches,
 * so at most one batch of rows is held in memory.
 *
 * Any sink failure is re-raised as a {@link SinkWriteException} naming the
 * table, the last batch the sink accepted and the rows already handed over.
 */
public class BatchEmitter {

    private static final Logger log = LoggerFactory.getLogger(BatchEmitter.class);

    public static final int DEFAULT_BATCH_SIZE = 5_000;

    private final TableType table;
    private final RecordSink sink;
    private final int batchSize;
    private final GenerationListener listener;

    private List<TelemetryRecord> buffer;
    private long batchesEmitted;
    private long rowsEmitted;

    public BatchEmitter(TableType table, RecordSink sink, int batchSize, GenerationListener listener) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive: " + batchSize);
        }
        this.table = table;
        this.sink = sink;
        this.batchSize = batchSize;
        this.listener = listener;
        this.buffer = new ArrayList<>(batchSize);
    }

    public void add(TelemetryRecord record) {
        buffer.add(record);
        if (buffer.size() >= batchSize) {
            flush();
        }
    }

    public void flush() {
        if (buffer.isEmpty()) {
            return;
        }
        List<TelemetryRecord> batch = buffer;
        buffer = new ArrayList<>(batchSize);
        try {
            sink.emit(batch);
        } catch (RuntimeException e) {
            throw new SinkWriteException(table.getTableName(), batchesEmitted - 1, rowsEmitted, e);
        }
        rowsEmitted += batch.size();
        long index = batchesEmitted++;
        log.debug("[{}] batch {} emitted ({} rows, {} total)", table.getTableName(), index, batch.size(), rowsEmitted);
        listener.onBatchEmitted(table, index, batch.size(), rowsEmitted);
    }

    /**
     * Flushes the tail batch and signals completion to the sink.
     */
    public void finish() {
        flush();
        try {
            sink.finish(table.getTableName());
        } catch (RuntimeException e) {
            throw new SinkWriteException(table.getTableName(), batchesEmitted - 1, rowsEmitted, e);
        }
    }

    /** Drops rows that were buffered but not yet emitted. */
    public void discard() {
        buffer = new ArrayList<>(0);
    }

    public TableType getTable() { return table; }

    public long getRowsEmitted() { return rowsEmitted; }

    public long getBatchesEmitted() { return batchesEmitted; }

    public long getLastBatchIndex() { return batchesEmitted - 1; }
}
