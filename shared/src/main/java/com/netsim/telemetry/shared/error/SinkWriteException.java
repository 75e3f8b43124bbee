package com.netsim.telemetry.shared.error;

/**
 * An output sink failed while accepting a batch.
 *
 * Sinks raise it with just a message and cause; the batch emitter re-raises it
 * with the table name, the index of the last batch the sink accepted (-1 when
 * none was) and the number of rows already handed over. Batches accepted before
 * the failure are not rolled back, so the output may be partial.
 */
public class SinkWriteException extends SimulationException {

    private final String table;
    private final long lastBatchIndex;
    private final long rowsEmitted;

    public SinkWriteException(String message, Throwable cause) {
        super(message, cause);
        this.table = null;
        this.lastBatchIndex = -1;
        this.rowsEmitted = 0;
    }

    public SinkWriteException(String table, long lastBatchIndex, long rowsEmitted, Throwable cause) {
        super("Sink for table '" + table + "' failed after batch " + lastBatchIndex
                + " (" + rowsEmitted + " rows already emitted): " + cause.getMessage(), cause);
        this.table = table;
        this.lastBatchIndex = lastBatchIndex;
        this.rowsEmitted = rowsEmitted;
    }

    public String getTable() { return table; }

    public long getLastBatchIndex() { return lastBatchIndex; }

    public long getRowsEmitted() { return rowsEmitted; }
}
