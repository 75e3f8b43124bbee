package com.netsim.telemetry.datagen.engine;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.netsim.telemetry.shared.model.record.TableType;

/**
 * Outcome of one table. For FAILED tables, rows up to and including
 * {@code lastBatchIndex} were accepted by the sink and remain valid.
 */
public final class TableResult {

    public enum Status { COMPLETED, FAILED, CANCELLED }

    @JsonProperty("table")
    private final TableType table;

    @JsonProperty("output_name")
    private final String outputName;

    @JsonProperty("status")
    private final Status status;

    @JsonProperty("planned_rows")
    private final long plannedRows;

    @JsonProperty("rows_emitted")
    private final long rowsEmitted;

    @JsonProperty("batches_emitted")
    private final long batchesEmitted;

    @JsonProperty("error")
    private final String error;

    TableResult(TableType table, String outputName, Status status, long plannedRows,
                long rowsEmitted, long batchesEmitted, String error) {
        this.table = table;
        this.outputName = outputName;
        this.status = status;
        this.plannedRows = plannedRows;
        this.rowsEmitted = rowsEmitted;
        this.batchesEmitted = batchesEmitted;
        this.error = error;
    }

    public TableType getTable() { return table; }
    public String getOutputName() { return outputName; }
    public Status getStatus() { return status; }
    public long getPlannedRows() { return plannedRows; }
    public long getRowsEmitted() { return rowsEmitted; }
    public long getBatchesEmitted() { return batchesEmitted; }
    public String getError() { return error; }

    /** Index of the last batch the sink accepted, -1 when none was. */
    @JsonProperty("last_batch_index")
    public long getLastBatchIndex() { return batchesEmitted - 1; }

    public boolean isCompleted() {
        return status == Status.COMPLETED;
    }

    @Override
    public String toString() {
        return table.getTableName() + ": " + status + " (" + rowsEmitted + "/" + plannedRows + " rows)"
                + (error != null ? " - " + error : "");
    }
}
