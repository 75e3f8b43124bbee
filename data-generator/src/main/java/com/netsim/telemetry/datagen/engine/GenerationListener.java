package com.netsim.telemetry.datagen.engine;

import com.netsim.telemetry.shared.model.record.TableType;

/**
 * Progress callbacks. May be invoked from several worker threads when tables
 * are generated in parallel.
 */
public interface GenerationListener {

    GenerationListener NONE = new GenerationListener() {};

    default void onTableStarted(TableType table, long plannedRows) {
    }

    default void onBatchEmitted(TableType table, long batchIndex, int batchSize, long rowsSoFar) {
    }

    default void onTableFinished(TableResult result) {
    }
}
