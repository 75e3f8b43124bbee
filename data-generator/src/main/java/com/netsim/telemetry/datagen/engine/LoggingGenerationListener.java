package com.netsim.telemetry.datagen.engine;

import com.netsim.telemetry.shared.model.record.TableType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Logs progress at roughly every 10% of a table.
 */
public class LoggingGenerationListener implements GenerationListener {

    private static final Logger log = LoggerFactory.getLogger(LoggingGenerationListener.class);

    private final Map<TableType, Long> planned = new ConcurrentHashMap<>();
    private final Map<TableType, Integer> lastDecile = new ConcurrentHashMap<>();

    @Override
    public void onTableStarted(TableType table, long plannedRows) {
        planned.put(table, plannedRows);
        lastDecile.put(table, 0);
        log.info("[{}] generating {} rows", table.getTableName(), plannedRows);
    }

    @Override
    public void onBatchEmitted(TableType table, long batchIndex, int batchSize, long rowsSoFar) {
        long total = planned.getOrDefault(table, 0L);
        if (total <= 0) {
            return;
        }
        int decile = (int) (rowsSoFar * 10 / total);
        Integer previous = lastDecile.put(table, decile);
        if (previous == null || decile > previous) {
            log.info("[{}] {}% ({} / {} rows)", table.getTableName(), decile * 10, rowsSoFar, total);
        }
    }

    @Override
    public void onTableFinished(TableResult result) {
        switch (result.getStatus()) {
            case COMPLETED -> log.info("[{}] completed: {} rows in {} batches",
                    result.getTable().getTableName(), result.getRowsEmitted(), result.getBatchesEmitted());
            case FAILED -> log.error("[{}] failed after batch {} ({} rows emitted, output is partial): {}",
                    result.getTable().getTableName(), result.getLastBatchIndex(), result.getRowsEmitted(),
                    result.getError());
            case CANCELLED -> log.warn("[{}] cancelled after {} rows", result.getTable().getTableName(),
                    result.getRowsEmitted());
        }
    }
}
