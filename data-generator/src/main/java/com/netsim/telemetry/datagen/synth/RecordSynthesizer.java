package com.netsim.telemetry.datagen.synth;

import com.netsim.telemetry.shared.model.fault.FaultState;
import com.netsim.telemetry.shared.model.record.CommonFields;
import com.netsim.telemetry.shared.model.record.TableType;
import com.netsim.telemetry.shared.model.record.TelemetryRecord;

import java.time.LocalDateTime;

/**
 * Maps a (common block, fault state, timestamp) triple to one fully populated
 * row of a fixed schema.
 *
 * Implementations own a per-table random stream and are not thread-safe; one
 * instance serves one table of one run.
 *
 * @param <R> the row type
 */
public interface RecordSynthesizer<R extends TelemetryRecord> {

    TableType getTableType();

    /**
     * @throws com.netsim.telemetry.shared.error.SchemaViolationException if a
     *         field would fall outside its documented domain
     */
    R synthesize(CommonFields common, FaultState fault, LocalDateTime timestamp);
}
