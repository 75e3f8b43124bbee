package com.netsim.telemetry.datagen.synth;

import com.netsim.telemetry.shared.model.fault.FaultState;
import com.netsim.telemetry.shared.model.record.CommonFields;
import com.netsim.telemetry.shared.model.record.TelemetryRecord;
import com.netsim.telemetry.shared.model.topology.DeviceInterface;
import com.netsim.telemetry.shared.model.topology.Topology;

/**
 * Shared plumbing for the synthesizers: topology lookup, anomaly labelling
 * and domain checks. Synthesizers that draw values extend
 * {@link SeededRecordSynthesizer} instead.
 */
public abstract class AbstractRecordSynthesizer<R extends TelemetryRecord> implements RecordSynthesizer<R> {

    protected final Topology topology;

    protected AbstractRecordSynthesizer(Topology topology) {
        this.topology = topology;
    }

    protected DeviceInterface interfaceOf(CommonFields common) {
        return topology.getInterface(common.getModuleId());
    }

    protected R label(R record, CommonFields common, FaultState fault) {
        record.setCommon(common);
        record.setAnomaly(fault.isAnomalous());
        record.setAnomalyType(fault.getKind().getLabel());
        return record;
    }

    protected double check(String field, double value, double min, double max) {
        return FieldDomain.require(getTableType().getTableName(), field, value, min, max);
    }

    protected long checkCounter(String field, long value) {
        return FieldDomain.requireNonNegative(getTableType().getTableName(), field, value);
    }

    protected static double round(double value, int decimals) {
        double scale = Math.pow(10, decimals);
        return Math.round(value * scale) / scale;
    }
}
