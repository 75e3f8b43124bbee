package com.netsim.telemetry.datagen.engine;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.netsim.telemetry.shared.model.record.TableType;
import com.netsim.telemetry.shared.model.topology.Topology;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * What a run produced: the seed that was used (so a drawn seed can be replayed),
 * the topology size and one result per requested table.
 */
public final class GenerationReport {

    @JsonProperty("seed")
    private final long seed;

    @JsonProperty("devices")
    private final int devices;

    @JsonProperty("interfaces")
    private final int interfaces;

    @JsonProperty("optical_interfaces")
    private final int opticalInterfaces;

    @JsonProperty("tables")
    private final Map<TableType, TableResult> results;

    private final Topology topology;

    GenerationReport(long seed, Topology topology, Map<TableType, TableResult> results) {
        this.seed = seed;
        this.topology = topology;
        this.devices = topology.getDevices().size();
        this.interfaces = topology.getInterfaces().size();
        this.opticalInterfaces = topology.getOpticalInterfaces().size();
        this.results = Collections.unmodifiableMap(new EnumMap<>(results));
    }

    public long getSeed() { return seed; }

    public int getDevices() { return devices; }

    public int getInterfaces() { return interfaces; }

    public int getOpticalInterfaces() { return opticalInterfaces; }

    public Map<TableType, TableResult> getResults() { return results; }

    /** The fleet the rows were keyed to; not serialized. */
    public Topology topology() { return topology; }

    public TableResult result(TableType table) {
        TableResult result = results.get(table);
        if (result == null) {
            throw new IllegalArgumentException("Table was not requested: " + table.getTableName());
        }
        return result;
    }

    public boolean isSuccessful() {
        return results.values().stream().allMatch(TableResult::isCompleted);
    }

    @Override
    public String toString() {
        return "GenerationReport{seed=" + seed + ", devices=" + devices + ", results=" + results.values() + "}";
    }
}
