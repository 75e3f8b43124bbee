package com.netsim.telemetry.shared.model.request;

import com.netsim.telemetry.shared.config.SimulatorConfig;
import com.netsim.telemetry.shared.error.ConfigurationException;
import com.netsim.telemetry.shared.model.record.TableType;
import com.netsim.telemetry.shared.model.topology.EnvironmentProfile;
import com.netsim.telemetry.shared.model.topology.Topology;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Read-only input of one generation run.
 *
 * All validation happens in {@link Builder#build()}, so an invalid request
 * never reaches the generator. A missing seed means "draw one"; the generator
 * reports the seed it used.
 *
 * USAGE:
 *   GenerationRequest request = GenerationRequest.builder()
 *       .dateRange(DateRange.of(LocalDate.of(2025, 3, 1), LocalDate.of(2025, 3, 1)))
 *       .rowsPerTable(1_000)
 *       .environment(EnvironmentProfile.LAB)
 *       .deviceCount(5)
 *       .faultRatio(0.1)
 *       .seed(42L)
 *       .build();
 */
public final class GenerationRequest {

    private final DateRange dateRange;
    private final long rowsPerTable;
    private final EnvironmentProfile environment;
    private final int deviceCount;
    private final double faultRatio;
    private final Set<TableType> tables;
    private final Map<TableType, String> outputNames;
    private final Long seed;
    private final boolean parallel;

    private GenerationRequest(Builder b) {
        this.dateRange = b.dateRange;
        this.rowsPerTable = b.rowsPerTable;
        this.environment = b.environment;
        this.deviceCount = b.deviceCount != null ? b.deviceCount : b.environment.getDefaultDeviceCount();
        this.faultRatio = b.faultRatio;
        this.tables = Collections.unmodifiableSet(EnumSet.copyOf(b.tables));
        Map<TableType, String> names = new EnumMap<>(TableType.class);
        for (TableType table : TableType.values()) {
            names.put(table, b.outputNames.getOrDefault(table, table.getDefaultOutputName()));
        }
        this.outputNames = Collections.unmodifiableMap(names);
        this.seed = b.seed;
        this.parallel = b.parallel;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Build a request from {@code generation.*} and {@code output.*} keys.
     */
    public static GenerationRequest fromConfig(SimulatorConfig config) {
        Builder b = builder()
                .dateRange(DateRange.of(
                        parseDate(config.get("generation.start-date"), "startDate"),
                        parseDate(config.get("generation.end-date"), "endDate")))
                .rowsPerTable(parseLong(config.get("generation.rows-per-table", "1000"), "rowsPerTable"))
                .environment(EnvironmentProfile.fromName(config.get("generation.environment", "datacenter")))
                .faultRatio(parseDouble(config.get("generation.fault-ratio", "0.01"), "faultRatio"))
                .parallel(config.getBoolean("generation.parallel", false));

        String devices = config.get("generation.devices");
        if (devices != null) {
            long parsed = parseLong(devices, "deviceCount");
            b.deviceCount((int) Math.max(Integer.MIN_VALUE, Math.min(Integer.MAX_VALUE, parsed)));
        }
        String seed = config.get("generation.seed");
        if (seed != null) {
            b.seed(parseLong(seed, "seed"));
        }
        String tables = config.get("generation.tables");
        if (tables != null) {
            b.tables(parseTables(tables));
        }
        for (TableType table : TableType.values()) {
            b.outputName(table, config.getOutputName(table));
        }
        return b.build();
    }

    public static Set<TableType> parseTables(String csv) {
        Set<TableType> result = EnumSet.noneOf(TableType.class);
        for (String part : csv.split(",")) {
            if (!part.isBlank()) {
                result.add(TableType.fromName(part));
            }
        }
        return result;
    }

    public static LocalDate parseDate(String value, String field) {
        if (value == null) {
            throw new ConfigurationException(field, "is required (yyyy-MM-dd)");
        }
        try {
            return LocalDate.parse(value.trim());
        } catch (DateTimeParseException e) {
            throw new ConfigurationException(field, "not a yyyy-MM-dd date: '" + value + "'", e);
        }
    }

    public static long parseLong(String value, String field) {
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException(field, "not an integer: '" + value + "'", e);
        }
    }

    public static double parseDouble(String value, String field) {
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException(field, "not a number: '" + value + "'", e);
        }
    }

    public DateRange getDateRange() { return dateRange; }
    public long getRowsPerTable() { return rowsPerTable; }
    public EnvironmentProfile getEnvironment() { return environment; }
    public int getDeviceCount() { return deviceCount; }
    public double getFaultRatio() { return faultRatio; }
    public Set<TableType> getTables() { return tables; }
    public Map<TableType, String> getOutputNames() { return outputNames; }
    public Optional<Long> getSeed() { return Optional.ofNullable(seed); }
    public boolean isParallel() { return parallel; }

    public String getOutputName(TableType table) {
        return outputNames.get(table);
    }

    /** Copy of this request pinned to a concrete seed. */
    public GenerationRequest withSeed(long resolvedSeed) {
        Builder b = builder()
                .dateRange(dateRange)
                .rowsPerTable(rowsPerTable)
                .environment(environment)
                .deviceCount(deviceCount)
                .faultRatio(faultRatio)
                .tables(tables)
                .seed(resolvedSeed)
                .parallel(parallel);
        outputNames.forEach(b::outputName);
        return b.build();
    }

    @Override
    public String toString() {
        return "GenerationRequest{range=" + dateRange + ", rowsPerTable=" + rowsPerTable
                + ", environment=" + environment.getLabel() + ", devices=" + deviceCount
                + ", faultRatio=" + faultRatio + ", tables=" + tables
                + ", seed=" + (seed != null ? seed : "<random>") + ", parallel=" + parallel + "}";
    }

    public static final class Builder {

        private DateRange dateRange;
        private long rowsPerTable = 1_000;
        private EnvironmentProfile environment = EnvironmentProfile.DATACENTER;
        private Integer deviceCount;
        private double faultRatio = 0.01;
        private Set<TableType> tables = EnumSet.allOf(TableType.class);
        private final Map<TableType, String> outputNames = new EnumMap<>(TableType.class);
        private Long seed;
        private boolean parallel;

        private Builder() {}

        public Builder dateRange(DateRange dateRange) { this.dateRange = dateRange; return this; }
        public Builder rowsPerTable(long rowsPerTable) { this.rowsPerTable = rowsPerTable; return this; }
        public Builder environment(EnvironmentProfile environment) { this.environment = environment; return this; }
        public Builder deviceCount(Integer deviceCount) { this.deviceCount = deviceCount; return this; }
        public Builder faultRatio(double faultRatio) { this.faultRatio = faultRatio; return this; }
        public Builder tables(Set<TableType> tables) { this.tables = tables; return this; }
        public Builder seed(Long seed) { this.seed = seed; return this; }
        public Builder parallel(boolean parallel) { this.parallel = parallel; return this; }

        public Builder outputName(TableType table, String name) {
            outputNames.put(table, name);
            return this;
        }

        public GenerationRequest build() {
            if (dateRange == null) {
                throw new ConfigurationException("dateRange", "is required");
            }
            if (rowsPerTable < 0) {
                throw new ConfigurationException("rowsPerTable", "must be >= 0, was " + rowsPerTable);
            }
            if (environment == null) {
                throw new ConfigurationException("environment", "is required");
            }
            if (deviceCount != null && (deviceCount <= 0 || deviceCount > Topology.MAX_DEVICE_COUNT)) {
                throw new ConfigurationException("deviceCount",
                        "must be in [1, " + Topology.MAX_DEVICE_COUNT + "], was " + deviceCount);
            }
            if (Double.isNaN(faultRatio) || faultRatio < 0.0 || faultRatio > 1.0) {
                throw new ConfigurationException("faultRatio", "must be in [0, 1], was " + faultRatio);
            }
            if (tables == null || tables.isEmpty()) {
                throw new ConfigurationException("tables", "at least one table is required");
            }
            for (Map.Entry<TableType, String> entry : outputNames.entrySet()) {
                if (entry.getValue() == null || entry.getValue().isBlank()) {
                    throw new ConfigurationException("outputName", "blank name for table " + entry.getKey().getTableName());
                }
            }
            return new GenerationRequest(this);
        }
    }
}
