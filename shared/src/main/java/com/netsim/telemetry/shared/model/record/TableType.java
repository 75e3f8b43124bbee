package com.netsim.telemetry.shared.model.record;

import com.netsim.telemetry.shared.error.ConfigurationException;

import java.util.Locale;

/**
 * The five output tables, with the native sampling granularity of each.
 *
 * DDM and lifecycle rows only exist for interfaces that carry an optical
 * module. Lifecycle rows share DDM's schedule, one prediction per DDM sample.
 */
public enum TableType {

    GRPC("grpc", 60, false, "grpc_data"),
    SNMP("snmp", 300, false, "snmp_data"),
    SYSLOG("syslog", 1, false, "syslog_data"),
    DDM("ddm", 300, true, "ddm_data"),
    LIFECYCLE("lifecycle", 300, true, "predict_data");

    private final String tableName;
    private final int granularitySeconds;
    private final boolean opticalOnly;
    private final String defaultOutputName;

    TableType(String tableName, int granularitySeconds, boolean opticalOnly, String defaultOutputName) {
        this.tableName = tableName;
        this.granularitySeconds = granularitySeconds;
        this.opticalOnly = opticalOnly;
        this.defaultOutputName = defaultOutputName;
    }

    public String getTableName() { return tableName; }

    public int getGranularitySeconds() { return granularitySeconds; }

    public boolean isOpticalOnly() { return opticalOnly; }

    public String getDefaultOutputName() { return defaultOutputName; }

    public static TableType fromName(String name) {
        if (name != null) {
            String normalized = name.trim().toLowerCase(Locale.ROOT);
            for (TableType table : values()) {
                if (table.tableName.equals(normalized)) {
                    return table;
                }
            }
            if (normalized.equals("gnmi")) {
                return GRPC;
            }
            if (normalized.equals("predict") || normalized.equals("prediction")) {
                return LIFECYCLE;
            }
        }
        throw new ConfigurationException("tables", "unknown table '" + name + "'");
    }
}
