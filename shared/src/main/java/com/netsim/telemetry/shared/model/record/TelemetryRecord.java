package com.netsim.telemetry.shared.model.record;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonUnwrapped;

import java.time.LocalDateTime;

/**
 * Base of every table row: the flattened common block followed by the
 * anomaly label. Concrete rows add their schema-specific columns.
 *
 * A record is created by a synthesizer, handed straight to the batch emitter
 * and never mutated by the generator afterwards.
 */
public abstract class TelemetryRecord {

    @JsonUnwrapped
    private CommonFields common = new CommonFields();

    @JsonProperty("is_anomaly")
    private boolean anomaly;

    @JsonProperty("anomaly_type")
    private String anomalyType = "normal";

    protected TelemetryRecord() {}

    @JsonIgnore
    public abstract TableType getTableType();

    public CommonFields getCommon() { return common; }
    public void setCommon(CommonFields common) { this.common = common; }

    public boolean isAnomaly() { return anomaly; }
    public void setAnomaly(boolean anomaly) { this.anomaly = anomaly; }

    public String getAnomalyType() { return anomalyType; }
    public void setAnomalyType(String anomalyType) { this.anomalyType = anomalyType; }

    // Shortcuts into the common block

    @JsonIgnore
    public String getModuleId() { return common.getModuleId(); }

    @JsonIgnore
    public LocalDateTime getTimestamp() { return common.getTimestamp(); }
}
