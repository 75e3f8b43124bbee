package com.netsim.telemetry.shared.model.record;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One structured syslog event. {@code priority} is the RFC 5424 PRI value
 * (facility_code * 8 + severity_code); {@code raw_log} is the line as the
 * device vendor would format it.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class SyslogEventRecord extends TelemetryRecord {

    @JsonProperty("facility")
    private String facility;

    @JsonProperty("facility_code")
    private int facilityCode;

    @JsonProperty("severity")
    private String severity;

    @JsonProperty("severity_code")
    private int severityCode;

    @JsonProperty("priority")
    private int priority;

    @JsonProperty("category")
    private String category;

    @JsonProperty("message")
    private String message;

    @JsonProperty("raw_log")
    private String rawLog;

    public SyslogEventRecord() {}

    @Override
    public TableType getTableType() {
        return TableType.SYSLOG;
    }

    // --- Getters and Setters ---

    public String getFacility() { return facility; }
    public void setFacility(String facility) { this.facility = facility; }

    public int getFacilityCode() { return facilityCode; }
    public void setFacilityCode(int facilityCode) { this.facilityCode = facilityCode; }

    public String getSeverity() { return severity; }
    public void setSeverity(String severity) { this.severity = severity; }

    public int getSeverityCode() { return severityCode; }
    public void setSeverityCode(int severityCode) { this.severityCode = severityCode; }

    public int getPriority() { return priority; }
    public void setPriority(int priority) { this.priority = priority; }

    public String getCategory() { return category; }
    public void setCategory(String category) { this.category = category; }

    public String getMessage() { return message; }
    public void setMessage(String message) { this.message = message; }

    public String getRawLog() { return rawLog; }
    public void setRawLog(String rawLog) { this.rawLog = rawLog; }
}
