package com.netsim.telemetry.shared.model.record;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;

/**
 * A remaining-life prediction for an optical module, derived from the recent
 * DDM history of the same module_id rather than sampled on its own.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class LifecyclePredictionRecord extends TelemetryRecord {

    @JsonProperty("optic_vendor")
    private String opticVendor;

    @JsonProperty("serial_number")
    private String serialNumber;

    @JsonProperty("failure_probability")
    private double failureProbability;

    @JsonProperty("predicted_remaining_days")
    private int predictedRemainingDays;

    @JsonProperty("predicted_failure_date")
    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd")
    private LocalDate predictedFailureDate;

    @JsonProperty("accumulated_severity")
    private double accumulatedSeverity;

    @JsonProperty("history_size")
    private int historySize;

    @JsonProperty("model_name")
    private String modelName;

    public LifecyclePredictionRecord() {}

    @Override
    public TableType getTableType() {
        return TableType.LIFECYCLE;
    }

    // --- Getters and Setters ---

    public String getOpticVendor() { return opticVendor; }
    public void setOpticVendor(String opticVendor) { this.opticVendor = opticVendor; }

    public String getSerialNumber() { return serialNumber; }
    public void setSerialNumber(String serialNumber) { this.serialNumber = serialNumber; }

    public double getFailureProbability() { return failureProbability; }
    public void setFailureProbability(double failureProbability) { this.failureProbability = failureProbability; }

    public int getPredictedRemainingDays() { return predictedRemainingDays; }
    public void setPredictedRemainingDays(int predictedRemainingDays) { this.predictedRemainingDays = predictedRemainingDays; }

    public LocalDate getPredictedFailureDate() { return predictedFailureDate; }
    public void setPredictedFailureDate(LocalDate predictedFailureDate) { this.predictedFailureDate = predictedFailureDate; }

    public double getAccumulatedSeverity() { return accumulatedSeverity; }
    public void setAccumulatedSeverity(double accumulatedSeverity) { this.accumulatedSeverity = accumulatedSeverity; }

    public int getHistorySize() { return historySize; }
    public void setHistorySize(int historySize) { this.historySize = historySize; }

    public String getModelName() { return modelName; }
    public void setModelName(String modelName) { this.modelName = modelName; }
}
