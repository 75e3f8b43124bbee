package com.netsim.telemetry.shared.model.record;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One digital-diagnostics reading of an optical module, with per-channel
 * alarm flags evaluated against the module thresholds.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class DdmMetricRecord extends TelemetryRecord {

    @JsonProperty("optic_vendor")
    private String opticVendor;

    @JsonProperty("serial_number")
    private String serialNumber;

    @JsonProperty("part_number")
    private String partNumber;

    @JsonProperty("temperature")
    private double temperature;

    @JsonProperty("voltage")
    private double voltage;

    @JsonProperty("bias_current")
    private double biasCurrent;

    @JsonProperty("tx_power")
    private double txPower;

    @JsonProperty("rx_power")
    private double rxPower;

    @JsonProperty("temperature_alarm")
    private boolean temperatureAlarm;

    @JsonProperty("voltage_alarm")
    private boolean voltageAlarm;

    @JsonProperty("bias_alarm")
    private boolean biasAlarm;

    @JsonProperty("tx_power_alarm")
    private boolean txPowerAlarm;

    @JsonProperty("rx_power_alarm")
    private boolean rxPowerAlarm;

    public DdmMetricRecord() {}

    @Override
    public TableType getTableType() {
        return TableType.DDM;
    }

    public int alarmCount() {
        int count = 0;
        if (temperatureAlarm) count++;
        if (voltageAlarm) count++;
        if (biasAlarm) count++;
        if (txPowerAlarm) count++;
        if (rxPowerAlarm) count++;
        return count;
    }

    // --- Getters and Setters ---

    public String getOpticVendor() { return opticVendor; }
    public void setOpticVendor(String opticVendor) { this.opticVendor = opticVendor; }

    public String getSerialNumber() { return serialNumber; }
    public void setSerialNumber(String serialNumber) { this.serialNumber = serialNumber; }

    public String getPartNumber() { return partNumber; }
    public void setPartNumber(String partNumber) { this.partNumber = partNumber; }

    public double getTemperature() { return temperature; }
    public void setTemperature(double temperature) { this.temperature = temperature; }

    public double getVoltage() { return voltage; }
    public void setVoltage(double voltage) { this.voltage = voltage; }

    public double getBiasCurrent() { return biasCurrent; }
    public void setBiasCurrent(double biasCurrent) { this.biasCurrent = biasCurrent; }

    public double getTxPower() { return txPower; }
    public void setTxPower(double txPower) { this.txPower = txPower; }

    public double getRxPower() { return rxPower; }
    public void setRxPower(double rxPower) { this.rxPower = rxPower; }

    public boolean isTemperatureAlarm() { return temperatureAlarm; }
    public void setTemperatureAlarm(boolean temperatureAlarm) { this.temperatureAlarm = temperatureAlarm; }

    public boolean isVoltageAlarm() { return voltageAlarm; }
    public void setVoltageAlarm(boolean voltageAlarm) { this.voltageAlarm = voltageAlarm; }

    public boolean isBiasAlarm() { return biasAlarm; }
    public void setBiasAlarm(boolean biasAlarm) { this.biasAlarm = biasAlarm; }

    public boolean isTxPowerAlarm() { return txPowerAlarm; }
    public void setTxPowerAlarm(boolean txPowerAlarm) { this.txPowerAlarm = txPowerAlarm; }

    public boolean isRxPowerAlarm() { return rxPowerAlarm; }
    public void setRxPowerAlarm(boolean rxPowerAlarm) { this.rxPowerAlarm = rxPowerAlarm; }
}
