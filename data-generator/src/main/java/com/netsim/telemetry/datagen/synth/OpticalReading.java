package com.netsim.telemetry.datagen.synth;

import com.netsim.telemetry.shared.model.topology.OpticalModule;

/**
 * One set of transceiver readings, rounded to two decimals.
 */
public final class OpticalReading {

    private final double temperature;
    private final double voltage;
    private final double biasCurrent;
    private final double txPower;
    private final double rxPower;

    public OpticalReading(double temperature, double voltage, double biasCurrent, double txPower, double rxPower) {
        this.temperature = temperature;
        this.voltage = voltage;
        this.biasCurrent = biasCurrent;
        this.txPower = txPower;
        this.rxPower = rxPower;
    }

    public double getTemperature() { return temperature; }
    public double getVoltage() { return voltage; }
    public double getBiasCurrent() { return biasCurrent; }
    public double getTxPower() { return txPower; }
    public double getRxPower() { return rxPower; }

    public boolean isTemperatureAlarm() {
        return temperature > OpticalModule.TEMPERATURE_HIGH_ALARM || temperature < OpticalModule.TEMPERATURE_LOW_ALARM;
    }

    public boolean isVoltageAlarm() {
        return voltage > OpticalModule.VOLTAGE_HIGH_ALARM || voltage < OpticalModule.VOLTAGE_LOW_ALARM;
    }

    public boolean isBiasAlarm() {
        return biasCurrent > OpticalModule.BIAS_HIGH_ALARM || biasCurrent < OpticalModule.BIAS_LOW_ALARM;
    }

    public boolean isTxPowerAlarm() {
        return txPower > OpticalModule.TX_POWER_HIGH_ALARM || txPower < OpticalModule.TX_POWER_LOW_ALARM;
    }

    public boolean isRxPowerAlarm() {
        return rxPower > OpticalModule.RX_POWER_HIGH_ALARM || rxPower < OpticalModule.RX_POWER_LOW_ALARM;
    }
}
