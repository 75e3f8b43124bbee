package com.netsim.telemetry.shared.model.topology;

import java.util.Objects;

/**
 * A pluggable optical transceiver seated in exactly one interface.
 *
 * The nominal readings are the anchors every DDM-style sample is drawn
 * around. Alarm thresholds follow common SFF-8472 / CMIS vendor defaults and
 * are shared by all modules.
 */
public final class OpticalModule {

    public static final double TEMPERATURE_HIGH_ALARM = 75.0;
    public static final double TEMPERATURE_LOW_ALARM = -5.0;
    public static final double VOLTAGE_HIGH_ALARM = 3.60;
    public static final double VOLTAGE_LOW_ALARM = 3.14;
    public static final double BIAS_HIGH_ALARM = 90.0;
    public static final double BIAS_LOW_ALARM = 6.0;
    public static final double TX_POWER_HIGH_ALARM = 4.0;
    public static final double TX_POWER_LOW_ALARM = -4.5;
    public static final double RX_POWER_HIGH_ALARM = 3.0;
    public static final double RX_POWER_LOW_ALARM = -7.0;

    /** Rated service life used by the lifecycle model. */
    public static final int RATED_LIFE_DAYS = 1825;

    private final String vendor;
    private final String serialNumber;
    private final String partNumber;
    private final int ageDays;
    private final double nominalTemperature;
    private final double nominalVoltage;
    private final double nominalBiasCurrent;
    private final double nominalTxPower;
    private final double nominalRxPower;

    public OpticalModule(String vendor, String serialNumber, String partNumber, int ageDays,
                         double nominalTemperature, double nominalVoltage, double nominalBiasCurrent,
                         double nominalTxPower, double nominalRxPower) {
        this.vendor = Objects.requireNonNull(vendor, "vendor");
        this.serialNumber = Objects.requireNonNull(serialNumber, "serialNumber");
        this.partNumber = partNumber;
        this.ageDays = ageDays;
        this.nominalTemperature = nominalTemperature;
        this.nominalVoltage = nominalVoltage;
        this.nominalBiasCurrent = nominalBiasCurrent;
        this.nominalTxPower = nominalTxPower;
        this.nominalRxPower = nominalRxPower;
    }

    public String getVendor() { return vendor; }
    public String getSerialNumber() { return serialNumber; }
    public String getPartNumber() { return partNumber; }
    public int getAgeDays() { return ageDays; }
    public double getNominalTemperature() { return nominalTemperature; }
    public double getNominalVoltage() { return nominalVoltage; }
    public double getNominalBiasCurrent() { return nominalBiasCurrent; }
    public double getNominalTxPower() { return nominalTxPower; }
    public double getNominalRxPower() { return nominalRxPower; }

    @Override
    public String toString() {
        return "OpticalModule{vendor='" + vendor + "', serial='" + serialNumber + "', part='" + partNumber + "'}";
    }
}
