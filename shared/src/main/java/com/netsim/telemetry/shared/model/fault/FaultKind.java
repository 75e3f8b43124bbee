package com.netsim.telemetry.shared.model.fault;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * The fixed set of anomaly kinds the fault injector can attach to a
 * (module_id, time bucket) pair.
 *
 * Weights are relative draw frequencies among anomalies; severity is drawn
 * uniformly from [minSeverity, maxSeverity]. Optical kinds only apply to
 * interfaces that carry a module.
 */
public enum FaultKind {

    NONE("normal", false, 0, 0.0, 0.0),
    LINK_FLAP("link_flap", false, 25, 0.5, 1.0),
    HIGH_TEMPERATURE("high_temperature", true, 20, 0.3, 1.0),
    HIGH_ERROR_RATE("high_error_rate", false, 25, 0.2, 1.0),
    LOW_RX_POWER("low_rx_power", true, 15, 0.3, 1.0),
    BROADCAST_STORM("broadcast_storm", false, 15, 0.4, 1.0);

    private final String label;
    private final boolean optical;
    private final int weight;
    private final double minSeverity;
    private final double maxSeverity;

    FaultKind(String label, boolean optical, int weight, double minSeverity, double maxSeverity) {
        this.label = label;
        this.optical = optical;
        this.weight = weight;
        this.minSeverity = minSeverity;
        this.maxSeverity = maxSeverity;
    }

    @JsonValue
    public String getLabel() { return label; }

    public boolean isOptical() { return optical; }

    public int getWeight() { return weight; }

    public double getMinSeverity() { return minSeverity; }

    public double getMaxSeverity() { return maxSeverity; }
}
