package com.netsim.telemetry.shared.model.topology;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Interface speed classes, with the pluggable form factor each one
 * normally carries.
 */
public enum LinkSpeed {

    G1("1G", 1_000_000_000L, "SFP"),
    G10("10G", 10_000_000_000L, "SFP+"),
    G25("25G", 25_000_000_000L, "SFP28"),
    G40("40G", 40_000_000_000L, "QSFP+"),
    G100("100G", 100_000_000_000L, "QSFP28"),
    G200("200G", 200_000_000_000L, "QSFP56"),
    G400("400G", 400_000_000_000L, "QSFP-DD"),
    G800("800G", 800_000_000_000L, "OSFP");

    private final String label;
    private final long bitsPerSecond;
    private final String formFactor;

    LinkSpeed(String label, long bitsPerSecond, String formFactor) {
        this.label = label;
        this.bitsPerSecond = bitsPerSecond;
        this.formFactor = formFactor;
    }

    @JsonValue
    public String getLabel() { return label; }

    public long getBitsPerSecond() { return bitsPerSecond; }

    public String getFormFactor() { return formFactor; }

    /** 1G copper/SFP ports are modelled without a pluggable optic. */
    public boolean supportsPluggableOptics() {
        return this != G1;
    }
}
