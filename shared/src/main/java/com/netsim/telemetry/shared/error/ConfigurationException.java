package com.netsim.telemetry.shared.error;

/**
 * Raised when a generation request (or a value derived from it) is invalid:
 * bad date ranges, out-of-domain ratios, non-positive counts, unknown profiles.
 *
 * Always raised before any row is produced, and always names the offending field.
 */
public class ConfigurationException extends SimulationException {

    private final String field;

    public ConfigurationException(String field, String message) {
        super("Invalid '" + field + "': " + message);
        this.field = field;
    }

    public ConfigurationException(String field, String message, Throwable cause) {
        super("Invalid '" + field + "': " + message, cause);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
