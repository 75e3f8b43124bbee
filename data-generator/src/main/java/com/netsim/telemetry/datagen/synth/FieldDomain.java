package com.netsim.telemetry.datagen.synth;

import com.netsim.telemetry.shared.error.SchemaViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Column domain checks. Out-of-domain values are logged and rejected, never
 * clamped.
 */
final class FieldDomain {

    private static final Logger log = LoggerFactory.getLogger(FieldDomain.class);

    private FieldDomain() {}

    static double require(String table, String field, double value, double min, double max) {
        if (Double.isNaN(value) || value < min || value > max) {
            String domain = "[" + min + ", " + max + "]";
            log.error("Schema violation in table '{}': {}={} outside {}", table, field, value, domain);
            throw new SchemaViolationException(table, field, value, domain);
        }
        return value;
    }

    static long requireNonNegative(String table, String field, long value) {
        if (value < 0) {
            log.error("Schema violation in table '{}': {}={} is negative", table, field, value);
            throw new SchemaViolationException(table, field, value, "[0, +inf)");
        }
        return value;
    }
}
