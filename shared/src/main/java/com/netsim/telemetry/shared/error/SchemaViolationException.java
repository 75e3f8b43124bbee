package com.netsim.telemetry.shared.error;

/**
 * A synthesizer produced a value outside its column's documented domain.
 *
 * This signals a bug in the fault injector or in a module's baseline
 * anchors, never bad user input, and is fatal for the whole run.
 */
public class SchemaViolationException extends SimulationException {

    private final String table;
    private final String field;
    private final Object value;

    public SchemaViolationException(String table, String field, Object value, String domain) {
        super("Table '" + table + "' produced " + field + "=" + value + " outside domain " + domain);
        this.table = table;
        this.field = field;
        this.value = value;
    }

    public String getTable() { return table; }

    public String getField() { return field; }

    public Object getValue() { return value; }
}
