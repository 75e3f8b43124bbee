package com.netsim.telemetry.shared.config;

import com.netsim.telemetry.shared.model.record.TableType;

import java.io.IOException;
import java.io.InputStream;
import java.util.Locale;
import java.util.Properties;

/**
 * Central configuration for the simulator.
 * Loads from simulator.properties and allows environment variable overrides.
 *
 * Convention: explicit overrides (command-line flags) win over environment
 * variables, which win over system properties, which win over the properties file.
 * ENV_VAR naming: uppercase, dots and dashes replaced with underscores.
 * e.g., "generation.fault-ratio" -> GENERATION_FAULT_RATIO
 */
public class SimulatorConfig {

    private static final String RESOURCE = "simulator.properties";
    private static SimulatorConfig instance;

    private final Properties props = new Properties();
    private final Properties overrides = new Properties();

    private SimulatorConfig() {
        loadProperties(RESOURCE);
    }

    SimulatorConfig(Properties overrides) {
        loadProperties(RESOURCE);
        this.overrides.putAll(overrides);
    }

    public static synchronized SimulatorConfig getInstance() {
        if (instance == null) {
            instance = new SimulatorConfig();
        }
        return instance;
    }

    /**
     * Config backed by the classpath file plus explicit overrides. Intended for
     * tests and embedding; does not touch the shared instance.
     */
    public static SimulatorConfig withOverrides(Properties overrides) {
        return new SimulatorConfig(overrides);
    }

    private void loadProperties(String resource) {
        try (InputStream is = getClass().getClassLoader().getResourceAsStream(resource)) {
            if (is != null) {
                props.load(is);
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load " + resource, e);
        }
    }

    /**
     * Get a config value. Checks explicit overrides, then environment variables (with dot-to-underscore mapping),
     * then system properties, then the properties file, then the provided default.
     */
    public String get(String key, String defaultValue) {
        String override = overrides.getProperty(key);
        if (override != null && !override.isBlank()) {
            return override.trim();
        }
        String envKey = key.toUpperCase(Locale.ROOT).replace('.', '_').replace('-', '_');
        String envValue = System.getenv(envKey);
        if (envValue != null && !envValue.isEmpty()) {
            return envValue;
        }
        String sysProp = System.getProperty(key);
        if (sysProp != null && !sysProp.isEmpty()) {
            return sysProp;
        }
        String value = props.getProperty(key);
        return value != null && !value.isBlank() ? value.trim() : defaultValue;
    }

    public String get(String key) {
        return get(key, null);
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        String value = get(key);
        return value != null ? Boolean.parseBoolean(value) : defaultValue;
    }

    // --- Convenience accessors for common config ---

    public String getDataOutputDir() {
        return get("output.dir", "./generated-data");
    }

    public String getSinkType() {
        return get("output.sink", "jsonl");
    }

    public String getOutputName(TableType table) {
        return get("output." + table.getTableName(), table.getDefaultOutputName());
    }

    public String getKafkaBootstrapServers() {
        return get("kafka.bootstrap.servers", "localhost:9092");
    }
}
