package com.netsim.telemetry.datagen;

import com.netsim.telemetry.datagen.engine.GenerationReport;
import com.netsim.telemetry.datagen.engine.TelemetryGenerator;
import com.netsim.telemetry.datagen.sink.DiscardingSink;
import com.netsim.telemetry.datagen.sink.JsonLinesSinkFactory;
import com.netsim.telemetry.datagen.sink.KafkaSinkFactory;
import com.netsim.telemetry.datagen.sink.SinkFactory;
import com.netsim.telemetry.shared.config.SimulatorConfig;
import com.netsim.telemetry.shared.error.ConfigurationException;
import com.netsim.telemetry.shared.error.SimulationException;
import com.netsim.telemetry.shared.model.request.GenerationRequest;
import com.netsim.telemetry.shared.util.JsonUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;

/**
 * CLI entry point for telemetry generation.
 *
 * Run as:
 *   java -jar data-generator.jar --start-date 2025-03-01 --end-date 2025-03-07 \
 *       --count 50000 --environment isp --fault-ratio 0.02 --seed 42
 *
 * Or via Maven:
 *   mvn exec:java -pl data-generator -Dexec.mainClass="com.netsim.telemetry.datagen.DataGeneratorMain"
 *
 * Flags override simulator.properties (and its environment overrides). Any
 * flag left out falls back to the configured value.
 *
 *   --start-date / --end-date   inclusive yyyy-MM-dd window
 *   --count                     rows per table
 *   --environment               lab | datacenter | enterprise | isp | campus | complete
 *   --devices                   device count (default: per environment)
 *   --fault-ratio               fraction of anomalous rows, 0..1
 *   --seed                      replay a previous run
 *   --tables                    comma list of grpc,snmp,syslog,ddm,lifecycle
 *   --output-dir                directory for jsonl output
 *   --sink                      jsonl | kafka | none
 *   --parallel                  generate tables concurrently
 *
 * Exit codes: 0 success, 1 generation or sink failure, 2 invalid request.
 */
public class DataGeneratorMain {

    private static final Logger log = LoggerFactory.getLogger(DataGeneratorMain.class);

    private static final Map<String, String> FLAGS = Map.ofEntries(
            Map.entry("--start-date", "generation.start-date"),
            Map.entry("--end-date", "generation.end-date"),
            Map.entry("--count", "generation.rows-per-table"),
            Map.entry("--environment", "generation.environment"),
            Map.entry("--devices", "generation.devices"),
            Map.entry("--fault-ratio", "generation.fault-ratio"),
            Map.entry("--seed", "generation.seed"),
            Map.entry("--tables", "generation.tables"),
            Map.entry("--output-dir", "output.dir"),
            Map.entry("--sink", "output.sink"));

    public static void main(String[] args) {
        System.exit(run(args));
    }

    static int run(String[] args) {
        log.info("=== Network Telemetry Simulator ===");
        try {
            SimulatorConfig config = SimulatorConfig.withOverrides(toOverrides(args));
            GenerationRequest request = GenerationRequest.fromConfig(config);
            GenerationReport report = generate(config, request);

            log.info("Run summary:\n{}", JsonUtil.toJson(report));
            if (!report.isSuccessful()) {
                log.error("Generation finished with failed tables; replay with --seed {}", report.getSeed());
                return 1;
            }
            log.info("Data generation complete. Replay with --seed {}", report.getSeed());
            return 0;
        } catch (ConfigurationException e) {
            log.error("Invalid request: {}", e.getMessage());
            return 2;
        } catch (SimulationException e) {
            log.error("Generation failed", e);
            return 1;
        }
    }

    private static GenerationReport generate(SimulatorConfig config, GenerationRequest request) {
        String sinkType = config.getSinkType().trim().toLowerCase(Locale.ROOT);
        TelemetryGenerator generator = new TelemetryGenerator();
        switch (sinkType) {
            case "jsonl" -> {
                Path dir = Path.of(config.getDataOutputDir());
                log.info("Writing JSON Lines to {}", dir.toAbsolutePath());
                return generator.generate(request, new JsonLinesSinkFactory(dir));
            }
            case "kafka" -> {
                try (KafkaSinkFactory kafka = KafkaSinkFactory.fromConfig(config)) {
                    return generator.generate(request, kafka);
                }
            }
            case "none" -> {
                SinkFactory discard = (table, name) -> new DiscardingSink();
                return generator.generate(request, discard);
            }
            default -> throw new ConfigurationException("sink", "unknown sink type '" + sinkType
                    + "' (expected jsonl, kafka or none)");
        }
    }

    static Properties toOverrides(String[] args) {
        Properties overrides = new Properties();
        for (Map.Entry<String, String> flag : FLAGS.entrySet()) {
            String value = parseArg(args, flag.getKey(), null);
            if (value != null) {
                overrides.setProperty(flag.getValue(), value);
            }
        }
        for (String arg : args) {
            if (arg.equals("--parallel")) {
                overrides.setProperty("generation.parallel", "true");
            }
        }
        return overrides;
    }

    private static String parseArg(String[] args, String flag, String defaultValue) {
        for (int i = 0; i < args.length - 1; i++) {
            if (args[i].equals(flag)) {
                return args[i + 1];
            }
        }
        return defaultValue;
    }
}
