package com.netsim.telemetry.datagen.engine;

import com.netsim.telemetry.datagen.engine.TableResult.Status;
import com.netsim.telemetry.datagen.fault.FaultInjector;
import com.netsim.telemetry.datagen.identity.ModuleKeyGenerator;
import com.netsim.telemetry.datagen.schedule.SamplePlan;
import com.netsim.telemetry.datagen.schedule.ScheduledSample;
import com.netsim.telemetry.datagen.schedule.TimeSeriesScheduler;
import com.netsim.telemetry.datagen.sink.BatchEmitter;
import com.netsim.telemetry.datagen.sink.DiscardingSink;
import com.netsim.telemetry.datagen.sink.RecordSink;
import com.netsim.telemetry.datagen.sink.SinkFactory;
import com.netsim.telemetry.datagen.synth.BoundedDdmHistory;
import com.netsim.telemetry.datagen.synth.DdmMetricSynthesizer;
import com.netsim.telemetry.datagen.synth.GrpcMetricSynthesizer;
import com.netsim.telemetry.datagen.synth.LifecyclePredictionSynthesizer;
import com.netsim.telemetry.datagen.synth.OpticalReadingSampler;
import com.netsim.telemetry.datagen.synth.RecordSynthesizer;
import com.netsim.telemetry.datagen.synth.SnmpStatusSynthesizer;
import com.netsim.telemetry.datagen.synth.SyslogEventSynthesizer;
import com.netsim.telemetry.datagen.topology.TopologyBuilder;
import com.netsim.telemetry.shared.error.SimulationException;
import com.netsim.telemetry.shared.error.SinkWriteException;
import com.netsim.telemetry.shared.model.fault.FaultState;
import com.netsim.telemetry.shared.model.record.CommonFields;
import com.netsim.telemetry.shared.model.record.DdmMetricRecord;
import com.netsim.telemetry.shared.model.record.TableType;
import com.netsim.telemetry.shared.model.record.TelemetryRecord;
import com.netsim.telemetry.shared.model.request.GenerationRequest;
import com.netsim.telemetry.shared.model.topology.Topology;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Runs one generation request end to end.
 *
 * PIPELINE (per table):
 *   Topology -> TimeSeriesScheduler -> ModuleKeyGenerator -> FaultInjector
 *            -> RecordSynthesizer -> BatchEmitter -> RecordSink
 *
 * All tables share the topology, the key generator and the fault injector, so
 * module_ids and fault decisions line up across tables. Each table gets its own
 * random stream derived from the run seed, which keeps every table
 * reproducible whether tables run one after another or in parallel.
 *
 * DDM and lifecycle rows are produced in one pass: every DDM row is recorded
 * into a bounded per-module history and the lifecycle prediction for the same
 * (module_id, timestamp) is derived from it right away. Lifecycle therefore
 * emits exactly as many rows as DDM would.
 *
 * ERRORS:
 *   - ConfigurationException: thrown before any sink is opened
 *   - SchemaViolationException: fatal, propagates out of generate()
 *   - SinkWriteException: that table is reported FAILED, the others continue
 *   - interrupt: the running table stops and is reported CANCELLED
 *
 * USAGE:
 *   GenerationReport report = new TelemetryGenerator()
 *       .generate(request, new JsonLinesSinkFactory(Path.of("./generated-data")));
 *   long seed = report.getSeed();   // replay with request.withSeed(seed)
 */
public class TelemetryGenerator {

    private static final Logger log = LoggerFactory.getLogger(TelemetryGenerator.class);

    private final int batchSize;
    private final GenerationListener listener;

    public TelemetryGenerator() {
        this(BatchEmitter.DEFAULT_BATCH_SIZE, new LoggingGenerationListener());
    }

    public TelemetryGenerator(GenerationListener listener) {
        this(BatchEmitter.DEFAULT_BATCH_SIZE, listener);
    }

    public TelemetryGenerator(int batchSize, GenerationListener listener) {
        this.batchSize = batchSize;
        this.listener = listener;
    }

    public GenerationReport generate(GenerationRequest request, SinkFactory sinks) {
        long seed = request.getSeed().orElseGet(TelemetryGenerator::drawSeed);
        log.info("Starting generation: {} (seed={})", request, seed);

        Topology topology = new TopologyBuilder(seed).build(request.getEnvironment(), request.getDeviceCount());
        Run run = new Run(request, seed, topology);

        // Plan every table before opening any sink so bad requests fail cleanly.
        Map<TableType, SamplePlan> plans = new EnumMap<>(TableType.class);
        for (TableType table : request.getTables()) {
            TableType schedule = table == TableType.LIFECYCLE ? TableType.DDM : table;
            plans.put(table, new TimeSeriesScheduler(streamSeed(seed, schedule) ^ 0x5DEECE66DL)
                    .plan(request.getDateRange(), request.getRowsPerTable(), topology, schedule));
        }

        List<Callable<List<TableResult>>> jobs = new ArrayList<>();
        for (TableType table : List.of(TableType.GRPC, TableType.SNMP, TableType.SYSLOG)) {
            if (plans.containsKey(table)) {
                jobs.add(() -> List.of(runTable(run, table, plans.get(table), sinks)));
            }
        }
        if (plans.containsKey(TableType.DDM) || plans.containsKey(TableType.LIFECYCLE)) {
            SamplePlan opticsPlan = plans.containsKey(TableType.DDM) ? plans.get(TableType.DDM) : plans.get(TableType.LIFECYCLE);
            jobs.add(() -> runOptics(run, opticsPlan, sinks));
        }

        List<TableResult> results = request.isParallel() && jobs.size() > 1
                ? runParallel(jobs)
                : runSequential(jobs);

        Map<TableType, TableResult> byTable = new EnumMap<>(TableType.class);
        for (TableResult result : results) {
            byTable.put(result.getTable(), result);
        }
        GenerationReport report = new GenerationReport(seed, topology, byTable);
        log.info("Generation finished: {}", report);
        return report;
    }

    // ===== EXECUTION =====

    private List<TableResult> runSequential(List<Callable<List<TableResult>>> jobs) {
        List<TableResult> results = new ArrayList<>();
        for (Callable<List<TableResult>> job : jobs) {
            results.addAll(call(job));
        }
        return results;
    }

    private List<TableResult> runParallel(List<Callable<List<TableResult>>> jobs) {
        int threads = Math.min(jobs.size(), Runtime.getRuntime().availableProcessors());
        ExecutorService pool = Executors.newFixedThreadPool(Math.max(1, threads));
        log.info("Generating {} table jobs on {} worker threads", jobs.size(), threads);
        try {
            List<Future<List<TableResult>>> futures = new ArrayList<>();
            for (Callable<List<TableResult>> job : jobs) {
                futures.add(pool.submit(job));
            }
            List<TableResult> results = new ArrayList<>();
            for (Future<List<TableResult>> future : futures) {
                results.addAll(future.get());
            }
            return results;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new SimulationException("Table generation failed", cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SimulationException("Interrupted while waiting for table workers", e);
        } finally {
            pool.shutdownNow();
        }
    }

    private static List<TableResult> call(Callable<List<TableResult>> job) {
        try {
            return job.call();
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new SimulationException("Table generation failed", e);
        }
    }

    // ===== SINGLE TABLES (gRPC, SNMP, syslog) =====

    private TableResult runTable(Run run, TableType table, SamplePlan plan, SinkFactory sinks) {
        RecordSynthesizer<?> synthesizer = synthesizerFor(run, table);
        TableStream stream = new TableStream(table, run.request.getOutputName(table), sinks, plan.getTotalRows());
        try {
            for (ScheduledSample sample : plan) {
                if (!stream.isActive()) {
                    break;
                }
                if (Thread.currentThread().isInterrupted()) {
                    stream.cancel();
                    break;
                }
                CommonFields common = run.keys.commonFieldsFor(sample.getInterface(), sample.getTimestamp());
                FaultState fault = run.faults.decide(sample.getInterface(), sample.getTimestamp(), run.request.getFaultRatio());
                stream.add(synthesizer.synthesize(common, fault, sample.getTimestamp()));
            }
            stream.completeIfActive();
        } finally {
            stream.close();
        }
        return stream.toResult();
    }

    private RecordSynthesizer<?> synthesizerFor(Run run, TableType table) {
        long streamSeed = streamSeed(run.seed, table);
        return switch (table) {
            case GRPC -> new GrpcMetricSynthesizer(run.topology, streamSeed, run.opticalSampler);
            case SNMP -> new SnmpStatusSynthesizer(run.topology, run.request.getDateRange().getStart(), streamSeed);
            case SYSLOG -> new SyslogEventSynthesizer(run.topology, streamSeed);
            case DDM, LIFECYCLE -> throw new IllegalArgumentException(table + " is generated by the optics pass");
        };
    }

    // ===== OPTICS PASS (DDM + lifecycle) =====

    private List<TableResult> runOptics(Run run, SamplePlan plan, SinkFactory sinks) {
        boolean wantDdm = run.request.getTables().contains(TableType.DDM);
        boolean wantLifecycle = run.request.getTables().contains(TableType.LIFECYCLE);

        DdmMetricSynthesizer ddmSynth = new DdmMetricSynthesizer(run.topology, streamSeed(run.seed, TableType.DDM), run.opticalSampler);
        BoundedDdmHistory history = new BoundedDdmHistory();
        LifecyclePredictionSynthesizer lifecycleSynth = new LifecyclePredictionSynthesizer(run.topology, history);

        TableStream ddm = wantDdm
                ? new TableStream(TableType.DDM, run.request.getOutputName(TableType.DDM), sinks, plan.getTotalRows())
                : null;
        TableStream lifecycle = wantLifecycle
                ? new TableStream(TableType.LIFECYCLE, run.request.getOutputName(TableType.LIFECYCLE), sinks, plan.getTotalRows())
                : null;
        try {
            for (ScheduledSample sample : plan) {
                boolean ddmActive = ddm != null && ddm.isActive();
                boolean lifecycleActive = lifecycle != null && lifecycle.isActive();
                if (!ddmActive && !lifecycleActive) {
                    break;
                }
                if (Thread.currentThread().isInterrupted()) {
                    if (ddmActive) {
                        ddm.cancel();
                    }
                    if (lifecycleActive) {
                        lifecycle.cancel();
                    }
                    break;
                }
                FaultState fault = run.faults.decide(sample.getInterface(), sample.getTimestamp(), run.request.getFaultRatio());
                DdmMetricRecord ddmRow = ddmSynth.synthesize(
                        run.keys.commonFieldsFor(sample.getInterface(), sample.getTimestamp()), fault, sample.getTimestamp());
                history.record(ddmRow, fault);
                if (ddmActive) {
                    ddm.add(ddmRow);
                }
                if (lifecycleActive) {
                    lifecycle.add(lifecycleSynth.synthesize(
                            run.keys.commonFieldsFor(sample.getInterface(), sample.getTimestamp()), fault, sample.getTimestamp()));
                }
            }
            if (ddm != null) {
                ddm.completeIfActive();
            }
            if (lifecycle != null) {
                lifecycle.completeIfActive();
            }
        } finally {
            if (ddm != null) {
                ddm.close();
            }
            if (lifecycle != null) {
                lifecycle.close();
            }
        }

        List<TableResult> results = new ArrayList<>(2);
        if (ddm != null) {
            results.add(ddm.toResult());
        }
        if (lifecycle != null) {
            results.add(lifecycle.toResult());
        }
        return results;
    }

    // ===== HELPERS =====

    /**
     * Independent, reproducible stream seed per table.
     */
    static long streamSeed(long runSeed, TableType table) {
        long z = runSeed + 0x9E3779B97F4A7C15L * (table.ordinal() + 1);
        z = (z ^ (z >>> 30)) * 0xBF58476D1CE4E5B9L;
        z = (z ^ (z >>> 27)) * 0x94D049BB133111EBL;
        return z ^ (z >>> 31);
    }

    private static long drawSeed() {
        long seed = new SecureRandom().nextLong();
        log.info("No seed supplied; drew seed {} (pass it back to reproduce this run)", seed);
        return seed;
    }

    /** Shared, read-only state of one run. */
    private static final class Run {
        private final GenerationRequest request;
        private final long seed;
        private final Topology topology;
        private final ModuleKeyGenerator keys;
        private final FaultInjector faults;
        private final OpticalReadingSampler opticalSampler = new OpticalReadingSampler();

        Run(GenerationRequest request, long seed, Topology topology) {
            this.request = request;
            this.seed = seed;
            this.topology = topology;
            this.keys = new ModuleKeyGenerator(topology);
            this.faults = new FaultInjector(seed, topology);
        }
    }

    /**
     * One table's sink, emitter and outcome. A sink that cannot be opened
     * fails this table only; the stream then holds a discarding placeholder.
     */
    private final class TableStream {
        private final TableType table;
        private final String outputName;
        private final RecordSink sink;
        private final BatchEmitter emitter;
        private final long plannedRows;
        private Status status;
        private String error;

        TableStream(TableType table, String outputName, SinkFactory sinks, long plannedRows) {
            this.table = table;
            this.outputName = outputName;
            this.plannedRows = plannedRows;
            listener.onTableStarted(table, plannedRows);

            RecordSink opened;
            SinkWriteException openFailure = null;
            try {
                opened = sinks.open(table, outputName);
            } catch (SinkWriteException e) {
                opened = new DiscardingSink();
                openFailure = e;
            }
            this.sink = opened;
            this.emitter = new BatchEmitter(table, opened, batchSize, listener);
            if (openFailure != null) {
                fail(openFailure);
            }
        }

        boolean isActive() {
            return status == null;
        }

        /** Adds a row; a sink failure ends this table only. */
        void add(TelemetryRecord record) {
            try {
                emitter.add(record);
            } catch (SinkWriteException e) {
                fail(e);
            }
        }

        void complete() {
            emitter.finish();
            status = Status.COMPLETED;
        }

        void completeIfActive() {
            if (!isActive()) {
                return;
            }
            try {
                complete();
            } catch (SinkWriteException e) {
                fail(e);
            }
        }

        void cancel() {
            emitter.discard();
            status = Status.CANCELLED;
        }

        void fail(SinkWriteException e) {
            emitter.discard();
            status = Status.FAILED;
            error = e.getMessage();
            log.error("Sink failure on table '{}'", table.getTableName(), e);
        }

        void close() {
            try {
                sink.close();
            } catch (RuntimeException e) {
                log.error("Failed to close sink for table '{}'", table.getTableName(), e);
                if (status == Status.COMPLETED) {
                    status = Status.FAILED;
                    error = e.getMessage();
                }
            }
            if (status == null) {
                // An exception is propagating; the table did not complete.
                status = Status.FAILED;
                error = "aborted";
            }
        }

        TableResult toResult() {
            TableResult result = new TableResult(table, outputName, status, plannedRows,
                    emitter.getRowsEmitted(), emitter.getBatchesEmitted(), error);
            listener.onTableFinished(result);
            return result;
        }
    }
}
