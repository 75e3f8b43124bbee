package com.netsim.telemetry.datagen.engine;

import com.netsim.telemetry.datagen.engine.TableResult.Status;
import com.netsim.telemetry.datagen.fault.FaultInjector;
import com.netsim.telemetry.datagen.sink.InMemorySinkFactory;
import com.netsim.telemetry.datagen.sink.RecordSink;
import com.netsim.telemetry.datagen.sink.SinkFactory;
import com.netsim.telemetry.shared.error.SinkWriteException;
import com.netsim.telemetry.shared.model.record.DdmMetricRecord;
import com.netsim.telemetry.shared.model.record.GrpcMetricRecord;
import com.netsim.telemetry.shared.model.record.LifecyclePredictionRecord;
import com.netsim.telemetry.shared.model.record.SnmpStatusRecord;
import com.netsim.telemetry.shared.model.record.TableType;
import com.netsim.telemetry.shared.model.record.TelemetryRecord;
import com.netsim.telemetry.shared.model.request.DateRange;
import com.netsim.telemetry.shared.model.request.GenerationRequest;
import com.netsim.telemetry.shared.model.topology.DeviceInterface;
import com.netsim.telemetry.shared.model.topology.Topology;
import com.netsim.telemetry.shared.util.JsonUtil;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.time.LocalDate;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * End-to-end runs against in-memory sinks.
 */
class TelemetryGeneratorTest {

    private static final DateRange ONE_DAY = DateRange.of(LocalDate.of(2025, 3, 1), LocalDate.of(2025, 3, 1));
    private static final DateRange MARCH = DateRange.of(LocalDate.of(2025, 3, 1), LocalDate.of(2025, 3, 31));

    private final TelemetryGenerator generator = new TelemetryGenerator(GenerationListener.NONE);

    private static GenerationRequest.Builder request() {
        return GenerationRequest.builder().dateRange(ONE_DAY).rowsPerTable(1_000).deviceCount(5).faultRatio(0.1).seed(42L);
    }

    private static List<String> json(InMemorySinkFactory sinks, TableType table) {
        return sinks.sink(table).getRows().stream().map(JsonUtil::toJsonLine).toList();
    }

    @Nested
    @DisplayName("Determinism")
    class Determinism {

        @Test
        @DisplayName("Same request and seed give identical rows in every table")
        void sameSeedSameRows() {
            InMemorySinkFactory first = new InMemorySinkFactory();
            InMemorySinkFactory second = new InMemorySinkFactory();

            generator.generate(request().build(), first);
            generator.generate(request().build(), second);

            for (TableType table : TableType.values()) {
                assertThat(json(first, table)).as(table.getTableName()).containsExactlyElementsOf(json(second, table));
            }
        }

        @Test
        @DisplayName("Parallel generation produces the same rows as sequential")
        void parallelMatchesSequential() {
            InMemorySinkFactory sequential = new InMemorySinkFactory();
            InMemorySinkFactory parallel = new InMemorySinkFactory();

            generator.generate(request().build(), sequential);
            GenerationReport report = generator.generate(request().parallel(true).build(), parallel);

            assertThat(report.isSuccessful()).isTrue();
            for (TableType table : TableType.values()) {
                assertThat(json(parallel, table)).as(table.getTableName()).containsExactlyElementsOf(json(sequential, table));
            }
        }

        @Test
        @DisplayName("A drawn seed is reported and replays the run")
        void drawnSeedReplays() {
            InMemorySinkFactory drawn = new InMemorySinkFactory();
            InMemorySinkFactory replay = new InMemorySinkFactory();
            GenerationRequest unseeded = request().seed(null).tables(EnumSet.of(TableType.SNMP)).build();

            GenerationReport report = generator.generate(unseeded, drawn);
            generator.generate(unseeded.withSeed(report.getSeed()), replay);

            assertThat(json(replay, TableType.SNMP)).containsExactlyElementsOf(json(drawn, TableType.SNMP));
        }

        @Test
        @DisplayName("Requesting a subset of tables does not change the rows of the others")
        void subsetIndependence() {
            InMemorySinkFactory all = new InMemorySinkFactory();
            InMemorySinkFactory lifecycleOnly = new InMemorySinkFactory();

            generator.generate(request().build(), all);
            generator.generate(request().tables(EnumSet.of(TableType.LIFECYCLE)).build(), lifecycleOnly);

            assertThat(lifecycleOnly.isOpened(TableType.DDM)).isFalse();
            assertThat(json(lifecycleOnly, TableType.LIFECYCLE)).containsExactlyElementsOf(json(all, TableType.LIFECYCLE));
        }
    }

    @Nested
    @DisplayName("Row counts and keys")
    class CountsAndKeys {

        @ParameterizedTest(name = "{0}")
        @EnumSource(TableType.class)
        @DisplayName("Each table emits exactly the requested volume")
        void exactVolume(TableType table) {
            InMemorySinkFactory sinks = new InMemorySinkFactory();

            GenerationReport report = generator.generate(request().rowsPerTable(1_234).build(), sinks);

            assertThat(sinks.sink(table).getRows()).hasSize(1_234);
            assertThat(report.result(table).getRowsEmitted()).isEqualTo(1_234);
            assertThat(report.result(table).getStatus()).isEqualTo(Status.COMPLETED);
            assertThat(sinks.sink(table).isClosed()).isTrue();
        }

        @Test
        @DisplayName("Every module_id in every table exists in the topology")
        void referentialIntegrity() {
            InMemorySinkFactory sinks = new InMemorySinkFactory();

            GenerationReport report = generator.generate(request().build(), sinks);
            Topology topology = report.topology();

            for (TableType table : TableType.values()) {
                for (TelemetryRecord row : sinks.sink(table).getRows()) {
                    assertThat(topology.containsKey(row.getModuleId())).as(row.getModuleId()).isTrue();
                    assertThat(ONE_DAY.contains(row.getTimestamp())).isTrue();
                    if (table.isOpticalOnly()) {
                        assertThat(topology.getInterface(row.getModuleId()).hasModule()).isTrue();
                    }
                }
            }
        }

        @Test
        @DisplayName("Lifecycle rows pair one to one with DDM rows")
        void lifecyclePairsWithDdm() {
            InMemorySinkFactory sinks = new InMemorySinkFactory();

            generator.generate(request().build(), sinks);
            List<DdmMetricRecord> ddm = sinks.rows(TableType.DDM);
            List<LifecyclePredictionRecord> lifecycle = sinks.rows(TableType.LIFECYCLE);

            assertThat(lifecycle).hasSameSizeAs(ddm);
            for (int i = 0; i < ddm.size(); i++) {
                assertThat(lifecycle.get(i).getModuleId()).isEqualTo(ddm.get(i).getModuleId());
                assertThat(lifecycle.get(i).getTimestamp()).isEqualTo(ddm.get(i).getTimestamp());
                assertThat(lifecycle.get(i).getSerialNumber()).isEqualTo(ddm.get(i).getSerialNumber());
            }
        }

        @Test
        @DisplayName("Volume 0 emits nothing but still finishes every table")
        void zeroVolume() {
            InMemorySinkFactory sinks = new InMemorySinkFactory();

            GenerationReport report = generator.generate(request().rowsPerTable(0).build(), sinks);

            assertThat(report.isSuccessful()).isTrue();
            for (TableType table : TableType.values()) {
                assertThat(sinks.sink(table).getRows()).isEmpty();
                assertThat(sinks.sink(table).isFinished()).isTrue();
                assertThat(sinks.sink(table).getFinishedTable()).isEqualTo(table.getTableName());
            }
        }

        @Test
        @DisplayName("Output names are forwarded to the sinks untouched")
        void outputNames() {
            InMemorySinkFactory sinks = new InMemorySinkFactory();

            generator.generate(request().outputName(TableType.LIFECYCLE, "predict_data").rowsPerTable(10).build(), sinks);

            assertThat(sinks.sink(TableType.LIFECYCLE).getOutputName()).isEqualTo("predict_data");
            assertThat(sinks.sink(TableType.GRPC).getOutputName()).isEqualTo("grpc_data");
        }
    }

    @Nested
    @DisplayName("Faults")
    class Faults {

        @Test
        @DisplayName("One day, 1000 rows, ratio 0.1, 5 devices: about 100 abnormal SNMP rows from 5 devices")
        void snmpScenario() {
            InMemorySinkFactory sinks = new InMemorySinkFactory();

            GenerationReport report = generator.generate(request().tables(EnumSet.of(TableType.SNMP)).build(), sinks);
            List<SnmpStatusRecord> rows = sinks.rows(TableType.SNMP);

            assertThat(rows).hasSize(1_000);
            long abnormal = rows.stream().filter(TelemetryRecord::isAnomaly).count();
            assertThat(abnormal).isBetween(60L, 140L);
            Set<String> hosts = rows.stream().map(r -> r.getCommon().getDeviceHostname()).collect(Collectors.toSet());
            assertThat(hosts).hasSize(5);
            assertThat(report.getDevices()).isEqualTo(5);
        }

        @Test
        @DisplayName("Abnormal share converges to the ratio over 10,000 rows")
        void ratioConverges() {
            InMemorySinkFactory sinks = new InMemorySinkFactory();

            generator.generate(request().dateRange(MARCH).rowsPerTable(10_000).deviceCount(20).faultRatio(0.05).build(), sinks);

            for (TableType table : TableType.values()) {
                List<TelemetryRecord> rows = sinks.sink(table).getRows();
                double share = (double) rows.stream().filter(TelemetryRecord::isAnomaly).count() / rows.size();
                assertThat(share).as(table.getTableName()).isBetween(0.03, 0.07);
            }
        }

        @Test
        @DisplayName("Ratio 0 gives no anomalies and every port up")
        void ratioZero() {
            InMemorySinkFactory sinks = new InMemorySinkFactory();

            generator.generate(request().faultRatio(0.0).build(), sinks);

            for (TableType table : TableType.values()) {
                assertThat(sinks.sink(table).getRows())
                        .allMatch(r -> !r.isAnomaly() && "normal".equals(r.getAnomalyType()));
            }
            assertThat(sinks.<GrpcMetricRecord>rows(TableType.GRPC)).allMatch(r -> "UP".equals(r.getOperStatus()));
            assertThat(sinks.<SnmpStatusRecord>rows(TableType.SNMP)).allMatch(r -> "up".equals(r.getIfOperStatus()));
        }

        @Test
        @DisplayName("gRPC, SNMP and syslog agree on the fault of a shared key and bucket")
        void crossTableConsistency() {
            InMemorySinkFactory sinks = new InMemorySinkFactory();
            GenerationRequest req = request().faultRatio(0.3).build();

            GenerationReport report = generator.generate(req, sinks);
            FaultInjector injector = new FaultInjector(report.getSeed(), report.topology());

            for (TableType table : List.of(TableType.GRPC, TableType.SNMP, TableType.SYSLOG, TableType.DDM)) {
                for (TelemetryRecord row : sinks.sink(table).getRows()) {
                    DeviceInterface iface = report.topology().getInterface(row.getModuleId());
                    assertThat(row.getAnomalyType())
                            .isEqualTo(injector.decide(iface, row.getTimestamp(), 0.3).getKind().getLabel());
                }
            }
        }
    }

    @Nested
    @DisplayName("Failures")
    class Failures {

        @Test
        @DisplayName("A failing sink fails its own table only")
        void sinkFailureIsolated() {
            InMemorySinkFactory healthy = new InMemorySinkFactory();
            SinkFactory sinks = (table, name) -> table == TableType.GRPC || table == TableType.DDM
                    ? new FailingAfterFirstBatch(healthy.open(table, name))
                    : healthy.open(table, name);

            GenerationReport report = new TelemetryGenerator(100, GenerationListener.NONE)
                    .generate(request().build(), sinks);

            for (TableType failed : List.of(TableType.GRPC, TableType.DDM)) {
                TableResult result = report.result(failed);
                assertThat(result.getStatus()).isEqualTo(Status.FAILED);
                assertThat(result.getRowsEmitted()).isEqualTo(100);
                assertThat(result.getLastBatchIndex()).isZero();
                assertThat(result.getError()).contains(failed.getTableName());
                assertThat(healthy.sink(failed).isClosed()).isTrue();
            }
            for (TableType ok : List.of(TableType.SNMP, TableType.SYSLOG, TableType.LIFECYCLE)) {
                assertThat(report.result(ok).getStatus()).isEqualTo(Status.COMPLETED);
                assertThat(healthy.sink(ok).getRows()).hasSize(1_000);
            }
            assertThat(report.isSuccessful()).isFalse();
        }

        @Test
        @DisplayName("An interrupted run reports its tables as cancelled")
        void interrupted() {
            InMemorySinkFactory sinks = new InMemorySinkFactory();
            Thread.currentThread().interrupt();
            try {
                GenerationReport report = generator.generate(request().build(), sinks);

                assertThat(report.getResults().values()).extracting(TableResult::getStatus).containsOnly(Status.CANCELLED);
                for (TableType table : TableType.values()) {
                    assertThat(sinks.sink(table).isFinished()).as(table.getTableName()).isFalse();
                    assertThat(sinks.sink(table).isClosed()).as(table.getTableName()).isTrue();
                }
            } finally {
                Thread.interrupted();
            }
        }

        @Test
        @DisplayName("An interrupted single-table run is cancelled, not completed")
        void interruptedSingleTable() {
            InMemorySinkFactory sinks = new InMemorySinkFactory();
            Thread.currentThread().interrupt();
            try {
                GenerationReport report = generator.generate(request().tables(EnumSet.of(TableType.SNMP)).build(), sinks);

                TableResult snmp = report.result(TableType.SNMP);
                assertThat(snmp.getStatus()).isEqualTo(Status.CANCELLED);
                assertThat(snmp.getRowsEmitted()).isZero();
                assertThat(sinks.sink(TableType.SNMP).isFinished()).isFalse();
                assertThat(report.isSuccessful()).isFalse();
            } finally {
                Thread.interrupted();
            }
        }

        @Test
        @DisplayName("A sink that cannot be opened fails its own table and the rest still run")
        void sinkOpenFailureIsolated() {
            InMemorySinkFactory healthy = new InMemorySinkFactory();
            SinkFactory sinks = (table, name) -> {
                if (table == TableType.GRPC || table == TableType.LIFECYCLE) {
                    throw new SinkWriteException("Cannot open " + name + ": disk full", new IllegalStateException("disk full"));
                }
                return healthy.open(table, name);
            };

            GenerationReport report = generator.generate(request().build(), sinks);

            for (TableType failed : List.of(TableType.GRPC, TableType.LIFECYCLE)) {
                TableResult result = report.result(failed);
                assertThat(result.getStatus()).isEqualTo(Status.FAILED);
                assertThat(result.getRowsEmitted()).isZero();
                assertThat(result.getLastBatchIndex()).isEqualTo(-1);
                assertThat(result.getError()).contains("disk full");
                assertThat(healthy.isOpened(failed)).isFalse();
            }
            for (TableType ok : List.of(TableType.SNMP, TableType.SYSLOG, TableType.DDM)) {
                assertThat(report.result(ok).getStatus()).isEqualTo(Status.COMPLETED);
                assertThat(healthy.sink(ok).getRows()).hasSize(1_000);
                assertThat(healthy.sink(ok).isFinished()).isTrue();
            }
            assertThat(report.isSuccessful()).isFalse();
        }
    }

    /** Accepts one batch, then refuses everything. */
    private static final class FailingAfterFirstBatch implements RecordSink {
        private final RecordSink delegate;
        private int batches;

        FailingAfterFirstBatch(RecordSink delegate) {
            this.delegate = delegate;
        }

        @Override
        public void emit(List<? extends TelemetryRecord> batch) {
            if (batches++ > 0) {
                throw new IllegalStateException("connection reset");
            }
            delegate.emit(batch);
        }

        @Override
        public void finish(String tableName) {
            delegate.finish(tableName);
        }

        @Override
        public void close() {
            delegate.close();
        }
    }
}
