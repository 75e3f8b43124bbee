package com.netsim.telemetry.datagen.sink;

import com.netsim.telemetry.datagen.engine.GenerationListener;
import com.netsim.telemetry.shared.error.SinkWriteException;
import com.netsim.telemetry.shared.model.record.TableType;
import com.netsim.telemetry.shared.model.record.TelemetryRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BatchEmitterTest {

    @Test
    @DisplayName("Rows reach the sink in fixed-size batches with a short tail")
    void batching() {
        InMemorySinkFactory factory = new InMemorySinkFactory();
        RecordSink sink = factory.open(TableType.SYSLOG, "syslog_data");
        List<Long> batchIndexes = new ArrayList<>();
        GenerationListener listener = new GenerationListener() {
            @Override
            public void onBatchEmitted(TableType table, long batchIndex, int batchRows, long rowsSoFar) {
                batchIndexes.add(batchIndex);
            }
        };
        BatchEmitter emitter = new BatchEmitter(TableType.SYSLOG, sink, 4, listener);

        SampleRows.rows(10).forEach(emitter::add);
        emitter.finish();

        InMemorySinkFactory.InMemorySink out = factory.sink(TableType.SYSLOG);
        assertThat(out.getBatchSizes()).containsExactly(4, 4, 2);
        assertThat(out.getRows()).hasSize(10);
        assertThat(out.getFinishedTable()).isEqualTo("syslog");
        assertThat(batchIndexes).containsExactly(0L, 1L, 2L);
        assertThat(emitter.getRowsEmitted()).isEqualTo(10);
        assertThat(emitter.getLastBatchIndex()).isEqualTo(2);
    }

    @Test
    @DisplayName("Finishing an empty table still signals the sink")
    void emptyTable() {
        InMemorySinkFactory factory = new InMemorySinkFactory();
        BatchEmitter emitter = new BatchEmitter(TableType.DDM, factory.open(TableType.DDM, "ddm_data"), 100, GenerationListener.NONE);

        emitter.finish();

        assertThat(factory.sink(TableType.DDM).isFinished()).isTrue();
        assertThat(factory.sink(TableType.DDM).getBatchSizes()).isEmpty();
        assertThat(emitter.getLastBatchIndex()).isEqualTo(-1);
    }

    @Test
    @DisplayName("A sink failure names the table and the last accepted batch")
    void sinkFailure() {
        RecordSink flaky = new RecordSink() {
            private int calls;

            @Override
            public void emit(List<? extends TelemetryRecord> batch) {
                if (++calls == 3) {
                    throw new IllegalStateException("disk full");
                }
            }

            @Override
            public void finish(String tableName) {
            }
        };
        BatchEmitter emitter = new BatchEmitter(TableType.GRPC, flaky, 5, GenerationListener.NONE);

        assertThatThrownBy(() -> SampleRows.rows(20).forEach(emitter::add))
                .isInstanceOf(SinkWriteException.class)
                .satisfies(e -> {
                    SinkWriteException error = (SinkWriteException) e;
                    assertThat(error.getTable()).isEqualTo("grpc");
                    assertThat(error.getLastBatchIndex()).isEqualTo(1);
                    assertThat(error.getRowsEmitted()).isEqualTo(10);
                    assertThat(error.getCause()).hasMessage("disk full");
                });
    }

    @Test
    void rejectsNonPositiveBatchSize() {
        assertThatThrownBy(() -> new BatchEmitter(TableType.GRPC, new DiscardingSink(), 0, GenerationListener.NONE))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
