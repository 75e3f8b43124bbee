package com.netsim.telemetry.datagen.sink;

import com.netsim.telemetry.shared.error.SinkWriteException;
import com.netsim.telemetry.shared.model.record.TelemetryRecord;
import com.netsim.telemetry.shared.util.JsonUtil;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.apache.kafka.common.KafkaException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Publishes rows to a Kafka topic: key = module_id (so one interface's rows
 * stay ordered on one partition), value = the row's JSON.
 *
 * Each batch is sent, flushed and acknowledged before emit returns, so a
 * failed batch never hides behind later ones.
 */
public class KafkaRecordSink implements RecordSink {

    private static final Logger log = LoggerFactory.getLogger(KafkaRecordSink.class);
    private static final long ACK_TIMEOUT_SECONDS = 30;

    private final Producer<String, String> producer;
    private final String topic;
    private long rows;

    public KafkaRecordSink(Producer<String, String> producer, String topic) {
        this.producer = producer;
        this.topic = topic;
    }

    @Override
    public void emit(List<? extends TelemetryRecord> batch) {
        List<Future<RecordMetadata>> pending = new ArrayList<>(batch.size());
        try {
            for (TelemetryRecord record : batch) {
                pending.add(producer.send(new ProducerRecord<>(topic, record.getModuleId(), JsonUtil.toJsonLine(record))));
            }
            producer.flush();
            for (Future<RecordMetadata> future : pending) {
                future.get(ACK_TIMEOUT_SECONDS, TimeUnit.SECONDS);
            }
        } catch (KafkaException | IllegalStateException e) {
            throw new SinkWriteException("Failed publishing to topic " + topic, e);
        } catch (ExecutionException e) {
            throw new SinkWriteException("Broker rejected a row for topic " + topic, e.getCause());
        } catch (TimeoutException e) {
            throw new SinkWriteException("Timed out waiting for acks from topic " + topic, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SinkWriteException("Interrupted while publishing to topic " + topic, e);
        }
        rows += batch.size();
    }

    @Override
    public void finish(String tableName) {
        log.info("Published {} {} rows to topic '{}'", rows, tableName, topic);
    }

    public String getTopic() {
        return topic;
    }
}
