package com.netsim.telemetry.datagen.sink;

import com.netsim.telemetry.shared.config.SimulatorConfig;
import com.netsim.telemetry.shared.model.record.TableType;
import org.apache.kafka.clients.producer.KafkaProducer;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.serialization.StringSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Properties;

/**
 * Kafka sinks sharing one producer; the output name of each table is its topic.
 * Closing the factory closes the producer.
 */
public class KafkaSinkFactory implements SinkFactory, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(KafkaSinkFactory.class);

    private final Producer<String, String> producer;

    public KafkaSinkFactory(Producer<String, String> producer) {
        this.producer = producer;
    }

    public static KafkaSinkFactory fromConfig(SimulatorConfig config) {
        Properties props = new Properties();
        props.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, config.getKafkaBootstrapServers());
        props.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class.getName());
        props.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, StringSerializer.class.getName());
        props.put(ProducerConfig.ACKS_CONFIG, config.get("kafka.acks", "all"));
        props.put(ProducerConfig.LINGER_MS_CONFIG, config.get("kafka.linger.ms", "20"));
        log.info("Connecting Kafka sink to {}", config.getKafkaBootstrapServers());
        return new KafkaSinkFactory(new KafkaProducer<>(props));
    }

    @Override
    public RecordSink open(TableType table, String outputName) {
        return new KafkaRecordSink(producer, outputName);
    }

    @Override
    public void close() {
        producer.close();
        log.info("Kafka sink producer closed");
    }
}
