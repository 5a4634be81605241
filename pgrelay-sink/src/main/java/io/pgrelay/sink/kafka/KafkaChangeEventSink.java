/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgrelay.sink.kafka;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Properties;
import java.util.concurrent.CompletableFuture;

import org.apache.kafka.clients.producer.KafkaProducer;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.serialization.ByteArraySerializer;
import org.apache.kafka.common.serialization.StringSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.pgrelay.annotation.ThreadSafe;
import io.pgrelay.data.Change;
import io.pgrelay.data.ChangeJson;
import io.pgrelay.sink.ChangeEventSinkConfig;
import io.pgrelay.sink.spi.ChangeEventSink;
import io.pgrelay.sink.spi.SinkException;

/**
 * Publishes every change as compact JSON to a Kafka topic derived from the change.
 */
@ThreadSafe
public class KafkaChangeEventSink implements ChangeEventSink {

    private static final Logger LOGGER = LoggerFactory.getLogger(KafkaChangeEventSink.class);

    static final String STREAM_HEADER = "stream";
    private static final Duration CLOSE_TIMEOUT = Duration.ofSeconds(30);

    private final Producer<String, byte[]> producer;
    private final SubjectNamingStrategy namingStrategy;
    private final String stream;

    public KafkaChangeEventSink(ChangeEventSinkConfig config) {
        this(new KafkaProducer<>(producerProperties(config), new StringSerializer(), new ByteArraySerializer()),
                new SubjectNamingStrategy(config.brokerSubjectPrefix()), config.brokerStream());
        LOGGER.info("Publishing changes to Kafka at {} with subject prefix '{}'", config.brokerServers(), config.brokerSubjectPrefix());
    }

    public KafkaChangeEventSink(Producer<String, byte[]> producer, SubjectNamingStrategy namingStrategy, String stream) {
        this.producer = producer;
        this.namingStrategy = namingStrategy;
        this.stream = stream;
    }

    static Properties producerProperties(ChangeEventSinkConfig config) {
        final Properties props = new Properties();
        props.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, config.brokerServers());
        props.put(ProducerConfig.CLIENT_ID_CONFIG, config.brokerStream());
        props.put(ProducerConfig.ACKS_CONFIG, "all");
        props.put(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, "true");
        return props;
    }

    @Override
    public CompletableFuture<Void> deliver(Change change) {
        final CompletableFuture<Void> result = new CompletableFuture<>();
        final String subject = namingStrategy.subjectFor(change);
        try {
            final ProducerRecord<String, byte[]> record = new ProducerRecord<>(subject, namingStrategy.keyFor(change),
                    ChangeJson.COMPACT.writeAsBytes(change));
            if (stream != null) {
                record.headers().add(STREAM_HEADER, stream.getBytes(StandardCharsets.UTF_8));
            }
            LOGGER.debug("Sending {} change to '{}'", change.operation(), subject);
            producer.send(record, (metadata, exception) -> {
                if (exception != null) {
                    result.completeExceptionally(new SinkException(
                            String.format("Failed to publish %s change to '%s'", change.operation(), subject), exception));
                }
                else {
                    LOGGER.trace("Published {} change to {}-{}@{}", change.operation(), metadata.topic(), metadata.partition(),
                            metadata.offset());
                    result.complete(null);
                }
            });
        }
        catch (RuntimeException e) {
            result.completeExceptionally(new SinkException(
                    String.format("Failed to publish %s change to '%s'", change.operation(), subject), e));
        }
        return result;
    }

    @Override
    public String name() {
        return "kafka";
    }

    @Override
    public void close() {
        LOGGER.debug("Closing Kafka producer");
        producer.close(CLOSE_TIMEOUT);
    }
}
