/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgrelay.sink;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.pgrelay.config.Configuration;
import io.pgrelay.sink.console.ConsoleChangeEventSink;
import io.pgrelay.sink.http.HttpIngestionChangeEventSink;
import io.pgrelay.sink.kafka.KafkaChangeEventSink;
import io.pgrelay.sink.spi.ChangeEventSink;
import io.pgrelay.sink.spi.SinkType;

/**
 * Creates the sinks selected by a configuration.
 */
public final class ChangeEventSinks {

    private static final Logger LOGGER = LoggerFactory.getLogger(ChangeEventSinks.class);

    private ChangeEventSinks() {
    }

    /**
     * Validate the configuration and create one sink per selected sink type, in configuration order.
     *
     * @param config the relay configuration; may not be null
     * @return the sinks; never null or empty
     * @throws io.pgrelay.config.InvalidConfigurationException if the sink configuration is invalid
     */
    public static List<ChangeEventSink> create(Configuration config) {
        final ChangeEventSinkConfig sinkConfig = new ChangeEventSinkConfig(config);
        sinkConfig.validate();

        final List<ChangeEventSink> sinks = new ArrayList<>();
        try {
            for (SinkType type : sinkConfig.sinkTypes()) {
                sinks.add(create(type, sinkConfig));
                LOGGER.info("Created {} sink", type.getValue());
            }
        }
        catch (RuntimeException e) {
            sinks.forEach(ChangeEventSinks::closeQuietly);
            throw e;
        }
        return sinks;
    }

    static ChangeEventSink create(SinkType type, ChangeEventSinkConfig config) {
        switch (type) {
            case CONSOLE:
                return new ConsoleChangeEventSink(config.consoleFormat());
            case BROKER:
                return new KafkaChangeEventSink(config);
            case HTTP:
                return new HttpIngestionChangeEventSink(config);
            default:
                throw new IllegalArgumentException("Unsupported sink type " + type);
        }
    }

    private static void closeQuietly(ChangeEventSink sink) {
        try {
            sink.close();
        }
        catch (RuntimeException e) {
            LOGGER.warn("Failed to close sink '{}'", sink.name(), e);
        }
    }
}
