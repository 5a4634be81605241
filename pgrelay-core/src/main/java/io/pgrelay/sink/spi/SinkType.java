/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgrelay.sink.spi;

import java.util.Arrays;
import java.util.stream.Collectors;

import io.pgrelay.config.EnumeratedValue;

/**
 * The kinds of sinks a relay can be configured with.
 */
public enum SinkType implements EnumeratedValue {

    /**
     * Writes changes to the standard output.
     */
    CONSOLE("console"),

    /**
     * Publishes changes to a Kafka broker.
     */
    BROKER("kafka"),

    /**
     * Pushes row changes to an HTTP ingestion endpoint.
     */
    HTTP("http");

    private final String value;

    SinkType(String value) {
        this.value = value;
    }

    @Override
    public String getValue() {
        return value;
    }

    /**
     * Determine the sink type from the supplied value. {@code broker} is accepted for the broker kind.
     *
     * @param value the configuration property value; may be null
     * @return the matching option, or null if no match is found
     */
    public static SinkType parse(String value) {
        if (value == null) {
            return null;
        }
        value = value.trim();
        for (SinkType option : SinkType.values()) {
            if (option.getValue().equalsIgnoreCase(value)) {
                return option;
            }
        }
        if ("broker".equalsIgnoreCase(value)) {
            return BROKER;
        }
        return null;
    }

    /**
     * @return the comma-separated names of all sink types
     */
    public static String validNames() {
        return Arrays.stream(values()).map(SinkType::getValue).collect(Collectors.joining(", "));
    }
}
