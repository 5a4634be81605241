/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgrelay.sink.console;

import java.util.Arrays;
import java.util.stream.Collectors;

import io.pgrelay.config.EnumeratedValue;
import io.pgrelay.config.InvalidConfigurationException;

/**
 * The renderings supported by the console sink.
 */
public enum OutputFormat implements EnumeratedValue {

    /**
     * One compact JSON document per line.
     */
    JSON("json"),

    /**
     * Indented, multi-line JSON.
     */
    JSON_PRETTY("json-pretty"),

    /**
     * Human-readable text.
     */
    TEXT("text");

    private final String value;

    OutputFormat(String value) {
        this.value = value;
    }

    @Override
    public String getValue() {
        return value;
    }

    /**
     * Determine the output format from the supplied value.
     *
     * @param value the configuration property value; may not be null
     * @return the matching option; never null
     * @throws InvalidConfigurationException if the value does not name a format
     */
    public static OutputFormat parse(String value) {
        if (value != null) {
            String trimmed = value.trim();
            for (OutputFormat option : OutputFormat.values()) {
                if (option.getValue().equalsIgnoreCase(trimmed)) {
                    return option;
                }
            }
        }
        throw new InvalidConfigurationException("Unknown output format '" + value + "'; valid formats are "
                + Arrays.stream(values()).map(OutputFormat::getValue).collect(Collectors.joining(", ")));
    }
}
