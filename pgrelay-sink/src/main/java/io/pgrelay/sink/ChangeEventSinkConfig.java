/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgrelay.sink;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.apache.kafka.common.config.ConfigDef.Importance;
import org.apache.kafka.common.config.ConfigDef.Type;

import io.pgrelay.config.Configuration;
import io.pgrelay.config.Field;
import io.pgrelay.config.InvalidConfigurationException;
import io.pgrelay.sink.console.OutputFormat;
import io.pgrelay.sink.spi.SinkType;

/**
 * The configuration of the sinks a relay delivers changes to.
 */
public class ChangeEventSinkConfig {

    public static final String DEFAULT_SUBJECT_PREFIX = "postgres";
    public static final int DEFAULT_HTTP_BATCH_SIZE = 1;

    public static final Field SINK_TYPE = Field.create("sink.type")
            .withDisplayName("Sinks")
            .withType(Type.LIST)
            .withImportance(Importance.HIGH)
            .withDefault(SinkType.CONSOLE.getValue())
            .withValidation(ChangeEventSinkConfig::validateSinkTypes)
            .withDescription("Comma-separated list of the sinks changes are delivered to: " + SinkType.validNames() + ".");

    public static final Field CONSOLE_FORMAT = Field.create("console.format")
            .withDisplayName("Console format")
            .withImportance(Importance.MEDIUM)
            .withEnum(OutputFormat.class, OutputFormat.JSON)
            .withDescription("How the console sink renders changes: json, json-pretty or text.");

    public static final Field BROKER_SERVERS = Field.create("broker.servers")
            .withDisplayName("Broker servers")
            .withType(Type.LIST)
            .withImportance(Importance.HIGH)
            .withValidation(Field::isRequired)
            .withDescription("The bootstrap servers of the Kafka cluster changes are published to.");

    public static final Field BROKER_STREAM = Field.create("broker.stream")
            .withDisplayName("Broker stream")
            .withType(Type.STRING)
            .withImportance(Importance.HIGH)
            .withValidation(Field::isRequired)
            .withDescription("The logical stream name; used as the producer client id and sent in the 'stream' header.");

    public static final Field BROKER_SUBJECT_PREFIX = Field.create("broker.subject.prefix")
            .withDisplayName("Subject prefix")
            .withType(Type.STRING)
            .withImportance(Importance.MEDIUM)
            .withDefault(DEFAULT_SUBJECT_PREFIX)
            .withValidation(Field::isRequired)
            .withDescription("The prefix of every topic changes are published to.");

    public static final Field HTTP_URL = Field.create("http.url")
            .withDisplayName("Ingestion URL")
            .withType(Type.STRING)
            .withImportance(Importance.HIGH)
            .withValidation(Field::isRequired, ChangeEventSinkConfig::validateHttpUrl)
            .withDescription("The base URL of the HTTP ingestion endpoint.");

    public static final Field HTTP_PIPELINE = Field.create("http.pipeline")
            .withDisplayName("Ingestion pipeline")
            .withType(Type.STRING)
            .withImportance(Importance.HIGH)
            .withValidation(Field::isRequired)
            .withDescription("The identifier of the ingestion pipeline rows are pushed to.");

    public static final Field HTTP_TABLES = Field.create("http.tables")
            .withDisplayName("Ingestion tables")
            .withType(Type.LIST)
            .withImportance(Importance.MEDIUM)
            .withDescription("Optional comma-separated list of '<schema>_<table>' destinations; rows of other tables are dropped.");

    public static final Field HTTP_API_KEY = Field.create("http.api.key")
            .withDisplayName("Ingestion API key")
            .withType(Type.PASSWORD)
            .withImportance(Importance.MEDIUM)
            .withDescription("Optional bearer credential sent with every request.");

    public static final Field HTTP_BATCH_SIZE = Field.create("http.batch.size")
            .withDisplayName("Ingestion batch size")
            .withType(Type.INT)
            .withImportance(Importance.LOW)
            .withDefault(DEFAULT_HTTP_BATCH_SIZE)
            .withValidation(Field::isPositiveInteger)
            .withDescription("The number of rows buffered per destination before they are pushed.");

    public static final Field.Set BROKER_FIELDS = Field.Set.of(BROKER_SERVERS, BROKER_STREAM, BROKER_SUBJECT_PREFIX);
    public static final Field.Set HTTP_FIELDS = Field.Set.of(HTTP_URL, HTTP_PIPELINE, HTTP_TABLES, HTTP_API_KEY, HTTP_BATCH_SIZE);

    private final Configuration config;

    public ChangeEventSinkConfig(Configuration config) {
        this.config = config;
    }

    public Configuration getConfig() {
        return config;
    }

    /**
     * The distinct sink types in configuration order.
     *
     * @throws InvalidConfigurationException if a name is unknown or no sink is selected
     */
    public List<SinkType> sinkTypes() {
        final Set<SinkType> types = new LinkedHashSet<>();
        for (String name : config.getList(SINK_TYPE)) {
            SinkType type = SinkType.parse(name);
            if (type == null) {
                throw new InvalidConfigurationException("Unknown sink '" + name + "'; valid sinks are " + SinkType.validNames());
            }
            types.add(type);
        }
        if (types.isEmpty()) {
            throw new InvalidConfigurationException("At least one sink must be selected; valid sinks are " + SinkType.validNames());
        }
        return new ArrayList<>(types);
    }

    /**
     * The fields that must be valid for the selected sinks.
     */
    public Field.Set fieldsToValidate() {
        Field.Set fields = Field.Set.of(SINK_TYPE);
        for (SinkType type : sinkTypes()) {
            switch (type) {
                case CONSOLE:
                    fields = fields.with(CONSOLE_FORMAT);
                    break;
                case BROKER:
                    fields = fields.with(BROKER_FIELDS);
                    break;
                case HTTP:
                    fields = fields.with(HTTP_FIELDS);
                    break;
                default:
                    break;
            }
        }
        return fields;
    }

    /**
     * Validate the sink selection and the settings of every selected sink.
     *
     * @throws InvalidConfigurationException if the configuration is not valid
     */
    public void validate() {
        config.validateAndThrow(Field.Set.of(SINK_TYPE));
        config.validateAndThrow(fieldsToValidate());
    }

    public OutputFormat consoleFormat() {
        return OutputFormat.parse(config.getString(CONSOLE_FORMAT));
    }

    public String brokerServers() {
        return String.join(",", config.getList(BROKER_SERVERS));
    }

    public String brokerStream() {
        return config.getString(BROKER_STREAM);
    }

    public String brokerSubjectPrefix() {
        return config.getString(BROKER_SUBJECT_PREFIX);
    }

    public String httpUrl() {
        return config.getString(HTTP_URL);
    }

    public String httpPipeline() {
        return config.getString(HTTP_PIPELINE);
    }

    public List<String> httpTables() {
        return config.getList(HTTP_TABLES);
    }

    public String httpApiKey() {
        return config.getString(HTTP_API_KEY);
    }

    public int httpBatchSize() {
        return config.getInteger(HTTP_BATCH_SIZE);
    }

    private static int validateSinkTypes(Configuration config, Field field, Field.ValidationOutput problems) {
        int count = 0;
        final List<String> names = config.getList(field);
        if (names.isEmpty()) {
            problems.accept(field, config.getString(field), "At least one sink must be selected");
            return 1;
        }
        for (String name : names) {
            if ("nats".equalsIgnoreCase(name.trim())) {
                problems.accept(field, name, "NATS is not supported; the broker sink publishes to Kafka, select 'kafka' instead");
                count++;
            }
            else if (SinkType.parse(name) == null) {
                problems.accept(field, name, "Unknown sink '" + name + "'; valid sinks are " + SinkType.validNames());
                count++;
            }
        }
        return count;
    }

    private static int validateHttpUrl(Configuration config, Field field, Field.ValidationOutput problems) {
        final String value = config.getString(field);
        if (value == null || value.startsWith("http://") || value.startsWith("https://")) {
            return 0;
        }
        problems.accept(field, value, "An http:// or https:// URL is expected");
        return 1;
    }
}
