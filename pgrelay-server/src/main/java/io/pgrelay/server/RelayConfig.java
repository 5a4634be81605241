/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgrelay.server;

import java.io.File;
import java.io.IOException;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.pgrelay.config.Configuration;
import io.pgrelay.config.Field;
import io.pgrelay.config.InvalidConfigurationException;
import io.pgrelay.connector.postgresql.PostgresConnectorConfig;
import io.pgrelay.sink.ChangeEventSinkConfig;
import io.pgrelay.util.CommandLineOptions;

/**
 * Maps the command line of the relay onto a {@link Configuration}.
 * <p>
 * Properties read from the file named by {@code --config} are applied first; options given on the command line
 * override them.
 */
public final class RelayConfig {

    private static final Logger LOGGER = LoggerFactory.getLogger(RelayConfig.class);

    /**
     * A command line option and the configuration field it sets.
     *
     * @param shortName the one-letter form, e.g. {@code -s}; may be null
     * @param longName the long form, e.g. {@code --slot}
     * @param argument the name of the value shown in the usage, or null for a flag
     * @param field the field the option sets; null for options that do not map to a field
     * @param description the usage text
     */
    public record Option(String shortName, String longName, String argument, Field field, String description) {

        boolean isFlag() {
            return argument == null;
        }

        String usage() {
            final String names = shortName != null ? shortName + ", " + longName : "    " + longName;
            return isFlag() ? names : names + " <" + argument + ">";
        }
    }

    public static final Option CONNECTION = new Option("-c", "--connection", "conninfo", PostgresConnectorConfig.DATABASE_CONNECTION,
            "PostgreSQL connection string (jdbc URL, postgres:// URI or key=value pairs)");
    public static final Option SLOT = new Option("-s", "--slot", "name", PostgresConnectorConfig.SLOT_NAME,
            "Logical replication slot to consume");
    public static final Option PUBLICATION = new Option("-p", "--publication", "name", PostgresConnectorConfig.PUBLICATION_NAME,
            "Publication to stream changes of");
    public static final Option FORMAT = new Option("-f", "--format", "format", ChangeEventSinkConfig.CONSOLE_FORMAT,
            "Console format: json (default), json-pretty or text");
    public static final Option OUTPUT = new Option("-o", "--output", "sinks", ChangeEventSinkConfig.SINK_TYPE,
            "Comma-separated sinks: console (default), kafka, http");
    public static final Option CREATE_SLOT = new Option(null, "--create-slot", null, PostgresConnectorConfig.CREATE_SLOT,
            "Create the replication slot if it does not exist");
    public static final Option BROKER_SERVERS = new Option(null, "--broker-servers", "host:port,...", ChangeEventSinkConfig.BROKER_SERVERS,
            "Kafka bootstrap servers (kafka sink)");
    public static final Option BROKER_STREAM = new Option(null, "--broker-stream", "name", ChangeEventSinkConfig.BROKER_STREAM,
            "Logical stream name (kafka sink)");
    public static final Option BROKER_SUBJECT_PREFIX = new Option(null, "--broker-subject-prefix", "prefix",
            ChangeEventSinkConfig.BROKER_SUBJECT_PREFIX, "Topic prefix, default postgres (kafka sink)");
    public static final Option HTTP_URL = new Option(null, "--http-url", "url", ChangeEventSinkConfig.HTTP_URL,
            "Base URL of the ingestion endpoint (http sink)");
    public static final Option HTTP_PIPELINE = new Option(null, "--http-pipeline", "id", ChangeEventSinkConfig.HTTP_PIPELINE,
            "Ingestion pipeline (http sink)");
    public static final Option HTTP_TABLES = new Option(null, "--http-tables", "schema_table,...", ChangeEventSinkConfig.HTTP_TABLES,
            "Only push rows of these destinations (http sink)");
    public static final Option HTTP_API_KEY = new Option(null, "--http-api-key", "key", ChangeEventSinkConfig.HTTP_API_KEY,
            "Bearer credential (http sink)");
    public static final Option HTTP_BATCH_SIZE = new Option(null, "--http-batch-size", "rows", ChangeEventSinkConfig.HTTP_BATCH_SIZE,
            "Rows buffered per destination before a push, default 1 (http sink)");
    public static final Option POLL_INTERVAL = new Option(null, "--poll-interval-ms", "millis", PostgresConnectorConfig.POLL_INTERVAL_MS,
            "Wait between polls of an idle slot, default 100");
    public static final Option CONFIG_FILE = new Option(null, "--config", "file", null,
            "Properties file with configuration; command line options take precedence");
    public static final Option HELP = new Option("-h", "--help", null, null, "Print this help and exit");

    public static final List<Option> OPTIONS = Arrays.asList(CONNECTION, SLOT, PUBLICATION, FORMAT, OUTPUT, CREATE_SLOT,
            BROKER_SERVERS, BROKER_STREAM, BROKER_SUBJECT_PREFIX, HTTP_URL, HTTP_PIPELINE, HTTP_TABLES, HTTP_API_KEY,
            HTTP_BATCH_SIZE, POLL_INTERVAL, CONFIG_FILE, HELP);

    private RelayConfig() {
    }

    public static boolean isHelpRequested(CommandLineOptions options) {
        return options.hasOption(HELP.shortName(), HELP.longName());
    }

    /**
     * Build the relay configuration from the command line.
     *
     * @param options the parsed command line; may not be null
     * @return the configuration; never null
     * @throws InvalidConfigurationException if the command line contains unknown options or parameters
     * @throws IOException if the configuration file cannot be read
     */
    public static Configuration fromCommandLine(CommandLineOptions options) throws IOException {
        final Set<String> unknown = options.getUnknownOptions(knownNames());
        if (!unknown.isEmpty()) {
            throw new InvalidConfigurationException("Unknown option(s) " + unknown + "; use --help to list the supported options");
        }
        if (!options.getParameters().isEmpty()) {
            throw new InvalidConfigurationException("Unexpected argument(s) " + options.getParameters());
        }

        final Configuration.Builder builder = Configuration.create();
        final String file = options.getOption(CONFIG_FILE.longName());
        if (file != null) {
            LOGGER.info("Reading configuration from '{}'", file);
            builder.apply(Configuration.load(new File(file)));
        }
        for (Option option : OPTIONS) {
            if (option.field() == null) {
                continue;
            }
            final String value = option.shortName() != null
                    ? options.getOption(option.shortName(), option.longName(), null)
                    : options.getOption(option.longName());
            if (value != null) {
                builder.with(option.field(), value);
            }
        }
        return builder.build();
    }

    /**
     * Validate the connector settings and the settings of every selected sink.
     *
     * @throws InvalidConfigurationException if anything is invalid
     */
    public static void validate(Configuration config) {
        new PostgresConnectorConfig(config).validate();
        new ChangeEventSinkConfig(config).validate();
    }

    public static String usage() {
        final StringBuilder sb = new StringBuilder("Usage: pgrelay -c <conninfo> -s <slot> -p <publication> [options]\n\nOptions:\n");
        for (Option option : OPTIONS) {
            sb.append(String.format("  %-42s %s%n", option.usage(), option.description()));
        }
        return sb.toString();
    }

    private static Set<String> knownNames() {
        final Set<String> names = new HashSet<>();
        for (Option option : OPTIONS) {
            names.add(option.longName());
            if (option.shortName() != null) {
                names.add(option.shortName());
            }
        }
        return names;
    }
}
