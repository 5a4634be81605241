/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgrelay.connector.postgresql;

import java.time.Duration;

import org.apache.kafka.common.config.ConfigDef.Importance;
import org.apache.kafka.common.config.ConfigDef.Type;

import io.pgrelay.config.Configuration;
import io.pgrelay.config.Field;
import io.pgrelay.config.InvalidConfigurationException;
import io.pgrelay.connector.postgresql.connection.ConnectionString;

/**
 * The configuration properties of the PostgreSQL change source.
 */
public class PostgresConnectorConfig {

    public static final long DEFAULT_POLL_INTERVAL_MS = 100L;

    public static final Field DATABASE_CONNECTION = Field.create("database.connection")
            .withDisplayName("Connection")
            .withType(Type.STRING)
            .withImportance(Importance.HIGH)
            .withValidation(Field::isRequired, PostgresConnectorConfig::validateConnectionString)
            .withDescription("The PostgreSQL connection string, either a jdbc:postgresql:// URL, a postgres:// URI "
                    + "or libpq 'key=value' pairs.");

    public static final Field SLOT_NAME = Field.create("slot.name")
            .withDisplayName("Slot")
            .withType(Type.STRING)
            .withImportance(Importance.HIGH)
            .withValidation(Field::isRequired)
            .withDescription("The name of the logical replication slot the changes are consumed from.");

    public static final Field PUBLICATION_NAME = Field.create("publication.name")
            .withDisplayName("Publication")
            .withType(Type.STRING)
            .withImportance(Importance.HIGH)
            .withValidation(Field::isRequired)
            .withDescription("The name of the publication that selects the tables to decode.");

    public static final Field CREATE_SLOT = Field.create("slot.create")
            .withDisplayName("Create slot")
            .withType(Type.BOOLEAN)
            .withImportance(Importance.MEDIUM)
            .withDefault(false)
            .withValidation(Field::isBoolean)
            .withDescription("Whether to create the replication slot with the pgoutput plugin on startup. "
                    + "An existing slot is reused.");

    public static final Field POLL_INTERVAL_MS = Field.create("poll.interval.ms")
            .withDisplayName("Poll interval (ms)")
            .withType(Type.LONG)
            .withImportance(Importance.MEDIUM)
            .withDefault(DEFAULT_POLL_INTERVAL_MS)
            .withValidation(Field::isPositiveLong)
            .withDescription("Time to wait before polling the slot again after a fetch returned no changes. Defaults to "
                    + DEFAULT_POLL_INTERVAL_MS + "ms.");

    public static final Field MAX_BATCH_SIZE = Field.create("max.batch.size")
            .withDisplayName("Maximum batch size")
            .withType(Type.INT)
            .withImportance(Importance.LOW)
            .withDefault(0)
            .withValidation(Field::isNonNegativeInteger)
            .withDescription("The maximum number of changes consumed from the slot by one fetch; 0 means no limit.");

    public static final Field.Set ALL_FIELDS = Field.Set.of(DATABASE_CONNECTION, SLOT_NAME, PUBLICATION_NAME, CREATE_SLOT,
            POLL_INTERVAL_MS, MAX_BATCH_SIZE);

    private final Configuration config;

    public PostgresConnectorConfig(Configuration config) {
        this.config = config;
    }

    public Configuration getConfig() {
        return config;
    }

    /**
     * Validate the configuration.
     *
     * @throws io.pgrelay.config.InvalidConfigurationException if a value is missing or invalid
     */
    public void validate() {
        config.validateAndThrow(ALL_FIELDS);
    }

    public ConnectionString connectionString() {
        return ConnectionString.parse(config.getString(DATABASE_CONNECTION));
    }

    public String slotName() {
        return config.getString(SLOT_NAME);
    }

    public String publicationName() {
        return config.getString(PUBLICATION_NAME);
    }

    public boolean createSlot() {
        return config.getBoolean(CREATE_SLOT);
    }

    public Duration pollInterval() {
        return Duration.ofMillis(config.getLong(POLL_INTERVAL_MS));
    }

    public int maxBatchSize() {
        return config.getInteger(MAX_BATCH_SIZE);
    }

    private static int validateConnectionString(Configuration config, Field field, Field.ValidationOutput problems) {
        final String value = config.getString(field);
        if (value == null || value.trim().isEmpty()) {
            return 0;
        }
        try {
            ConnectionString.parse(value);
            return 0;
        }
        catch (InvalidConfigurationException e) {
            problems.accept(field, "<masked>", e.getMessage());
            return 1;
        }
    }
}
