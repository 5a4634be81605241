/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgrelay.config;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.Set;
import java.util.function.Consumer;

import org.apache.kafka.common.config.ConfigValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.pgrelay.annotation.Immutable;
import io.pgrelay.util.Strings;

/**
 * An immutable representation of a relay configuration. A {@link Configuration} object is basically a decorator around a
 * set of key-value pairs, with {@link Field} definitions supplying the defaults and validation rules.
 *
 * @author Randall Hauch
 */
@Immutable
public interface Configuration {

    Logger LOGGER = LoggerFactory.getLogger(Configuration.class);

    /**
     * A builder of Configuration objects.
     */
    class Builder {
        private final Map<String, String> props = new LinkedHashMap<>();

        protected Builder() {
        }

        protected Builder(Map<String, String> props) {
            this.props.putAll(props);
        }

        /**
         * Associate the given value with the specified key. A {@code null} value removes the key.
         *
         * @param key the key
         * @param value the value
         * @return this builder object so methods can be chained together; never null
         */
        public Builder with(String key, Object value) {
            if (value == null) {
                props.remove(key);
            }
            else {
                props.put(key, value.toString());
            }
            return this;
        }

        public Builder with(Field field, Object value) {
            return with(field.name(), value);
        }

        /**
         * If there is no value for the specified key, associate the given value with it.
         *
         * @param field the field
         * @param value the default value
         * @return this builder object so methods can be chained together; never null
         */
        public Builder withDefault(Field field, Object value) {
            if (!props.containsKey(field.name())) {
                with(field, value);
            }
            return this;
        }

        /**
         * Add all of the values of the supplied configuration, overwriting any existing values.
         *
         * @param other the configuration whose values are to be applied; may be null
         * @return this builder object so methods can be chained together; never null
         */
        public Builder apply(Configuration other) {
            if (other != null) {
                other.keys().forEach(key -> with(key, other.getString(key)));
            }
            return this;
        }

        public Configuration build() {
            return Configuration.from(props);
        }
    }

    /**
     * Obtain a new {@link Builder} instance.
     *
     * @return the new builder; never null
     */
    static Builder create() {
        return new Builder();
    }

    /**
     * Obtain a configuration instance by copying the supplied map of string keys and values.
     *
     * @param properties the properties; may be null or empty
     * @return the configuration; never null
     */
    static Configuration from(Map<String, String> properties) {
        final Map<String, String> props = properties != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(properties))
                : Collections.emptyMap();
        return new Configuration() {
            @Override
            public String getString(String key) {
                return props.get(key);
            }

            @Override
            public Set<String> keys() {
                return props.keySet();
            }

            @Override
            public String toString() {
                return withMaskedSecrets(props).toString();
            }
        };
    }

    /**
     * Obtain a configuration instance by copying the supplied Properties object.
     *
     * @param properties the properties; may be null or empty
     * @return the configuration; never null
     */
    static Configuration from(Properties properties) {
        Map<String, String> props = new LinkedHashMap<>();
        if (properties != null) {
            properties.stringPropertyNames().forEach(key -> props.put(key, properties.getProperty(key)));
        }
        return from(props);
    }

    /**
     * Obtain a configuration instance by loading the Properties from the supplied file.
     *
     * @param file the file containing the configuration properties; may not be null
     * @return the configuration; never null
     * @throws IOException if there is an error reading the stream
     */
    static Configuration load(File file) throws IOException {
        try (InputStream stream = new FileInputStream(file)) {
            Properties properties = new Properties();
            properties.load(stream);
            LOGGER.debug("Loaded {} configuration properties from {}", properties.size(), file);
            return from(properties);
        }
    }

    private static Map<String, String> withMaskedSecrets(Map<String, String> props) {
        Map<String, String> masked = new LinkedHashMap<>();
        props.forEach((key, value) -> {
            String lower = key.toLowerCase();
            boolean secret = lower.contains("password") || lower.contains("api.key") || lower.contains("secret");
            masked.put(key, secret ? "********" : value);
        });
        return masked;
    }

    /**
     * Get the string value associated with the given key.
     *
     * @param key the key for the configuration property
     * @return the value, or null if the key is null or there is no such key-value pair in the configuration
     */
    String getString(String key);

    /**
     * Get the set of keys in this configuration.
     *
     * @return the set of keys; never null but possibly empty
     */
    Set<String> keys();

    /**
     * Obtain an editor for a copy of this configuration.
     *
     * @return a builder that is populated with this configuration's key-value pairs; never null
     */
    default Builder edit() {
        return create().apply(this);
    }

    /**
     * Get the string value associated with the given field, returning the field's default value if there is no such
     * key-value pair.
     *
     * @param field the field; may not be null
     * @return the configuration's value for the field, or the field's default value if there is no such key-value pair
     */
    default String getString(Field field) {
        String value = getString(field.name());
        return value != null ? value : field.defaultValueAsString();
    }

    /**
     * Get the integer value associated with the given field, returning the field's default value if there is no such
     * key-value pair.
     *
     * @param field the field; may not be null
     * @return the integer value, or the field's default value
     * @throws NumberFormatException if the value is not a valid integer
     */
    default int getInteger(Field field) {
        String value = getString(field);
        return value != null ? Integer.parseInt(value.trim()) : 0;
    }

    default long getLong(Field field) {
        String value = getString(field);
        return value != null ? Long.parseLong(value.trim()) : 0L;
    }

    default boolean getBoolean(Field field) {
        String value = getString(field);
        return value != null && Boolean.parseBoolean(value.trim());
    }

    /**
     * Get the comma-separated list associated with the given field.
     *
     * @param field the field; may not be null
     * @return the trimmed, non-empty list items; never null but possibly empty
     */
    default List<String> getList(Field field) {
        return Strings.splitCommaSeparated(getString(field));
    }

    /**
     * Get a copy of these configuration properties as a Properties object.
     *
     * @return the properties object; never null
     */
    default Properties asProperties() {
        Properties props = new Properties();
        keys().forEach(key -> props.setProperty(key, getString(key)));
        return props;
    }

    /**
     * Validate the supplied fields in this configuration. Extra fields not described by the supplied {@code fields}
     * parameter are not validated.
     *
     * @param fields the fields
     * @return the {@link ConfigValue} for every field; never null
     */
    default Map<String, ConfigValue> validate(Field.Set fields) {
        Map<String, ConfigValue> configValuesByFieldName = new LinkedHashMap<>();
        for (Field field : fields) {
            ConfigValue value = new ConfigValue(field.name());
            value.value(getString(field));
            configValuesByFieldName.put(field.name(), value);
            field.validate(this, (f, invalidValue, problemMessage) -> {
                configValuesByFieldName.get(f.name()).addErrorMessage(problemMessage);
            });
        }
        return configValuesByFieldName;
    }

    /**
     * Validate the supplied fields in this configuration, reporting each problem to the supplied function.
     *
     * @param fields the fields
     * @param problems the function called with each problem message; may not be null
     * @return {@code true} if the value is considered valid, or {@code false} if it is not valid
     */
    default boolean validateAndRecord(Iterable<Field> fields, Consumer<String> problems) {
        boolean valid = true;
        for (Field field : fields) {
            if (!field.validate(this, (f, value, problemMessage) -> {
                String violation = String.format("The '%s' value is invalid: %s", f.name(), problemMessage);
                problems.accept(violation);
            })) {
                valid = false;
            }
        }
        return valid;
    }

    /**
     * Validate the supplied fields in this configuration.
     *
     * @param fields the fields
     * @throws InvalidConfigurationException if any of the fields is invalid
     */
    default void validateAndThrow(Field.Set fields) {
        Map<String, ConfigValue> values = validate(fields);
        StringBuilder message = new StringBuilder();
        for (ConfigValue value : values.values()) {
            for (String problem : value.errorMessages()) {
                if (message.length() > 0) {
                    message.append("; ");
                }
                message.append(String.format("The '%s' value is invalid: %s", value.name(), problem));
            }
        }
        if (message.length() > 0) {
            throw new InvalidConfigurationException(message.toString(), values.values());
        }
    }
}
