/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgrelay.config;

import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

import org.apache.kafka.common.config.ConfigDef.Importance;
import org.apache.kafka.common.config.ConfigDef.Type;

import io.pgrelay.annotation.Immutable;

/**
 * An immutable definition of a field that may appear within a {@link Configuration} instance.
 *
 * @author Randall Hauch
 */
@Immutable
public final class Field {

    /**
     * A set of fields.
     */
    @Immutable
    public static final class Set implements Iterable<Field> {

        public static Set of(Field... fields) {
            return new Set(Arrays.asList(fields));
        }

        private final Map<String, Field> fieldsByName;

        private Set(Iterable<Field> fields) {
            Map<String, Field> byName = new LinkedHashMap<>();
            fields.forEach(field -> byName.put(field.name(), field));
            this.fieldsByName = Collections.unmodifiableMap(byName);
        }

        /**
         * Get the field with the given {@link Field#name() name}.
         *
         * @param name the name of the field
         * @return the field, or {@code null} if there is no field with the given name
         */
        public Field fieldWithName(String name) {
            return fieldsByName.get(name);
        }

        /**
         * Get a new set that contains the fields in this set and those supplied.
         *
         * @param fields the fields to include with this set's fields
         * @return the new set; never null
         */
        public Set with(Field... fields) {
            java.util.List<Field> all = new java.util.ArrayList<>(fieldsByName.values());
            all.addAll(Arrays.asList(fields));
            return new Set(all);
        }

        /**
         * Get a new set that contains the fields in this set and in the supplied set.
         *
         * @param other the other fields
         * @return the new set; never null
         */
        public Set with(Set other) {
            java.util.List<Field> all = new java.util.ArrayList<>(fieldsByName.values());
            other.forEach(all::add);
            return new Set(all);
        }

        @Override
        public Iterator<Field> iterator() {
            return fieldsByName.values().iterator();
        }

        @Override
        public String toString() {
            return fieldsByName.keySet().stream().collect(Collectors.joining(", "));
        }
    }

    /**
     * A functional interface that accepts validation results.
     */
    @FunctionalInterface
    public interface ValidationOutput {
        /**
         * Accept a problem with the given value for the field.
         * @param field the field with the value; may not be null
         * @param value the value that is not valid
         * @param problemMessage the message describing the problem; may not be null
         */
        void accept(Field field, Object value, String problemMessage);
    }

    /**
     * A functional interface that can be used to validate field values.
     */
    @FunctionalInterface
    public interface Validator {

        /**
         * Validate the supplied value for the field, and report any problems to the designated consumer.
         *
         * @param config the configuration containing the field to be validated; may not be null
         * @param field the {@link Field} being validated; never null
         * @param problems the consumer to be called with each problem; never null
         * @return the number of problems that were found, or 0 if the value is valid
         */
        int validate(Configuration config, Field field, ValidationOutput problems);

        /**
         * Obtain a new {@link Validator} object that validates using this validator and the supplied validator.
         *
         * @param other the validation function to call after this
         * @return the new validator, or this validator if {@code other} is {@code null} or equal to {@code this}
         */
        default Validator and(Validator other) {
            if (other == null || other == this) {
                return this;
            }
            return (config, field, problems) -> validate(config, field, problems) + other.validate(config, field, problems);
        }
    }

    /**
     * Create an immutable {@link Field} instance with the given property name.
     *
     * @param name the name of the field; may not be null
     * @return the field; never null
     */
    public static Field create(String name) {
        return new Field(name, null, null, Type.STRING, Importance.MEDIUM, null, null);
    }

    private final String name;
    private final String displayName;
    private final String description;
    private final Type type;
    private final Importance importance;
    private final String defaultValue;
    private final Validator validator;

    private Field(String name, String displayName, String description, Type type, Importance importance,
                  String defaultValue, Validator validator) {
        Objects.requireNonNull(name, "The field name is required");
        this.name = name;
        this.displayName = displayName;
        this.description = description;
        this.type = type;
        this.importance = importance;
        this.defaultValue = defaultValue;
        this.validator = validator;
    }

    public String name() {
        return name;
    }

    public String displayName() {
        return displayName;
    }

    public String description() {
        return description;
    }

    public Type type() {
        return type;
    }

    public Importance importance() {
        return importance;
    }

    /**
     * Get the string form of the default value for this field.
     *
     * @return the default value, or {@code null} if there is no default
     */
    public String defaultValueAsString() {
        return defaultValue;
    }

    public boolean hasDefaultValue() {
        return defaultValue != null;
    }

    /**
     * Validate the supplied value for this field, and report any problems to the designated consumer.
     *
     * @param config the field values keyed by their name; may not be null
     * @param problems the consumer to be called with each problem; never null
     * @return {@code true} if the value is considered valid, or {@code false} if it is not valid
     */
    public boolean validate(Configuration config, ValidationOutput problems) {
        return validator == null || validator.validate(config, this, problems) == 0;
    }

    public Field withDisplayName(String displayName) {
        return new Field(name, displayName, description, type, importance, defaultValue, validator);
    }

    public Field withDescription(String description) {
        return new Field(name, displayName, description, type, importance, defaultValue, validator);
    }

    public Field withType(Type type) {
        return new Field(name, displayName, description, type, importance, defaultValue, validator);
    }

    public Field withImportance(Importance importance) {
        return new Field(name, displayName, description, type, importance, defaultValue, validator);
    }

    public Field withDefault(String defaultValue) {
        return new Field(name, displayName, description, type, importance, defaultValue, validator);
    }

    public Field withDefault(boolean defaultValue) {
        return withDefault(Boolean.toString(defaultValue));
    }

    public Field withDefault(int defaultValue) {
        return withDefault(Integer.toString(defaultValue));
    }

    public Field withDefault(long defaultValue) {
        return withDefault(Long.toString(defaultValue));
    }

    /**
     * Create and return a new Field instance that is a copy of this field but that uses the supplied enumeration
     * for its allowed values and default.
     *
     * @param enumType the enumeration type for this field
     * @param defaultOption the default enumeration value; may be null
     * @return the new field; never null
     */
    public <T extends Enum<T> & EnumeratedValue> Field withEnum(Class<T> enumType, T defaultOption) {
        java.util.Set<String> allowed = Arrays.stream(enumType.getEnumConstants())
                .map(EnumeratedValue::getValue)
                .map(String::toLowerCase)
                .collect(Collectors.toCollection(java.util.LinkedHashSet::new));
        Validator enumValidator = (config, field, problems) -> {
            String value = config.getString(field);
            if (value == null || allowed.contains(value.trim().toLowerCase())) {
                return 0;
            }
            problems.accept(field, value, "Value must be one of " + String.join(", ", allowed));
            return 1;
        };
        Field result = withType(Type.STRING).withValidation(enumValidator);
        return defaultOption != null ? result.withDefault(defaultOption.getValue()) : result;
    }

    /**
     * Create and return a new Field instance that is a copy of this field but that uses the supplied validators in
     * addition to any existing validator.
     *
     * @param validators the additional validation functions; may be null
     * @return the new field; never null
     */
    public Field withValidation(Validator... validators) {
        Validator combined = this.validator;
        for (Validator other : validators) {
            combined = combined == null ? other : combined.and(other);
        }
        return new Field(name, displayName, description, type, importance, defaultValue, combined);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) {
            return true;
        }
        if (obj instanceof Field) {
            return this.name.equals(((Field) obj).name);
        }
        return false;
    }

    @Override
    public String toString() {
        return name();
    }

    public static int isRequired(Configuration config, Field field, ValidationOutput problems) {
        String value = config.getString(field);
        if (value != null && value.trim().length() > 0) {
            return 0;
        }
        problems.accept(field, value, "A value is required");
        return 1;
    }

    public static int isOptional(Configuration config, Field field, ValidationOutput problems) {
        return 0;
    }

    public static int isBoolean(Configuration config, Field field, ValidationOutput problems) {
        String value = config.getString(field);
        if (value == null ||
                value.trim().equalsIgnoreCase(Boolean.TRUE.toString()) ||
                value.trim().equalsIgnoreCase(Boolean.FALSE.toString())) {
            return 0;
        }
        problems.accept(field, value, "Either 'true' or 'false' is expected");
        return 1;
    }

    public static int isPositiveInteger(Configuration config, Field field, ValidationOutput problems) {
        return checkInteger(config, field, problems, 1, "A positive, non-zero integer value is expected");
    }

    public static int isNonNegativeInteger(Configuration config, Field field, ValidationOutput problems) {
        return checkInteger(config, field, problems, 0, "A non-negative integer value is expected");
    }

    public static int isPositiveLong(Configuration config, Field field, ValidationOutput problems) {
        String value = config.getString(field);
        if (value == null) {
            return 0;
        }
        try {
            if (Long.parseLong(value.trim()) > 0) {
                return 0;
            }
        }
        catch (NumberFormatException e) {
            problems.accept(field, value, "A positive, non-zero long value is expected");
            return 1;
        }
        problems.accept(field, value, "A positive, non-zero long value is expected");
        return 1;
    }

    private static int checkInteger(Configuration config, Field field, ValidationOutput problems, int minimum, String message) {
        String value = config.getString(field);
        if (value == null) {
            return 0;
        }
        try {
            if (Integer.parseInt(value.trim()) >= minimum) {
                return 0;
            }
        }
        catch (NumberFormatException e) {
            problems.accept(field, value, message);
            return 1;
        }
        problems.accept(field, value, message);
        return 1;
    }
}
