/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgrelay.data;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.core.JsonEncoding;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import io.pgrelay.PgRelayException;
import io.pgrelay.annotation.ThreadSafe;

/**
 * Reads and writes {@link Change} objects as JSON using the Jackson library.
 * <p>
 * The JSON form wraps the change in a single property named after the variant, e.g.
 * {@code {"Begin":{"lsn":"0/1234567","timestamp":123456789,"xid":999}}}, with snake_case field names.
 */
@ThreadSafe
public final class ChangeJson {

    public static final ChangeJson COMPACT = new ChangeJson(false);
    public static final ChangeJson PRETTY = new ChangeJson(true);

    private static final JsonFactory factory = new JsonFactory();
    private static final ObjectMapper mapper = new ObjectMapper(factory);

    private final boolean pretty;

    private ChangeJson(boolean pretty) {
        this.pretty = pretty;
    }

    /**
     * Write the supplied change as a JSON string.
     *
     * @param change the change; may not be null
     * @return the JSON representation; never null
     */
    public String write(Change change) {
        StringWriter writer = new StringWriter();
        try (JsonGenerator generator = factory.createGenerator(writer)) {
            configure(generator);
            writeChange(change, generator);
        }
        catch (IOException e) {
            throw new PgRelayException("Failed to serialize " + change.operation() + " change", e);
        }
        return writer.toString();
    }

    /**
     * Write the supplied change as UTF-8 encoded JSON.
     *
     * @param change the change; may not be null
     * @return the JSON bytes; never null
     */
    public byte[] writeAsBytes(Change change) {
        try (ByteArrayOutputStream stream = new ByteArrayOutputStream()) {
            try (JsonGenerator generator = factory.createGenerator(stream, JsonEncoding.UTF8)) {
                configure(generator);
                writeChange(change, generator);
            }
            return stream.toByteArray();
        }
        catch (IOException e) {
            throw new PgRelayException("Failed to serialize " + change.operation() + " change", e);
        }
    }

    /**
     * Read a change from its JSON representation.
     *
     * @param json the JSON text; may not be null
     * @return the change; never null
     * @throws PgRelayException if the text is not valid JSON or does not describe a known change
     */
    public static Change read(String json) {
        JsonNode root;
        try {
            root = mapper.readTree(json);
        }
        catch (IOException e) {
            throw new PgRelayException("Malformed change JSON", e);
        }
        if (root == null || !root.isObject() || root.size() != 1) {
            throw new PgRelayException("A change must be a JSON object with exactly one variant property");
        }
        Map.Entry<String, JsonNode> variant = root.fields().next();
        JsonNode body = variant.getValue();
        if (!body.isObject()) {
            throw new PgRelayException("The '" + variant.getKey() + "' change must be a JSON object");
        }
        switch (variant.getKey()) {
            case "Begin":
                return new Change.Begin(text(body, "lsn"), number(body, "timestamp"), number(body, "xid"));
            case "Commit":
                return new Change.Commit(text(body, "lsn"), number(body, "timestamp"));
            case "Relation":
                return new Change.Relation(number(body, "relation_id"), text(body, "schema"), text(body, "table"),
                        columns(body));
            case "Insert":
                return new Change.Insert(number(body, "relation_id"), text(body, "schema"), text(body, "table"),
                        tuple(body, "new_tuple"));
            case "Update":
                JsonNode old = body.get("old_tuple");
                return new Change.Update(number(body, "relation_id"), text(body, "schema"), text(body, "table"),
                        old == null || old.isNull() ? null : tuple(body, "old_tuple"), tuple(body, "new_tuple"));
            case "Delete":
                return new Change.Delete(number(body, "relation_id"), text(body, "schema"), text(body, "table"),
                        tuple(body, "old_tuple"));
            default:
                throw new PgRelayException("Unknown change variant '" + variant.getKey() + "'");
        }
    }

    private void configure(JsonGenerator generator) {
        if (pretty) {
            generator.setPrettyPrinter(new DefaultPrettyPrinter());
        }
    }

    private static void writeChange(Change change, JsonGenerator generator) throws IOException {
        generator.writeStartObject();
        switch (change.operation()) {
            case BEGIN:
                Change.Begin begin = (Change.Begin) change;
                generator.writeObjectFieldStart("Begin");
                generator.writeStringField("lsn", begin.lsn().get());
                generator.writeNumberField("timestamp", begin.timestamp());
                generator.writeNumberField("xid", begin.xid());
                break;
            case COMMIT:
                Change.Commit commit = (Change.Commit) change;
                generator.writeObjectFieldStart("Commit");
                generator.writeStringField("lsn", commit.lsn().get());
                generator.writeNumberField("timestamp", commit.timestamp());
                break;
            case RELATION:
                Change.Relation relation = (Change.Relation) change;
                generator.writeObjectFieldStart("Relation");
                writeTable(relation, generator);
                generator.writeArrayFieldStart("columns");
                for (Column column : relation.columns()) {
                    generator.writeStartObject();
                    generator.writeStringField("name", column.name());
                    generator.writeNumberField("type_id", column.typeId());
                    generator.writeNumberField("flags", column.flags());
                    generator.writeEndObject();
                }
                generator.writeEndArray();
                break;
            case INSERT:
                Change.Insert insert = (Change.Insert) change;
                generator.writeObjectFieldStart("Insert");
                writeTable(insert, generator);
                writeTuple("new_tuple", insert.newTuple(), generator);
                break;
            case UPDATE:
                Change.Update update = (Change.Update) change;
                generator.writeObjectFieldStart("Update");
                writeTable(update, generator);
                if (update.oldTuple().isPresent()) {
                    writeTuple("old_tuple", update.oldTuple().get(), generator);
                }
                else {
                    generator.writeNullField("old_tuple");
                }
                writeTuple("new_tuple", update.newTuple(), generator);
                break;
            case DELETE:
                Change.Delete delete = (Change.Delete) change;
                generator.writeObjectFieldStart("Delete");
                writeTable(delete, generator);
                writeTuple("old_tuple", delete.oldTuple(), generator);
                break;
            default:
                throw new IllegalStateException("Unexpected operation " + change.operation());
        }
        generator.writeEndObject();
        generator.writeEndObject();
    }

    private static void writeTable(Change.TableChange change, JsonGenerator generator) throws IOException {
        generator.writeNumberField("relation_id", change.relationId());
        generator.writeStringField("schema", change.schema());
        generator.writeStringField("table", change.table());
    }

    private static void writeTuple(String fieldName, Map<String, String> tuple, JsonGenerator generator) throws IOException {
        generator.writeObjectFieldStart(fieldName);
        for (Map.Entry<String, String> entry : tuple.entrySet()) {
            if (entry.getValue() == null) {
                generator.writeNullField(entry.getKey());
            }
            else {
                generator.writeStringField(entry.getKey(), entry.getValue());
            }
        }
        generator.writeEndObject();
    }

    private static JsonNode required(JsonNode body, String fieldName) {
        JsonNode value = body.get(fieldName);
        if (value == null || value.isNull()) {
            throw new PgRelayException("Missing '" + fieldName + "' field");
        }
        return value;
    }

    private static String text(JsonNode body, String fieldName) {
        JsonNode value = required(body, fieldName);
        if (!value.isTextual()) {
            throw new PgRelayException("The '" + fieldName + "' field must be a string");
        }
        return value.textValue();
    }

    private static long number(JsonNode body, String fieldName) {
        JsonNode value = required(body, fieldName);
        if (!value.isIntegralNumber() || !value.canConvertToLong()) {
            throw new PgRelayException("The '" + fieldName + "' field must be an integer");
        }
        return value.longValue();
    }

    private static List<Column> columns(JsonNode body) {
        JsonNode array = required(body, "columns");
        if (!array.isArray()) {
            throw new PgRelayException("The 'columns' field must be an array");
        }
        List<Column> columns = new ArrayList<>();
        for (JsonNode column : array) {
            columns.add(new Column(text(column, "name"), number(column, "type_id"), (int) number(column, "flags")));
        }
        return columns;
    }

    private static Map<String, String> tuple(JsonNode body, String fieldName) {
        JsonNode object = required(body, fieldName);
        if (!object.isObject()) {
            throw new PgRelayException("The '" + fieldName + "' field must be an object");
        }
        Map<String, String> tuple = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = object.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode value = field.getValue();
            if (value.isNull()) {
                tuple.put(field.getKey(), null);
            }
            else if (value.isTextual()) {
                tuple.put(field.getKey(), value.textValue());
            }
            else {
                throw new PgRelayException("Tuple value for column '" + field.getKey() + "' must be a string or null");
            }
        }
        return tuple;
    }
}
