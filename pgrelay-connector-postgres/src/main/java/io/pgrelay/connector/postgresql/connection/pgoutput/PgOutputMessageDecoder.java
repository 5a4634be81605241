/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgrelay.connector.postgresql.connection.pgoutput;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.pgrelay.connector.postgresql.connection.Lsn;
import io.pgrelay.connector.postgresql.connection.MessageDecodingException;
import io.pgrelay.connector.postgresql.connection.RelationCatalog;
import io.pgrelay.connector.postgresql.connection.RelationDefinition;
import io.pgrelay.data.Change;
import io.pgrelay.data.Column;

/**
 * Decodes messages of the {@code pgoutput} plugin, protocol version 1.
 * <p>
 * Row changes are resolved against the {@link RelationCatalog}, which is updated by every {@code Relation} message.
 * A message that fails to decode leaves the catalog untouched.
 */
public class PgOutputMessageDecoder {

    private static final Logger LOGGER = LoggerFactory.getLogger(PgOutputMessageDecoder.class);

    private static final int BEGIN_LENGTH = 8 + 8 + 4;
    private static final int COMMIT_LENGTH = 1 + 8 + 8 + 8;

    private static final char NEW_TUPLE = 'N';
    private static final char KEY_TUPLE = 'K';
    private static final char OLD_TUPLE = 'O';

    private static final char NULL_VALUE = 'n';
    private static final char UNCHANGED_TOAST_VALUE = 'u';
    private static final char TEXT_VALUE = 't';

    private final RelationCatalog catalog;

    public PgOutputMessageDecoder(RelationCatalog catalog) {
        this.catalog = catalog;
    }

    public Optional<Change> decode(byte[] message) {
        return decode(ByteBuffer.wrap(message));
    }

    /**
     * Decode a single message.
     *
     * @param buffer the message, positioned at its type byte
     * @return the decoded change, or empty for empty input and for message types that are not relayed
     * @throws MessageDecodingException if the message is truncated or malformed, or refers to an unknown relation
     */
    public Optional<Change> decode(ByteBuffer buffer) {
        if (!buffer.hasRemaining()) {
            return Optional.empty();
        }
        final char tag = (char) Byte.toUnsignedInt(buffer.get());
        final MessageType type = MessageType.forType(tag);
        if (type == null) {
            LOGGER.warn("Unknown pgoutput message type '{}' (0x{}), skipping", tag, Integer.toHexString(tag));
            return Optional.empty();
        }
        switch (type) {
            case BEGIN:
                return Optional.of(decodeBegin(buffer));
            case COMMIT:
                return Optional.of(decodeCommit(buffer));
            case RELATION:
                return Optional.of(decodeRelation(buffer));
            case INSERT:
                return Optional.of(decodeInsert(buffer));
            case UPDATE:
                return Optional.of(decodeUpdate(buffer));
            case DELETE:
                return Optional.of(decodeDelete(buffer));
            default:
                LOGGER.trace("Message type {} is not relayed", type);
                return Optional.empty();
        }
    }

    private Change decodeBegin(ByteBuffer buffer) {
        requireRemaining(buffer, BEGIN_LENGTH, "BEGIN message");
        final Lsn lsn = Lsn.valueOf(buffer.getLong());
        final long timestamp = buffer.getLong();
        final long xid = Integer.toUnsignedLong(buffer.getInt());
        return new Change.Begin(lsn.asString(), timestamp, xid);
    }

    private Change decodeCommit(ByteBuffer buffer) {
        requireRemaining(buffer, COMMIT_LENGTH, "COMMIT message");
        buffer.get();
        final Lsn lsn = Lsn.valueOf(buffer.getLong());
        buffer.getLong();
        final long timestamp = buffer.getLong();
        return new Change.Commit(lsn.asString(), timestamp);
    }

    private Change decodeRelation(ByteBuffer buffer) {
        final long relationId = readRelationId(buffer);
        final String schema = readString(buffer);
        final String table = readString(buffer);
        requireRemaining(buffer, 1 + 2, "RELATION header");
        buffer.get();
        final int columnCount = Short.toUnsignedInt(buffer.getShort());
        final List<Column> columns = new ArrayList<>(columnCount);
        for (int i = 0; i < columnCount; i++) {
            requireRemaining(buffer, 1, "column flags");
            final int flags = Byte.toUnsignedInt(buffer.get());
            final String name = readString(buffer);
            requireRemaining(buffer, 4 + 4, "column type");
            final long typeId = Integer.toUnsignedLong(buffer.getInt());
            buffer.getInt();
            columns.add(new Column(name, typeId, flags));
        }
        catalog.put(relationId, schema, table, columns);
        LOGGER.debug("Relation {}.{} ({}) registered with {} columns", schema, table, relationId, columnCount);
        return new Change.Relation(relationId, schema, table, columns);
    }

    private Change decodeInsert(ByteBuffer buffer) {
        final long relationId = readRelationId(buffer);
        final RelationDefinition relation = resolve(relationId);
        final char marker = readMarker(buffer);
        if (marker != NEW_TUPLE) {
            throw new MessageDecodingException("Expected new tuple marker 'N' in INSERT but got '" + marker + "'");
        }
        return new Change.Insert(relationId, relation.schema(), relation.table(), readTuple(buffer, relation));
    }

    private Change decodeUpdate(ByteBuffer buffer) {
        final long relationId = readRelationId(buffer);
        final RelationDefinition relation = resolve(relationId);
        Map<String, String> oldTuple = null;
        char marker = readMarker(buffer);
        if (marker == KEY_TUPLE || marker == OLD_TUPLE) {
            oldTuple = readTuple(buffer, relation);
            marker = readMarker(buffer);
            if (marker != NEW_TUPLE) {
                throw new MessageDecodingException("Expected new tuple marker 'N' in UPDATE but got '" + marker + "'");
            }
        }
        else if (marker != NEW_TUPLE) {
            throw new MessageDecodingException("Unexpected tuple marker '" + marker + "' in UPDATE");
        }
        final Map<String, String> newTuple = readTuple(buffer, relation);
        return new Change.Update(relationId, relation.schema(), relation.table(), oldTuple, newTuple);
    }

    private Change decodeDelete(ByteBuffer buffer) {
        final long relationId = readRelationId(buffer);
        final RelationDefinition relation = resolve(relationId);
        final char marker = readMarker(buffer);
        if (marker != KEY_TUPLE && marker != OLD_TUPLE) {
            throw new MessageDecodingException("Expected key or old tuple marker in DELETE but got '" + marker + "'");
        }
        return new Change.Delete(relationId, relation.schema(), relation.table(), readTuple(buffer, relation));
    }

    private RelationDefinition resolve(long relationId) {
        return catalog.get(relationId)
                .orElseThrow(() -> new MessageDecodingException("Unknown relation id " + relationId));
    }

    private Map<String, String> readTuple(ByteBuffer buffer, RelationDefinition relation) {
        requireRemaining(buffer, 2, "tuple column count");
        final int columnCount = Short.toUnsignedInt(buffer.getShort());
        final Map<String, String> tuple = new LinkedHashMap<>();
        for (int i = 0; i < columnCount; i++) {
            final String name = relation.columnName(i);
            final char kind = readMarker(buffer);
            switch (kind) {
                case NULL_VALUE:
                case UNCHANGED_TOAST_VALUE:
                    tuple.put(name, null);
                    break;
                case TEXT_VALUE:
                    requireRemaining(buffer, 4, "column value length");
                    final long length = Integer.toUnsignedLong(buffer.getInt());
                    requireRemaining(buffer, length, "column value");
                    final byte[] value = new byte[(int) length];
                    buffer.get(value);
                    tuple.put(name, new String(value, StandardCharsets.UTF_8));
                    break;
                default:
                    throw new MessageDecodingException("Unknown value kind '" + kind + "' for column " + name + " of "
                            + relation.schema() + "." + relation.table());
            }
        }
        return tuple;
    }

    private static long readRelationId(ByteBuffer buffer) {
        requireRemaining(buffer, 4, "relation id");
        return Integer.toUnsignedLong(buffer.getInt());
    }

    private static char readMarker(ByteBuffer buffer) {
        requireRemaining(buffer, 1, "tuple marker");
        return (char) Byte.toUnsignedInt(buffer.get());
    }

    /**
     * Reads a NUL-terminated string. A missing terminator ends the string at the end of the buffer.
     */
    private static String readString(ByteBuffer buffer) {
        final int start = buffer.position();
        int end = start;
        while (end < buffer.limit() && buffer.get(end) != 0) {
            end++;
        }
        final byte[] bytes = new byte[end - start];
        buffer.get(bytes);
        if (buffer.hasRemaining()) {
            buffer.get();
        }
        return new String(bytes, StandardCharsets.UTF_8);
    }

    private static void requireRemaining(ByteBuffer buffer, long required, String what) {
        if (buffer.remaining() < required) {
            throw new MessageDecodingException(String.format("Truncated %s: %d byte(s) required but only %d remaining",
                    what, required, buffer.remaining()));
        }
    }
}
