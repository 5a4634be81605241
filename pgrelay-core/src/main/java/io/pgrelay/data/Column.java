/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgrelay.data;

import java.util.Objects;

import io.pgrelay.annotation.Immutable;

/**
 * A column of a relation as announced by a {@code Relation} message.
 */
@Immutable
public final class Column {

    private final String name;
    private final long typeId;
    private final int flags;

    /**
     * @param name the column name; may not be null
     * @param typeId the OID of the column's data type, an unsigned 32-bit value
     * @param flags the column flags, an unsigned byte where bit 1 marks a key column
     */
    public Column(String name, long typeId, int flags) {
        this.name = Objects.requireNonNull(name, "name");
        this.typeId = typeId;
        this.flags = flags;
    }

    public String name() {
        return name;
    }

    public long typeId() {
        return typeId;
    }

    public int flags() {
        return flags;
    }

    /**
     * Whether the column is part of the relation's replica identity key.
     */
    public boolean isKey() {
        return (flags & 0x01) != 0;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof Column)) {
            return false;
        }
        Column that = (Column) obj;
        return typeId == that.typeId && flags == that.flags && name.equals(that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, typeId, flags);
    }

    @Override
    public String toString() {
        return name + " (type_id: " + typeId + ", flags: " + flags + ")";
    }
}
