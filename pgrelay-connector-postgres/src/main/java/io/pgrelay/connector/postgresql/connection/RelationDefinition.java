/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgrelay.connector.postgresql.connection;

import java.util.List;
import java.util.Objects;

import io.pgrelay.annotation.Immutable;
import io.pgrelay.data.Column;

/**
 * The structure of a table as last announced by the server.
 */
@Immutable
public final class RelationDefinition {

    private final long relationId;
    private final String schema;
    private final String table;
    private final List<Column> columns;

    public RelationDefinition(long relationId, String schema, String table, List<Column> columns) {
        this.relationId = relationId;
        this.schema = Objects.requireNonNull(schema, "schema");
        this.table = Objects.requireNonNull(table, "table");
        this.columns = List.copyOf(columns);
    }

    public long relationId() {
        return relationId;
    }

    public String schema() {
        return schema;
    }

    public String table() {
        return table;
    }

    public List<Column> columns() {
        return columns;
    }

    /**
     * Get the name of the column at the given position. Positions beyond the known columns get a synthetic
     * {@code column_<index>} name, so that rows sent after an unseen schema change still decode.
     *
     * @param index the zero-based column position
     * @return the column name; never null
     */
    public String columnName(int index) {
        return index < columns.size() ? columns.get(index).name() : "column_" + index;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof RelationDefinition)) {
            return false;
        }
        RelationDefinition that = (RelationDefinition) obj;
        return relationId == that.relationId && schema.equals(that.schema) && table.equals(that.table)
                && columns.equals(that.columns);
    }

    @Override
    public int hashCode() {
        return Objects.hash(relationId, schema, table, columns);
    }

    @Override
    public String toString() {
        return schema + "." + table + " (" + relationId + ") " + columns;
    }
}
