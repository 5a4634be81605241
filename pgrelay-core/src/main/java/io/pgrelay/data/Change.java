/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgrelay.data;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import io.pgrelay.annotation.Immutable;

/**
 * A single decoded logical replication event. The set of variants is closed: transaction markers ({@link Begin},
 * {@link Commit}), schema announcements ({@link Relation}) and row changes ({@link Insert}, {@link Update},
 * {@link Delete}).
 * <p>
 * Row values are carried as text, the way the server sends them. A tuple maps column names to values in column order,
 * where a {@code null} value stands for SQL {@code NULL}.
 */
@Immutable
public abstract class Change {

    /**
     * The kind of a change.
     */
    public enum Operation {
        BEGIN("begin"),
        COMMIT("commit"),
        RELATION("relation"),
        INSERT("insert"),
        UPDATE("update"),
        DELETE("delete");

        private final String code;

        Operation(String code) {
            this.code = code;
        }

        /**
         * The lower-case name used in subjects and row payloads.
         */
        public String code() {
            return code;
        }
    }

    private Change() {
    }

    public abstract Operation operation();

    /**
     * Get the log sequence number carried by this change.
     *
     * @return the textual LSN for transaction markers, or empty for every other change
     */
    public Optional<String> lsn() {
        return Optional.empty();
    }

    /**
     * Whether this change marks a transaction boundary.
     */
    public boolean isTransactional() {
        return false;
    }

    static Map<String, String> copyOf(Map<String, String> tuple) {
        Objects.requireNonNull(tuple, "tuple");
        return Collections.unmodifiableMap(new LinkedHashMap<>(tuple));
    }

    /**
     * Start of a transaction.
     */
    public static final class Begin extends Change {
        private final String lsn;
        private final long timestamp;
        private final long xid;

        public Begin(String lsn, long timestamp, long xid) {
            this.lsn = Objects.requireNonNull(lsn, "lsn");
            this.timestamp = timestamp;
            this.xid = xid;
        }

        @Override
        public Operation operation() {
            return Operation.BEGIN;
        }

        @Override
        public Optional<String> lsn() {
            return Optional.of(lsn);
        }

        @Override
        public boolean isTransactional() {
            return true;
        }

        /**
         * The commit timestamp in microseconds since 2000-01-01, as sent by the server.
         */
        public long timestamp() {
            return timestamp;
        }

        public long xid() {
            return xid;
        }

        @Override
        public boolean equals(Object obj) {
            if (this == obj) {
                return true;
            }
            if (!(obj instanceof Begin)) {
                return false;
            }
            Begin that = (Begin) obj;
            return timestamp == that.timestamp && xid == that.xid && lsn.equals(that.lsn);
        }

        @Override
        public int hashCode() {
            return Objects.hash(lsn, timestamp, xid);
        }

        @Override
        public String toString() {
            return "Begin{lsn=" + lsn + ", timestamp=" + timestamp + ", xid=" + xid + "}";
        }
    }

    /**
     * End of a transaction.
     */
    public static final class Commit extends Change {
        private final String lsn;
        private final long timestamp;

        public Commit(String lsn, long timestamp) {
            this.lsn = Objects.requireNonNull(lsn, "lsn");
            this.timestamp = timestamp;
        }

        @Override
        public Operation operation() {
            return Operation.COMMIT;
        }

        @Override
        public Optional<String> lsn() {
            return Optional.of(lsn);
        }

        @Override
        public boolean isTransactional() {
            return true;
        }

        public long timestamp() {
            return timestamp;
        }

        @Override
        public boolean equals(Object obj) {
            if (this == obj) {
                return true;
            }
            if (!(obj instanceof Commit)) {
                return false;
            }
            Commit that = (Commit) obj;
            return timestamp == that.timestamp && lsn.equals(that.lsn);
        }

        @Override
        public int hashCode() {
            return Objects.hash(lsn, timestamp);
        }

        @Override
        public String toString() {
            return "Commit{lsn=" + lsn + ", timestamp=" + timestamp + "}";
        }
    }

    /**
     * Base class for changes that are scoped to a single table.
     */
    public abstract static class TableChange extends Change {
        private final long relationId;
        private final String schema;
        private final String table;

        private TableChange(long relationId, String schema, String table) {
            this.relationId = relationId;
            this.schema = Objects.requireNonNull(schema, "schema");
            this.table = Objects.requireNonNull(table, "table");
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

        /**
         * @return the {@code schema.table} name
         */
        public String qualifiedName() {
            return schema + "." + table;
        }

        boolean sameTable(TableChange that) {
            return relationId == that.relationId && schema.equals(that.schema) && table.equals(that.table);
        }
    }

    /**
     * Announcement of a table's structure, sent before the first row change of that table in a session.
     */
    public static final class Relation extends TableChange {
        private final List<Column> columns;

        public Relation(long relationId, String schema, String table, List<Column> columns) {
            super(relationId, schema, table);
            this.columns = List.copyOf(columns);
        }

        @Override
        public Operation operation() {
            return Operation.RELATION;
        }

        public List<Column> columns() {
            return columns;
        }

        @Override
        public boolean equals(Object obj) {
            if (this == obj) {
                return true;
            }
            if (!(obj instanceof Relation)) {
                return false;
            }
            Relation that = (Relation) obj;
            return sameTable(that) && columns.equals(that.columns);
        }

        @Override
        public int hashCode() {
            return Objects.hash(relationId(), schema(), table(), columns);
        }

        @Override
        public String toString() {
            return "Relation{" + qualifiedName() + " (" + relationId() + "), columns=" + columns + "}";
        }
    }

    public static final class Insert extends TableChange {
        private final Map<String, String> newTuple;

        public Insert(long relationId, String schema, String table, Map<String, String> newTuple) {
            super(relationId, schema, table);
            this.newTuple = copyOf(newTuple);
        }

        @Override
        public Operation operation() {
            return Operation.INSERT;
        }

        public Map<String, String> newTuple() {
            return newTuple;
        }

        @Override
        public boolean equals(Object obj) {
            if (this == obj) {
                return true;
            }
            if (!(obj instanceof Insert)) {
                return false;
            }
            Insert that = (Insert) obj;
            return sameTable(that) && newTuple.equals(that.newTuple);
        }

        @Override
        public int hashCode() {
            return Objects.hash(relationId(), schema(), table(), newTuple);
        }

        @Override
        public String toString() {
            return "Insert{" + qualifiedName() + " (" + relationId() + "), new=" + newTuple + "}";
        }
    }

    /**
     * A row update. The old tuple is only present when the replica identity provides one.
     */
    public static final class Update extends TableChange {
        private final Map<String, String> oldTuple;
        private final Map<String, String> newTuple;

        public Update(long relationId, String schema, String table, Map<String, String> oldTuple, Map<String, String> newTuple) {
            super(relationId, schema, table);
            this.oldTuple = oldTuple != null ? copyOf(oldTuple) : null;
            this.newTuple = copyOf(newTuple);
        }

        @Override
        public Operation operation() {
            return Operation.UPDATE;
        }

        public Optional<Map<String, String>> oldTuple() {
            return Optional.ofNullable(oldTuple);
        }

        public Map<String, String> newTuple() {
            return newTuple;
        }

        @Override
        public boolean equals(Object obj) {
            if (this == obj) {
                return true;
            }
            if (!(obj instanceof Update)) {
                return false;
            }
            Update that = (Update) obj;
            return sameTable(that) && Objects.equals(oldTuple, that.oldTuple) && newTuple.equals(that.newTuple);
        }

        @Override
        public int hashCode() {
            return Objects.hash(relationId(), schema(), table(), oldTuple, newTuple);
        }

        @Override
        public String toString() {
            return "Update{" + qualifiedName() + " (" + relationId() + "), old=" + oldTuple + ", new=" + newTuple + "}";
        }
    }

    public static final class Delete extends TableChange {
        private final Map<String, String> oldTuple;

        public Delete(long relationId, String schema, String table, Map<String, String> oldTuple) {
            super(relationId, schema, table);
            this.oldTuple = copyOf(oldTuple);
        }

        @Override
        public Operation operation() {
            return Operation.DELETE;
        }

        public Map<String, String> oldTuple() {
            return oldTuple;
        }

        @Override
        public boolean equals(Object obj) {
            if (this == obj) {
                return true;
            }
            if (!(obj instanceof Delete)) {
                return false;
            }
            Delete that = (Delete) obj;
            return sameTable(that) && oldTuple.equals(that.oldTuple);
        }

        @Override
        public int hashCode() {
            return Objects.hash(relationId(), schema(), table(), oldTuple);
        }

        @Override
        public String toString() {
            return "Delete{" + qualifiedName() + " (" + relationId() + "), old=" + oldTuple + "}";
        }
    }
}
