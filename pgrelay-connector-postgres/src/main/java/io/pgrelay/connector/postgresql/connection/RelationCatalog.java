/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgrelay.connector.postgresql.connection;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import io.pgrelay.annotation.ThreadSafe;
import io.pgrelay.data.Column;
import io.pgrelay.util.FunctionalReadWriteLock;

/**
 * The relations announced by the server during the current session, keyed by relation id.
 * <p>
 * Entries are immutable {@link RelationDefinition}s replaced as a whole, so readers observe either the previous or the
 * new definition of a relation. Entries are never evicted.
 */
@ThreadSafe
public class RelationCatalog {

    private final FunctionalReadWriteLock lock = FunctionalReadWriteLock.reentrant();
    private final Map<Long, RelationDefinition> relations = new HashMap<>();

    /**
     * Add or replace the definition of a relation.
     *
     * @param relationId the relation OID
     * @param schema the schema name; may not be null
     * @param table the table name; may not be null
     * @param columns the columns in their ordinal order; may not be null
     * @return the stored definition; never null
     */
    public RelationDefinition put(long relationId, String schema, String table, List<Column> columns) {
        final RelationDefinition definition = new RelationDefinition(relationId, schema, table, columns);
        lock.write(() -> relations.put(relationId, definition));
        return definition;
    }

    public Optional<RelationDefinition> get(long relationId) {
        return lock.read(() -> Optional.ofNullable(relations.get(relationId)));
    }

    public int size() {
        return lock.read(relations::size);
    }
}
