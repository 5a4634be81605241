/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgrelay.connector.postgresql.connection;

import java.util.Objects;

/**
 * One row returned by {@code pg_logical_slot_get_binary_changes}.
 *
 * @param lsn the textual LSN of the message
 * @param xid the transaction id, or -1 when the server returned NULL
 * @param data the raw pgoutput message
 */
public record ReplicationRow(String lsn, long xid, byte[] data) {

    public ReplicationRow {
        Objects.requireNonNull(lsn, "lsn");
        Objects.requireNonNull(data, "data");
    }
}
