/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgrelay.connector.postgresql.connection;

/**
 * The state of a replication slot as reported by {@code pg_replication_slots}.
 *
 * @param confirmedFlushLsn the position up to which the consumer has confirmed receipt; may be null
 * @param restartLsn the oldest position still required by the slot; may be null
 * @param active whether a session is currently using the slot
 */
public record SlotStatus(String confirmedFlushLsn, String restartLsn, boolean active) {
}
