/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgrelay.connector.postgresql;

import java.sql.SQLException;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.pgrelay.PgRelayException;
import io.pgrelay.annotation.NotThreadSafe;
import io.pgrelay.connector.postgresql.connection.Lsn;
import io.pgrelay.connector.postgresql.connection.MessageDecodingException;
import io.pgrelay.connector.postgresql.connection.PostgresConnection;
import io.pgrelay.connector.postgresql.connection.RelationCatalog;
import io.pgrelay.connector.postgresql.connection.ReplicationRow;
import io.pgrelay.connector.postgresql.connection.SlotStatus;
import io.pgrelay.connector.postgresql.connection.pgoutput.PgOutputMessageDecoder;
import io.pgrelay.data.Change;
import io.pgrelay.util.DelayStrategy;

/**
 * Turns repeated {@code pg_logical_slot_get_binary_changes} calls into a continuous feed of decoded changes.
 * <p>
 * Changes are handed out one at a time in the order the server returned them. When the slot has nothing pending,
 * the stream waits for the poll interval and asks again.
 */
@NotThreadSafe
public class ReplicationStream implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(ReplicationStream.class);

    private final PostgresConnection connection;
    private final PgOutputMessageDecoder decoder;
    private final String slotName;
    private final String publicationName;
    private final int maxBatchSize;
    private final DelayStrategy pauseNoMessage;
    private final Deque<Change> pending = new ArrayDeque<>();

    private String lastReceivedLsn;
    private Lsn lastProcessedLsn;

    public ReplicationStream(PostgresConnection connection, PostgresConnectorConfig config) {
        this(connection, new PgOutputMessageDecoder(new RelationCatalog()), config.slotName(), config.publicationName(),
                config.maxBatchSize(), DelayStrategy.constant(config.pollInterval()));
    }

    public ReplicationStream(PostgresConnection connection, PgOutputMessageDecoder decoder, String slotName,
                             String publicationName, int maxBatchSize, DelayStrategy pauseNoMessage) {
        this.connection = connection;
        this.decoder = decoder;
        this.slotName = slotName;
        this.publicationName = publicationName;
        this.maxBatchSize = maxBatchSize;
        this.pauseNoMessage = pauseNoMessage;
    }

    /**
     * Get the next change, fetching and decoding a new batch from the slot when nothing is buffered.
     *
     * @param context tells whether the stream should keep waiting for changes; may not be null
     * @return the next change, or empty if the context stopped running before a change arrived
     * @throws SQLException if fetching from the slot failed
     * @throws MessageDecodingException if a message of the fetched batch could not be decoded
     */
    public Optional<Change> next(ChangeEventSourceContext context) throws SQLException {
        if (!pending.isEmpty()) {
            return Optional.of(pending.poll());
        }
        while (context.isRunning()) {
            final List<ReplicationRow> rows = connection.fetchBinaryChanges(slotName, publicationName, maxBatchSize);
            if (rows.isEmpty()) {
                pauseNoMessage.sleepWhen(true);
                continue;
            }
            LOGGER.trace("Fetched {} message(s) from slot '{}'", rows.size(), slotName);
            for (ReplicationRow row : rows) {
                try {
                    decoder.decode(row.data()).ifPresent(pending::add);
                }
                catch (MessageDecodingException e) {
                    pending.clear();
                    throw new MessageDecodingException("Failed to decode message at LSN " + row.lsn() + ": " + e.getMessage(), e);
                }
                lastReceivedLsn = row.lsn();
            }
            if (!pending.isEmpty()) {
                return Optional.of(pending.poll());
            }
        }
        return Optional.empty();
    }

    /**
     * Record that all changes up to the given position have been dispatched. The processed position only moves forward;
     * an earlier or invalid position is ignored.
     *
     * @param lsn the position of the last dispatched change, in {@code X/X} form
     * @throws IllegalArgumentException if the position cannot be parsed
     */
    public void markProcessed(String lsn) {
        final Lsn position = Lsn.valueOf(lsn);
        if (position.isValid() && (lastProcessedLsn == null || position.compareTo(lastProcessedLsn) > 0)) {
            lastProcessedLsn = position;
        }
    }

    public Optional<String> lastReceivedLsn() {
        return Optional.ofNullable(lastReceivedLsn);
    }

    public Optional<String> lastProcessedLsn() {
        return Optional.ofNullable(lastProcessedLsn).map(Lsn::asString);
    }

    /**
     * Read the current state of the slot.
     *
     * @return the slot status; never null
     * @throws SQLException if the query failed
     * @throws PgRelayException if the slot does not exist
     */
    public SlotStatus status() throws SQLException {
        return connection.slotStatus(slotName)
                .orElseThrow(() -> new PgRelayException("Replication slot '" + slotName + "' not found"));
    }

    public String slotName() {
        return slotName;
    }

    @Override
    public void close() throws SQLException {
        pending.clear();
        connection.close();
    }
}
