/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgrelay.server;

import java.sql.SQLException;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.pgrelay.connector.postgresql.ChangeEventSourceContext;
import io.pgrelay.connector.postgresql.ReplicationStream;
import io.pgrelay.connector.postgresql.connection.PostgresConnection;
import io.pgrelay.connector.postgresql.connection.SlotStatus;
import io.pgrelay.data.Change;
import io.pgrelay.pipeline.ChangeEventDispatcher;
import io.pgrelay.util.Clock;

/**
 * Drives changes from the replication stream to the sinks until it is stopped or fails.
 * <p>
 * Each change is dispatched to every sink before the next one is read. A stop request is observed between changes and
 * while the stream waits for new changes, never in the middle of a dispatch.
 */
public class RelayEngine {

    private static final Logger LOGGER = LoggerFactory.getLogger(RelayEngine.class);

    private final PostgresConnection connection;
    private final ReplicationStream stream;
    private final ChangeEventDispatcher dispatcher;
    private final boolean createSlot;
    private final Clock clock;
    private final AtomicBoolean running = new AtomicBoolean(true);
    private final ChangeEventSourceContext context = running::get;

    private long dispatched;

    public RelayEngine(PostgresConnection connection, ReplicationStream stream, ChangeEventDispatcher dispatcher, boolean createSlot,
                       Clock clock) {
        this.connection = connection;
        this.stream = stream;
        this.dispatcher = dispatcher;
        this.createSlot = createSlot;
        this.clock = clock;
    }

    /**
     * Stream changes until {@link #stop()} is called.
     *
     * @throws SQLException if the slot could not be created or read
     * @throws InterruptedException if the thread was interrupted while waiting for the sinks
     * @throws io.pgrelay.PgRelayException if a message could not be decoded or a change could not be delivered
     */
    public void run() throws SQLException, InterruptedException {
        final long start = clock.currentTimeInMillis();
        LOGGER.info("Starting relay from slot '{}' to {} sink(s)", stream.slotName(), dispatcher.sinks().size());
        if (dispatcher.sinks().isEmpty()) {
            LOGGER.warn("No sinks configured, changes will be consumed and discarded");
        }
        try {
            if (createSlot) {
                connection.createReplicationSlot(stream.slotName());
            }
            while (running.get()) {
                final Optional<Change> next = stream.next(context);
                if (next.isEmpty()) {
                    break;
                }
                final Change change = next.get();
                dispatcher.dispatch(change);
                change.lsn().ifPresent(stream::markProcessed);
                dispatched++;
            }
        }
        finally {
            running.set(false);
            logDiagnostics(clock.currentTimeInMillis() - start);
        }
    }

    /**
     * Request the relay to stop once the current change has been dispatched.
     */
    public void stop() {
        if (running.compareAndSet(true, false)) {
            LOGGER.info("Stopping relay");
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    public long dispatchedChanges() {
        return dispatched;
    }

    private void logDiagnostics(long elapsedMillis) {
        LOGGER.info("Relay stopped after {} ms having dispatched {} change(s)", elapsedMillis, dispatched);
        LOGGER.info("Last received LSN: {}, last processed LSN: {}", stream.lastReceivedLsn().orElse("none"),
                stream.lastProcessedLsn().orElse("none"));
        try {
            final SlotStatus status = stream.status();
            LOGGER.info("Slot '{}': confirmed flush LSN {}, restart LSN {}, active {}", stream.slotName(),
                    status.confirmedFlushLsn(), status.restartLsn(), status.active());
        }
        catch (SQLException | RuntimeException e) {
            LOGGER.warn("Unable to read the status of slot '{}': {}", stream.slotName(), e.getMessage());
        }
    }
}
