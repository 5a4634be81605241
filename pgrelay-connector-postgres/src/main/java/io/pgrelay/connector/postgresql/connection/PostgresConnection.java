/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgrelay.connector.postgresql.connection;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Properties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.pgrelay.annotation.NotThreadSafe;

/**
 * A JDBC connection to the PostgreSQL server that consumes logical replication changes through the SQL function
 * interface of a replication slot.
 */
@NotThreadSafe
public class PostgresConnection implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(PostgresConnection.class);

    private static final String FETCH_CHANGES = "SELECT lsn, xid, data FROM pg_logical_slot_get_binary_changes(?, NULL, ?, "
            + "'proto_version', '1', 'publication_names', ?)";
    private static final String SLOT_STATUS = "SELECT confirmed_flush_lsn, restart_lsn, active FROM pg_replication_slots "
            + "WHERE slot_name = ?";
    private static final String CREATE_SLOT = "SELECT pg_create_logical_replication_slot(?, 'pgoutput')";

    private static final String DUPLICATE_OBJECT_SQL_STATE = "42710";

    /**
     * Establishes the physical JDBC connection.
     */
    @FunctionalInterface
    public interface ConnectionFactory {
        Connection connect(String url, Properties properties) throws SQLException;
    }

    @FunctionalInterface
    public interface StatementPreparer {
        void accept(PreparedStatement statement) throws SQLException;
    }

    @FunctionalInterface
    public interface ResultSetMapper<T> {
        T apply(ResultSet rs) throws SQLException;
    }

    private final ConnectionString connectionString;
    private final ConnectionFactory factory;
    private Connection conn;

    public PostgresConnection(ConnectionString connectionString) {
        this(connectionString, DriverManager::getConnection);
    }

    public PostgresConnection(ConnectionString connectionString, ConnectionFactory factory) {
        this.connectionString = connectionString;
        this.factory = factory;
    }

    /**
     * Obtain the underlying connection, opening it if needed.
     *
     * @return the open connection; never null
     * @throws SQLException if the connection cannot be established
     */
    public synchronized Connection connection() throws SQLException {
        if (conn == null || conn.isClosed()) {
            LOGGER.debug("Connecting to {}", connectionString);
            conn = factory.connect(connectionString.url(), connectionString.properties());
            if (conn == null) {
                throw new SQLException("Unable to obtain a JDBC connection");
            }
            conn.setAutoCommit(true);
        }
        return conn;
    }

    /**
     * Consume the pending changes of a slot. Every returned row is consumed from the slot.
     *
     * @param slotName the logical replication slot
     * @param publicationName the publication whose tables are decoded
     * @param maxChanges the maximum number of changes to fetch, or 0 for no limit
     * @return the rows in server order; never null but possibly empty
     * @throws SQLException if the query fails
     */
    public List<ReplicationRow> fetchBinaryChanges(String slotName, String publicationName, int maxChanges) throws SQLException {
        return prepareQueryAndMap(FETCH_CHANGES, statement -> {
            statement.setString(1, slotName);
            if (maxChanges > 0) {
                statement.setInt(2, maxChanges);
            }
            else {
                statement.setNull(2, Types.INTEGER);
            }
            statement.setString(3, publicationName);
        }, rs -> {
            final List<ReplicationRow> rows = new ArrayList<>();
            while (rs.next()) {
                final String lsn = rs.getString(1);
                final long xid = rs.getLong(2);
                final boolean xidIsNull = rs.wasNull();
                final byte[] data = rs.getBytes(3);
                rows.add(new ReplicationRow(lsn, xidIsNull ? -1L : xid, data != null ? data : new byte[0]));
            }
            return rows;
        });
    }

    /**
     * Read the state of a replication slot.
     *
     * @param slotName the slot
     * @return the state, or empty if there is no such slot
     * @throws SQLException if the query fails
     */
    public Optional<SlotStatus> slotStatus(String slotName) throws SQLException {
        return prepareQueryAndMap(SLOT_STATUS, statement -> statement.setString(1, slotName), rs -> {
            if (rs.next()) {
                return Optional.of(new SlotStatus(rs.getString(1), rs.getString(2), rs.getBoolean(3)));
            }
            return Optional.empty();
        });
    }

    /**
     * Create a logical replication slot using the {@code pgoutput} plugin. A slot that already exists is left as is.
     *
     * @param slotName the slot
     * @return {@code true} if the slot was created, {@code false} if it already existed
     * @throws SQLException if the slot cannot be created for another reason
     */
    public boolean createReplicationSlot(String slotName) throws SQLException {
        try {
            prepareQueryAndMap(CREATE_SLOT, statement -> statement.setString(1, slotName), ResultSet::next);
            LOGGER.info("Created replication slot '{}'", slotName);
            return true;
        }
        catch (SQLException e) {
            if (isDuplicateObject(e)) {
                LOGGER.info("Replication slot '{}' already exists", slotName);
                return false;
            }
            throw e;
        }
    }

    private static boolean isDuplicateObject(SQLException e) {
        return DUPLICATE_OBJECT_SQL_STATE.equals(e.getSQLState())
                || (e.getMessage() != null && e.getMessage().contains("already exists"));
    }

    /**
     * Execute a SQL prepared query and map its results.
     *
     * @param preparedQueryString the prepared query string
     * @param preparer the function that assigns values to the prepared statement
     * @param mapper the function processing the query results
     * @return the result of the mapper calculation
     * @throws SQLException if there is an error connecting to the database or executing the statements
     */
    public <T> T prepareQueryAndMap(String preparedQueryString, StatementPreparer preparer, ResultSetMapper<T> mapper)
            throws SQLException {
        try (PreparedStatement statement = connection().prepareStatement(preparedQueryString)) {
            preparer.accept(statement);
            try (ResultSet resultSet = statement.executeQuery()) {
                return mapper.apply(resultSet);
            }
        }
    }

    public synchronized boolean isConnected() throws SQLException {
        return conn != null && !conn.isClosed();
    }

    @Override
    public synchronized void close() throws SQLException {
        if (conn != null) {
            try {
                LOGGER.trace("Closing database connection");
                conn.close();
            }
            finally {
                conn = null;
            }
        }
    }
}
