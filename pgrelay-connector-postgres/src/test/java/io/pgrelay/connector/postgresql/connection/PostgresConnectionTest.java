/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgrelay.connector.postgresql.connection;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.util.List;

import org.junit.Before;
import org.junit.Test;

public class PostgresConnectionTest {

    private Connection jdbc;
    private PreparedStatement statement;
    private ResultSet resultSet;
    private PostgresConnection connection;

    @Before
    public void beforeEach() throws SQLException {
        jdbc = mock(Connection.class);
        statement = mock(PreparedStatement.class);
        resultSet = mock(ResultSet.class);
        when(jdbc.prepareStatement(anyString())).thenReturn(statement);
        when(statement.executeQuery()).thenReturn(resultSet);
        connection = new PostgresConnection(ConnectionString.parse("host=localhost dbname=test"), (url, props) -> jdbc);
    }

    @Test
    public void shouldFetchRowsWithUnlimitedBatch() throws SQLException {
        when(resultSet.next()).thenReturn(true, true, false);
        when(resultSet.getString(1)).thenReturn("0/16B3748", "0/16B3750");
        when(resultSet.getLong(2)).thenReturn(750L, 750L);
        when(resultSet.getBytes(3)).thenReturn(new byte[]{ 'B' }, new byte[]{ 'C' });

        List<ReplicationRow> rows = connection.fetchBinaryChanges("slot", "pub", 0);

        assertThat(rows).extracting(ReplicationRow::lsn).containsExactly("0/16B3748", "0/16B3750");
        assertThat(rows.get(0).xid()).isEqualTo(750L);
        verify(jdbc).prepareStatement(eq("SELECT lsn, xid, data FROM pg_logical_slot_get_binary_changes(?, NULL, ?, "
                + "'proto_version', '1', 'publication_names', ?)"));
        verify(statement).setString(1, "slot");
        verify(statement).setNull(2, Types.INTEGER);
        verify(statement).setString(3, "pub");
        verify(statement).close();
    }

    @Test
    public void shouldBindBatchLimit() throws SQLException {
        when(resultSet.next()).thenReturn(false);

        assertThat(connection.fetchBinaryChanges("slot", "pub", 500)).isEmpty();
        verify(statement).setInt(2, 500);
        verify(statement, never()).setNull(2, Types.INTEGER);
    }

    @Test
    public void shouldReadSlotStatus() throws SQLException {
        when(resultSet.next()).thenReturn(true);
        when(resultSet.getString(1)).thenReturn("0/16B3750");
        when(resultSet.getString(2)).thenReturn("0/16B3700");
        when(resultSet.getBoolean(3)).thenReturn(true);

        assertThat(connection.slotStatus("slot")).hasValue(new SlotStatus("0/16B3750", "0/16B3700", true));
    }

    @Test
    public void shouldReturnEmptyStatusForMissingSlot() throws SQLException {
        when(resultSet.next()).thenReturn(false);
        assertThat(connection.slotStatus("missing")).isEmpty();
    }

    @Test
    public void shouldCreateSlot() throws SQLException {
        when(resultSet.next()).thenReturn(true);
        assertThat(connection.createReplicationSlot("slot")).isTrue();
        verify(jdbc).prepareStatement("SELECT pg_create_logical_replication_slot(?, 'pgoutput')");
    }

    @Test
    public void shouldTolerateExistingSlot() throws SQLException {
        when(statement.executeQuery()).thenThrow(new SQLException("replication slot \"slot\" already exists", "42710"));
        assertThat(connection.createReplicationSlot("slot")).isFalse();
    }

    @Test
    public void shouldPropagateOtherSlotCreationFailures() throws SQLException {
        when(statement.executeQuery()).thenThrow(new SQLException("permission denied", "42501"));
        assertThatThrownBy(() -> connection.createReplicationSlot("slot")).isInstanceOf(SQLException.class);
    }

    @Test
    public void shouldCloseUnderlyingConnection() throws SQLException {
        when(resultSet.next()).thenReturn(false);
        connection.fetchBinaryChanges("slot", "pub", 0);
        assertThat(connection.isConnected()).isTrue();

        connection.close();

        verify(jdbc).close();
        assertThat(connection.isConnected()).isFalse();
    }
}
