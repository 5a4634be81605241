/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgrelay.server;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.sql.SQLException;
import java.util.Collections;
import java.util.Optional;

import org.junit.Before;
import org.junit.Test;
import org.mockito.InOrder;

import io.pgrelay.connector.postgresql.ChangeEventSourceContext;
import io.pgrelay.connector.postgresql.ReplicationStream;
import io.pgrelay.connector.postgresql.connection.PostgresConnection;
import io.pgrelay.connector.postgresql.connection.SlotStatus;
import io.pgrelay.data.Change;
import io.pgrelay.data.ChangeFixtures;
import io.pgrelay.pipeline.ChangeEventDispatcher;
import io.pgrelay.pipeline.DispatchException;
import io.pgrelay.util.MockClock;

public class RelayEngineTest {

    private PostgresConnection connection;
    private ReplicationStream stream;
    private ChangeEventDispatcher dispatcher;
    private RelayEngine engine;

    @Before
    public void beforeEach() throws Exception {
        connection = mock(PostgresConnection.class);
        stream = mock(ReplicationStream.class);
        dispatcher = mock(ChangeEventDispatcher.class);
        when(stream.slotName()).thenReturn("relay_slot");
        when(stream.lastReceivedLsn()).thenReturn(Optional.empty());
        when(stream.lastProcessedLsn()).thenReturn(Optional.empty());
        when(stream.status()).thenReturn(new SlotStatus("0/1234600", "0/1234500", false));
        when(dispatcher.sinks()).thenReturn(Collections.emptyList());
        engine = new RelayEngine(connection, stream, dispatcher, false, new MockClock(1000));
    }

    @Test
    public void shouldDispatchChangesInOrderAndRecordPositions() throws Exception {
        Change begin = ChangeFixtures.begin();
        Change insert = ChangeFixtures.insertAlice();
        Change commit = ChangeFixtures.commit();
        when(stream.next(any(ChangeEventSourceContext.class)))
                .thenReturn(Optional.of(begin), Optional.of(insert), Optional.of(commit))
                .thenAnswer(invocation -> {
                    engine.stop();
                    return Optional.empty();
                });

        engine.run();

        InOrder order = inOrder(dispatcher, stream);
        order.verify(dispatcher).dispatch(begin);
        order.verify(stream).markProcessed("0/1234567");
        order.verify(dispatcher).dispatch(insert);
        order.verify(dispatcher).dispatch(commit);
        order.verify(stream).markProcessed("0/1234600");
        assertThat(engine.dispatchedChanges()).isEqualTo(3);
        assertThat(engine.isRunning()).isFalse();
        verify(stream).status();
        verify(connection, never()).createReplicationSlot(anyString());
    }

    @Test
    public void shouldStopStreamWaitingForChanges() throws Exception {
        when(stream.next(any(ChangeEventSourceContext.class))).thenAnswer(invocation -> {
            ChangeEventSourceContext context = invocation.getArgument(0);
            assertThat(context.isRunning()).isTrue();
            engine.stop();
            assertThat(context.isRunning()).isFalse();
            return Optional.empty();
        });

        engine.run();

        verify(dispatcher, never()).dispatch(any(Change.class));
    }

    @Test
    public void shouldCreateSlotBeforeStreaming() throws Exception {
        engine = new RelayEngine(connection, stream, dispatcher, true, new MockClock());
        engine.stop();

        engine.run();

        verify(connection).createReplicationSlot("relay_slot");
        verify(stream, never()).next(any(ChangeEventSourceContext.class));
    }

    @Test
    public void shouldEndOnDeliveryFailureWithoutRecordingPosition() throws Exception {
        Change begin = ChangeFixtures.begin();
        when(stream.next(any(ChangeEventSourceContext.class))).thenReturn(Optional.of(begin));
        doThrow(new DispatchException("Failed to deliver", Collections.singletonList("kafka"), 0, new RuntimeException("down")))
                .when(dispatcher).dispatch(begin);

        assertThatThrownBy(engine::run).isInstanceOf(DispatchException.class);

        verify(stream, never()).markProcessed(anyString());
        assertThat(engine.isRunning()).isFalse();
        verify(stream).status();
    }

    @Test
    public void shouldNotFailWhenSlotStatusIsUnavailable() throws Exception {
        when(stream.status()).thenThrow(new SQLException("connection lost"));
        when(stream.next(any(ChangeEventSourceContext.class))).thenAnswer(invocation -> {
            engine.stop();
            return Optional.empty();
        });

        engine.run();

        verify(stream).status();
    }
}
