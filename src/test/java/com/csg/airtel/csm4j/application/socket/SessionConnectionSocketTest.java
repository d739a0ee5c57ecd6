package com.csg.airtel.csm4j.application.socket;

import com.csg.airtel.csm4j.domain.model.session.SessionConnection;
import com.csg.airtel.csm4j.domain.model.session.SessionStatus;
import com.csg.airtel.csm4j.domain.service.ConnectionRegistry;
import com.csg.airtel.csm4j.domain.service.SessionLifecycleController;
import com.csg.airtel.csm4j.domain.transport.TransportChannel;
import com.csg.airtel.csm4j.exception.InvalidStateTransitionException;
import com.csg.airtel.csm4j.exception.ResourceExhaustedException;
import com.csg.airtel.csm4j.exception.SessionNotFoundException;
import io.quarkus.websockets.next.CloseReason;
import io.quarkus.websockets.next.WebSocketConnection;
import io.smallrye.mutiny.Uni;
import io.smallrye.mutiny.helpers.test.UniAssertSubscriber;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SessionConnectionSocketTest {

    @Mock
    private SessionLifecycleController lifecycleController;

    @Mock
    private ConnectionRegistry connectionRegistry;

    @Mock
    private WebSocketConnection connection;

    private SessionConnectionSocket socket;

    @BeforeEach
    void setUp() {
        socket = new SessionConnectionSocket(lifecycleController, connectionRegistry);
        lenient().when(connection.pathParam("id")).thenReturn("s1");
    }

    @Test
    void shouldAttachConnectionOnOpen() {
        when(lifecycleController.connect(eq("s1"), any(TransportChannel.class)))
                .thenReturn(Uni.createFrom().item(SessionConnection.builder().id("ws-1").build()));

        socket.onOpen(connection)
                .subscribe().withSubscriber(UniAssertSubscriber.create())
                .awaitItem().assertCompleted();

        verify(connection, never()).close(any(CloseReason.class));
    }

    @Test
    void shouldCloseWhenSessionUnknown() {
        // Given
        when(connection.id()).thenReturn("ws-1");
        when(lifecycleController.connect(eq("s1"), any(TransportChannel.class)))
                .thenReturn(Uni.createFrom().failure(new SessionNotFoundException("s1")));
        when(connection.close(any(CloseReason.class))).thenReturn(Uni.createFrom().voidItem());

        // When
        socket.onOpen(connection)
                .subscribe().withSubscriber(UniAssertSubscriber.create())
                .awaitItem().assertCompleted();

        // Then
        ArgumentCaptor<CloseReason> reason = ArgumentCaptor.forClass(CloseReason.class);
        verify(connection).close(reason.capture());
        assertThat(reason.getValue().getCode()).isEqualTo(SessionConnectionSocket.CLOSE_SESSION_NOT_FOUND);
    }

    @Test
    void shouldRecordInboundBytes() {
        when(connection.id()).thenReturn("ws-1");
        when(connectionRegistry.recordInbound("s1", "ws-1", 6)).thenReturn(Uni.createFrom().voidItem());

        socket.onMessage("héllo", connection)
                .subscribe().withSubscriber(UniAssertSubscriber.create())
                .awaitItem().assertCompleted();

        verify(connectionRegistry).recordInbound("s1", "ws-1", 6);
    }

    @Test
    void shouldMarkClosedOnClose() {
        when(connection.id()).thenReturn("ws-1");
        when(connectionRegistry.onClosed("s1", "ws-1")).thenReturn(Uni.createFrom().failure(new RuntimeException("redis down")));

        socket.onClose(connection)
                .subscribe().withSubscriber(UniAssertSubscriber.create())
                .awaitItem().assertCompleted();

        verify(connectionRegistry).onClosed("s1", "ws-1");
    }

    @Test
    void testCloseReason_MapsFailures() {
        assertThat(SessionConnectionSocket.closeReason(
                new InvalidStateTransitionException("s1", SessionStatus.TERMINATED, "connected")).getCode())
                .isEqualTo(SessionConnectionSocket.CLOSE_REJECTED);
        assertThat(SessionConnectionSocket.closeReason(new ResourceExhaustedException("full")).getCode())
                .isEqualTo(SessionConnectionSocket.CLOSE_SERVER_ERROR);
        assertThat(SessionConnectionSocket.closeReason(new IllegalStateException()).getCode())
                .isEqualTo(SessionConnectionSocket.CLOSE_SERVER_ERROR);
    }
}
