package com.csg.airtel.csm4j.domain.service;

import com.csg.airtel.csm4j.domain.model.CreateSessionRequest;
import com.csg.airtel.csm4j.domain.model.session.ConnectionStatus;
import com.csg.airtel.csm4j.domain.model.session.Session;
import com.csg.airtel.csm4j.domain.model.session.SessionConnection;
import com.csg.airtel.csm4j.domain.model.session.SessionStatus;
import com.csg.airtel.csm4j.domain.model.session.SessionType;
import com.csg.airtel.csm4j.exception.ValidationException;
import com.csg.airtel.csm4j.external.clients.SessionStore;
import com.csg.airtel.csm4j.support.InMemoryRedis;
import com.csg.airtel.csm4j.support.MutableClock;
import com.csg.airtel.csm4j.support.RecordingChannel;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.smallrye.mutiny.helpers.test.UniAssertSubscriber;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConnectionRegistryTest {

    private static final Instant START = Instant.parse("2026-01-01T00:00:00Z");

    private MutableClock clock;
    private SessionStore sessionStore;
    private ConnectionRegistry connectionRegistry;
    private Session session;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(START);
        ObjectMapper objectMapper = new ObjectMapper();
        objectMapper.findAndRegisterModules();
        sessionStore = new SessionStore(new InMemoryRedis().dataSource(), objectMapper);
        connectionRegistry = new ConnectionRegistry(sessionStore, new SessionOperationQueue(), clock, 3);

        session = SessionMappingUtil.newSession(CreateSessionRequest.of("user-1", SessionType.INTERACTIVE), START);
        session.setStatus(SessionStatus.ACTIVE);
        sessionStore.save(session)
                .subscribe().withSubscriber(UniAssertSubscriber.create())
                .awaitItem();
    }

    @Test
    void testRegister_AddsActiveConnection() {
        // Given
        clock.advance(Duration.ofSeconds(10));

        // When
        SessionConnection connection = connectionRegistry.register(session, new RecordingChannel("c1"));

        // Then
        assertThat(connection.getStatus()).isEqualTo(ConnectionStatus.ACTIVE);
        assertThat(connection.getClientIP()).isEqualTo("10.0.0.1");
        assertThat(session.getMetrics().getActiveConnections()).isEqualTo(1);
        assertThat(session.getLastActivity()).isEqualTo(START.plusSeconds(10));
        assertThat(connectionRegistry.liveChannels(session.getId())).isEqualTo(1);
    }

    @Test
    void testRegister_SingleConnectionSessionRejectsSecond() {
        // Given
        session.getConfiguration().setAllowMultipleConnections(false);
        connectionRegistry.register(session, new RecordingChannel("c1"));

        // When / Then
        assertThatThrownBy(() -> connectionRegistry.register(session, new RecordingChannel("c2")))
                .isInstanceOf(ValidationException.class);
        assertThat(session.getConnections()).hasSize(1);
    }

    @Test
    void testRegister_TrimsOldestClosedEntries() {
        // Given history limit of 3
        for (int i = 0; i < 3; i++) {
            connectionRegistry.register(session, new RecordingChannel("old-" + i));
        }
        connectionRegistry.closeAll(session, 1000, "reset")
                .subscribe().withSubscriber(UniAssertSubscriber.create())
                .awaitItem();

        // When
        connectionRegistry.register(session, new RecordingChannel("new"));

        // Then
        assertThat(session.getConnections()).extracting(SessionConnection::getId)
                .containsExactly("old-1", "old-2", "new");
    }

    @Test
    void testRecordInbound_UpdatesCounters() {
        // Given
        connectionRegistry.register(session, new RecordingChannel("c1"));
        clock.advance(Duration.ofMinutes(1));

        // When
        connectionRegistry.recordInbound(session.getId(), "c1", 128)
                .subscribe().withSubscriber(UniAssertSubscriber.create())
                .awaitItem().assertCompleted();

        // Then
        SessionConnection connection = session.findConnection("c1").orElseThrow();
        assertThat(connection.getBytesTransferred()).isEqualTo(128);
        assertThat(connection.getLastActivity()).isEqualTo(START.plusSeconds(60));
        assertThat(session.getMetrics().getTotalRequests()).isEqualTo(1);
        assertThat(session.getMetrics().getDataProcessed()).isEqualTo(128);
        assertThat(session.getLastActivity()).isEqualTo(START.plusSeconds(60));
    }

    @Test
    void testRecordInbound_ClosedConnectionIgnored() {
        // Given
        connectionRegistry.register(session, new RecordingChannel("c1"));
        connectionRegistry.onClosed(session.getId(), "c1")
                .subscribe().withSubscriber(UniAssertSubscriber.create())
                .awaitItem();

        // When
        connectionRegistry.recordInbound(session.getId(), "c1", 64)
                .subscribe().withSubscriber(UniAssertSubscriber.create())
                .awaitItem();

        // Then
        assertThat(session.getMetrics().getTotalRequests()).isZero();
    }

    @Test
    void testOnClosed_IsIdempotent() {
        // Given
        connectionRegistry.register(session, new RecordingChannel("c1"));

        // When
        connectionRegistry.onClosed(session.getId(), "c1")
                .subscribe().withSubscriber(UniAssertSubscriber.create())
                .awaitItem();
        connectionRegistry.onClosed(session.getId(), "c1")
                .subscribe().withSubscriber(UniAssertSubscriber.create())
                .awaitItem();

        // Then
        SessionConnection connection = session.findConnection("c1").orElseThrow();
        assertThat(connection.getStatus()).isEqualTo(ConnectionStatus.CLOSED);
        assertThat(session.getMetrics().getActiveConnections()).isZero();
        assertThat(connectionRegistry.liveChannels(session.getId())).isZero();
    }

    @Test
    void testCloseAll_ClosesChannelsWithCode() {
        // Given
        RecordingChannel first = new RecordingChannel("c1");
        RecordingChannel second = new RecordingChannel("c2");
        connectionRegistry.register(session, first);
        connectionRegistry.register(session, second);

        // When
        int closed = connectionRegistry.closeAll(session, 1000, "Session hibernating")
                .subscribe().withSubscriber(UniAssertSubscriber.create())
                .awaitItem().getItem();

        // Then
        assertThat(closed).isEqualTo(2);
        assertThat(first.closeCode()).isEqualTo(1000);
        assertThat(second.closeReason()).isEqualTo("Session hibernating");
        assertThat(session.getOpenConnections()).isEmpty();
        assertThat(session.getMetrics().getActiveConnections()).isZero();
        assertThat(connectionRegistry.liveChannels()).isZero();
    }

    @Test
    void testActiveConnections_OnlyActiveStatus() {
        connectionRegistry.register(session, new RecordingChannel("c1"));
        connectionRegistry.register(session, new RecordingChannel("c2"));
        session.findConnection("c2").orElseThrow().setStatus(ConnectionStatus.IDLE);

        assertThat(connectionRegistry.activeConnections(session)).extracting(SessionConnection::getId)
                .containsExactly("c1");
    }
}
