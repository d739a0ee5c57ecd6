package com.csg.airtel.csm4j.domain.service;

import com.csg.airtel.csm4j.domain.model.session.ConnectionStatus;
import com.csg.airtel.csm4j.domain.model.session.ConnectionType;
import com.csg.airtel.csm4j.domain.model.session.Session;
import com.csg.airtel.csm4j.domain.model.session.SessionConnection;
import com.csg.airtel.csm4j.domain.model.session.SessionMetrics;
import com.csg.airtel.csm4j.domain.transport.TransportChannel;
import com.csg.airtel.csm4j.exception.ValidationException;
import com.csg.airtel.csm4j.external.clients.SessionStore;
import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Live transport connections per session.
 * <p>
 * Sole writer of {@code connections} and of the connection derived metrics.
 * {@link #register} and {@link #closeAll} run inside an operation the caller
 * already serializes for the session; inbound traffic and client side closes
 * arrive from the transport and are queued here.
 */
@ApplicationScoped
public class ConnectionRegistry {

    private static final Logger log = Logger.getLogger(ConnectionRegistry.class);

    private final SessionStore sessionStore;
    private final SessionOperationQueue operationQueue;
    private final Clock clock;
    private final int historyLimit;

    private final Map<String, Map<String, TransportChannel>> channels = new ConcurrentHashMap<>();

    @Inject
    public ConnectionRegistry(SessionStore sessionStore,
                              SessionOperationQueue operationQueue,
                              Clock clock,
                              @ConfigProperty(name = "session-manager.event-history-limit", defaultValue = "100") int historyLimit) {
        this.sessionStore = sessionStore;
        this.operationQueue = operationQueue;
        this.clock = clock;
        this.historyLimit = historyLimit;
    }

    /**
     * Records a newly accepted connection on the session. The caller persists.
     *
     * @throws ValidationException when the session allows a single connection
     *                             and one is already active
     */
    public SessionConnection register(Session session, TransportChannel channel) {
        Boolean multiple = session.getConfiguration().getAllowMultipleConnections();
        if (Boolean.FALSE.equals(multiple) && !activeConnections(session).isEmpty()) {
            throw new ValidationException("Session " + session.getId() + " does not allow multiple connections");
        }

        Instant now = clock.instant();
        SessionConnection connection = SessionConnection.builder()
                .id(channel.id())
                .type(ConnectionType.WEBSOCKET)
                .clientIP(channel.clientAddress())
                .userAgent(channel.userAgent())
                .connectedAt(now)
                .lastActivity(now)
                .status(ConnectionStatus.ACTIVE)
                .metadata(new HashMap<>())
                .build();

        if (session.getConnections() == null) {
            session.setConnections(new ArrayList<>());
        }
        session.getConnections().add(connection);
        trimHistory(session);

        SessionMetrics metrics = session.getMetrics();
        metrics.setActiveConnections(metrics.getActiveConnections() + 1);
        session.setLastActivity(now);

        channels.computeIfAbsent(session.getId(), id -> new ConcurrentHashMap<>())
                .put(connection.getId(), channel);
        log.infof("Connection %s accepted for session %s from %s",
                connection.getId(), session.getId(), connection.getClientIP());
        return connection;
    }

    /**
     * One inbound message. Ignored when the session or the connection is
     * gone or already closed.
     */
    public Uni<Void> recordInbound(String sessionId, String connectionId, long bytes) {
        return operationQueue.submit(sessionId, () -> sessionStore.load(sessionId)
                .onItem().transformToUni(session -> {
                    if (session == null) {
                        return Uni.createFrom().voidItem();
                    }
                    SessionConnection connection = session.findConnection(connectionId).orElse(null);
                    if (connection == null || !connection.isOpen()) {
                        if (log.isDebugEnabled()) {
                            log.debugf("Dropping message for closed connection %s of session %s", connectionId, sessionId);
                        }
                        return Uni.createFrom().voidItem();
                    }
                    Instant now = clock.instant();
                    connection.setLastActivity(now);
                    connection.setBytesTransferred(connection.getBytesTransferred() + bytes);
                    if (connection.getStatus() == ConnectionStatus.IDLE) {
                        connection.setStatus(ConnectionStatus.ACTIVE);
                    }
                    session.setLastActivity(now);
                    SessionMetrics metrics = session.getMetrics();
                    metrics.setTotalRequests(metrics.getTotalRequests() + 1);
                    metrics.setDataProcessed(metrics.getDataProcessed() + bytes);
                    return sessionStore.save(session);
                }));
    }

    /**
     * Client side close. Idempotent: a connection already marked closed is left
     * alone.
     */
    public Uni<Void> onClosed(String sessionId, String connectionId) {
        Map<String, TransportChannel> live = channels.get(sessionId);
        if (live != null) {
            live.remove(connectionId);
            channels.computeIfPresent(sessionId, (id, map) -> map.isEmpty() ? null : map);
        }
        return operationQueue.submit(sessionId, () -> sessionStore.load(sessionId)
                .onItem().transformToUni(session -> {
                    if (session == null || !markClosed(session, connectionId, clock.instant())) {
                        return Uni.createFrom().voidItem();
                    }
                    log.infof("Connection %s closed for session %s", connectionId, sessionId);
                    return sessionStore.save(session);
                }));
    }

    /**
     * Marks every open connection of the session closed and closes the live
     * channels with the given code. Returns the number of connections closed.
     * The caller persists.
     */
    public Uni<Integer> closeAll(Session session, int code, String reason) {
        Instant now = clock.instant();
        int closed = 0;
        for (SessionConnection connection : session.getOpenConnections()) {
            if (markClosed(session, connection.getId(), now)) {
                closed++;
            }
        }
        session.getMetrics().setActiveConnections(0);

        Map<String, TransportChannel> live = channels.remove(session.getId());
        int count = closed;
        if (live == null || live.isEmpty()) {
            return Uni.createFrom().item(count);
        }
        List<Uni<Void>> closing = new ArrayList<>(live.size());
        for (TransportChannel channel : live.values()) {
            closing.add(channel.close(code, reason)
                    .onFailure().recoverWithUni(e -> {
                        log.warnf(e, "Failed to close channel %s of session %s", channel.id(), session.getId());
                        return Uni.createFrom().voidItem();
                    }));
        }
        log.infof("Closing %d connection(s) of session %s: %s", live.size(), session.getId(), reason);
        return Uni.join().all(closing).andFailFast().replaceWith(count);
    }

    public List<SessionConnection> activeConnections(Session session) {
        if (session.getConnections() == null) {
            return List.of();
        }
        return session.getConnections().stream()
                .filter(connection -> connection.getStatus() == ConnectionStatus.ACTIVE)
                .toList();
    }

    public int liveChannels(String sessionId) {
        Map<String, TransportChannel> live = channels.get(sessionId);
        return live == null ? 0 : live.size();
    }

    public int liveChannels() {
        return channels.values().stream().mapToInt(Map::size).sum();
    }

    private boolean markClosed(Session session, String connectionId, Instant now) {
        SessionConnection connection = session.findConnection(connectionId).orElse(null);
        if (connection == null || !connection.isOpen()) {
            return false;
        }
        connection.setStatus(ConnectionStatus.CLOSED);
        connection.setClosedAt(now);
        SessionMetrics metrics = session.getMetrics();
        metrics.setActiveConnections(Math.max(0, metrics.getActiveConnections() - 1));
        return true;
    }

    // oldest closed entries go first, open ones are never dropped
    private void trimHistory(Session session) {
        List<SessionConnection> connections = session.getConnections();
        int excess = connections.size() - historyLimit;
        Iterator<SessionConnection> iterator = connections.iterator();
        while (excess > 0 && iterator.hasNext()) {
            if (!iterator.next().isOpen()) {
                iterator.remove();
                excess--;
            }
        }
    }
}
