package com.csg.airtel.csm4j.domain.model.session;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.*;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A long-running, container-backed execution session. Stored as one JSON
 * document per id.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class Session {
    private String id;
    private String userId;
    private String containerId;
    private SessionType sessionType;
    private SessionStatus status;
    private Instant createdAt;
    private Instant lastActivity;
    private Instant expiresAt;
    private SessionConfiguration configuration;
    private ResourceAllocation resources;
    private SessionMetrics metrics;
    private List<SessionConnection> connections;
    private SessionPersistence persistence;
    private AutoScalingConfig scaling;
    private SessionSecurity security;
    private List<SessionEvent> events;

    /**
     * Appends an event and drops the oldest entries beyond {@code limit}.
     */
    public void appendEvent(SessionEvent event, int limit) {
        if (events == null) {
            events = new ArrayList<>();
        }
        events.add(event);
        if (events.size() > limit) {
            events = new ArrayList<>(events.subList(events.size() - limit, events.size()));
        }
    }

    public Optional<SessionConnection> findConnection(String connectionId) {
        if (connections == null) {
            return Optional.empty();
        }
        return connections.stream()
                .filter(connection -> connection.getId().equals(connectionId))
                .findFirst();
    }

    @JsonIgnore
    public List<SessionConnection> getOpenConnections() {
        if (connections == null) {
            return List.of();
        }
        return connections.stream().filter(SessionConnection::isOpen).toList();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Session session = (Session) o;
        return Objects.equals(id, session.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }
}
