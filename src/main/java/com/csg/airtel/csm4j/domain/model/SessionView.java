package com.csg.airtel.csm4j.domain.model;

import com.csg.airtel.csm4j.domain.model.session.*;

import java.time.Instant;
import java.util.List;

/**
 * Externally visible projection of a session. Connections and events are cut
 * to the most recent entries and the security descriptor is left out.
 */
public record SessionView(
        String id,
        String userId,
        String containerId,
        SessionType sessionType,
        SessionStatus status,
        Instant createdAt,
        Instant lastActivity,
        Instant expiresAt,
        SessionConfiguration configuration,
        ResourceAllocation resources,
        SessionMetrics metrics,
        SessionPersistence persistence,
        AutoScalingConfig scaling,
        List<SessionConnection> connections,
        List<SessionEvent> events) {
}
