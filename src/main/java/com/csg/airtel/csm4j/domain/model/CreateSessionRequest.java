package com.csg.airtel.csm4j.domain.model;

import com.csg.airtel.csm4j.domain.model.session.AutoScalingConfig;
import com.csg.airtel.csm4j.domain.model.session.SessionConfiguration;
import com.csg.airtel.csm4j.domain.model.session.SessionPersistence;
import com.csg.airtel.csm4j.domain.model.session.SessionSecurity;
import com.csg.airtel.csm4j.domain.model.session.SessionType;

import java.time.Instant;

/**
 * Body of {@code POST /sessions}. Everything except {@code userId} is optional;
 * nested objects are partial overrides of the defaults.
 */
public record CreateSessionRequest(
        String id,
        String userId,
        String containerId,
        SessionType sessionType,
        Instant expiresAt,
        SessionConfiguration configuration,
        ResourceSpec resources,
        SessionPersistence persistence,
        AutoScalingConfig scaling,
        SessionSecurity security) {

    public static CreateSessionRequest of(String userId, SessionType sessionType) {
        return new CreateSessionRequest(null, userId, null, sessionType, null, null, null, null, null, null);
    }
}
