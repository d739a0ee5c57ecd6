package com.csg.airtel.csm4j.domain.model;

import com.csg.airtel.csm4j.domain.model.session.Session;
import com.csg.airtel.csm4j.domain.model.session.SessionStatus;
import com.csg.airtel.csm4j.domain.model.session.SessionType;

public record SessionQuery(String userId, SessionStatus status, SessionType sessionType, Integer limit) {

    public boolean matches(Session session) {
        if (userId != null && !userId.equals(session.getUserId())) return false;
        if (status != null && status != session.getStatus()) return false;
        return sessionType == null || sessionType == session.getSessionType();
    }
}
