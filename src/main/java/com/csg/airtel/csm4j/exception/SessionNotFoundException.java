package com.csg.airtel.csm4j.exception;

import com.csg.airtel.csm4j.domain.constant.ResponseCodeEnum;
import jakarta.ws.rs.core.Response;

public class SessionNotFoundException extends BaseException {

    private final String sessionId;

    public SessionNotFoundException(String sessionId) {
        super("Session not found: " + sessionId,
                ResponseCodeEnum.SESSION_NOT_FOUND.description(),
                Response.Status.NOT_FOUND,
                ResponseCodeEnum.SESSION_NOT_FOUND.code());
        this.sessionId = sessionId;
    }

    public String getSessionId() {
        return sessionId;
    }
}
