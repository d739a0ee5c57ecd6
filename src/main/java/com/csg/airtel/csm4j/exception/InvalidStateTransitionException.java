package com.csg.airtel.csm4j.exception;

import com.csg.airtel.csm4j.domain.constant.ResponseCodeEnum;
import com.csg.airtel.csm4j.domain.model.session.SessionStatus;
import jakarta.ws.rs.core.Response;

/**
 * Only raised for requests that are not idempotent with respect to the current
 * state. Hibernating an already hibernating session, for example, is a no-op
 * success and never ends up here.
 */
public class InvalidStateTransitionException extends BaseException {

    public InvalidStateTransitionException(String sessionId, Object from, Object to) {
        super("Session " + sessionId + " cannot move from " + from + " to " + to,
                ResponseCodeEnum.INVALID_STATE_TRANSITION.description(),
                Response.Status.CONFLICT,
                ResponseCodeEnum.INVALID_STATE_TRANSITION.code());
    }

    public InvalidStateTransitionException(String sessionId, SessionStatus status, String operation) {
        super("Session " + sessionId + " is " + status.value() + " and cannot be " + operation,
                ResponseCodeEnum.INVALID_STATE_TRANSITION.description(),
                Response.Status.CONFLICT,
                ResponseCodeEnum.INVALID_STATE_TRANSITION.code());
    }
}
