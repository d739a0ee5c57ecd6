package com.csg.airtel.csm4j.exception;

import com.csg.airtel.csm4j.domain.constant.ResponseCodeEnum;
import jakarta.ws.rs.core.Response;

/**
 * Raised when the capacity collaborator cannot satisfy a reservation.
 */
public class ResourceExhaustedException extends BaseException {

    public ResourceExhaustedException(String message) {
        super(message,
                ResponseCodeEnum.RESOURCE_EXHAUSTED.description(),
                Response.Status.SERVICE_UNAVAILABLE,
                ResponseCodeEnum.RESOURCE_EXHAUSTED.code());
    }
}
