package com.csg.airtel.csm4j.exception;

import com.csg.airtel.csm4j.domain.constant.ResponseCodeEnum;
import jakarta.ws.rs.core.Response;

public class ValidationException extends BaseException {

    public ValidationException(String message) {
        super(message,
                ResponseCodeEnum.VALIDATION_ERROR.description(),
                Response.Status.BAD_REQUEST,
                ResponseCodeEnum.VALIDATION_ERROR.code());
    }
}
