package com.csg.airtel.csm4j.exception;

import com.csg.airtel.csm4j.domain.constant.ResponseCodeEnum;
import jakarta.ws.rs.core.Response;

public class ContainerInitException extends BaseException {

    public ContainerInitException(String message, Throwable cause) {
        super(message,
                ResponseCodeEnum.CONTAINER_INIT_ERROR.description(),
                Response.Status.BAD_GATEWAY,
                ResponseCodeEnum.CONTAINER_INIT_ERROR.code(),
                cause);
    }
}
