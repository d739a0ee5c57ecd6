package com.csg.airtel.csm4j.exception;

import jakarta.ws.rs.core.Response;
import lombok.Getter;

/**
 * Root of the session manager error taxonomy. Carries the HTTP status and the
 * response code that the REST layer renders.
 */
@Getter
public class BaseException extends RuntimeException {

    private final String description;
    private final Response.Status status;
    private final String code;

    public BaseException(String message, String description, Response.Status status, String code) {
        super(message);
        this.description = description;
        this.status = status;
        this.code = code;
    }

    public BaseException(String message, String description, Response.Status status, String code,
                         StackTraceElement[] stackTrace) {
        this(message, description, status, code);
        if (stackTrace != null) {
            setStackTrace(stackTrace);
        }
    }

    public BaseException(String message, String description, Response.Status status, String code, Throwable cause) {
        super(message, cause);
        this.description = description;
        this.status = status;
        this.code = code;
    }
}
