package com.csg.airtel.csm4j.application.resources;

import com.csg.airtel.csm4j.domain.constant.ResponseCodeEnum;
import com.csg.airtel.csm4j.domain.model.response.ApiResponse;
import com.csg.airtel.csm4j.domain.model.response.ErrorDetail;
import com.csg.airtel.csm4j.exception.BaseException;
import com.fasterxml.jackson.core.JsonProcessingException;
import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.Response;
import org.jboss.logging.Logger;
import org.jboss.resteasy.reactive.RestResponse;
import org.jboss.resteasy.reactive.server.ServerExceptionMapper;

/**
 * Renders failures as {@code {message, data: {code, description}, timestamp}}.
 * Unexpected exceptions become a generic 500 without internals.
 */
public class ExceptionMappers {

    private static final Logger log = Logger.getLogger(ExceptionMappers.class);

    @ServerExceptionMapper
    public RestResponse<ApiResponse<ErrorDetail>> mapBaseException(BaseException e) {
        if (e.getStatus().getFamily() == Response.Status.Family.SERVER_ERROR) {
            log.errorf(e, "Request failed: %s", e.getMessage());
        } else {
            log.warnf("Request rejected (%s): %s", e.getCode(), e.getMessage());
        }
        return RestResponse.status(e.getStatus(),
                ApiResponse.of(e.getMessage(), new ErrorDetail(e.getCode(), e.getDescription())));
    }

    @ServerExceptionMapper
    public RestResponse<ApiResponse<ErrorDetail>> mapJsonException(JsonProcessingException e) {
        log.warnf("Malformed request body: %s", e.getOriginalMessage());
        return RestResponse.status(Response.Status.BAD_REQUEST,
                ApiResponse.of("Malformed request body",
                        new ErrorDetail(ResponseCodeEnum.VALIDATION_ERROR.code(), ResponseCodeEnum.VALIDATION_ERROR.description())));
    }

    @ServerExceptionMapper
    public RestResponse<ApiResponse<ErrorDetail>> mapWebApplicationException(WebApplicationException e) {
        Response.StatusType status = e.getResponse().getStatusInfo();
        return RestResponse.status(status,
                ApiResponse.of(status.getReasonPhrase(),
                        new ErrorDetail(String.valueOf(status.getStatusCode()), status.getReasonPhrase())));
    }

    @ServerExceptionMapper
    public RestResponse<ApiResponse<ErrorDetail>> mapUnexpected(Throwable e) {
        log.errorf(e, "Unexpected error");
        return RestResponse.status(Response.Status.INTERNAL_SERVER_ERROR,
                ApiResponse.of(ResponseCodeEnum.INTERNAL_ERROR.description(),
                        new ErrorDetail(ResponseCodeEnum.INTERNAL_ERROR.code(), ResponseCodeEnum.INTERNAL_ERROR.description())));
    }
}
