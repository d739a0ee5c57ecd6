package com.csg.airtel.csm4j.application.resources;

import com.csg.airtel.csm4j.domain.model.response.ApiResponse;
import com.csg.airtel.csm4j.domain.model.response.ErrorDetail;
import com.csg.airtel.csm4j.domain.model.session.SessionStatus;
import com.csg.airtel.csm4j.exception.ContainerInitException;
import com.csg.airtel.csm4j.exception.InvalidStateTransitionException;
import com.csg.airtel.csm4j.exception.ResourceExhaustedException;
import com.csg.airtel.csm4j.exception.SessionNotFoundException;
import com.csg.airtel.csm4j.exception.ValidationException;
import com.fasterxml.jackson.core.JsonParseException;
import jakarta.ws.rs.NotAllowedException;
import org.jboss.resteasy.reactive.RestResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ExceptionMappersTest {

    private ExceptionMappers exceptionMappers;

    @BeforeEach
    void setUp() {
        exceptionMappers = new ExceptionMappers();
    }

    @Test
    void testMapBaseException_StatusPerType() {
        assertThat(exceptionMappers.mapBaseException(new SessionNotFoundException("s1")).getStatus()).isEqualTo(404);
        assertThat(exceptionMappers.mapBaseException(new ValidationException("bad")).getStatus()).isEqualTo(400);
        assertThat(exceptionMappers.mapBaseException(
                new InvalidStateTransitionException("s1", SessionStatus.TERMINATED, "updated")).getStatus()).isEqualTo(409);
        assertThat(exceptionMappers.mapBaseException(new ResourceExhaustedException("full")).getStatus()).isEqualTo(503);
        assertThat(exceptionMappers.mapBaseException(
                new ContainerInitException("init", new IllegalStateException())).getStatus()).isEqualTo(502);
    }

    @Test
    void testMapBaseException_Body() {
        RestResponse<ApiResponse<ErrorDetail>> response = exceptionMappers.mapBaseException(new SessionNotFoundException("s1"));

        assertThat(response.getEntity().getMessage()).isEqualTo("Session not found: s1");
        assertThat(response.getEntity().getData().code()).isEqualTo("CSM-404");
        assertThat(response.getEntity().getTimestamp()).isNotNull();
    }

    @Test
    void testMapJsonException() {
        RestResponse<ApiResponse<ErrorDetail>> response =
                exceptionMappers.mapJsonException(new JsonParseException(null, "Unexpected character"));

        assertThat(response.getStatus()).isEqualTo(400);
        assertThat(response.getEntity().getData().code()).isEqualTo("CSM-400");
    }

    @Test
    void testMapWebApplicationException() {
        RestResponse<ApiResponse<ErrorDetail>> response =
                exceptionMappers.mapWebApplicationException(new NotAllowedException("GET"));

        assertThat(response.getStatus()).isEqualTo(405);
        assertThat(response.getEntity().getData().code()).isEqualTo("405");
    }

    @Test
    void testMapUnexpected_HidesInternals() {
        RestResponse<ApiResponse<ErrorDetail>> response =
                exceptionMappers.mapUnexpected(new NullPointerException("secret detail"));

        assertThat(response.getStatus()).isEqualTo(500);
        assertThat(response.getEntity().getMessage()).isEqualTo("Internal server error");
        assertThat(response.getEntity().getData().code()).isEqualTo("CSM-500");
    }
}
