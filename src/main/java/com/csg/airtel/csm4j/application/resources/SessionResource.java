package com.csg.airtel.csm4j.application.resources;

import com.csg.airtel.csm4j.domain.model.ConnectionList;
import com.csg.airtel.csm4j.domain.model.CreateSessionRequest;
import com.csg.airtel.csm4j.domain.model.LifecycleResult;
import com.csg.airtel.csm4j.domain.model.RestoreRequest;
import com.csg.airtel.csm4j.domain.model.ScaleRequest;
import com.csg.airtel.csm4j.domain.model.ScalingDecision;
import com.csg.airtel.csm4j.domain.model.SessionListResponse;
import com.csg.airtel.csm4j.domain.model.SessionQuery;
import com.csg.airtel.csm4j.domain.model.SessionView;
import com.csg.airtel.csm4j.domain.model.UpdateSessionRequest;
import com.csg.airtel.csm4j.domain.model.response.ApiResponse;
import com.csg.airtel.csm4j.domain.model.session.RestorePoint;
import com.csg.airtel.csm4j.domain.model.session.SessionStatus;
import com.csg.airtel.csm4j.domain.model.session.SessionType;
import com.csg.airtel.csm4j.domain.service.SessionLifecycleController;
import com.csg.airtel.csm4j.exception.ValidationException;
import io.smallrye.mutiny.Uni;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.PUT;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.jboss.logging.Logger;
import org.jboss.resteasy.reactive.RestPath;
import org.jboss.resteasy.reactive.RestQuery;
import org.jboss.resteasy.reactive.RestResponse;

import java.util.Map;
import java.util.function.Function;

/**
 * HTTP surface of the session lifecycle manager. The persistent connection
 * upgrade is served by {@code SessionConnectionSocket} on
 * {@code /sessions/{id}/connect}.
 */
@Path("/sessions")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class SessionResource {

    private static final Logger log = Logger.getLogger(SessionResource.class);

    private final SessionLifecycleController lifecycleController;

    @Inject
    public SessionResource(SessionLifecycleController lifecycleController) {
        this.lifecycleController = lifecycleController;
    }

    @POST
    public Uni<RestResponse<ApiResponse<SessionView>>> createSession(CreateSessionRequest request) {
        log.infof("Create session request for user %s", request == null ? null : request.userId());
        return lifecycleController.createSession(request)
                .onItem().transform(view -> RestResponse.status(Response.Status.CREATED,
                        ApiResponse.of("Session created", view)));
    }

    @GET
    public Uni<ApiResponse<SessionListResponse>> listSessions(@RestQuery String userId,
                                                              @RestQuery String status,
                                                              @RestQuery String sessionType,
                                                              @RestQuery Integer limit) {
        SessionQuery query = new SessionQuery(
                userId,
                parse(status, SessionStatus::fromValue, "status"),
                parse(sessionType, SessionType::fromValue, "sessionType"),
                limit);
        return lifecycleController.listSessions(query)
                .onItem().transform(list -> ApiResponse.of("Sessions retrieved", list));
    }

    @GET
    @Path("/{id}")
    public Uni<ApiResponse<SessionView>> getSession(@RestPath String id) {
        return lifecycleController.getSession(id)
                .onItem().transform(view -> ApiResponse.of("Session retrieved", view));
    }

    @PUT
    @Path("/{id}")
    public Uni<ApiResponse<SessionView>> updateSession(@RestPath String id, UpdateSessionRequest request) {
        return lifecycleController.updateSession(id, request)
                .onItem().transform(view -> ApiResponse.of("Session updated", view));
    }

    @DELETE
    @Path("/{id}")
    public Uni<ApiResponse<SessionView>> terminateSession(@RestPath String id) {
        return lifecycleController.terminateSession(id)
                .onItem().transform(SessionResource::toResponse);
    }

    @POST
    @Path("/{id}/hibernate")
    public Uni<ApiResponse<SessionView>> hibernateSession(@RestPath String id) {
        return lifecycleController.hibernateSession(id)
                .onItem().transform(SessionResource::toResponse);
    }

    @POST
    @Path("/{id}/resume")
    public Uni<ApiResponse<SessionView>> resumeSession(@RestPath String id) {
        return lifecycleController.resumeSession(id)
                .onItem().transform(SessionResource::toResponse);
    }

    @POST
    @Path("/{id}/scale")
    public Uni<ApiResponse<Map<String, ScalingDecision>>> scaleSession(@RestPath String id, ScaleRequest request) {
        return lifecycleController.scaleSession(id, request)
                .onItem().transform(decision -> ApiResponse.of("Scaling decision: " + decision.action().value(),
                        Map.of("scalingDecision", decision)));
    }

    @POST
    @Path("/{id}/snapshot")
    public Uni<ApiResponse<RestorePoint>> createSnapshot(@RestPath String id) {
        return lifecycleController.createSnapshot(id)
                .onItem().transform(restorePoint -> ApiResponse.of("Snapshot created", restorePoint));
    }

    @POST
    @Path("/{id}/restore")
    public Uni<ApiResponse<SessionView>> restoreSession(@RestPath String id, RestoreRequest request) {
        return lifecycleController.restoreSession(id, request == null ? null : request.snapshotId())
                .onItem().transform(view -> ApiResponse.of("Session restored", view));
    }

    @GET
    @Path("/{id}/connections")
    public Uni<ApiResponse<ConnectionList>> getConnections(@RestPath String id) {
        return lifecycleController.getConnections(id)
                .onItem().transform(connections -> ApiResponse.of("Active connections", connections));
    }

    private static ApiResponse<SessionView> toResponse(LifecycleResult result) {
        return ApiResponse.of(result.message(), result.session());
    }

    private static <T> T parse(String value, Function<String, T> parser, String name) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return parser.apply(value);
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Invalid " + name + ": " + value);
        }
    }
}
