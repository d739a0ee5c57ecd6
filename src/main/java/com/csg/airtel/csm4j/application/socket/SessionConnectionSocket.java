package com.csg.airtel.csm4j.application.socket;

import com.csg.airtel.csm4j.domain.service.ConnectionRegistry;
import com.csg.airtel.csm4j.domain.service.SessionLifecycleController;
import com.csg.airtel.csm4j.exception.BaseException;
import com.csg.airtel.csm4j.exception.SessionNotFoundException;
import io.quarkus.websockets.next.CloseReason;
import io.quarkus.websockets.next.OnClose;
import io.quarkus.websockets.next.OnOpen;
import io.quarkus.websockets.next.OnTextMessage;
import io.quarkus.websockets.next.WebSocket;
import io.quarkus.websockets.next.WebSocketConnection;
import io.smallrye.mutiny.Uni;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.nio.charset.StandardCharsets;

/**
 * Persistent client connection to a session. Opening attaches the connection
 * (resuming a hibernating session first), every text frame counts as
 * activity, and a client close marks the connection closed.
 */
@WebSocket(path = "/sessions/{id}/connect")
public class SessionConnectionSocket {

    private static final Logger log = Logger.getLogger(SessionConnectionSocket.class);

    static final int CLOSE_SESSION_NOT_FOUND = 4404;
    static final int CLOSE_REJECTED = 4409;
    static final int CLOSE_SERVER_ERROR = 1011;

    private final SessionLifecycleController lifecycleController;
    private final ConnectionRegistry connectionRegistry;

    @Inject
    public SessionConnectionSocket(SessionLifecycleController lifecycleController, ConnectionRegistry connectionRegistry) {
        this.lifecycleController = lifecycleController;
        this.connectionRegistry = connectionRegistry;
    }

    @OnOpen
    public Uni<Void> onOpen(WebSocketConnection connection) {
        String sessionId = connection.pathParam("id");
        return lifecycleController.connect(sessionId, new WebSocketTransportChannel(connection))
                .onItem().invoke(accepted -> {
                    if (log.isDebugEnabled()) {
                        log.debugf("WebSocket %s attached to session %s", accepted.getId(), sessionId);
                    }
                })
                .replaceWithVoid()
                .onFailure().recoverWithUni(e -> {
                    log.warnf("Rejecting connection %s to session %s: %s", connection.id(), sessionId, e.getMessage());
                    return connection.close(closeReason(e));
                });
    }

    @OnTextMessage
    public Uni<Void> onMessage(String message, WebSocketConnection connection) {
        String sessionId = connection.pathParam("id");
        return connectionRegistry.recordInbound(sessionId, connection.id(),
                        message.getBytes(StandardCharsets.UTF_8).length)
                .onFailure().recoverWithUni(e -> {
                    log.errorf(e, "Failed to record message on connection %s of session %s", connection.id(), sessionId);
                    return Uni.createFrom().voidItem();
                });
    }

    @OnClose
    public Uni<Void> onClose(WebSocketConnection connection) {
        String sessionId = connection.pathParam("id");
        return connectionRegistry.onClosed(sessionId, connection.id())
                .onFailure().recoverWithUni(e -> {
                    log.errorf(e, "Failed to record close of connection %s of session %s", connection.id(), sessionId);
                    return Uni.createFrom().voidItem();
                });
    }

    static CloseReason closeReason(Throwable failure) {
        if (failure instanceof SessionNotFoundException) {
            return new CloseReason(CLOSE_SESSION_NOT_FOUND, "Session not found");
        }
        if (failure instanceof BaseException && ((BaseException) failure).getStatus().getStatusCode() < 500) {
            return new CloseReason(CLOSE_REJECTED, ((BaseException) failure).getDescription());
        }
        return new CloseReason(CLOSE_SERVER_ERROR, "Connection could not be attached");
    }
}
