package com.csg.airtel.csm4j.application.socket;

import com.csg.airtel.csm4j.domain.transport.TransportChannel;
import io.quarkus.websockets.next.CloseReason;
import io.quarkus.websockets.next.WebSocketConnection;
import io.smallrye.mutiny.Uni;

/**
 * {@link TransportChannel} over a WebSockets Next connection. The client
 * address comes from the proxy headers; the handshake does not expose the
 * peer address.
 */
public class WebSocketTransportChannel implements TransportChannel {

    static final String UNKNOWN = "unknown";

    private final WebSocketConnection connection;

    public WebSocketTransportChannel(WebSocketConnection connection) {
        this.connection = connection;
    }

    @Override
    public String id() {
        return connection.id();
    }

    @Override
    public String clientAddress() {
        String forwarded = connection.handshakeRequest().header("X-Forwarded-For");
        if (forwarded != null && !forwarded.isBlank()) {
            return forwarded.split(",")[0].trim();
        }
        String realIp = connection.handshakeRequest().header("X-Real-IP");
        return realIp == null || realIp.isBlank() ? UNKNOWN : realIp;
    }

    @Override
    public String userAgent() {
        return connection.handshakeRequest().header("User-Agent");
    }

    @Override
    public boolean isOpen() {
        return connection.isOpen();
    }

    @Override
    public Uni<Void> close(int code, String reason) {
        if (!connection.isOpen()) {
            return Uni.createFrom().voidItem();
        }
        return connection.close(new CloseReason(code, reason));
    }
}
