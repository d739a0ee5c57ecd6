package com.csg.airtel.csm4j.domain.transport;

import io.smallrye.mutiny.Uni;

/**
 * Server side handle of one live client connection.
 */
public interface TransportChannel {

    String id();

    String clientAddress();

    String userAgent();

    boolean isOpen();

    Uni<Void> close(int code, String reason);
}
