package com.csg.airtel.csm4j.domain.model;

import com.csg.airtel.csm4j.domain.model.session.SessionConnection;

import java.util.List;

public record ConnectionList(List<SessionConnection> connections, int count) {

    public static ConnectionList of(List<SessionConnection> connections) {
        return new ConnectionList(connections, connections.size());
    }
}
