package com.csg.airtel.csm4j.domain.model.session;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ConnectionType {
    WEBSOCKET("websocket"),
    HTTP("http"),
    TCP("tcp"),
    UDP("udp"),
    SSH("ssh");

    private final String value;

    ConnectionType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static ConnectionType fromValue(String value) {
        for (ConnectionType candidate : values()) {
            if (candidate.value.equalsIgnoreCase(value) || candidate.name().equalsIgnoreCase(value)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown ConnectionType: " + value);
    }
}
