package com.csg.airtel.csm4j.domain.model.session;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ConnectionStatus {
    ACTIVE("active"),
    IDLE("idle"),
    CLOSED("closed");

    private final String value;

    ConnectionStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static ConnectionStatus fromValue(String value) {
        for (ConnectionStatus candidate : values()) {
            if (candidate.value.equalsIgnoreCase(value) || candidate.name().equalsIgnoreCase(value)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown ConnectionStatus: " + value);
    }
}
