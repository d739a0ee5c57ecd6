package com.csg.airtel.csm4j.domain.model.session;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum SessionType {
    INTERACTIVE("interactive"),
    BATCH("batch"),
    STREAMING("streaming"),
    API("api"),
    DEVELOPMENT("development");

    private final String value;

    SessionType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static SessionType fromValue(String value) {
        for (SessionType candidate : values()) {
            if (candidate.value.equalsIgnoreCase(value) || candidate.name().equalsIgnoreCase(value)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown SessionType: " + value);
    }
}
