package com.csg.airtel.csm4j.domain.model.session;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum EventType {
    CREATED("created"),
    STARTED("started"),
    SCALED("scaled"),
    HIBERNATED("hibernated"),
    RESUMED("resumed"),
    FAILED("failed"),
    TERMINATED("terminated"),
    SNAPSHOT("snapshot"),
    RESTORED("restored");

    private final String value;

    EventType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static EventType fromValue(String value) {
        for (EventType candidate : values()) {
            if (candidate.value.equalsIgnoreCase(value) || candidate.name().equalsIgnoreCase(value)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown EventType: " + value);
    }
}
