package com.csg.airtel.csm4j.domain.model.session;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ScalingAction {
    SCALE_UP("scale_up"),
    SCALE_DOWN("scale_down"),
    MAINTAIN("maintain");

    private final String value;

    ScalingAction(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static ScalingAction fromValue(String value) {
        for (ScalingAction candidate : values()) {
            if (candidate.value.equalsIgnoreCase(value) || candidate.name().equalsIgnoreCase(value)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown ScalingAction: " + value);
    }
}
