package com.csg.airtel.csm4j.domain.model.session;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle states of a container session.
 * <p>
 * Allowed moves:
 * <pre>
 * initializing -> active | failed
 * active       -> hibernating | terminating
 * hibernating  -> active | terminating
 * terminating  -> terminated
 * </pre>
 * {@code terminated} and {@code failed} are absorbing.
 */
public enum SessionStatus {
    INITIALIZING("initializing"),
    ACTIVE("active"),
    HIBERNATING("hibernating"),
    TERMINATING("terminating"),
    TERMINATED("terminated"),
    FAILED("failed");

    private final String value;

    SessionStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public Set<SessionStatus> successors() {
        switch (this) {
            case INITIALIZING:
                return EnumSet.of(ACTIVE, FAILED);
            case ACTIVE:
                return EnumSet.of(HIBERNATING, TERMINATING);
            case HIBERNATING:
                return EnumSet.of(ACTIVE, TERMINATING);
            case TERMINATING:
                return EnumSet.of(TERMINATED);
            default:
                return EnumSet.noneOf(SessionStatus.class);
        }
    }

    public boolean canTransitionTo(SessionStatus target) {
        return successors().contains(target);
    }

    public boolean isAbsorbing() {
        return this == TERMINATED || this == FAILED;
    }

    @JsonCreator
    public static SessionStatus fromValue(String value) {
        for (SessionStatus status : values()) {
            if (status.value.equalsIgnoreCase(value) || status.name().equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown session status: " + value);
    }
}
