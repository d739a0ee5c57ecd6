package com.csg.airtel.csm4j.domain.model;

/**
 * Outcome of a lifecycle request. {@code changed} is false when the session
 * already was in the requested state and nothing was done.
 */
public record LifecycleResult(SessionView session, boolean changed, String message) {

    public static LifecycleResult changed(SessionView session, String message) {
        return new LifecycleResult(session, true, message);
    }

    public static LifecycleResult unchanged(SessionView session, String message) {
        return new LifecycleResult(session, false, message);
    }
}
