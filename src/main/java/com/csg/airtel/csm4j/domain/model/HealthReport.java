package com.csg.airtel.csm4j.domain.model;

import java.util.List;

public record HealthReport(
        String status,
        int activeSessions,
        int hibernatedSessions,
        int totalSessions,
        List<String> issues) {

    public static final String HEALTHY = "healthy";
    public static final String DEGRADED = "degraded";
}
