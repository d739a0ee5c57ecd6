package com.csg.airtel.csm4j.domain.model;

public record FleetMetrics(
        int totalSessions,
        int activeSessions,
        int hibernatingSessions,
        long totalConnections,
        double totalCost,
        double avgResponseTime,
        ResourceUtilization resourceUtilization,
        long scalingEvents,
        double uptimePercentage) {

    public record ResourceUtilization(double cpu, double memory, double disk) {
    }
}
