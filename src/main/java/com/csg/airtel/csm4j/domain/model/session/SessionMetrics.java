package com.csg.airtel.csm4j.domain.model.session;

import lombok.*;

import java.time.Instant;

/**
 * Counters and derived rates. Written by the lifecycle controller, the
 * connection registry and the metrics refresh tick only.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class SessionMetrics {
    private long totalRequests;
    private int activeConnections;
    private long dataProcessed;  // bytes
    private double errorRate;    // percent
    private double responseTime; // ms, average
    private long uptime;         // ms
    private double costAccrued;
    private Instant lastUpdated;
    private PerformanceMetrics performance;
}
