package com.csg.airtel.csm4j.domain.model;

/**
 * One telemetry reading for a session. {@code cpuPercent} is relative to the
 * allocated cores and may exceed 100.
 */
public record UsageSample(
        double cpuPercent,
        long memoryBytes,
        long swapBytes,
        long diskBytes,
        long diskIops,
        long bandwidthUp,
        long bandwidthDown,
        double responseTimeMs) {
}
