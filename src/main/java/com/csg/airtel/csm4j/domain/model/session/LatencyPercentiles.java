package com.csg.airtel.csm4j.domain.model.session;

public record LatencyPercentiles(double p50, double p90, double p95, double p99) {

    public static LatencyPercentiles zero() {
        return new LatencyPercentiles(0, 0, 0, 0);
    }
}
