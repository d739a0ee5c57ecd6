package com.csg.airtel.csm4j.domain.model.session;

import lombok.*;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class PerformanceMetrics {
    private double throughput; // requests per second
    private LatencyPercentiles latency;
    private double availability; // percent
}
