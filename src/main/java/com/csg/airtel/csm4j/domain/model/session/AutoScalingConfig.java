package com.csg.airtel.csm4j.domain.model.session;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.*;

import java.time.Instant;
import java.util.Map;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class AutoScalingConfig {
    @JsonProperty("enabled")
    private Boolean enabled;
    private Integer minReplicas;
    private Integer maxReplicas;
    private Integer currentReplicas;
    private Double targetCpuUtilization;
    private Double targetMemoryUtilization;
    private Double scaleUpThreshold;
    private Double scaleDownThreshold;
    private Long cooldownPeriod; // seconds

    /**
     * Time of the most recent {@code scaled} event, used to gate the cooldown.
     */
    private Instant lastScaledAt;
    private Map<String, Double> metrics;

    @JsonIgnore
    public boolean isEnabled() {
        return Boolean.TRUE.equals(enabled);
    }
}
