package com.csg.airtel.csm4j.domain.service;

import com.csg.airtel.csm4j.domain.model.ScaleRequest;
import com.csg.airtel.csm4j.domain.model.ScalingDecision;
import com.csg.airtel.csm4j.domain.model.session.AutoScalingConfig;
import com.csg.airtel.csm4j.domain.model.session.ResourceAllocation;
import com.csg.airtel.csm4j.domain.model.session.ScalingAction;
import com.csg.airtel.csm4j.domain.model.session.Session;
import com.csg.airtel.csm4j.domain.runtime.ContainerRuntime;
import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

import static com.csg.airtel.csm4j.domain.constant.SessionDefaults.*;

/**
 * Replica decisions from cpu utilization. No action is proposed while the
 * cooldown since the last {@code scaled} event is running, manual requests
 * included.
 */
@ApplicationScoped
public class AutoScaler {

    private static final Logger log = Logger.getLogger(AutoScaler.class);

    private static final double THRESHOLD_CONFIDENCE = 0.8;
    private static final double MAINTAIN_CONFIDENCE = 0.9;
    private static final double CERTAIN = 1.0;

    private final ContainerRuntime containerRuntime;

    @Inject
    public AutoScaler(ContainerRuntime containerRuntime) {
        this.containerRuntime = containerRuntime;
    }

    public ScalingDecision decide(Session session, ScaleRequest request, Instant now) {
        AutoScalingConfig scaling = session.getScaling();
        Map<String, Double> metrics = utilization(session.getResources());
        int min = scaling.getMinReplicas() == null ? MIN_REPLICAS : scaling.getMinReplicas();
        int max = scaling.getMaxReplicas() == null ? MAX_REPLICAS : scaling.getMaxReplicas();
        int current = scaling.getCurrentReplicas() == null ? min : scaling.getCurrentReplicas();

        if (!scaling.isEnabled()) {
            return ScalingDecision.maintain("Auto-scaling disabled", current, CERTAIN, metrics);
        }

        Duration remaining = cooldownRemaining(scaling, now);
        if (!remaining.isZero()) {
            return ScalingDecision.maintain("Cooldown active, " + remaining.toSeconds() + "s remaining",
                    current, CERTAIN, metrics);
        }

        ScaleRequest effective = request == null ? ScaleRequest.automatic() : request;
        if (effective.replicas() != null) {
            int target = clamp(effective.replicas(), min, max);
            return toDecision(target, current, "Manual request for " + effective.replicas() + " replicas",
                    CERTAIN, metrics);
        }
        if (effective.action() != null) {
            if (effective.action() == ScalingAction.SCALE_UP) {
                return toDecision(Math.min(current + 1, max), current, "Manual scale up", CERTAIN, metrics);
            }
            if (effective.action() == ScalingAction.SCALE_DOWN) {
                return toDecision(Math.max(current - 1, min), current, "Manual scale down", CERTAIN, metrics);
            }
            return ScalingDecision.maintain("Manual maintain", current, CERTAIN, metrics);
        }

        double cpu = metrics.get("cpu");
        double up = scaling.getScaleUpThreshold() == null ? SCALE_UP_THRESHOLD : scaling.getScaleUpThreshold();
        double down = scaling.getScaleDownThreshold() == null ? SCALE_DOWN_THRESHOLD : scaling.getScaleDownThreshold();
        if (cpu > up) {
            return toDecision(Math.min(current + 1, max), current,
                    String.format("CPU usage %.1f%% above %.1f%%", cpu, up), THRESHOLD_CONFIDENCE, metrics);
        }
        if (cpu < down) {
            return toDecision(Math.max(current - 1, min), current,
                    String.format("CPU usage %.1f%% below %.1f%%", cpu, down), THRESHOLD_CONFIDENCE, metrics);
        }
        return ScalingDecision.maintain("Utilization within thresholds", current, MAINTAIN_CONFIDENCE, metrics);
    }

    /**
     * Hands a non-maintain decision to the runtime and records the new replica
     * count on success.
     */
    public Uni<Void> execute(Session session, ScalingDecision decision) {
        if (!decision.requiresAction()) {
            return Uni.createFrom().voidItem();
        }
        return containerRuntime.scaleReplicas(session.getId(), decision.currentReplicas(), decision.targetReplicas())
                .onItem().invoke(() -> {
                    session.getScaling().setCurrentReplicas(decision.targetReplicas());
                    log.infof("Session %s %s: %d -> %d replicas (%s)", session.getId(), decision.action().value(),
                            decision.currentReplicas(), decision.targetReplicas(), decision.reason());
                });
    }

    Duration cooldownRemaining(AutoScalingConfig scaling, Instant now) {
        if (scaling.getLastScaledAt() == null) {
            return Duration.ZERO;
        }
        long cooldown = scaling.getCooldownPeriod() == null ? COOLDOWN_PERIOD_SECONDS : scaling.getCooldownPeriod();
        Instant readyAt = scaling.getLastScaledAt().plusSeconds(cooldown);
        return now.isBefore(readyAt) ? Duration.between(now, readyAt) : Duration.ZERO;
    }

    private static ScalingDecision toDecision(int target, int current, String reason, double confidence,
                                              Map<String, Double> metrics) {
        if (target == current) {
            return ScalingDecision.maintain(reason + ", already at " + current + " replicas", current, confidence, metrics);
        }
        ScalingAction action = target > current ? ScalingAction.SCALE_UP : ScalingAction.SCALE_DOWN;
        return new ScalingDecision(action, reason, current, target, confidence, metrics);
    }

    private static Map<String, Double> utilization(ResourceAllocation resources) {
        Map<String, Double> metrics = new LinkedHashMap<>();
        metrics.put("cpu", resources.getCpu().getUsage());
        long memoryAllocated = resources.getMemory().getAllocated();
        metrics.put("memory", memoryAllocated == 0 ? 0.0 : resources.getMemory().getUsage() * 100.0 / memoryAllocated);
        return metrics;
    }

    private static int clamp(int value, int min, int max) {
        return Math.max(min, Math.min(max, value));
    }
}
