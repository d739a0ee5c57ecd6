package com.csg.airtel.csm4j.domain.model;

import com.csg.airtel.csm4j.domain.model.session.ScalingAction;

import java.util.Map;

public record ScalingDecision(
        ScalingAction action,
        String reason,
        int currentReplicas,
        int targetReplicas,
        double confidence,
        Map<String, Double> metrics) {

    public static ScalingDecision maintain(String reason, int replicas, double confidence, Map<String, Double> metrics) {
        return new ScalingDecision(ScalingAction.MAINTAIN, reason, replicas, replicas, confidence, metrics);
    }

    public boolean requiresAction() {
        return action != ScalingAction.MAINTAIN;
    }
}
