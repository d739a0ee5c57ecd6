package com.csg.airtel.csm4j.domain.model;

import com.csg.airtel.csm4j.domain.model.session.ScalingAction;

public record ScaleRequest(ScalingAction action, Integer replicas) {

    public static ScaleRequest automatic() {
        return new ScaleRequest(null, null);
    }

    public boolean isManual() {
        return action != null || replicas != null;
    }
}
