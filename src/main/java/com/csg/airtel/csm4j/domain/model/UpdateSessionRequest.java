package com.csg.airtel.csm4j.domain.model;

import com.csg.airtel.csm4j.domain.model.session.AutoScalingConfig;
import com.csg.airtel.csm4j.domain.model.session.SessionConfiguration;

public record UpdateSessionRequest(
        SessionConfiguration configuration,
        ResourceSpec resources,
        AutoScalingConfig scaling) {

    public boolean isEmpty() {
        return configuration == null && resources == null && scaling == null;
    }
}
