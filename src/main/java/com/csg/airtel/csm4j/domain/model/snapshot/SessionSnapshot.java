package com.csg.airtel.csm4j.domain.model.snapshot;

import com.csg.airtel.csm4j.domain.model.session.SessionConfiguration;
import com.csg.airtel.csm4j.domain.model.session.SessionMetrics;

import java.time.Instant;

/**
 * Checkpointed working state of a session, enough to bring it back after a
 * hibernation.
 */
public record SessionSnapshot(
        String snapshotId,
        String sessionId,
        Instant takenAt,
        SessionConfiguration configuration,
        SessionMetrics metrics,
        Integer replicas) {
}
