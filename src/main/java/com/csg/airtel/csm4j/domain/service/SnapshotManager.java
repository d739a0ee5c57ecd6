package com.csg.airtel.csm4j.domain.service;

import com.csg.airtel.csm4j.domain.constant.ResponseCodeEnum;
import com.csg.airtel.csm4j.domain.constant.SessionDefaults;
import com.csg.airtel.csm4j.domain.model.session.RestorePoint;
import com.csg.airtel.csm4j.domain.model.session.Session;
import com.csg.airtel.csm4j.domain.model.session.SessionMetrics;
import com.csg.airtel.csm4j.domain.model.session.SessionPersistence;
import com.csg.airtel.csm4j.domain.model.snapshot.SessionSnapshot;
import com.csg.airtel.csm4j.exception.BaseException;
import com.csg.airtel.csm4j.exception.SnapshotNotFoundException;
import com.csg.airtel.csm4j.external.clients.SnapshotStore;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.core.Response;
import org.jboss.logging.Logger;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HexFormat;
import java.util.UUID;

/**
 * Point-in-time checkpoints of a session's working state: configuration,
 * metric counters and replica count.
 */
@ApplicationScoped
public class SnapshotManager {

    private static final Logger log = Logger.getLogger(SnapshotManager.class);
    static final String CHECKSUM_PREFIX = "sha256_";

    private final SnapshotStore snapshotStore;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Inject
    public SnapshotManager(SnapshotStore snapshotStore, ObjectMapper objectMapper, Clock clock) {
        this.snapshotStore = snapshotStore;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * Stores a snapshot and makes it the session's restore point.
     */
    public Uni<RestorePoint> createSnapshot(Session session) {
        Instant now = clock.instant();
        String snapshotId = "snap_" + UUID.randomUUID();
        Integer replicas = session.getScaling() == null ? null : session.getScaling().getCurrentReplicas();
        SessionSnapshot snapshot = new SessionSnapshot(snapshotId, session.getId(), now,
                session.getConfiguration(), session.getMetrics(), replicas);

        byte[] payload;
        try {
            payload = objectMapper.writeValueAsBytes(snapshot);
        } catch (JsonProcessingException e) {
            return Uni.createFrom().failure(new BaseException("Failed to serialize snapshot for session " + session.getId(),
                    ResponseCodeEnum.EXCEPTION_CLIENT_LAYER.description(),
                    Response.Status.INTERNAL_SERVER_ERROR,
                    ResponseCodeEnum.EXCEPTION_CLIENT_LAYER.code(), e));
        }
        String checksum = checksum(payload);
        SessionPersistence persistence = session.getPersistence();
        long retention = persistence.getRetentionPeriod() == null
                ? SessionDefaults.RETENTION_PERIOD_MS
                : persistence.getRetentionPeriod();

        return snapshotStore.save(session.getId(), snapshotId,
                        new String(payload, StandardCharsets.UTF_8), Duration.ofMillis(retention))
                .onItem().transform(ignored -> {
                    RestorePoint restorePoint = new RestorePoint(snapshotId, now, payload.length, checksum);
                    persistence.setRestorePoint(restorePoint);
                    persistence.setLastSnapshot(now);
                    persistence.setSnapshotSize((long) payload.length);
                    log.infof("Snapshot %s created for session %s (%d bytes)", snapshotId, session.getId(), payload.length);
                    return restorePoint;
                });
    }

    /**
     * Resume-time restore of the current restore point. Counters and replicas
     * come back from the checkpoint; the live configuration is kept, so updates
     * made while hibernating survive. Emits {@code null} when the session has
     * no restore point.
     */
    public Uni<SessionSnapshot> restore(Session session) {
        RestorePoint restorePoint = session.getPersistence() == null ? null : session.getPersistence().getRestorePoint();
        if (restorePoint == null) {
            return Uni.createFrom().nullItem();
        }
        return restore(session, restorePoint.id(), false);
    }

    /**
     * Applies a stored snapshot by id, configuration included; a {@code null}
     * id means the current restore point. The checksum is verified whenever the
     * id is the current restore point.
     */
    public Uni<SessionSnapshot> restore(Session session, String snapshotId) {
        return restore(session, snapshotId, true);
    }

    private Uni<SessionSnapshot> restore(Session session, String snapshotId, boolean withConfiguration) {
        RestorePoint restorePoint = session.getPersistence() == null ? null : session.getPersistence().getRestorePoint();
        String target = snapshotId != null ? snapshotId : restorePoint == null ? null : restorePoint.id();
        if (target == null) {
            return Uni.createFrom().failure(new SnapshotNotFoundException(session.getId(), "<none>"));
        }
        return snapshotStore.load(session.getId(), target)
                .onItem().transform(payload -> {
                    if (payload == null) {
                        throw new SnapshotNotFoundException(session.getId(), target);
                    }
                    byte[] bytes = payload.getBytes(StandardCharsets.UTF_8);
                    if (restorePoint != null && restorePoint.id().equals(target)
                            && !checksum(bytes).equals(restorePoint.checksum())) {
                        throw new BaseException("Snapshot " + target + " of session " + session.getId() + " failed checksum verification",
                                ResponseCodeEnum.SNAPSHOT_CORRUPTED.description(),
                                Response.Status.INTERNAL_SERVER_ERROR,
                                ResponseCodeEnum.SNAPSHOT_CORRUPTED.code());
                    }
                    SessionSnapshot snapshot = read(bytes, session.getId());
                    apply(session, snapshot, withConfiguration);
                    log.infof("Session %s restored from snapshot %s", session.getId(), target);
                    return snapshot;
                });
    }

    /**
     * True when persistence is on and the snapshot interval has elapsed since
     * the last snapshot, or no snapshot exists yet.
     */
    public boolean isDue(Session session, Instant now) {
        SessionPersistence persistence = session.getPersistence();
        if (persistence == null || !persistence.isEnabled()) {
            return false;
        }
        if (persistence.getLastSnapshot() == null) {
            return true;
        }
        long interval = persistence.getSnapshotInterval() == null
                ? SessionDefaults.SNAPSHOT_INTERVAL_MS
                : persistence.getSnapshotInterval();
        return Duration.between(persistence.getLastSnapshot(), now).toMillis() > interval;
    }

    static String checksum(byte[] payload) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return CHECKSUM_PREFIX + HexFormat.of().formatHex(digest.digest(payload));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    // connections are not part of the checkpoint, the live count stays as is
    private static void apply(Session session, SessionSnapshot snapshot, boolean withConfiguration) {
        if (withConfiguration && snapshot.configuration() != null) {
            session.setConfiguration(snapshot.configuration());
        }
        SessionMetrics saved = snapshot.metrics();
        if (saved != null) {
            SessionMetrics metrics = session.getMetrics();
            metrics.setTotalRequests(saved.getTotalRequests());
            metrics.setDataProcessed(saved.getDataProcessed());
            metrics.setErrorRate(saved.getErrorRate());
            metrics.setCostAccrued(saved.getCostAccrued());
        }
        if (snapshot.replicas() != null && session.getScaling() != null) {
            session.getScaling().setCurrentReplicas(snapshot.replicas());
        }
    }

    private SessionSnapshot read(byte[] payload, String sessionId) {
        try {
            return objectMapper.readValue(payload, SessionSnapshot.class);
        } catch (Exception e) {
            throw new BaseException("Failed to read snapshot of session " + sessionId,
                    ResponseCodeEnum.EXCEPTION_CLIENT_LAYER.description(),
                    Response.Status.INTERNAL_SERVER_ERROR,
                    ResponseCodeEnum.EXCEPTION_CLIENT_LAYER.code(), e);
        }
    }
}
