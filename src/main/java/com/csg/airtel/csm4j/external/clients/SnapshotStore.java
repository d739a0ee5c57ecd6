package com.csg.airtel.csm4j.external.clients;

import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import io.quarkus.redis.datasource.value.SetArgs;
import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.faulttolerance.Retry;
import org.eclipse.microprofile.faulttolerance.Timeout;
import org.jboss.logging.Logger;

import java.time.Duration;

/**
 * Snapshot payloads keyed {@code snapshot:<sessionId>:<snapshotId>}. Entries
 * expire after the session's retention period.
 */
@ApplicationScoped
public class SnapshotStore {

    private static final Logger log = Logger.getLogger(SnapshotStore.class);
    private static final String KEY_PREFIX = "snapshot:";

    final ReactiveRedisDataSource reactiveRedisDataSource;

    @Inject
    public SnapshotStore(ReactiveRedisDataSource reactiveRedisDataSource) {
        this.reactiveRedisDataSource = reactiveRedisDataSource;
    }

    @Timeout(value = 5000)
    public Uni<Void> save(String sessionId, String snapshotId, String payload, Duration retention) {
        String key = key(sessionId, snapshotId);
        return reactiveRedisDataSource.value(String.class)
                .set(key, payload, new SetArgs().px(retention))
                .onItem().invoke(() -> log.infof("Snapshot %s stored for session %s (%d bytes)",
                        snapshotId, sessionId, payload.length()))
                .onFailure().invoke(e -> log.errorf(e, "Failed to store snapshot %s for session %s", snapshotId, sessionId));
    }

    @Retry(maxRetries = 3, delay = 100, maxDuration = 5000)
    @Timeout(value = 5000)
    public Uni<String> load(String sessionId, String snapshotId) {
        return reactiveRedisDataSource.value(String.class)
                .get(key(sessionId, snapshotId));
    }

    static String key(String sessionId, String snapshotId) {
        return KEY_PREFIX + sessionId + ":" + snapshotId;
    }
}
