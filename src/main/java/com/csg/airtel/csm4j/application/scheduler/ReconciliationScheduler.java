package com.csg.airtel.csm4j.application.scheduler;

import com.csg.airtel.csm4j.domain.model.session.Session;
import com.csg.airtel.csm4j.domain.model.session.SessionStatus;
import com.csg.airtel.csm4j.domain.service.SessionLifecycleController;
import com.csg.airtel.csm4j.external.clients.SessionStore;
import io.quarkus.runtime.ShutdownEvent;
import io.quarkus.runtime.StartupEvent;
import io.quarkus.scheduler.Scheduled;
import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Periodic reconciliation of the indexed sessions. Each tick isolates failures
 * per session; a failing session is logged and the tick moves on.
 */
@ApplicationScoped
public class ReconciliationScheduler {

    private static final Logger log = Logger.getLogger(ReconciliationScheduler.class);

    private final SessionLifecycleController lifecycleController;
    private final SessionStore sessionStore;

    @Inject
    public ReconciliationScheduler(SessionLifecycleController lifecycleController, SessionStore sessionStore) {
        this.lifecycleController = lifecycleController;
        this.sessionStore = sessionStore;
    }

    void onStart(@Observes StartupEvent event) {
        lifecycleController.recoverSessions()
                .subscribe().with(
                        count -> log.infof("Session manager started with %d stored session(s)", count),
                        failure -> log.errorf(failure, "Session recovery failed, starting with an empty index"));
    }

    void onStop(@Observes ShutdownEvent event) {
        lifecycleController.shutdown();
    }

    @Scheduled(identity = "session-cleanup",
            every = "${session-manager.cleanup-interval:5m}",
            concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    Uni<Void> cleanupTick() {
        return runCleanup().replaceWithVoid();
    }

    @Scheduled(identity = "session-metrics",
            every = "${session-manager.metrics-interval:1m}",
            concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    Uni<Void> metricsTick() {
        return forEach("metrics", session -> session.getStatus() == SessionStatus.ACTIVE,
                lifecycleController::refreshMetrics)
                .replaceWithVoid();
    }

    @Scheduled(identity = "session-scaling",
            every = "${session-manager.scaling-interval:30s}",
            concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    Uni<Void> scalingTick() {
        return forEach("scaling",
                session -> session.getStatus() == SessionStatus.ACTIVE && session.getScaling().isEnabled(),
                lifecycleController::autoScale)
                .replaceWithVoid();
    }

    @Scheduled(identity = "session-snapshot",
            every = "${session-manager.snapshot-interval:10m}",
            concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    Uni<Void> snapshotTick() {
        return forEach("snapshot",
                session -> session.getStatus() == SessionStatus.ACTIVE && session.getPersistence().isEnabled(),
                lifecycleController::snapshotIfDue)
                .replaceWithVoid();
    }

    /**
     * One cleanup pass over every indexed session. Emits the number of purged
     * records.
     */
    public Uni<Integer> runCleanup() {
        return forEach("cleanup",
                session -> session.getStatus() == SessionStatus.HIBERNATING || session.getStatus().isAbsorbing(),
                lifecycleController::cleanup)
                .onItem().transform(results -> (int) results.stream().filter(Boolean.TRUE::equals).count())
                .onItem().invoke(purged -> {
                    if (purged > 0) {
                        log.infof("Cleanup purged %d session record(s)", purged);
                    }
                });
    }

    private <T> Uni<List<T>> forEach(String tick, Predicate<Session> eligible, Function<String, Uni<T>> action) {
        long startTime = System.currentTimeMillis();
        List<Uni<T>> work = new ArrayList<>();
        for (Session session : List.copyOf(sessionStore.cached())) {
            if (!eligible.test(session)) {
                continue;
            }
            String sessionId = session.getId();
            work.add(action.apply(sessionId)
                    .onFailure().recoverWithItem(e -> {
                        log.errorf(e, "%s tick failed for session %s", tick, sessionId);
                        return null;
                    }));
        }
        if (work.isEmpty()) {
            return Uni.createFrom().item(List.of());
        }
        return Uni.join().all(work).andFailFast()
                .onItem().invoke(() -> {
                    if (log.isDebugEnabled()) {
                        log.debugf("%s tick processed %d session(s) in %d ms", tick, work.size(),
                                System.currentTimeMillis() - startTime);
                    }
                });
    }
}
