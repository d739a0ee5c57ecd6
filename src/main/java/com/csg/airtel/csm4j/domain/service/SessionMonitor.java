package com.csg.airtel.csm4j.domain.service;

import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import io.smallrye.mutiny.subscription.Cancellable;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;

/**
 * One tick stream per active session. The handler returns {@code false} when
 * the session should no longer be watched, which cancels the stream.
 */
@ApplicationScoped
public class SessionMonitor {

    private static final Logger log = Logger.getLogger(SessionMonitor.class);

    private final Duration interval;
    private final Map<String, Cancellable> monitors = new ConcurrentHashMap<>();

    @Inject
    public SessionMonitor(@ConfigProperty(name = "session-manager.monitor-interval", defaultValue = "30s") Duration interval) {
        this.interval = interval;
    }

    /**
     * Starts watching the session, replacing any monitor it already has.
     */
    public void start(String sessionId, Function<String, Uni<Boolean>> tick) {
        AtomicReference<Cancellable> self = new AtomicReference<>();
        Cancellable cancellable = Multi.createFrom().ticks()
                .startingAfter(interval)
                .every(interval)
                .onOverflow().drop()
                .onItem().transformToUniAndConcatenate(ignored -> tick.apply(sessionId)
                        .onFailure().recoverWithItem(e -> {
                            log.errorf(e, "Monitor tick failed for session %s", sessionId);
                            return Boolean.TRUE;
                        }))
                .subscribe().with(keep -> {
                    if (!Boolean.TRUE.equals(keep)) {
                        retire(sessionId, self.get());
                    }
                }, failure -> log.errorf(failure, "Monitor stream of session %s ended", sessionId));

        self.set(cancellable);
        Cancellable previous = monitors.put(sessionId, cancellable);
        if (previous != null) {
            previous.cancel();
        }
        if (log.isDebugEnabled()) {
            log.debugf("Monitor started for session %s every %s", sessionId, interval);
        }
    }

    public void stop(String sessionId) {
        Cancellable cancellable = monitors.remove(sessionId);
        if (cancellable != null) {
            cancellable.cancel();
            if (log.isDebugEnabled()) {
                log.debugf("Monitor stopped for session %s", sessionId);
            }
        }
    }

    // a newer monitor for the same session is left running
    private void retire(String sessionId, Cancellable cancellable) {
        if (cancellable == null) {
            return;
        }
        cancellable.cancel();
        if (monitors.remove(sessionId, cancellable) && log.isDebugEnabled()) {
            log.debugf("Monitor for session %s ended itself", sessionId);
        }
    }

    public void stopAll() {
        monitors.keySet().forEach(this::stop);
        log.infof("All session monitors stopped");
    }

    public boolean isMonitoring(String sessionId) {
        return monitors.containsKey(sessionId);
    }

    public int size() {
        return monitors.size();
    }
}
