package com.csg.airtel.csm4j.domain.service;

import com.csg.airtel.csm4j.domain.model.ConnectionList;
import com.csg.airtel.csm4j.domain.model.CreateSessionRequest;
import com.csg.airtel.csm4j.domain.model.LifecycleResult;
import com.csg.airtel.csm4j.domain.model.ScaleRequest;
import com.csg.airtel.csm4j.domain.model.ScalingDecision;
import com.csg.airtel.csm4j.domain.model.SessionListResponse;
import com.csg.airtel.csm4j.domain.model.SessionQuery;
import com.csg.airtel.csm4j.domain.model.SessionView;
import com.csg.airtel.csm4j.domain.model.UpdateSessionRequest;
import com.csg.airtel.csm4j.domain.model.session.AutoScalingConfig;
import com.csg.airtel.csm4j.domain.model.session.EventSeverity;
import com.csg.airtel.csm4j.domain.model.session.EventType;
import com.csg.airtel.csm4j.domain.model.session.PerformanceMetrics;
import com.csg.airtel.csm4j.domain.model.session.RestorePoint;
import com.csg.airtel.csm4j.domain.model.session.Session;
import com.csg.airtel.csm4j.domain.model.session.SessionConnection;
import com.csg.airtel.csm4j.domain.model.session.SessionMetrics;
import com.csg.airtel.csm4j.domain.model.session.SessionStatus;
import com.csg.airtel.csm4j.domain.runtime.ContainerRuntime;
import com.csg.airtel.csm4j.domain.transport.TransportChannel;
import com.csg.airtel.csm4j.exception.BaseException;
import com.csg.airtel.csm4j.exception.ContainerInitException;
import com.csg.airtel.csm4j.exception.InvalidStateTransitionException;
import com.csg.airtel.csm4j.exception.SessionNotFoundException;
import com.csg.airtel.csm4j.exception.SnapshotNotFoundException;
import com.csg.airtel.csm4j.exception.ValidationException;
import com.csg.airtel.csm4j.external.clients.SessionStore;
import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import static com.csg.airtel.csm4j.domain.constant.SessionDefaults.CLOSE_NORMAL;
import static com.csg.airtel.csm4j.domain.constant.SessionDefaults.CLOSE_REASON_HIBERNATING;
import static com.csg.airtel.csm4j.domain.constant.SessionDefaults.CLOSE_REASON_TERMINATED;

/**
 * Owns the session state machine and orchestrates the resource accountant,
 * connection registry, snapshot manager and auto scaler.
 * <p>
 * Every public operation that reads, mutates and saves a session runs through
 * {@link SessionOperationQueue} for that session id. The {@code internal*}
 * methods assume they already run inside such an operation and never submit
 * to the queue themselves.
 */
@ApplicationScoped
public class SessionLifecycleController {

    private static final Logger log = Logger.getLogger(SessionLifecycleController.class);

    private final SessionStore sessionStore;
    private final ResourceAccountant resourceAccountant;
    private final ConnectionRegistry connectionRegistry;
    private final SnapshotManager snapshotManager;
    private final AutoScaler autoScaler;
    private final SessionMonitor sessionMonitor;
    private final SessionOperationQueue operationQueue;
    private final ContainerRuntime containerRuntime;
    private final Clock clock;
    private final int eventHistoryLimit;
    private final int viewHistoryLimit;
    private final int listDefaultLimit;
    private final Duration terminatedRetention;

    private final Set<String> hibernatedSessions = ConcurrentHashMap.newKeySet();

    @Inject
    public SessionLifecycleController(SessionStore sessionStore,
                                      ResourceAccountant resourceAccountant,
                                      ConnectionRegistry connectionRegistry,
                                      SnapshotManager snapshotManager,
                                      AutoScaler autoScaler,
                                      SessionMonitor sessionMonitor,
                                      SessionOperationQueue operationQueue,
                                      ContainerRuntime containerRuntime,
                                      Clock clock,
                                      @ConfigProperty(name = "session-manager.event-history-limit", defaultValue = "100") int eventHistoryLimit,
                                      @ConfigProperty(name = "session-manager.view-history-limit", defaultValue = "10") int viewHistoryLimit,
                                      @ConfigProperty(name = "session-manager.list-default-limit", defaultValue = "50") int listDefaultLimit,
                                      @ConfigProperty(name = "session-manager.terminated-retention", defaultValue = "24h") Duration terminatedRetention) {
        this.sessionStore = sessionStore;
        this.resourceAccountant = resourceAccountant;
        this.connectionRegistry = connectionRegistry;
        this.snapshotManager = snapshotManager;
        this.autoScaler = autoScaler;
        this.sessionMonitor = sessionMonitor;
        this.operationQueue = operationQueue;
        this.containerRuntime = containerRuntime;
        this.clock = clock;
        this.eventHistoryLimit = eventHistoryLimit;
        this.viewHistoryLimit = viewHistoryLimit;
        this.listDefaultLimit = listDefaultLimit;
        this.terminatedRetention = terminatedRetention;
    }

    // ------------------------------------------------------------------
    // operations
    // ------------------------------------------------------------------

    public Uni<SessionView> createSession(CreateSessionRequest request) {
        if (request == null || request.userId() == null || request.userId().isBlank()) {
            return Uni.createFrom().failure(new ValidationException("userId is required"));
        }
        Session session = SessionMappingUtil.newSession(request, clock.instant());
        try {
            resourceAccountant.validate(session.getResources());
        } catch (ValidationException e) {
            return Uni.createFrom().failure(e);
        }
        String sessionId = session.getId();
        return operationQueue.submit(sessionId, () -> sessionStore.load(sessionId)
                .onItem().transformToUni(existing -> {
                    if (existing != null) {
                        return Uni.createFrom().failure(new ValidationException("Session " + sessionId + " already exists"));
                    }
                    return internalCreate(session);
                }));
    }

    /**
     * Reading a session counts as activity, so a polled session is not
     * hibernated for lack of writes.
     */
    public Uni<SessionView> getSession(String sessionId) {
        return operationQueue.submit(sessionId, () -> require(sessionId)
                .onItem().transformToUni(session -> {
                    if (session.getStatus().isAbsorbing()) {
                        return Uni.createFrom().item(view(session));
                    }
                    session.setLastActivity(clock.instant());
                    return sessionStore.save(session)
                            .replaceWith(() -> view(session));
                }));
    }

    public Uni<SessionView> updateSession(String sessionId, UpdateSessionRequest request) {
        if (request == null || request.isEmpty()) {
            return Uni.createFrom().failure(new ValidationException("Update must contain configuration, resources or scaling"));
        }
        return operationQueue.submit(sessionId, () -> require(sessionId)
                .onItem().transformToUni(session -> internalUpdate(session, request)));
    }

    public Uni<LifecycleResult> hibernateSession(String sessionId) {
        return operationQueue.submit(sessionId, () -> require(sessionId)
                .onItem().transformToUni(session -> internalHibernate(session, "Hibernation requested")));
    }

    public Uni<LifecycleResult> resumeSession(String sessionId) {
        return operationQueue.submit(sessionId, () -> require(sessionId)
                .onItem().transformToUni(this::internalResume));
    }

    public Uni<LifecycleResult> terminateSession(String sessionId) {
        return operationQueue.submit(sessionId, () -> require(sessionId)
                .onItem().transformToUni(session -> internalTerminate(session, "Termination requested")));
    }

    public Uni<ScalingDecision> scaleSession(String sessionId, ScaleRequest request) {
        return operationQueue.submit(sessionId, () -> require(sessionId)
                .onItem().transformToUni(session -> internalScale(session, request == null ? ScaleRequest.automatic() : request)));
    }

    public Uni<RestorePoint> createSnapshot(String sessionId) {
        return operationQueue.submit(sessionId, () -> require(sessionId)
                .onItem().transformToUni(session -> {
                    if (session.getStatus() != SessionStatus.ACTIVE && session.getStatus() != SessionStatus.HIBERNATING) {
                        return Uni.createFrom().failure(
                                new InvalidStateTransitionException(sessionId, session.getStatus(), "snapshotted"));
                    }
                    return internalSnapshot(session);
                }));
    }

    public Uni<SessionView> restoreSession(String sessionId, String snapshotId) {
        return operationQueue.submit(sessionId, () -> require(sessionId)
                .onItem().transformToUni(session -> {
                    if (session.getStatus() != SessionStatus.ACTIVE && session.getStatus() != SessionStatus.HIBERNATING) {
                        return Uni.createFrom().failure(
                                new InvalidStateTransitionException(sessionId, session.getStatus(), "restored"));
                    }
                    return snapshotManager.restore(session, snapshotId)
                            .onItem().transformToUni(snapshot -> {
                                addEvent(session, EventType.RESTORED, "Session restored from snapshot " + snapshot.snapshotId(),
                                        EventSeverity.INFO, Map.of("snapshotId", snapshot.snapshotId()));
                                return sessionStore.save(session);
                            })
                            .replaceWith(() -> view(session));
                }));
    }

    /**
     * Attaches a live transport connection. A hibernating session is resumed
     * first; any other non-active session rejects the connection.
     */
    public Uni<SessionConnection> connect(String sessionId, TransportChannel channel) {
        return operationQueue.submit(sessionId, () -> require(sessionId)
                .onItem().transformToUni(session -> {
                    Uni<LifecycleResult> ready = session.getStatus() == SessionStatus.HIBERNATING
                            ? internalResume(session)
                            : Uni.createFrom().nullItem();
                    return ready.onItem().transformToUni(ignored -> {
                        if (session.getStatus() != SessionStatus.ACTIVE) {
                            return Uni.createFrom().<SessionConnection>failure(
                                    new InvalidStateTransitionException(sessionId, session.getStatus(), "connected"));
                        }
                        SessionConnection connection = connectionRegistry.register(session, channel);
                        return sessionStore.save(session).replaceWith(connection);
                    });
                }));
    }

    public Uni<ConnectionList> getConnections(String sessionId) {
        return operationQueue.submit(sessionId, () -> require(sessionId)
                .onItem().transform(session -> ConnectionList.of(connectionRegistry.activeConnections(session).stream()
                        .map(connection -> connection.toBuilder().build())
                        .toList())));
    }

    public Uni<SessionListResponse> listSessions(SessionQuery query) {
        SessionQuery effective = query == null ? new SessionQuery(null, null, null, null) : query;
        int limit = effective.limit() == null ? listDefaultLimit : effective.limit();
        if (limit <= 0) {
            return Uni.createFrom().failure(new ValidationException("limit must be positive"));
        }
        return sessionStore.loadAll()
                .onItem().transform(sessions -> {
                    List<Session> matched = sessions.stream()
                            .filter(effective::matches)
                            .sorted(Comparator.comparing(Session::getLastActivity,
                                    Comparator.nullsLast(Comparator.<Instant>reverseOrder())))
                            .toList();
                    List<SessionView> page = matched.stream()
                            .limit(limit)
                            .map(this::view)
                            .toList();
                    return new SessionListResponse(page, matched.size(), limit);
                });
    }

    public Set<String> hibernatedSessions() {
        return Collections.unmodifiableSet(hibernatedSessions);
    }

    // ------------------------------------------------------------------
    // reconciliation
    // ------------------------------------------------------------------

    /**
     * One monitor evaluation. Hibernate eligibility is applied first, then
     * termination is checked against the same instant. Emits {@code false}
     * once the session no longer needs watching.
     */
    public Uni<Boolean> monitorTick(String sessionId) {
        return operationQueue.submit(sessionId, () -> sessionStore.load(sessionId)
                .onItem().transformToUni(session -> {
                    if (session == null || session.getStatus() != SessionStatus.ACTIVE) {
                        return Uni.createFrom().item(Boolean.FALSE);
                    }
                    Instant now = clock.instant();
                    Uni<LifecycleResult> hibernated = LifecyclePolicy.shouldHibernate(session, now)
                            ? internalHibernate(session, "Idle for " + LifecyclePolicy.idle(session, now) + " ms")
                            : Uni.createFrom().nullItem();
                    return hibernated.onItem().transformToUni(ignored -> {
                        String reason = LifecyclePolicy.terminationReason(session, now);
                        if (reason == null) {
                            return Uni.createFrom().item(session.getStatus() == SessionStatus.ACTIVE);
                        }
                        return internalTerminate(session, reason).replaceWith(Boolean.FALSE);
                    });
                }));
    }

    /**
     * Samples usage and recomputes derived telemetry for an active session.
     */
    public Uni<Void> refreshMetrics(String sessionId) {
        return operationQueue.submit(sessionId, () -> sessionStore.load(sessionId)
                .onItem().transformToUni(session -> {
                    if (session == null || session.getStatus() != SessionStatus.ACTIVE) {
                        return Uni.createFrom().voidItem();
                    }
                    return containerRuntime.sampleUsage(session)
                            .onItem().transformToUni(sample -> {
                                resourceAccountant.recordUsage(session, sample);
                                Instant now = clock.instant();
                                SessionMetrics metrics = session.getMetrics();
                                long uptime = Duration.between(session.getCreatedAt(), now).toMillis();
                                metrics.setUptime(uptime);
                                metrics.setResponseTime(sample.responseTimeMs());
                                metrics.setLastUpdated(now);
                                PerformanceMetrics performance = metrics.getPerformance();
                                if (performance != null && uptime > 0) {
                                    performance.setThroughput(metrics.getTotalRequests() * 1000.0 / uptime);
                                }
                                return sessionStore.save(session);
                            });
                }));
    }

    /**
     * Auto-scaling pass for one session. Only active sessions with scaling
     * enabled are evaluated.
     */
    public Uni<ScalingDecision> autoScale(String sessionId) {
        return operationQueue.submit(sessionId, () -> sessionStore.load(sessionId)
                .onItem().transformToUni(session -> {
                    if (session == null || session.getStatus() != SessionStatus.ACTIVE
                            || !session.getScaling().isEnabled()) {
                        return Uni.createFrom().nullItem();
                    }
                    return internalScale(session, ScaleRequest.automatic());
                }));
    }

    /**
     * Snapshots the session if persistence is on and the interval has passed.
     */
    public Uni<RestorePoint> snapshotIfDue(String sessionId) {
        return operationQueue.submit(sessionId, () -> sessionStore.load(sessionId)
                .onItem().transformToUni(session -> {
                    if (session == null || session.getStatus() != SessionStatus.ACTIVE
                            || !snapshotManager.isDue(session, clock.instant())) {
                        return Uni.createFrom().nullItem();
                    }
                    return internalSnapshot(session);
                }));
    }

    /**
     * Cleanup pass for one session: a hibernating session past its limits is
     * terminated, a terminated or failed one older than the retention window
     * is purged. Emits true when the record was purged.
     */
    public Uni<Boolean> cleanup(String sessionId) {
        return operationQueue.submit(sessionId, () -> sessionStore.load(sessionId)
                .onItem().transformToUni(session -> {
                    if (session == null) {
                        return Uni.createFrom().item(Boolean.FALSE);
                    }
                    Instant now = clock.instant();
                    if (session.getStatus() == SessionStatus.HIBERNATING) {
                        String reason = LifecyclePolicy.terminationReason(session, now);
                        if (reason == null) {
                            return Uni.createFrom().item(Boolean.FALSE);
                        }
                        return internalTerminate(session, reason).replaceWith(Boolean.FALSE);
                    }
                    if (session.getStatus().isAbsorbing()
                            && session.getLastActivity().isBefore(now.minus(terminatedRetention))) {
                        return sessionStore.delete(sessionId)
                                .onItem().invoke(() -> {
                                    hibernatedSessions.remove(sessionId);
                                    log.infof("Purged %s session %s", session.getStatus().value(), sessionId);
                                })
                                .replaceWith(Boolean.TRUE);
                    }
                    return Uni.createFrom().item(Boolean.FALSE);
                }));
    }

    /**
     * Rebuilds in-memory state from the store: hibernating sessions are
     * tracked, active ones are terminated when due and monitored otherwise,
     * and sessions interrupted during creation are marked failed.
     */
    public Uni<Integer> recoverSessions() {
        return sessionStore.loadAll()
                .onItem().transformToUni(sessions -> {
                    sessionStore.index(sessions);
                    if (sessions.isEmpty()) {
                        return Uni.createFrom().item(0);
                    }
                    List<Uni<Void>> recoveries = new ArrayList<>(sessions.size());
                    for (Session stored : sessions) {
                        String sessionId = stored.getId();
                        recoveries.add(operationQueue.submit(sessionId, () -> sessionStore.load(sessionId)
                                        .onItem().transformToUni(this::recover))
                                .onFailure().recoverWithUni(e -> {
                                    log.errorf(e, "Failed to recover session %s", sessionId);
                                    return Uni.createFrom().voidItem();
                                }));
                    }
                    return Uni.join().all(recoveries).andFailFast()
                            .replaceWith(sessions.size());
                })
                .onItem().invoke(count -> log.infof("Recovered %d session(s), %d hibernating, %d monitored",
                        count, hibernatedSessions.size(), sessionMonitor.size()));
    }

    public void shutdown() {
        sessionMonitor.stopAll();
        log.infof("Session lifecycle controller stopped");
    }

    // ------------------------------------------------------------------
    // internal, always inside a queued operation for the session
    // ------------------------------------------------------------------

    private Uni<SessionView> internalCreate(Session session) {
        String sessionId = session.getId();
        addEvent(session, EventType.CREATED, "Session created", EventSeverity.INFO,
                Map.of("sessionType", session.getSessionType().value(), "userId", session.getUserId()));
        return sessionStore.save(session)
                .onItem().transformToUni(ignored -> resourceAccountant.allocate(session))
                .onItem().transformToUni(ignored -> containerRuntime.initializeContainer(session)
                        .onFailure(failure -> !(failure instanceof BaseException))
                        .transform(e -> new ContainerInitException("Container initialization failed for session " + sessionId, e)))
                .onItem().transformToUni(ignored -> {
                    transition(session, SessionStatus.ACTIVE);
                    addEvent(session, EventType.STARTED, "Session started", EventSeverity.INFO, Map.of());
                    return sessionStore.save(session);
                })
                .onItem().transform(ignored -> {
                    startMonitor(sessionId);
                    log.infof("Session %s created for user %s", sessionId, session.getUserId());
                    return view(session);
                })
                .onFailure().call(e -> markFailed(session, e));
    }

    private Uni<Void> markFailed(Session session, Throwable cause) {
        log.errorf(cause, "Session %s failed during creation", session.getId());
        if (session.getStatus() == SessionStatus.ACTIVE) {
            // the active write never reached the store
            session.setStatus(SessionStatus.INITIALIZING);
        }
        if (session.getStatus() == SessionStatus.INITIALIZING) {
            transition(session, SessionStatus.FAILED);
        }
        addEvent(session, EventType.FAILED, "Session creation failed: " + cause.getMessage(), EventSeverity.ERROR,
                Map.of("error", cause.getClass().getSimpleName()));
        return resourceAccountant.release(session)
                .onFailure().invoke(e -> log.errorf(e, "Failed to release partial allocation of session %s", session.getId()))
                .onFailure().recoverWithNull()
                .onItem().transformToUni(ignored -> sessionStore.save(session))
                .onFailure().recoverWithUni(e -> {
                    log.errorf(e, "Failed to persist failed state of session %s", session.getId());
                    return Uni.createFrom().voidItem();
                });
    }

    private Uni<SessionView> internalUpdate(Session session, UpdateSessionRequest request) {
        if (session.getStatus().isAbsorbing()) {
            return Uni.createFrom().failure(new InvalidStateTransitionException(session.getId(), session.getStatus(), "updated"));
        }
        AutoScalingConfig scaling;
        try {
            scaling = SessionMappingUtil.mergeScaling(session.getScaling(), request.scaling());
            if (scaling.getMinReplicas() != null && scaling.getMaxReplicas() != null
                    && scaling.getMinReplicas() > scaling.getMaxReplicas()) {
                throw new ValidationException("minReplicas must not exceed maxReplicas");
            }
        } catch (ValidationException e) {
            return Uni.createFrom().failure(e);
        }
        int previousReplicas = session.getScaling().getCurrentReplicas() == null ? 0 : session.getScaling().getCurrentReplicas();
        int mergedReplicas = scaling.getCurrentReplicas() == null ? 0 : scaling.getCurrentReplicas();
        Uni<Void> replicas = session.getStatus() == SessionStatus.ACTIVE && previousReplicas != mergedReplicas
                ? containerRuntime.scaleReplicas(session.getId(), previousReplicas, mergedReplicas)
                : Uni.createFrom().voidItem();
        return resourceAccountant.resize(session, request.resources())
                .onItem().transformToUni(ignored -> replicas)
                .onItem().transformToUni(ignored -> {
                    Instant now = clock.instant();
                    session.setConfiguration(SessionMappingUtil.mergeConfiguration(session.getConfiguration(), request.configuration()));
                    session.setScaling(scaling);
                    session.setLastActivity(now);

                    Map<String, Object> changed = new LinkedHashMap<>();
                    changed.put("configuration", request.configuration() != null);
                    changed.put("resources", request.resources() != null);
                    changed.put("scaling", request.scaling() != null);
                    addEvent(session, EventType.SCALED, "Session configuration updated", EventSeverity.INFO, changed);
                    scaling.setLastScaledAt(now);
                    return sessionStore.save(session);
                })
                .onItem().transform(ignored -> {
                    log.infof("Session %s updated", session.getId());
                    return view(session);
                });
    }

    private Uni<LifecycleResult> internalHibernate(Session session, String reason) {
        String sessionId = session.getId();
        if (session.getStatus() == SessionStatus.HIBERNATING) {
            return Uni.createFrom().item(LifecycleResult.unchanged(view(session), "Session already hibernating"));
        }
        if (session.getStatus() != SessionStatus.ACTIVE) {
            return Uni.createFrom().failure(
                    new InvalidStateTransitionException(sessionId, session.getStatus(), SessionStatus.HIBERNATING));
        }
        Uni<Void> snapshot = session.getPersistence().isEnabled()
                ? internalSnapshot(session).replaceWithVoid()
                : Uni.createFrom().voidItem();
        return snapshot
                .onItem().transformToUni(ignored -> connectionRegistry.closeAll(session, CLOSE_NORMAL, CLOSE_REASON_HIBERNATING))
                .onItem().transformToUni(closed -> resourceAccountant.release(session)
                        .onItem().transformToUni(ignored -> {
                            transition(session, SessionStatus.HIBERNATING);
                            addEvent(session, EventType.HIBERNATED, reason, EventSeverity.INFO,
                                    Map.of("closedConnections", closed));
                            hibernatedSessions.add(sessionId);
                            sessionMonitor.stop(sessionId);
                            return sessionStore.save(session);
                        }))
                .onItem().transform(ignored -> {
                    log.infof("Session %s hibernated: %s", sessionId, reason);
                    return LifecycleResult.changed(view(session), "Session hibernated");
                })
                .onFailure().invoke(e -> sessionStore.evict(sessionId));
    }

    private Uni<LifecycleResult> internalResume(Session session) {
        String sessionId = session.getId();
        if (session.getStatus() != SessionStatus.HIBERNATING) {
            return Uni.createFrom().item(LifecycleResult.unchanged(view(session), "Session is not hibernating"));
        }
        return snapshotManager.restore(session)
                .onItem().invoke(snapshot -> {
                    if (snapshot != null) {
                        addEvent(session, EventType.RESTORED, "Session restored from snapshot " + snapshot.snapshotId(),
                                EventSeverity.INFO, Map.of("snapshotId", snapshot.snapshotId()));
                    }
                })
                .onFailure(SnapshotNotFoundException.class).recoverWithItem(e -> {
                    log.warnf("Resuming session %s without restore: %s", sessionId, e.getMessage());
                    addEvent(session, EventType.RESTORED, "Restore point unavailable, resumed without restore",
                            EventSeverity.WARNING, Map.of());
                    return null;
                })
                .onItem().transformToUni(ignored -> resourceAccountant.allocate(session))
                .onItem().transformToUni(ignored -> containerRuntime.initializeContainer(session)
                        .onFailure(failure -> !(failure instanceof BaseException))
                        .transform(e -> new ContainerInitException("Container initialization failed for session " + sessionId, e))
                        .onFailure().call(e -> resourceAccountant.release(session)
                                .onFailure().recoverWithNull()))
                .onItem().transformToUni(ignored -> {
                    transition(session, SessionStatus.ACTIVE);
                    session.setLastActivity(clock.instant());
                    addEvent(session, EventType.RESUMED, "Session resumed", EventSeverity.INFO, Map.of());
                    hibernatedSessions.remove(sessionId);
                    return sessionStore.save(session);
                })
                .onItem().transform(ignored -> {
                    startMonitor(sessionId);
                    log.infof("Session %s resumed", sessionId);
                    return LifecycleResult.changed(view(session), "Session resumed");
                })
                .onFailure().invoke(e -> sessionStore.evict(sessionId));
    }

    private Uni<LifecycleResult> internalTerminate(Session session, String reason) {
        String sessionId = session.getId();
        SessionStatus status = session.getStatus();
        if (status == SessionStatus.TERMINATED || status == SessionStatus.FAILED) {
            return Uni.createFrom().item(LifecycleResult.unchanged(view(session), "Session already " + status.value()));
        }
        if (status == SessionStatus.INITIALIZING) {
            return Uni.createFrom().failure(new InvalidStateTransitionException(sessionId, status, SessionStatus.TERMINATING));
        }
        if (status != SessionStatus.TERMINATING) {
            transition(session, SessionStatus.TERMINATING);
        }
        sessionMonitor.stop(sessionId);
        return connectionRegistry.closeAll(session, CLOSE_NORMAL, CLOSE_REASON_TERMINATED)
                .onItem().transformToUni(closed -> resourceAccountant.release(session)
                        .onItem().transformToUni(ignored -> {
                            transition(session, SessionStatus.TERMINATED);
                            session.setLastActivity(clock.instant());
                            addEvent(session, EventType.TERMINATED, reason, EventSeverity.INFO,
                                    Map.of("closedConnections", closed));
                            hibernatedSessions.remove(sessionId);
                            return sessionStore.save(session);
                        }))
                .onItem().transform(ignored -> {
                    log.infof("Session %s terminated: %s", sessionId, reason);
                    return LifecycleResult.changed(view(session), "Session terminated");
                });
    }

    private Uni<ScalingDecision> internalScale(Session session, ScaleRequest request) {
        AutoScalingConfig scaling = session.getScaling();
        if (session.getStatus() != SessionStatus.ACTIVE) {
            int replicas = scaling.getCurrentReplicas() == null ? 0 : scaling.getCurrentReplicas();
            return Uni.createFrom().item(ScalingDecision.maintain(
                    "Session is " + session.getStatus().value(), replicas, 1.0, Map.of()));
        }
        Instant now = clock.instant();
        ScalingDecision decision = autoScaler.decide(session, request, now);
        if (!decision.requiresAction()) {
            if (log.isDebugEnabled()) {
                log.debugf("Session %s maintains %d replicas: %s", session.getId(), decision.currentReplicas(), decision.reason());
            }
            return Uni.createFrom().item(decision);
        }
        return autoScaler.execute(session, decision)
                .onItem().transformToUni(ignored -> {
                    Map<String, Object> metadata = new LinkedHashMap<>();
                    metadata.put("action", decision.action().value());
                    metadata.put("from", decision.currentReplicas());
                    metadata.put("to", decision.targetReplicas());
                    addEvent(session, EventType.SCALED, decision.reason(), EventSeverity.INFO, metadata);
                    scaling.setLastScaledAt(now);
                    return sessionStore.save(session);
                })
                .replaceWith(decision);
    }

    private Uni<RestorePoint> internalSnapshot(Session session) {
        return snapshotManager.createSnapshot(session)
                .onItem().transformToUni(restorePoint -> {
                    addEvent(session, EventType.SNAPSHOT, "Snapshot " + restorePoint.id() + " created", EventSeverity.INFO,
                            Map.of("snapshotId", restorePoint.id(), "size", restorePoint.size()));
                    return sessionStore.save(session).replaceWith(restorePoint);
                });
    }

    private Uni<Void> recover(Session session) {
        if (session == null) {
            return Uni.createFrom().voidItem();
        }
        String sessionId = session.getId();
        SessionStatus status = session.getStatus();
        if (status == SessionStatus.HIBERNATING) {
            hibernatedSessions.add(sessionId);
            return Uni.createFrom().voidItem();
        }
        if (status == SessionStatus.INITIALIZING) {
            return markFailed(session, new IllegalStateException("Creation interrupted by restart"));
        }
        if (status != SessionStatus.ACTIVE && status != SessionStatus.TERMINATING) {
            return Uni.createFrom().voidItem();
        }
        String reason = LifecyclePolicy.terminationReason(session, clock.instant());
        if (reason != null || status == SessionStatus.TERMINATING) {
            return internalTerminate(session, reason == null ? "Termination interrupted" : reason).replaceWithVoid();
        }
        return resourceAccountant.allocate(session)
                .onFailure().invoke(e -> log.warnf("Reservation of recovered session %s not restored: %s",
                        sessionId, e.getMessage()))
                .onFailure().recoverWithNull()
                .onItem().transformToUni(ignored -> sessionStore.save(session))
                .onItem().invoke(() -> startMonitor(sessionId));
    }

    // ------------------------------------------------------------------
    // helpers
    // ------------------------------------------------------------------

    private Uni<Session> require(String sessionId) {
        return sessionStore.load(sessionId)
                .onItem().ifNull().failWith(() -> new SessionNotFoundException(sessionId));
    }

    private void transition(Session session, SessionStatus target) {
        SessionStatus current = session.getStatus();
        if (!current.canTransitionTo(target)) {
            throw new InvalidStateTransitionException(session.getId(), current, target);
        }
        session.setStatus(target);
        log.infof("Session %s: %s -> %s", session.getId(), current.value(), target.value());
    }

    private void addEvent(Session session, EventType type, String description, EventSeverity severity,
                        Map<String, Object> metadata) {
        session.appendEvent(SessionMappingUtil.newEvent(type, description, severity, metadata, clock.instant()),
                eventHistoryLimit);
    }

    private void startMonitor(String sessionId) {
        sessionMonitor.start(sessionId, this::monitorTick);
    }

    private SessionView view(Session session) {
        return SessionMappingUtil.toView(session, viewHistoryLimit);
    }
}
