package com.csg.airtel.csm4j.domain.service;

import com.csg.airtel.csm4j.domain.model.FleetMetrics;
import com.csg.airtel.csm4j.domain.model.HealthReport;
import com.csg.airtel.csm4j.domain.model.session.EventType;
import com.csg.airtel.csm4j.domain.model.session.ResourceAllocation;
import com.csg.airtel.csm4j.domain.model.session.Session;
import com.csg.airtel.csm4j.domain.model.session.SessionStatus;
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
import java.util.Collection;
import java.util.List;

/**
 * Fleet wide aggregates over the indexed sessions.
 */
@ApplicationScoped
public class FleetMetricsService {

    private static final Logger log = Logger.getLogger(FleetMetricsService.class);

    private final SessionStore sessionStore;
    private final SessionLifecycleController lifecycleController;
    private final Clock clock;
    private final int maxActiveSessions;
    private final double maxAvgResponseTimeMs;

    @Inject
    public FleetMetricsService(SessionStore sessionStore,
                               SessionLifecycleController lifecycleController,
                               Clock clock,
                               @ConfigProperty(name = "session-manager.health.max-active-sessions", defaultValue = "100") int maxActiveSessions,
                               @ConfigProperty(name = "session-manager.health.max-avg-response-time-ms", defaultValue = "1000") double maxAvgResponseTimeMs) {
        this.sessionStore = sessionStore;
        this.lifecycleController = lifecycleController;
        this.clock = clock;
        this.maxActiveSessions = maxActiveSessions;
        this.maxAvgResponseTimeMs = maxAvgResponseTimeMs;
    }

    public Uni<FleetMetrics> metrics() {
        return Uni.createFrom().item(() -> {
            Collection<Session> sessions = sessionStore.cached();
            List<Session> active = filter(sessions, SessionStatus.ACTIVE);
            long connections = 0;
            double cost = 0;
            long scalingEvents = 0;
            for (Session session : sessions) {
                connections += session.getMetrics().getActiveConnections();
                cost += session.getMetrics().getCostAccrued();
                if (session.getEvents() != null) {
                    // snapshot the list, appends happen on the session's queue
                    scalingEvents += List.copyOf(session.getEvents()).stream()
                            .filter(event -> event.getType() == EventType.SCALED)
                            .count();
                }
            }
            FleetMetrics metrics = new FleetMetrics(
                    sessions.size(),
                    active.size(),
                    filter(sessions, SessionStatus.HIBERNATING).size(),
                    connections,
                    cost,
                    averageResponseTime(active),
                    utilization(active),
                    scalingEvents,
                    uptimePercentage(sessions, clock.instant()));
            if (log.isDebugEnabled()) {
                log.debugf("Fleet metrics computed over %d sessions", sessions.size());
            }
            return metrics;
        });
    }

    /**
     * {@code degraded} when too many sessions are active or the average
     * response time of active sessions is above the configured maximum.
     */
    public Uni<HealthReport> health() {
        return Uni.createFrom().item(() -> {
            Collection<Session> sessions = sessionStore.cached();
            List<Session> active = filter(sessions, SessionStatus.ACTIVE);
            List<String> issues = new ArrayList<>();
            if (active.size() > maxActiveSessions) {
                issues.add("High number of active sessions");
            }
            if (averageResponseTime(active) > maxAvgResponseTimeMs) {
                issues.add("High average response time");
            }
            String status = issues.isEmpty() ? HealthReport.HEALTHY : HealthReport.DEGRADED;
            if (!issues.isEmpty()) {
                log.warnf("Session manager degraded: %s", issues);
            }
            return new HealthReport(status, active.size(), lifecycleController.hibernatedSessions().size(),
                    sessions.size(), issues);
        });
    }

    static double averageResponseTime(List<Session> active) {
        return active.stream()
                .mapToDouble(session -> session.getMetrics().getResponseTime())
                .average()
                .orElse(0);
    }

    static FleetMetrics.ResourceUtilization utilization(List<Session> active) {
        if (active.isEmpty()) {
            return new FleetMetrics.ResourceUtilization(0, 0, 0);
        }
        double cpu = 0;
        double memory = 0;
        double disk = 0;
        for (Session session : active) {
            ResourceAllocation resources = session.getResources();
            cpu += resources.getCpu().getUsage();
            memory += percent(resources.getMemory().getUsage(), resources.getMemory().getAllocated());
            disk += percent(resources.getDisk().getUsage(), resources.getDisk().getAllocated());
        }
        int count = active.size();
        return new FleetMetrics.ResourceUtilization(cpu / count, memory / count, disk / count);
    }

    static double uptimePercentage(Collection<Session> sessions, Instant now) {
        if (sessions.isEmpty()) {
            return 100;
        }
        long uptime = 0;
        long possible = 0;
        for (Session session : sessions) {
            uptime += session.getMetrics().getUptime();
            possible += Duration.between(session.getCreatedAt(), now).toMillis();
        }
        return possible > 0 ? uptime * 100.0 / possible : 100;
    }

    private static double percent(long usage, long allocated) {
        return allocated == 0 ? 0 : usage * 100.0 / allocated;
    }

    private static List<Session> filter(Collection<Session> sessions, SessionStatus status) {
        return sessions.stream().filter(session -> session.getStatus() == status).toList();
    }
}
