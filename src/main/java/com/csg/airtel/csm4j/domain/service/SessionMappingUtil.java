package com.csg.airtel.csm4j.domain.service;

import com.csg.airtel.csm4j.domain.model.CreateSessionRequest;
import com.csg.airtel.csm4j.domain.model.ResourceSpec;
import com.csg.airtel.csm4j.domain.model.SessionView;
import com.csg.airtel.csm4j.domain.model.session.*;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static com.csg.airtel.csm4j.domain.constant.SessionDefaults.*;

/**
 * Builds sessions from requests and projects them back out. Merges are shallow:
 * a non-null top-level field of the override replaces the base value.
 */
public class SessionMappingUtil {

    private SessionMappingUtil() {
    }

    public static Session newSession(CreateSessionRequest request, Instant now) {
        String sessionId = request.id() == null || request.id().isBlank()
                ? UUID.randomUUID().toString()
                : request.id();

        return Session.builder()
                .id(sessionId)
                .userId(request.userId() == null ? "" : request.userId())
                .containerId(request.containerId() == null ? "" : request.containerId())
                .sessionType(request.sessionType() == null ? SessionType.INTERACTIVE : request.sessionType())
                .status(SessionStatus.INITIALIZING)
                .createdAt(now)
                .lastActivity(now)
                .expiresAt(request.expiresAt())
                .configuration(mergeConfiguration(defaultConfiguration(), request.configuration()))
                .resources(initializeResources(request.resources()))
                .metrics(initializeMetrics(now))
                .connections(new ArrayList<>())
                .persistence(initializePersistence(request.persistence()))
                .scaling(mergeScaling(defaultScaling(), request.scaling()))
                .security(initializeSecurity(request.security()))
                .events(new ArrayList<>())
                .build();
    }

    public static SessionConfiguration defaultConfiguration() {
        return SessionConfiguration.builder()
                .maxIdleTime(MAX_IDLE_TIME_MS)
                .maxDuration(MAX_DURATION_MS)
                .autoHibernate(AUTO_HIBERNATE)
                .hibernateAfter(HIBERNATE_AFTER_MS)
                .autoScale(AUTO_SCALE)
                .persistData(PERSIST_DATA)
                .allowMultipleConnections(ALLOW_MULTIPLE_CONNECTIONS)
                .environment(new HashMap<>())
                .ports(new ArrayList<>(List.of(DEFAULT_PORT)))
                .volumes(new ArrayList<>())
                .network(NetworkPolicy.builder()
                        .bandwidth(NETWORK_BANDWIDTH)
                        .publicAccess(false)
                        .build())
                .build();
    }

    public static SessionConfiguration mergeConfiguration(SessionConfiguration base, SessionConfiguration overrides) {
        if (overrides == null) {
            return base;
        }
        return base.toBuilder()
                .maxIdleTime(pick(overrides.getMaxIdleTime(), base.getMaxIdleTime()))
                .maxDuration(pick(overrides.getMaxDuration(), base.getMaxDuration()))
                .autoHibernate(pick(overrides.getAutoHibernate(), base.getAutoHibernate()))
                .hibernateAfter(pick(overrides.getHibernateAfter(), base.getHibernateAfter()))
                .autoScale(pick(overrides.getAutoScale(), base.getAutoScale()))
                .persistData(pick(overrides.getPersistData(), base.getPersistData()))
                .allowMultipleConnections(pick(overrides.getAllowMultipleConnections(), base.getAllowMultipleConnections()))
                .environment(pick(overrides.getEnvironment(), base.getEnvironment()))
                .ports(pick(overrides.getPorts(), base.getPorts()))
                .volumes(pick(overrides.getVolumes(), base.getVolumes()))
                .network(pick(overrides.getNetwork(), base.getNetwork()))
                .build();
    }

    /**
     * Requested reservation with defaults filled in. Usage counters start at
     * zero and nothing is reserved yet.
     */
    public static ResourceAllocation initializeResources(ResourceSpec spec) {
        ResourceSpec.Quota cpu = spec == null ? null : spec.cpu();
        ResourceSpec.Quota memory = spec == null ? null : spec.memory();
        ResourceSpec.Quota disk = spec == null ? null : spec.disk();
        ResourceSpec.Quota gpu = spec == null ? null : spec.gpu();

        ResourceAllocation allocation = ResourceAllocation.builder()
                .cpu(CpuResource.builder()
                        .allocated(quota(cpu, true, CPU_ALLOCATED))
                        .limit(quota(cpu, false, CPU_LIMIT))
                        .build())
                .memory(MemoryResource.builder()
                        .allocated((long) quota(memory, true, MEMORY_ALLOCATED))
                        .limit((long) quota(memory, false, MEMORY_LIMIT))
                        .build())
                .disk(DiskResource.builder()
                        .allocated((long) quota(disk, true, DISK_ALLOCATED))
                        .limit((long) quota(disk, false, DISK_LIMIT))
                        .build())
                .network(new NetworkResource())
                .reserved(false)
                .build();

        if (gpu != null) {
            allocation.setGpu(GpuResource.builder()
                    .allocated((int) quota(gpu, true, 0))
                    .limit((int) quota(gpu, false, quota(gpu, true, 0)))
                    .build());
        }
        return allocation;
    }

    public static SessionMetrics initializeMetrics(Instant now) {
        return SessionMetrics.builder()
                .lastUpdated(now)
                .performance(PerformanceMetrics.builder()
                        .latency(LatencyPercentiles.zero())
                        .availability(100)
                        .build())
                .build();
    }

    public static SessionPersistence initializePersistence(SessionPersistence requested) {
        SessionPersistence persistence = SessionPersistence.builder()
                .enabled(false)
                .snapshotInterval(SNAPSHOT_INTERVAL_MS)
                .retentionPeriod(RETENTION_PERIOD_MS)
                .backupEnabled(false)
                .build();
        if (requested == null) {
            return persistence;
        }
        persistence.setEnabled(pick(requested.getEnabled(), persistence.getEnabled()));
        persistence.setSnapshotInterval(pick(requested.getSnapshotInterval(), persistence.getSnapshotInterval()));
        persistence.setRetentionPeriod(pick(requested.getRetentionPeriod(), persistence.getRetentionPeriod()));
        persistence.setBackupEnabled(pick(requested.getBackupEnabled(), persistence.getBackupEnabled()));
        persistence.setBackupInterval(requested.getBackupInterval());
        return persistence;
    }

    public static AutoScalingConfig defaultScaling() {
        return AutoScalingConfig.builder()
                .enabled(false)
                .minReplicas(MIN_REPLICAS)
                .maxReplicas(MAX_REPLICAS)
                .targetCpuUtilization(TARGET_CPU_UTILIZATION)
                .targetMemoryUtilization(TARGET_MEMORY_UTILIZATION)
                .scaleUpThreshold(SCALE_UP_THRESHOLD)
                .scaleDownThreshold(SCALE_DOWN_THRESHOLD)
                .cooldownPeriod(COOLDOWN_PERIOD_SECONDS)
                .metrics(new HashMap<>())
                .build();
    }

    /**
     * Shallow merge of a scaling patch. {@code currentReplicas} and
     * {@code lastScaledAt} are runtime state and never taken from the patch;
     * the replica count is clamped into the merged {@code [min, max]} range.
     */
    public static AutoScalingConfig mergeScaling(AutoScalingConfig base, AutoScalingConfig patch) {
        AutoScalingConfig merged = patch == null ? base : base.toBuilder()
                .enabled(pick(patch.getEnabled(), base.getEnabled()))
                .minReplicas(pick(patch.getMinReplicas(), base.getMinReplicas()))
                .maxReplicas(pick(patch.getMaxReplicas(), base.getMaxReplicas()))
                .targetCpuUtilization(pick(patch.getTargetCpuUtilization(), base.getTargetCpuUtilization()))
                .targetMemoryUtilization(pick(patch.getTargetMemoryUtilization(), base.getTargetMemoryUtilization()))
                .scaleUpThreshold(pick(patch.getScaleUpThreshold(), base.getScaleUpThreshold()))
                .scaleDownThreshold(pick(patch.getScaleDownThreshold(), base.getScaleDownThreshold()))
                .cooldownPeriod(pick(patch.getCooldownPeriod(), base.getCooldownPeriod()))
                .metrics(pick(patch.getMetrics(), base.getMetrics()))
                .build();
        Integer min = merged.getMinReplicas();
        Integer max = merged.getMaxReplicas();
        Integer current = merged.getCurrentReplicas();
        if (current == null) {
            current = min;
        }
        if (current != null && (min == null || max == null || min <= max)) {
            if (min != null && current < min) {
                current = min;
            }
            if (max != null && current > max) {
                current = max;
            }
        }
        merged.setCurrentReplicas(current);
        return merged;
    }

    public static SessionSecurity initializeSecurity(SessionSecurity requested) {
        SessionSecurity.Encryption encryption = requested == null ? null : requested.getEncryption();
        SessionSecurity.Authentication authentication = requested == null ? null : requested.getAuthentication();
        SessionSecurity.Authorization authorization = requested == null ? null : requested.getAuthorization();
        SessionSecurity.Networking networking = requested == null ? null : requested.getNetworking();
        SessionSecurity.Monitoring monitoring = requested == null ? null : requested.getMonitoring();

        return SessionSecurity.builder()
                .encryption(SessionSecurity.Encryption.builder()
                        .inTransit(encryption == null ? Boolean.TRUE : pick(encryption.getInTransit(), true))
                        .atRest(encryption == null ? Boolean.FALSE : pick(encryption.getAtRest(), false))
                        .algorithm(encryption == null ? ENCRYPTION_ALGORITHM : pick(encryption.getAlgorithm(), ENCRYPTION_ALGORITHM))
                        .build())
                .authentication(SessionSecurity.Authentication.builder()
                        .required(authentication == null ? Boolean.TRUE : pick(authentication.getRequired(), true))
                        .method(authentication == null ? AUTHENTICATION_METHOD : pick(authentication.getMethod(), AUTHENTICATION_METHOD))
                        .expiresAt(authentication == null ? null : authentication.getExpiresAt())
                        .build())
                .authorization(SessionSecurity.Authorization.builder()
                        .policies(authorization == null ? List.of() : pick(authorization.getPolicies(), List.of()))
                        .roles(authorization == null ? List.of() : pick(authorization.getRoles(), List.of()))
                        .permissions(authorization == null ? List.of() : pick(authorization.getPermissions(), List.of()))
                        .build())
                .networking(SessionSecurity.Networking.builder()
                        .firewallEnabled(networking == null ? Boolean.TRUE : pick(networking.getFirewallEnabled(), true))
                        .allowedPorts(networking == null ? List.of(80, 443, 8080) : pick(networking.getAllowedPorts(), List.of(80, 443, 8080)))
                        .blockedIPs(networking == null ? List.of() : pick(networking.getBlockedIPs(), List.of()))
                        .vpnRequired(networking == null ? Boolean.FALSE : pick(networking.getVpnRequired(), false))
                        .build())
                .monitoring(SessionSecurity.Monitoring.builder()
                        .auditLogging(monitoring == null ? Boolean.TRUE : pick(monitoring.getAuditLogging(), true))
                        .intrusionDetection(monitoring == null ? Boolean.FALSE : pick(monitoring.getIntrusionDetection(), false))
                        .anomalyDetection(monitoring == null ? Boolean.FALSE : pick(monitoring.getAnomalyDetection(), false))
                        .build())
                .build();
    }

    public static SessionEvent newEvent(EventType type, String description, EventSeverity severity,
                                        Map<String, Object> metadata, Instant now) {
        return SessionEvent.builder()
                .id(UUID.randomUUID().toString())
                .timestamp(now)
                .type(type)
                .description(description)
                .severity(severity)
                .metadata(metadata)
                .build();
    }

    public static SessionView toView(Session session, int historyLimit) {
        return new SessionView(
                session.getId(),
                session.getUserId(),
                session.getContainerId(),
                session.getSessionType(),
                session.getStatus(),
                session.getCreatedAt(),
                session.getLastActivity(),
                session.getExpiresAt(),
                copy(session.getConfiguration()),
                copy(session.getResources()),
                copy(session.getMetrics()),
                session.getPersistence() == null ? null : session.getPersistence().toBuilder().build(),
                copy(session.getScaling()),
                tail(session.getConnections(), historyLimit).stream().map(c -> c.toBuilder().build()).toList(),
                tail(session.getEvents(), historyLimit));
    }

    // views are serialized after the session's queue is released, so they never share mutable parts
    static SessionConfiguration copy(SessionConfiguration configuration) {
        if (configuration == null) {
            return null;
        }
        return configuration.toBuilder()
                .environment(configuration.getEnvironment() == null ? null : new HashMap<>(configuration.getEnvironment()))
                .ports(configuration.getPorts() == null ? null : new ArrayList<>(configuration.getPorts()))
                .volumes(configuration.getVolumes() == null ? null : new ArrayList<>(configuration.getVolumes()))
                .network(configuration.getNetwork() == null ? null : configuration.getNetwork().toBuilder().build())
                .build();
    }

    static ResourceAllocation copy(ResourceAllocation resources) {
        if (resources == null) {
            return null;
        }
        return resources.toBuilder()
                .cpu(resources.getCpu() == null ? null : resources.getCpu().toBuilder().build())
                .memory(resources.getMemory() == null ? null : resources.getMemory().toBuilder().build())
                .disk(resources.getDisk() == null ? null : resources.getDisk().toBuilder().build())
                .network(resources.getNetwork() == null ? null : resources.getNetwork().toBuilder().build())
                .gpu(resources.getGpu() == null ? null : resources.getGpu().toBuilder().build())
                .build();
    }

    static SessionMetrics copy(SessionMetrics metrics) {
        if (metrics == null) {
            return null;
        }
        return metrics.toBuilder()
                .performance(metrics.getPerformance() == null ? null : metrics.getPerformance().toBuilder().build())
                .build();
    }

    static AutoScalingConfig copy(AutoScalingConfig scaling) {
        if (scaling == null) {
            return null;
        }
        return scaling.toBuilder()
                .metrics(scaling.getMetrics() == null ? null : new HashMap<>(scaling.getMetrics()))
                .build();
    }

    static <T> List<T> tail(List<T> items, int limit) {
        if (items == null || items.isEmpty()) {
            return List.of();
        }
        int from = Math.max(0, items.size() - limit);
        return List.copyOf(items.subList(from, items.size()));
    }

    private static double quota(ResourceSpec.Quota quota, boolean allocated, double fallback) {
        if (quota == null) {
            return fallback;
        }
        Double value = allocated ? quota.allocated() : quota.limit();
        return value == null ? fallback : value;
    }

    private static <T> T pick(T override, T base) {
        return override != null ? override : base;
    }
}
