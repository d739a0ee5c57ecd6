package com.csg.airtel.csm4j.external.runtime;

import com.csg.airtel.csm4j.domain.model.UsageSample;
import com.csg.airtel.csm4j.domain.model.session.ResourceAllocation;
import com.csg.airtel.csm4j.domain.model.session.Session;
import com.csg.airtel.csm4j.domain.runtime.ContainerRuntime;
import com.csg.airtel.csm4j.exception.ResourceExhaustedException;
import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Single-node runtime used when no real container platform is wired in.
 * Keeps a capacity ledger so that the aggregate reservation of all sessions
 * never exceeds the configured ceiling, and produces sampled usage readings.
 */
@ApplicationScoped
public class LocalContainerRuntime implements ContainerRuntime {

    private static final Logger log = Logger.getLogger(LocalContainerRuntime.class);

    private final double cpuCapacity;
    private final long memoryCapacity;
    private final long diskCapacity;

    private final Map<String, Reservation> reservations = new HashMap<>();
    private final Map<String, Integer> replicas = new HashMap<>();

    @Inject
    public LocalContainerRuntime(
            @ConfigProperty(name = "session-manager.capacity.cpu-cores", defaultValue = "64") double cpuCapacity,
            @ConfigProperty(name = "session-manager.capacity.memory-bytes", defaultValue = "137438953472") long memoryCapacity,
            @ConfigProperty(name = "session-manager.capacity.disk-bytes", defaultValue = "2199023255552") long diskCapacity) {
        this.cpuCapacity = cpuCapacity;
        this.memoryCapacity = memoryCapacity;
        this.diskCapacity = diskCapacity;
    }

    @Override
    public Uni<Void> allocateResources(String sessionId, ResourceAllocation requested) {
        return Uni.createFrom().item(() -> {
            Reservation wanted = new Reservation(
                    requested.getCpu().getAllocated(),
                    requested.getMemory().getAllocated(),
                    requested.getDisk().getAllocated());
            reserve(sessionId, wanted);
            return null;
        }).replaceWithVoid();
    }

    @Override
    public Uni<Void> releaseResources(String sessionId) {
        return Uni.createFrom().item(() -> {
            Reservation released;
            synchronized (reservations) {
                released = reservations.remove(sessionId);
                replicas.remove(sessionId);
            }
            if (released != null) {
                log.infof("Released reservation for session %s: cpu=%.2f, memory=%d, disk=%d",
                        sessionId, released.cpu(), released.memory(), released.disk());
            }
            return null;
        }).replaceWithVoid();
    }

    @Override
    public Uni<Void> initializeContainer(Session session) {
        log.infof("Initializing container %s for session %s (%s)",
                session.getContainerId(), session.getId(), session.getSessionType().value());
        return Uni.createFrom().voidItem();
    }

    @Override
    public Uni<Void> scaleReplicas(String sessionId, int currentReplicas, int targetReplicas) {
        return Uni.createFrom().item(() -> {
            synchronized (reservations) {
                replicas.put(sessionId, targetReplicas);
            }
            log.infof("Session %s replicas %d -> %d", sessionId, currentReplicas, targetReplicas);
            return null;
        }).replaceWithVoid();
    }

    @Override
    public Uni<UsageSample> sampleUsage(Session session) {
        ThreadLocalRandom random = ThreadLocalRandom.current();
        ResourceAllocation resources = session.getResources();
        long memoryAllocated = resources.getMemory().getAllocated();
        long diskAllocated = resources.getDisk().getAllocated();
        return Uni.createFrom().item(new UsageSample(
                random.nextDouble() * 100,
                (long) (memoryAllocated * (0.3 + random.nextDouble() * 0.4)),
                0L,
                (long) (diskAllocated * (0.1 + random.nextDouble() * 0.3)),
                random.nextLong(0, 500),
                random.nextLong(0, 1024 * 1024),
                random.nextLong(0, 1024 * 1024),
                50 + random.nextDouble() * 100));
    }

    public int replicasOf(String sessionId) {
        synchronized (reservations) {
            return replicas.getOrDefault(sessionId, 1);
        }
    }

    public boolean holdsReservation(String sessionId) {
        synchronized (reservations) {
            return reservations.containsKey(sessionId);
        }
    }

    private void reserve(String sessionId, Reservation wanted) {
        synchronized (reservations) {
            double cpu = wanted.cpu();
            long memory = wanted.memory();
            long disk = wanted.disk();
            for (Map.Entry<String, Reservation> entry : reservations.entrySet()) {
                if (entry.getKey().equals(sessionId)) {
                    continue;
                }
                cpu += entry.getValue().cpu();
                memory += entry.getValue().memory();
                disk += entry.getValue().disk();
            }
            if (cpu > cpuCapacity) {
                throw new ResourceExhaustedException(String.format(
                        "CPU capacity exceeded for session %s: %.2f of %.2f cores", sessionId, cpu, cpuCapacity));
            }
            if (memory > memoryCapacity) {
                throw new ResourceExhaustedException(String.format(
                        "Memory capacity exceeded for session %s: %d of %d bytes", sessionId, memory, memoryCapacity));
            }
            if (disk > diskCapacity) {
                throw new ResourceExhaustedException(String.format(
                        "Disk capacity exceeded for session %s: %d of %d bytes", sessionId, disk, diskCapacity));
            }
            reservations.put(sessionId, wanted);
        }
        log.infof("Reserved for session %s: cpu=%.2f, memory=%d, disk=%d",
                sessionId, wanted.cpu(), wanted.memory(), wanted.disk());
    }

    private record Reservation(double cpu, long memory, long disk) {
    }
}
