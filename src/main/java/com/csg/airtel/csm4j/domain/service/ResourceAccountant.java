package com.csg.airtel.csm4j.domain.service;

import com.csg.airtel.csm4j.domain.model.ResourceSpec;
import com.csg.airtel.csm4j.domain.model.UsageSample;
import com.csg.airtel.csm4j.domain.model.session.CpuResource;
import com.csg.airtel.csm4j.domain.model.session.DiskResource;
import com.csg.airtel.csm4j.domain.model.session.GpuResource;
import com.csg.airtel.csm4j.domain.model.session.MemoryResource;
import com.csg.airtel.csm4j.domain.model.session.NetworkResource;
import com.csg.airtel.csm4j.domain.model.session.ResourceAllocation;
import com.csg.airtel.csm4j.domain.model.session.Session;
import com.csg.airtel.csm4j.domain.runtime.ContainerRuntime;
import com.csg.airtel.csm4j.exception.BaseException;
import com.csg.airtel.csm4j.exception.ResourceExhaustedException;
import com.csg.airtel.csm4j.exception.ValidationException;
import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

/**
 * Sole writer of {@link Session#getResources()}. Every mutation keeps
 * {@code allocated <= limit} for each resource kind; usage is telemetry and
 * only drives the throttled flags.
 */
@ApplicationScoped
public class ResourceAccountant {

    private static final Logger log = Logger.getLogger(ResourceAccountant.class);

    private final ContainerRuntime containerRuntime;

    @Inject
    public ResourceAccountant(ContainerRuntime containerRuntime) {
        this.containerRuntime = containerRuntime;
    }

    /**
     * Reserves the session's requested resources with the runtime. Any runtime
     * rejection surfaces as {@link ResourceExhaustedException}.
     */
    public Uni<Void> allocate(Session session) {
        ResourceAllocation resources = session.getResources();
        try {
            validate(resources);
        } catch (ValidationException e) {
            return Uni.createFrom().failure(e);
        }
        return containerRuntime.allocateResources(session.getId(), resources)
                .onItem().invoke(() -> {
                    resources.setReserved(true);
                    log.infof("Resources allocated for session %s: cpu=%.2f/%.2f, memory=%d/%d, disk=%d/%d",
                            session.getId(),
                            resources.getCpu().getAllocated(), resources.getCpu().getLimit(),
                            resources.getMemory().getAllocated(), resources.getMemory().getLimit(),
                            resources.getDisk().getAllocated(), resources.getDisk().getLimit());
                })
                .onFailure().transform(e -> asExhausted(session.getId(), e));
    }

    /**
     * Frees the reservation. Completes immediately when nothing is reserved.
     */
    public Uni<Void> release(Session session) {
        ResourceAllocation resources = session.getResources();
        if (resources == null || !resources.isReserved()) {
            if (log.isDebugEnabled()) {
                log.debugf("Session %s holds no reservation, release skipped", session.getId());
            }
            return Uni.createFrom().voidItem();
        }
        return containerRuntime.releaseResources(session.getId())
                .onItem().invoke(() -> {
                    resources.setReserved(false);
                    resources.getCpu().setUsage(0);
                    resources.getCpu().setThrottled(false);
                    resources.getMemory().setThrottled(false);
                    resources.getDisk().setThrottled(false);
                    log.infof("Resources released for session %s", session.getId());
                });
    }

    /**
     * Applies a resource change. The candidate allocation is validated before
     * anything is touched, and a session holding a reservation has it replaced
     * with the runtime first; the session only sees the new values once both
     * steps succeed.
     */
    public Uni<Void> resize(Session session, ResourceSpec spec) {
        if (spec == null) {
            return Uni.createFrom().voidItem();
        }
        ResourceAllocation current = session.getResources();
        ResourceAllocation candidate;
        try {
            candidate = applySpec(current, spec);
            validate(candidate);
        } catch (ValidationException e) {
            return Uni.createFrom().failure(e);
        }
        Uni<Void> reservation = current.isReserved()
                ? containerRuntime.allocateResources(session.getId(), candidate)
                        .onFailure().transform(e -> asExhausted(session.getId(), e))
                : Uni.createFrom().voidItem();
        return reservation.onItem().invoke(() -> {
            session.setResources(candidate);
            log.infof("Resources resized for session %s", session.getId());
        });
    }

    /**
     * Records one usage reading. CPU usage is a percentage of the allocated
     * cores, so the cpu is throttled when the cores actually used exceed the
     * limit.
     */
    public void recordUsage(Session session, UsageSample sample) {
        ResourceAllocation resources = session.getResources();

        CpuResource cpu = resources.getCpu();
        cpu.setUsage(sample.cpuPercent());
        cpu.setThrottled(sample.cpuPercent() * cpu.getAllocated() / 100 > cpu.getLimit());

        MemoryResource memory = resources.getMemory();
        memory.setUsage(sample.memoryBytes());
        memory.setSwapUsage(sample.swapBytes());
        memory.setThrottled(sample.memoryBytes() > memory.getLimit());

        DiskResource disk = resources.getDisk();
        disk.setUsage(sample.diskBytes());
        disk.setIops(sample.diskIops());
        disk.setThrottled(sample.diskBytes() > disk.getLimit());

        NetworkResource network = resources.getNetwork();
        if (network == null) {
            network = new NetworkResource();
            resources.setNetwork(network);
        }
        network.setBandwidthUp(sample.bandwidthUp());
        network.setBandwidthDown(sample.bandwidthDown());

        if (cpu.isThrottled() || memory.isThrottled() || disk.isThrottled()) {
            log.warnf("Session %s is throttled: cpu=%s, memory=%s, disk=%s",
                    session.getId(), cpu.isThrottled(), memory.isThrottled(), disk.isThrottled());
        }
    }

    /**
     * @throws ValidationException when any kind has a negative value or
     *                             {@code allocated > limit}
     */
    public void validate(ResourceAllocation resources) {
        if (resources == null || resources.getCpu() == null || resources.getMemory() == null
                || resources.getDisk() == null) {
            throw new ValidationException("cpu, memory and disk allocations are required");
        }
        check("cpu", resources.getCpu().getAllocated(), resources.getCpu().getLimit());
        check("memory", resources.getMemory().getAllocated(), resources.getMemory().getLimit());
        check("disk", resources.getDisk().getAllocated(), resources.getDisk().getLimit());
        GpuResource gpu = resources.getGpu();
        if (gpu != null) {
            check("gpu", gpu.getAllocated(), gpu.getLimit());
        }
    }

    private static void check(String kind, double allocated, double limit) {
        if (allocated < 0 || limit < 0) {
            throw new ValidationException(kind + " allocation must not be negative");
        }
        if (allocated > limit) {
            throw new ValidationException(String.format("%s allocated (%s) exceeds limit (%s)",
                    kind, format(allocated), format(limit)));
        }
    }

    private static String format(double value) {
        return value == Math.rint(value) ? String.valueOf((long) value) : String.valueOf(value);
    }

    private static ResourceAllocation applySpec(ResourceAllocation current, ResourceSpec spec) {
        ResourceAllocation next = current.toBuilder()
                .cpu(current.getCpu().toBuilder().build())
                .memory(current.getMemory().toBuilder().build())
                .disk(current.getDisk().toBuilder().build())
                .gpu(current.getGpu() == null ? null : current.getGpu().toBuilder().build())
                .build();

        if (spec.cpu() != null) {
            next.getCpu().setAllocated(pick(spec.cpu().allocated(), next.getCpu().getAllocated()));
            next.getCpu().setLimit(pick(spec.cpu().limit(), next.getCpu().getLimit()));
        }
        if (spec.memory() != null) {
            next.getMemory().setAllocated((long) pick(spec.memory().allocated(), next.getMemory().getAllocated()));
            next.getMemory().setLimit((long) pick(spec.memory().limit(), next.getMemory().getLimit()));
        }
        if (spec.disk() != null) {
            next.getDisk().setAllocated((long) pick(spec.disk().allocated(), next.getDisk().getAllocated()));
            next.getDisk().setLimit((long) pick(spec.disk().limit(), next.getDisk().getLimit()));
        }
        if (spec.gpu() != null) {
            GpuResource gpu = next.getGpu() == null ? new GpuResource() : next.getGpu();
            gpu.setAllocated((int) pick(spec.gpu().allocated(), gpu.getAllocated()));
            gpu.setLimit((int) pick(spec.gpu().limit(), Math.max(gpu.getLimit(), gpu.getAllocated())));
            next.setGpu(gpu);
        }
        return next;
    }

    private static double pick(Double requested, double current) {
        return requested != null ? requested : current;
    }

    private static Throwable asExhausted(String sessionId, Throwable failure) {
        if (failure instanceof ResourceExhaustedException || failure instanceof ValidationException) {
            return failure;
        }
        log.errorf(failure, "Capacity collaborator rejected reservation for session %s", sessionId);
        String detail = failure instanceof BaseException ? failure.getMessage() : failure.getClass().getSimpleName();
        return new ResourceExhaustedException("Unable to reserve resources for session " + sessionId + ": " + detail);
    }
}
