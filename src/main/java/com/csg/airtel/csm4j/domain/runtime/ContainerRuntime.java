package com.csg.airtel.csm4j.domain.runtime;

import com.csg.airtel.csm4j.domain.model.UsageSample;
import com.csg.airtel.csm4j.domain.model.session.ResourceAllocation;
import com.csg.airtel.csm4j.domain.model.session.Session;
import io.smallrye.mutiny.Uni;

/**
 * Contract with the container/VM runtime that runs the actual workloads.
 * The manager only decides what to do with each outcome; a failed {@code Uni}
 * is the failure signal.
 */
public interface ContainerRuntime {

    /**
     * Reserves capacity for the session, replacing any reservation it already
     * holds. Fails with {@code ResourceExhaustedException} when the request
     * cannot be satisfied.
     */
    Uni<Void> allocateResources(String sessionId, ResourceAllocation requested);

    /**
     * Frees the reservation. Completes normally when nothing is reserved.
     */
    Uni<Void> releaseResources(String sessionId);

    Uni<Void> initializeContainer(Session session);

    Uni<Void> scaleReplicas(String sessionId, int currentReplicas, int targetReplicas);

    /**
     * Current usage reading for an active session.
     */
    Uni<UsageSample> sampleUsage(Session session);
}
