package com.csg.airtel.csm4j.domain.model.session;

import lombok.*;

/**
 * Per-kind resource accounting of one session. Only the resource accountant
 * writes this structure; {@code allocated <= limit} holds for every kind.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class ResourceAllocation {
    private CpuResource cpu;
    private MemoryResource memory;
    private DiskResource disk;
    private NetworkResource network;
    private GpuResource gpu;

    /**
     * True while the capacity collaborator holds a reservation for the session.
     */
    private boolean reserved;
}
