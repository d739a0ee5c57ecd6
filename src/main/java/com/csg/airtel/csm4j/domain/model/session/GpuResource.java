package com.csg.airtel.csm4j.domain.model.session;

import lombok.*;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class GpuResource {
    private int allocated;
    private int limit;
    private double usage;
    private long memoryUsage;
}
