package com.csg.airtel.csm4j.domain.model.session;

import lombok.*;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class MemoryResource {
    private long allocated; // bytes
    private long limit;
    private long usage;
    private long swapUsage;
    private boolean throttled;
}
