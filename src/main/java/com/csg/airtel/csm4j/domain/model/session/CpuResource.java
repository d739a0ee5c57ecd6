package com.csg.airtel.csm4j.domain.model.session;

import lombok.*;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class CpuResource {
    private double allocated; // cores
    private double limit;     // cores
    private double usage;     // percent of allocated
    private boolean throttled;
}
