package com.csg.airtel.csm4j.domain.model.session;

import lombok.*;

import java.util.List;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class NetworkPolicy {
    private Long bandwidth; // bytes/sec
    private List<String> allowedIPs;
    private Boolean publicAccess;
}
