package com.csg.airtel.csm4j.domain.model.session;

import lombok.*;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class NetworkResource {
    private long bandwidthUp;   // bytes/sec
    private long bandwidthDown; // bytes/sec
    private long connections;
    private long packetsIn;
    private long packetsOut;
}
