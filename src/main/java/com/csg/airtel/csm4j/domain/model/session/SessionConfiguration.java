package com.csg.airtel.csm4j.domain.model.session;

import lombok.*;

import java.util.List;
import java.util.Map;

/**
 * Policy knobs of a session. Every field is nullable so that the same type
 * doubles as a partial override in create and update requests; a stored
 * session always holds a fully merged instance.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class SessionConfiguration {
    private Long maxIdleTime;       // ms
    private Long maxDuration;       // ms
    private Boolean autoHibernate;
    private Long hibernateAfter;    // ms of inactivity
    private Boolean autoScale;
    private Boolean persistData;
    private Boolean allowMultipleConnections;
    private Map<String, String> environment;
    private List<Integer> ports;
    private List<String> volumes;
    private NetworkPolicy network;
}
