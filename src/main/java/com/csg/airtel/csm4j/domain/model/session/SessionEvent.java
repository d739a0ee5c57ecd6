package com.csg.airtel.csm4j.domain.model.session;

import lombok.*;

import java.time.Instant;
import java.util.Map;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class SessionEvent {
    private String id;
    private Instant timestamp;
    private EventType type;
    private String description;
    private EventSeverity severity;
    private Map<String, Object> metadata;
}
