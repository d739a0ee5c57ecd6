package com.csg.airtel.csm4j.domain.model.session;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.*;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class SessionConnection {
    private String id;
    private ConnectionType type;
    private String clientIP;
    private String userAgent;
    private Instant connectedAt;
    private Instant lastActivity;
    private Instant closedAt;
    private long bytesTransferred;
    private ConnectionStatus status;
    private Map<String, Object> metadata;

    @JsonIgnore
    public boolean isOpen() {
        return status != ConnectionStatus.CLOSED;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SessionConnection that = (SessionConnection) o;
        return Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }
}
