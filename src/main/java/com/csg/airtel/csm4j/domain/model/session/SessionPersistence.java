package com.csg.airtel.csm4j.domain.model.session;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.*;

import java.time.Instant;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class SessionPersistence {
    @JsonProperty("enabled")
    private Boolean enabled;
    private Long snapshotInterval; // ms
    private Long retentionPeriod;  // ms
    private Instant lastSnapshot;
    private Long snapshotSize;     // bytes
    private Boolean backupEnabled;
    private Long backupInterval;
    private RestorePoint restorePoint;

    @JsonIgnore
    public boolean isEnabled() {
        return Boolean.TRUE.equals(enabled);
    }
}
