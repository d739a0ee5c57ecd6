package com.csg.airtel.csm4j.domain.model.session;

import lombok.*;

import java.time.Instant;
import java.util.List;

/**
 * Security descriptor stored with the session. The manager keeps it for the
 * runtime and auditing; it performs no access control with it.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class SessionSecurity {
    private Encryption encryption;
    private Authentication authentication;
    private Authorization authorization;
    private Networking networking;
    private Monitoring monitoring;

    @Getter
    @Setter
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder(toBuilder = true)
    public static class Encryption {
        private Boolean inTransit;
        private Boolean atRest;
        private String algorithm;
    }

    @Getter
    @Setter
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder(toBuilder = true)
    public static class Authentication {
        private Boolean required;
        private String method; // token | certificate | oauth | basic
        private Instant expiresAt;
    }

    @Getter
    @Setter
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder(toBuilder = true)
    public static class Authorization {
        private List<String> policies;
        private List<String> roles;
        private List<String> permissions;
    }

    @Getter
    @Setter
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder(toBuilder = true)
    public static class Networking {
        private Boolean firewallEnabled;
        private List<Integer> allowedPorts;
        private List<String> blockedIPs;
        private Boolean vpnRequired;
    }

    @Getter
    @Setter
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder(toBuilder = true)
    public static class Monitoring {
        private Boolean auditLogging;
        private Boolean intrusionDetection;
        private Boolean anomalyDetection;
    }
}
