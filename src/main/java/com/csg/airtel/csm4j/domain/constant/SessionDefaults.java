package com.csg.airtel.csm4j.domain.constant;

public class SessionDefaults {
    private SessionDefaults() {
    }

    public static final long MINUTE_MS = 60_000L;
    public static final long HOUR_MS = 60 * MINUTE_MS;
    public static final long GIB = 1024L * 1024L * 1024L;
    public static final long MIB = 1024L * 1024L;

    // configuration
    public static final long MAX_IDLE_TIME_MS = 30 * MINUTE_MS;
    public static final long MAX_DURATION_MS = 8 * HOUR_MS;
    public static final boolean AUTO_HIBERNATE = true;
    public static final long HIBERNATE_AFTER_MS = 15 * MINUTE_MS;
    public static final boolean AUTO_SCALE = false;
    public static final boolean PERSIST_DATA = false;
    public static final boolean ALLOW_MULTIPLE_CONNECTIONS = true;
    public static final int DEFAULT_PORT = 8080;
    public static final long NETWORK_BANDWIDTH = 100 * MIB;

    // resources
    public static final double CPU_ALLOCATED = 1;
    public static final double CPU_LIMIT = 2;
    public static final long MEMORY_ALLOCATED = GIB;
    public static final long MEMORY_LIMIT = 2 * GIB;
    public static final long DISK_ALLOCATED = 10 * GIB;
    public static final long DISK_LIMIT = 50 * GIB;

    // persistence
    public static final long SNAPSHOT_INTERVAL_MS = 5 * MINUTE_MS;
    public static final long RETENTION_PERIOD_MS = 24 * HOUR_MS;

    // scaling
    public static final int MIN_REPLICAS = 1;
    public static final int MAX_REPLICAS = 10;
    public static final double TARGET_CPU_UTILIZATION = 70;
    public static final double TARGET_MEMORY_UTILIZATION = 80;
    public static final double SCALE_UP_THRESHOLD = 80;
    public static final double SCALE_DOWN_THRESHOLD = 30;
    public static final long COOLDOWN_PERIOD_SECONDS = 300;

    // security
    public static final String ENCRYPTION_ALGORITHM = "AES-256";
    public static final String AUTHENTICATION_METHOD = "token";

    // transport close codes
    public static final int CLOSE_NORMAL = 1000;
    public static final String CLOSE_REASON_HIBERNATING = "Session hibernating";
    public static final String CLOSE_REASON_TERMINATED = "Session terminated";
}
