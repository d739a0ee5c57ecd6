package com.csg.airtel.csm4j.domain.service;

import com.csg.airtel.csm4j.domain.model.session.Session;
import com.csg.airtel.csm4j.domain.model.session.SessionConfiguration;

import java.time.Duration;
import java.time.Instant;

import static com.csg.airtel.csm4j.domain.constant.SessionDefaults.HIBERNATE_AFTER_MS;
import static com.csg.airtel.csm4j.domain.constant.SessionDefaults.MAX_DURATION_MS;
import static com.csg.airtel.csm4j.domain.constant.SessionDefaults.MAX_IDLE_TIME_MS;

/**
 * Time based eligibility checks used by the monitor and cleanup ticks.
 */
public class LifecyclePolicy {

    private LifecyclePolicy() {
    }

    public static boolean shouldHibernate(Session session, Instant now) {
        SessionConfiguration configuration = session.getConfiguration();
        if (!Boolean.TRUE.equals(configuration.getAutoHibernate())) {
            return false;
        }
        long hibernateAfter = configuration.getHibernateAfter() == null ? HIBERNATE_AFTER_MS : configuration.getHibernateAfter();
        return idle(session, now) > hibernateAfter;
    }

    public static boolean shouldTerminate(Session session, Instant now) {
        return terminationReason(session, now) != null;
    }

    /**
     * @return why the session is due for termination, or {@code null}
     */
    public static String terminationReason(Session session, Instant now) {
        if (session.getExpiresAt() != null && now.isAfter(session.getExpiresAt())) {
            return "Session expired";
        }
        SessionConfiguration configuration = session.getConfiguration();
        long maxDuration = configuration.getMaxDuration() == null ? MAX_DURATION_MS : configuration.getMaxDuration();
        if (Duration.between(session.getCreatedAt(), now).toMillis() > maxDuration) {
            return "Maximum duration exceeded";
        }
        long maxIdle = configuration.getMaxIdleTime() == null ? MAX_IDLE_TIME_MS : configuration.getMaxIdleTime();
        if (idle(session, now) > maxIdle) {
            return "Maximum idle time exceeded";
        }
        return null;
    }

    public static long idle(Session session, Instant now) {
        Instant lastActivity = session.getLastActivity() == null ? session.getCreatedAt() : session.getLastActivity();
        return Duration.between(lastActivity, now).toMillis();
    }
}
