package com.csg.airtel.csm4j.domain.service;

import com.csg.airtel.csm4j.domain.model.CreateSessionRequest;
import com.csg.airtel.csm4j.domain.model.session.Session;
import com.csg.airtel.csm4j.domain.model.session.SessionType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class LifecyclePolicyTest {

    private static final Instant CREATED = Instant.parse("2026-01-01T00:00:00Z");

    private Session session;

    @BeforeEach
    void setUp() {
        session = SessionMappingUtil.newSession(CreateSessionRequest.of("user-1", SessionType.INTERACTIVE), CREATED);
    }

    @Test
    void testShouldHibernate_AfterIdleThreshold() {
        assertThat(LifecyclePolicy.shouldHibernate(session, CREATED.plus(Duration.ofMinutes(15)))).isFalse();
        assertThat(LifecyclePolicy.shouldHibernate(session, CREATED.plus(Duration.ofMinutes(16)))).isTrue();
    }

    @Test
    void testShouldHibernate_DisabledByConfiguration() {
        session.getConfiguration().setAutoHibernate(false);

        assertThat(LifecyclePolicy.shouldHibernate(session, CREATED.plus(Duration.ofHours(1)))).isFalse();
    }

    @Test
    void testTerminationReason_Expired() {
        session.setExpiresAt(CREATED.plusSeconds(60));

        assertThat(LifecyclePolicy.terminationReason(session, CREATED.plusSeconds(61))).isEqualTo("Session expired");
        assertThat(LifecyclePolicy.terminationReason(session, CREATED.plusSeconds(30))).isNull();
    }

    @Test
    void testTerminationReason_MaxDuration() {
        session.getConfiguration().setMaxIdleTime(Duration.ofDays(1).toMillis());
        session.setLastActivity(CREATED.plus(Duration.ofHours(8)));

        String reason = LifecyclePolicy.terminationReason(session, CREATED.plus(Duration.ofHours(8)).plusSeconds(1));

        assertThat(reason).isEqualTo("Maximum duration exceeded");
    }

    @Test
    void testTerminationReason_MaxIdle() {
        String reason = LifecyclePolicy.terminationReason(session, CREATED.plus(Duration.ofMinutes(31)));

        assertThat(reason).isEqualTo("Maximum idle time exceeded");
        assertThat(LifecyclePolicy.shouldTerminate(session, CREATED.plus(Duration.ofMinutes(29)))).isFalse();
    }

    @Test
    void testIdle_FallsBackToCreatedAt() {
        session.setLastActivity(null);

        assertThat(LifecyclePolicy.idle(session, CREATED.plusSeconds(5))).isEqualTo(5000L);
    }
}
