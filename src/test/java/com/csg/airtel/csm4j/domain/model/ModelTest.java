package com.csg.airtel.csm4j.domain.model;

import com.csg.airtel.csm4j.domain.model.session.AutoScalingConfig;
import com.csg.airtel.csm4j.domain.model.session.ConnectionStatus;
import com.csg.airtel.csm4j.domain.model.session.EventType;
import com.csg.airtel.csm4j.domain.model.session.ScalingAction;
import com.csg.airtel.csm4j.domain.model.session.Session;
import com.csg.airtel.csm4j.domain.model.session.SessionConnection;
import com.csg.airtel.csm4j.domain.model.session.SessionEvent;
import com.csg.airtel.csm4j.domain.model.session.SessionPersistence;
import com.csg.airtel.csm4j.domain.model.session.SessionStatus;
import com.csg.airtel.csm4j.domain.model.session.SessionType;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ModelTest {

    private ObjectMapper objectMapper;

    @BeforeEach
    void setUp() {
        objectMapper = new ObjectMapper();
        objectMapper.findAndRegisterModules();
    }

    @Test
    void testSessionStatus_Transitions() {
        assertThat(SessionStatus.INITIALIZING.canTransitionTo(SessionStatus.ACTIVE)).isTrue();
        assertThat(SessionStatus.INITIALIZING.canTransitionTo(SessionStatus.FAILED)).isTrue();
        assertThat(SessionStatus.ACTIVE.canTransitionTo(SessionStatus.HIBERNATING)).isTrue();
        assertThat(SessionStatus.ACTIVE.canTransitionTo(SessionStatus.FAILED)).isFalse();
        assertThat(SessionStatus.HIBERNATING.canTransitionTo(SessionStatus.ACTIVE)).isTrue();
        assertThat(SessionStatus.HIBERNATING.canTransitionTo(SessionStatus.TERMINATED)).isFalse();
        assertThat(SessionStatus.TERMINATING.canTransitionTo(SessionStatus.TERMINATED)).isTrue();
    }

    @ParameterizedTest
    @EnumSource(value = SessionStatus.class, names = {"TERMINATED", "FAILED"})
    void testSessionStatus_AbsorbingHasNoSuccessors(SessionStatus status) {
        assertThat(status.isAbsorbing()).isTrue();
        assertThat(status.successors()).isEmpty();
    }

    @Test
    void testSessionStatus_FromValue() {
        assertThat(SessionStatus.fromValue("hibernating")).isEqualTo(SessionStatus.HIBERNATING);
        assertThat(SessionStatus.fromValue("ACTIVE")).isEqualTo(SessionStatus.ACTIVE);
        assertThatThrownBy(() -> SessionStatus.fromValue("sleeping"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testEnums_SerializeAsLowercaseValues() throws Exception {
        assertThat(objectMapper.writeValueAsString(SessionType.DEVELOPMENT)).isEqualTo("\"development\"");
        assertThat(objectMapper.writeValueAsString(ScalingAction.SCALE_UP)).isEqualTo("\"scale_up\"");
        assertThat(objectMapper.readValue("\"hibernated\"", EventType.class)).isEqualTo(EventType.HIBERNATED);
    }

    @Test
    void testEnabledFlags_SurviveJson() throws Exception {
        AutoScalingConfig scaling = AutoScalingConfig.builder().enabled(true).minReplicas(1).build();
        SessionPersistence persistence = SessionPersistence.builder().enabled(true).build();

        AutoScalingConfig scalingCopy = objectMapper.readValue(objectMapper.writeValueAsString(scaling), AutoScalingConfig.class);
        SessionPersistence persistenceCopy = objectMapper.readValue(objectMapper.writeValueAsString(persistence), SessionPersistence.class);

        assertThat(scalingCopy.isEnabled()).isTrue();
        assertThat(persistenceCopy.isEnabled()).isTrue();
    }

    @Test
    void testSession_AppendEventKeepsMostRecent() {
        Session session = new Session();
        for (int i = 0; i < 5; i++) {
            session.appendEvent(SessionEvent.builder().id("e" + i).type(EventType.SCALED).build(), 3);
        }

        assertThat(session.getEvents()).extracting(SessionEvent::getId).containsExactly("e2", "e3", "e4");
    }

    @Test
    void testSession_OpenConnections() {
        Session session = new Session();
        List<SessionConnection> connections = new ArrayList<>();
        connections.add(SessionConnection.builder().id("c1").status(ConnectionStatus.ACTIVE).build());
        connections.add(SessionConnection.builder().id("c2").status(ConnectionStatus.CLOSED).build());
        connections.add(SessionConnection.builder().id("c3").status(ConnectionStatus.IDLE).build());
        session.setConnections(connections);

        assertThat(session.getOpenConnections()).extracting(SessionConnection::getId).containsExactly("c1", "c3");
        assertThat(session.findConnection("c2")).isPresent();
        assertThat(session.findConnection("c9")).isEmpty();
    }

    @Test
    void testUpdateSessionRequest_IsEmpty() {
        assertThat(new UpdateSessionRequest(null, null, null).isEmpty()).isTrue();
        assertThat(new UpdateSessionRequest(null, null, new AutoScalingConfig()).isEmpty()).isFalse();
    }

    @Test
    void testScaleRequest_Automatic() {
        assertThat(ScaleRequest.automatic().isManual()).isFalse();
        assertThat(new ScaleRequest(ScalingAction.SCALE_DOWN, null).isManual()).isTrue();
    }
}
