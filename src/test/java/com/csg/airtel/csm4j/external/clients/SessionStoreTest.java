package com.csg.airtel.csm4j.external.clients;

import com.csg.airtel.csm4j.domain.model.CreateSessionRequest;
import com.csg.airtel.csm4j.domain.model.session.Session;
import com.csg.airtel.csm4j.domain.model.session.SessionStatus;
import com.csg.airtel.csm4j.domain.model.session.SessionType;
import com.csg.airtel.csm4j.domain.service.SessionMappingUtil;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import io.quarkus.redis.datasource.keys.ReactiveKeyCommands;
import io.quarkus.redis.datasource.value.ReactiveValueCommands;
import io.smallrye.mutiny.Uni;
import io.smallrye.mutiny.helpers.test.UniAssertSubscriber;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SessionStoreTest {

    @Mock
    private ReactiveRedisDataSource reactiveRedisDataSource;

    @Mock
    private ReactiveValueCommands<String, String> valueCommands;

    @Mock
    private ReactiveKeyCommands<String> keyCommands;

    private ObjectMapper objectMapper;
    private SessionStore sessionStore;
    private Session session;

    @BeforeEach
    void setUp() {
        objectMapper = new ObjectMapper();
        objectMapper.findAndRegisterModules();
        sessionStore = new SessionStore(reactiveRedisDataSource, objectMapper);
        session = SessionMappingUtil.newSession(CreateSessionRequest.of("user-1", SessionType.INTERACTIVE),
                Instant.parse("2026-01-01T00:00:00Z"));
        session.setId("s1");
    }

    @Test
    void testSave_WritesThroughAndIndexes() {
        // Given
        when(reactiveRedisDataSource.value(String.class)).thenReturn(valueCommands);
        when(valueCommands.set(eq("session:s1"), anyString())).thenReturn(Uni.createFrom().voidItem());

        // When
        sessionStore.save(session)
                .subscribe().withSubscriber(UniAssertSubscriber.create())
                .awaitItem().assertCompleted();

        // Then
        assertThat(sessionStore.cached("s1")).isSameAs(session);
    }

    @Test
    void testEvict_DropsIndexedCopy() {
        sessionStore.index(List.of(session));

        sessionStore.evict("s1");
        sessionStore.evict("unknown");

        assertThat(sessionStore.cached("s1")).isNull();
    }

    @Test
    void testSave_FailureEvictsIndexedCopy() {
        // Given
        sessionStore.index(List.of(session));
        when(reactiveRedisDataSource.value(String.class)).thenReturn(valueCommands);
        when(valueCommands.set(eq("session:s1"), anyString()))
                .thenReturn(Uni.createFrom().failure(new RuntimeException("connection reset")));

        // When
        UniAssertSubscriber<Void> subscriber = sessionStore.save(session)
                .subscribe().withSubscriber(UniAssertSubscriber.create());

        // Then
        subscriber.awaitFailure().assertFailedWith(RuntimeException.class, "connection reset");
        assertThat(sessionStore.cached("s1")).isNull();
    }

    @Test
    void testLoad_IndexHitSkipsRedis() {
        sessionStore.index(List.of(session));

        Session loaded = sessionStore.load("s1")
                .subscribe().withSubscriber(UniAssertSubscriber.create())
                .awaitItem().getItem();

        assertThat(loaded).isSameAs(session);
        verify(reactiveRedisDataSource, never()).value(String.class);
    }

    @Test
    void testLoad_ReadsRedisOnMiss() throws Exception {
        // Given
        String json = objectMapper.writeValueAsString(session);
        when(reactiveRedisDataSource.value(String.class)).thenReturn(valueCommands);
        when(valueCommands.get("session:s1")).thenReturn(Uni.createFrom().item(json));

        // When
        Session loaded = sessionStore.load("s1")
                .subscribe().withSubscriber(UniAssertSubscriber.create())
                .awaitItem().getItem();

        // Then
        assertThat(loaded.getId()).isEqualTo("s1");
        assertThat(loaded.getStatus()).isEqualTo(SessionStatus.INITIALIZING);
        assertThat(sessionStore.cached("s1")).isSameAs(loaded);
    }

    @Test
    void testLoad_MissingReturnsNull() {
        when(reactiveRedisDataSource.value(String.class)).thenReturn(valueCommands);
        when(valueCommands.get("session:missing")).thenReturn(Uni.createFrom().nullItem());

        Session loaded = sessionStore.load("missing")
                .subscribe().withSubscriber(UniAssertSubscriber.create())
                .awaitItem().getItem();

        assertThat(loaded).isNull();
    }

    @Test
    void testDelete_RemovesRecordAndIndex() {
        // Given
        sessionStore.index(List.of(session));
        when(reactiveRedisDataSource.key()).thenReturn(keyCommands);
        when(keyCommands.del("session:s1")).thenReturn(Uni.createFrom().item(1));

        // When
        Boolean deleted = sessionStore.delete("s1")
                .subscribe().withSubscriber(UniAssertSubscriber.create())
                .awaitItem().getItem();

        // Then
        assertThat(deleted).isTrue();
        assertThat(sessionStore.cached("s1")).isNull();
    }

    @Test
    void testLoadAll_SkipsUnreadableRecords() throws Exception {
        // Given
        Map<String, String> values = new LinkedHashMap<>();
        values.put("session:s1", objectMapper.writeValueAsString(session));
        values.put("session:broken", "{not json");
        values.put("session:gone", null);
        when(reactiveRedisDataSource.key()).thenReturn(keyCommands);
        when(reactiveRedisDataSource.value(String.class)).thenReturn(valueCommands);
        when(keyCommands.keys("session:*")).thenReturn(Uni.createFrom().item(List.copyOf(values.keySet())));
        when(valueCommands.mget(any(String[].class))).thenReturn(Uni.createFrom().item(values));

        // When
        List<Session> sessions = sessionStore.loadAll()
                .subscribe().withSubscriber(UniAssertSubscriber.create())
                .awaitItem().getItem();

        // Then
        assertThat(sessions).extracting(Session::getId).containsExactly("s1");
    }

    @Test
    void testLoadAll_NoKeys() {
        when(reactiveRedisDataSource.key()).thenReturn(keyCommands);
        when(keyCommands.keys("session:*")).thenReturn(Uni.createFrom().item(List.of()));

        List<Session> sessions = sessionStore.loadAll()
                .subscribe().withSubscriber(UniAssertSubscriber.create())
                .awaitItem().getItem();

        assertThat(sessions).isEmpty();
    }

    @Test
    void testIndex_KeepsExistingEntries() {
        Session stale = session.toBuilder().status(SessionStatus.FAILED).build();
        sessionStore.index(List.of(session));

        sessionStore.index(List.of(stale));

        assertThat(sessionStore.cached("s1")).isSameAs(session);
        assertThat(sessionStore.cached()).hasSize(1);
    }
}
