package com.csg.airtel.csm4j.external.clients;

import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import io.quarkus.redis.datasource.value.ReactiveValueCommands;
import io.quarkus.redis.datasource.value.SetArgs;
import io.smallrye.mutiny.Uni;
import io.smallrye.mutiny.helpers.test.UniAssertSubscriber;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SnapshotStoreTest {

    @Mock
    private ReactiveRedisDataSource reactiveRedisDataSource;

    @Mock
    private ReactiveValueCommands<String, String> valueCommands;

    private SnapshotStore snapshotStore;

    @BeforeEach
    void setUp() {
        snapshotStore = new SnapshotStore(reactiveRedisDataSource);
        lenient().when(reactiveRedisDataSource.value(String.class)).thenReturn(valueCommands);
    }

    @Test
    void testSave_UsesRetentionAsExpiry() {
        // Given
        when(valueCommands.set(eq("snapshot:s1:snap_1"), eq("{}"), any(SetArgs.class)))
                .thenReturn(Uni.createFrom().voidItem());

        // When
        snapshotStore.save("s1", "snap_1", "{}", Duration.ofHours(24))
                .subscribe().withSubscriber(UniAssertSubscriber.create())
                .awaitItem().assertCompleted();

        // Then
        verify(valueCommands).set(eq("snapshot:s1:snap_1"), eq("{}"), any(SetArgs.class));
    }

    @Test
    void testLoad_ReturnsPayload() {
        when(valueCommands.get("snapshot:s1:snap_1")).thenReturn(Uni.createFrom().item("{\"a\":1}"));

        String payload = snapshotStore.load("s1", "snap_1")
                .subscribe().withSubscriber(UniAssertSubscriber.create())
                .awaitItem().getItem();

        assertThat(payload).isEqualTo("{\"a\":1}");
    }

    @Test
    void testKey() {
        assertThat(SnapshotStore.key("s1", "snap_1")).isEqualTo("snapshot:s1:snap_1");
    }
}
