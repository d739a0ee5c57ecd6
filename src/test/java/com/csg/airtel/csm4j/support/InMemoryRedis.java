package com.csg.airtel.csm4j.support;

import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import io.quarkus.redis.datasource.keys.ReactiveKeyCommands;
import io.quarkus.redis.datasource.value.ReactiveValueCommands;
import io.quarkus.redis.datasource.value.SetArgs;
import io.smallrye.mutiny.Uni;
import org.mockito.invocation.InvocationOnMock;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.mock;

/**
 * Mocked {@link ReactiveRedisDataSource} backed by a map, for tests that need
 * the store to behave like Redis across several calls.
 */
@SuppressWarnings("unchecked")
public class InMemoryRedis {

    private final Map<String, String> data = new ConcurrentHashMap<>();
    private final ReactiveRedisDataSource dataSource = mock(ReactiveRedisDataSource.class);
    private final ReactiveValueCommands<String, String> values = mock(ReactiveValueCommands.class);
    private final ReactiveKeyCommands<String> keys = mock(ReactiveKeyCommands.class);

    public InMemoryRedis() {
        lenient().when(dataSource.value(String.class)).thenReturn(values);
        lenient().when(dataSource.key()).thenReturn(keys);

        lenient().when(values.get(anyString()))
                .thenAnswer(invocation -> Uni.createFrom().item(data.get(invocation.<String>getArgument(0))));
        lenient().when(values.set(anyString(), anyString()))
                .thenAnswer(invocation -> {
                    data.put(invocation.getArgument(0), invocation.getArgument(1));
                    return Uni.createFrom().voidItem();
                });
        lenient().when(values.set(anyString(), anyString(), any(SetArgs.class)))
                .thenAnswer(invocation -> {
                    data.put(invocation.getArgument(0), invocation.getArgument(1));
                    return Uni.createFrom().voidItem();
                });
        lenient().when(values.mget(any(String[].class)))
                .thenAnswer(invocation -> {
                    Map<String, String> found = new LinkedHashMap<>();
                    for (String key : keyArguments(invocation)) {
                        found.put(key, data.get(key));
                    }
                    return Uni.createFrom().item(found);
                });
        lenient().when(keys.keys(anyString()))
                .thenAnswer(invocation -> {
                    String pattern = invocation.getArgument(0);
                    String prefix = pattern.endsWith("*") ? pattern.substring(0, pattern.length() - 1) : pattern;
                    List<String> matched = new ArrayList<>();
                    for (String key : data.keySet()) {
                        if (pattern.endsWith("*") ? key.startsWith(prefix) : key.equals(prefix)) {
                            matched.add(key);
                        }
                    }
                    return Uni.createFrom().item(matched);
                });
        lenient().when(keys.del(any(String[].class)))
                .thenAnswer(invocation -> {
                    int removed = 0;
                    for (String key : keyArguments(invocation)) {
                        if (data.remove(key) != null) {
                            removed++;
                        }
                    }
                    return Uni.createFrom().item(removed);
                });
    }

    public ReactiveRedisDataSource dataSource() {
        return dataSource;
    }

    public ReactiveValueCommands<String, String> values() {
        return values;
    }

    public Map<String, String> data() {
        return data;
    }

    private static List<String> keyArguments(InvocationOnMock invocation) {
        List<String> result = new ArrayList<>();
        for (Object argument : invocation.getArguments()) {
            if (argument instanceof String[]) {
                result.addAll(List.of((String[]) argument));
            } else if (argument instanceof String) {
                result.add((String) argument);
            }
        }
        return result;
    }
}
