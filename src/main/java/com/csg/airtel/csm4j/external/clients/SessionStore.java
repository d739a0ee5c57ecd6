package com.csg.airtel.csm4j.external.clients;

import com.csg.airtel.csm4j.domain.constant.ResponseCodeEnum;
import com.csg.airtel.csm4j.domain.model.session.Session;
import com.csg.airtel.csm4j.exception.BaseException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import io.quarkus.redis.datasource.keys.ReactiveKeyCommands;
import io.smallrye.mutiny.Uni;
import io.smallrye.mutiny.unchecked.Unchecked;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.faulttolerance.CircuitBreaker;
import org.eclipse.microprofile.faulttolerance.Retry;
import org.eclipse.microprofile.faulttolerance.Timeout;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Durable session records in Redis, one {@code session:<id>} key per session,
 * fronted by an in-memory index. Every save writes through to Redis; a failed
 * write evicts the indexed copy so that the next load sees durable state.
 */
@ApplicationScoped
public class SessionStore {

    private static final Logger log = Logger.getLogger(SessionStore.class);
    public static final String KEY_PREFIX = "session:";

    final ReactiveRedisDataSource reactiveRedisDataSource;
    final ObjectMapper objectMapper;
    private final Map<String, Session> sessions = new ConcurrentHashMap<>();

    @Inject
    public SessionStore(ReactiveRedisDataSource reactiveRedisDataSource, ObjectMapper objectMapper) {
        this.reactiveRedisDataSource = reactiveRedisDataSource;
        this.objectMapper = objectMapper;
    }

    /**
     * Index first, Redis on a miss. A record found in Redis is added to the index.
     */
    @Retry(maxRetries = 3, delay = 100, maxDuration = 5000)
    @Timeout(value = 5000)
    public Uni<Session> load(String sessionId) {
        Session cached = sessions.get(sessionId);
        if (cached != null) {
            return Uni.createFrom().item(cached);
        }
        long startTime = System.currentTimeMillis();
        return reactiveRedisDataSource.value(String.class)
                .get(KEY_PREFIX + sessionId)
                .onItem().transform(Unchecked.function(json -> {
                    if (json == null || json.isEmpty()) {
                        return null;
                    }
                    Session session = deserialize(json);
                    Session existing = sessions.putIfAbsent(sessionId, session);
                    if (log.isDebugEnabled()) {
                        log.debugf("Session %s loaded from store in %d ms", sessionId, System.currentTimeMillis() - startTime);
                    }
                    return existing != null ? existing : session;
                }))
                .onFailure().invoke(e -> log.errorf(e, "Failed to load session %s", sessionId));
    }

    /**
     * Write-through save. If the write fails the index entry is evicted so the
     * next load re-reads the durable state.
     */
    @CircuitBreaker(requestVolumeThreshold = 10, failureRatio = 0.5, delay = 5000, successThreshold = 2)
    @Timeout(value = 5000)
    public Uni<Void> save(Session session) {
        String sessionId = session.getId();
        return Uni.createFrom().item(() -> serialize(session))
                .onItem().transformToUni(json -> reactiveRedisDataSource.value(String.class)
                        .set(KEY_PREFIX + sessionId, json))
                .onItem().invoke(() -> sessions.put(sessionId, session))
                .onFailure().invoke(e -> {
                    sessions.remove(sessionId);
                    log.errorf(e, "Failed to save session %s", sessionId);
                });
    }

    public Uni<Boolean> delete(String sessionId) {
        ReactiveKeyCommands<String> keyCommands = reactiveRedisDataSource.key();
        return keyCommands.del(KEY_PREFIX + sessionId)
                .onItem().invoke(() -> sessions.remove(sessionId))
                .map(deleted -> deleted > 0)
                .onItem().invoke(deleted -> log.infof("Session record %s deleted (existed=%s)", sessionId, deleted));
    }

    /**
     * Scans every {@code session:*} record in Redis. Used for listing and for
     * rebuilding the index on start.
     */
    @Retry(maxRetries = 3, delay = 200, maxDuration = 10000)
    @Timeout(value = 10000)
    public Uni<List<Session>> loadAll() {
        long startTime = System.currentTimeMillis();
        return reactiveRedisDataSource.key()
                .keys(KEY_PREFIX + "*")
                .onItem().transformToUni(keys -> {
                    if (keys == null || keys.isEmpty()) {
                        return Uni.createFrom().item(Collections.<String, String>emptyMap());
                    }
                    return reactiveRedisDataSource.value(String.class).mget(keys.toArray(new String[0]));
                })
                .onItem().transform(values -> {
                    List<Session> result = new ArrayList<>(values.size());
                    for (Map.Entry<String, String> entry : values.entrySet()) {
                        if (entry.getValue() == null) {
                            continue;
                        }
                        try {
                            result.add(deserialize(entry.getValue()));
                        } catch (BaseException e) {
                            log.warnf("Skipping unreadable session record %s: %s", entry.getKey(), e.getMessage());
                        }
                    }
                    log.infof("Scanned %d session records in %d ms", result.size(), System.currentTimeMillis() - startTime);
                    return result;
                });
    }

    /**
     * Puts records read by {@link #loadAll()} into the index without writing.
     * Entries already indexed win, they are at least as fresh.
     */
    public void index(Collection<Session> loaded) {
        for (Session session : loaded) {
            sessions.putIfAbsent(session.getId(), session);
        }
    }

    /**
     * Drops the index entry so the next load re-reads the durable record. Used
     * when an operation changed the indexed session and then failed before
     * saving.
     */
    public void evict(String sessionId) {
        if (sessions.remove(sessionId) != null) {
            log.warnf("Session %s evicted from index, durable state wins", sessionId);
        }
    }

    public Collection<Session> cached() {
        return Collections.unmodifiableCollection(sessions.values());
    }

    public Session cached(String sessionId) {
        return sessions.get(sessionId);
    }

    private String serialize(Session session) {
        try {
            return objectMapper.writeValueAsString(session);
        } catch (Exception e) {
            throw new BaseException("Failed to serialize session " + session.getId(),
                    ResponseCodeEnum.EXCEPTION_CLIENT_LAYER.description(),
                    Response.Status.INTERNAL_SERVER_ERROR,
                    ResponseCodeEnum.EXCEPTION_CLIENT_LAYER.code(), e.getStackTrace());
        }
    }

    private Session deserialize(String json) {
        try {
            return objectMapper.readValue(json, Session.class);
        } catch (Exception e) {
            throw new BaseException("Failed to deserialize session",
                    ResponseCodeEnum.EXCEPTION_CLIENT_LAYER.description(),
                    Response.Status.INTERNAL_SERVER_ERROR,
                    ResponseCodeEnum.EXCEPTION_CLIENT_LAYER.code(), e.getStackTrace());
        }
    }
}
