package com.csg.airtel.csm4j.domain.service;

import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Serializes operations per session id.
 * <p>
 * Each id owns a FIFO chain: an operation starts only after every operation
 * submitted earlier for the same id has completed, successfully or not.
 * Operations on different ids do not wait for each other. Ordering is fixed at
 * submission time, not at subscription time, so the returned {@code Uni} only
 * observes the result.
 * <p>
 * An operation must never submit to and wait on its own id, that would wait
 * on itself forever.
 */
@ApplicationScoped
public class SessionOperationQueue {

    private static final Logger log = Logger.getLogger(SessionOperationQueue.class);

    private final Map<String, CompletableFuture<Void>> tails = new ConcurrentHashMap<>();

    public <T> Uni<T> submit(String sessionId, Supplier<Uni<T>> operation) {
        CompletableFuture<T> result = new CompletableFuture<>();
        CompletableFuture<Void> done = new CompletableFuture<>();
        // the atomic swap fixes this operation's place in the chain
        CompletableFuture<Void> previous = tails.put(sessionId, done);
        CompletableFuture<Void> predecessor = previous == null
                ? CompletableFuture.completedFuture(null)
                : previous;
        predecessor.whenComplete((ignored, failure) -> run(sessionId, operation, result)
                .whenComplete((item, error) -> {
                    tails.remove(sessionId, done);
                    done.complete(null);
                }));
        // callers get a copy, cancelling it must not release the chain early
        return Uni.createFrom().completionStage(result.copy());
    }

    public int pendingChains() {
        return tails.size();
    }

    private <T> CompletableFuture<Void> run(String sessionId, Supplier<Uni<T>> operation, CompletableFuture<T> result) {
        try {
            operation.get()
                    .subscribe().with(result::complete, result::completeExceptionally);
        } catch (Exception e) {
            log.errorf(e, "Operation for session %s failed before it started", sessionId);
            result.completeExceptionally(e);
        }
        // the chain only waits, it never carries a failure to the next operation
        return result.handle((item, failure) -> (Void) null);
    }
}
