package com.positionintel.intelligence.coordination;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Coalesces concurrent computations per key.
 *
 * <p>The first caller for a key subscribes the computation; every caller that arrives
 * while it is in flight awaits the same {@link CompletableFuture} and receives the
 * identical value or error. The in-flight marker is cleared before waiters are
 * released, so a caller arriving after settlement starts a fresh computation.
 *
 * <p>Cancelling one waiter does not cancel the shared computation.
 */
public class SingleFlightCoordinator {

    private static final Logger log = LoggerFactory.getLogger(SingleFlightCoordinator.class);

    private final ConcurrentHashMap<String, CompletableFuture<?>> inFlight = new ConcurrentHashMap<>();

    @SuppressWarnings("unchecked")
    public <T> Mono<T> resolve(String key, Supplier<Mono<T>> compute) {
        return Mono.defer(() -> {
            CompletableFuture<T> created = new CompletableFuture<>();
            CompletableFuture<T> existing = (CompletableFuture<T>) inFlight.putIfAbsent(key, created);
            if (existing != null) {
                log.debug("SINGLE_FLIGHT_JOIN key={}", key);
                return Mono.fromFuture(existing, true);
            }

            log.debug("SINGLE_FLIGHT_START key={}", key);
            Mono.defer(compute).subscribe(
                value -> settle(key, created, () -> created.complete(value)),
                error -> settle(key, created, () -> created.completeExceptionally(error)),
                () -> settle(key, created, () -> created.complete(null)));
            return Mono.fromFuture(created, true);
        });
    }

    public int inFlightCount() {
        return inFlight.size();
    }

    private void settle(String key, CompletableFuture<?> future, Runnable completion) {
        inFlight.remove(key, future);
        if (!future.isDone()) {
            completion.run();
        }
    }
}
