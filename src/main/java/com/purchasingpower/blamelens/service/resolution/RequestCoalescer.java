package com.purchasingpower.blamelens.service.resolution;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Supplier;

/**
 * Shares one in-flight call per key between concurrent callers.
 *
 * <p>The future handed out is completed before its key is removed, so continuations attached
 * by callers run while the key is still registered. Removal uses the identity of the
 * registration: a call that settles after {@link #clear()} never removes a newer one.
 */
public class RequestCoalescer<T> {

    private final ConcurrentMap<String, CompletableFuture<T>> inFlight = new ConcurrentHashMap<>();

    /**
     * @return the in-flight future for {@code key}, or a new one backed by {@code call}
     */
    public CompletableFuture<T> coalesce(String key, Supplier<? extends CompletionStage<T>> call) {
        CompletableFuture<T> created = new CompletableFuture<>();
        CompletableFuture<T> existing = inFlight.putIfAbsent(key, created);
        if (existing != null) {
            return existing;
        }

        CompletionStage<T> stage;
        try {
            stage = call.get();
        } catch (RuntimeException e) {
            settle(key, created, null, e);
            return created;
        }

        stage.whenComplete((value, error) -> settle(key, created, value, error));
        return created;
    }

    public boolean isInFlight(String key) {
        return inFlight.containsKey(key);
    }

    public int inFlightCount() {
        return inFlight.size();
    }

    /**
     * Stops tracking every key. Calls already running still complete their futures.
     */
    public void clear() {
        inFlight.clear();
    }

    private void settle(String key, CompletableFuture<T> future, T value, Throwable error) {
        try {
            if (error != null) {
                future.completeExceptionally(error);
            } else {
                future.complete(value);
            }
        } finally {
            inFlight.remove(key, future);
        }
    }
}
