package com.async.trace.task;

import java.util.concurrent.CompletableFuture;

/**
 * Factory methods for common {@link Pollable}s.
 */
public final class Pollables {

    private Pollables() {
    }

    /**
     * A computation that is ready with {@code value} on the first poll.
     */
    public static <T> Pollable<T> ready(T value) {
        return () -> Poll.ready(value);
    }

    /**
     * Adapts a {@link CompletableFuture}. The returned pollable completes with the
     * future's value, or throws the exception the future completed with. It belongs to
     * a single driver: polling it from two tasks at once loses wakeups.
     */
    public static <T> Pollable<T> fromFuture(CompletableFuture<T> future) {
        return new CompletableFuturePollable<>(future);
    }
}
