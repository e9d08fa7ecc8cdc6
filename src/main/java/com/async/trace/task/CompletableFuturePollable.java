package com.async.trace.task;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * {@link Pollable} view of a {@link CompletableFuture}. A single completion callback
 * relays the completion to whichever task parked last.
 */
final class CompletableFuturePollable<T> implements Pollable<T> {

    private final CompletableFuture<T> future;
    private final AtomicTask task = new AtomicTask();
    private final AtomicBoolean callbackRegistered = new AtomicBoolean();

    CompletableFuturePollable(CompletableFuture<T> future) {
        this.future = future;
    }

    @Override
    public Poll<T> poll() throws Exception {
        if (future.isDone()) {
            return Poll.ready(result());
        }
        task.park();
        if (callbackRegistered.compareAndSet(false, true)) {
            future.whenComplete((value, error) -> task.notifyWaiter());
        }
        // completion may have raced with park()
        if (future.isDone()) {
            return Poll.ready(result());
        }
        return Poll.pending();
    }

    private T result() throws Exception {
        try {
            return future.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof Exception exception) {
                throw exception;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw e;
        }
    }
}
