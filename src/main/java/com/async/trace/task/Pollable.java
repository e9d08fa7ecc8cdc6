package com.async.trace.task;

import com.async.trace.future.TracedFuture;

import java.util.Map;

/**
 * A poll-driven asynchronous computation.
 *
 * <p>Each call to {@link #poll()} advances the computation once. A computation that
 * cannot make progress returns {@link Poll#pending()} after arranging for the waker of
 * the current task ({@link CurrentTask#current()}) to be woken once progress is
 * possible. The driver then polls again.</p>
 *
 * <p>A thrown {@link Exception} is the computation's error result. A thrown
 * {@link Error} is treated as an unwind: the computation must not be polled again.</p>
 *
 * @param <T> the value type
 */
@FunctionalInterface
public interface Pollable<T> {

    Poll<T> poll() throws Exception;

    /**
     * Wraps this computation in a {@link TracedFuture} with the given display name.
     */
    default TracedFuture<T> traced(String name) {
        return TracedFuture.of(this, name);
    }

    /**
     * Wraps this computation in a {@link TracedFuture} with a display name and metadata
     * recorded on the start event.
     */
    default TracedFuture<T> traced(String name, Map<String, String> metadata) {
        return TracedFuture.of(this, name, metadata);
    }
}
