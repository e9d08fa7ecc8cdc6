package com.async.trace.tracing;

import com.async.trace.core.model.SpanId;

/**
 * A scoped, synchronous span on the current thread.
 * Implements {@link AutoCloseable} so spans can be used in try-with-resources blocks,
 * which ends the span and restores the enclosing span when the block exits.
 *
 * <p>Example usage:</p>
 * <pre>
 * try (Span root = ThreadSpan.start("worker")) {
 *     try (Span span = SyncSpan.enter("load-config")) {
 *         // ... do work ...
 *     }
 * }
 * </pre>
 */
public interface Span extends AutoCloseable {

    SpanId id();

    String name();

    @Override
    void close();
}
