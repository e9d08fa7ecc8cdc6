package com.async.trace.sink;

import com.async.trace.core.model.TraceEvent;

/**
 * Receives trace events one at a time, synchronously, on the thread that produced them.
 * Implementations must be safe to call from many threads at once and must not emit
 * trace events themselves.
 */
@FunctionalInterface
public interface TraceSink {

    void accept(TraceEvent event);

    /**
     * A sink that drops every event.
     */
    TraceSink NOOP = event -> {};
}
