package com.async.trace.metrics;

import com.async.trace.core.model.EventKind;
import com.async.trace.state.TraceInvariantError;

/**
 * No-op implementation of {@link TraceMetrics}.
 */
public class NoOpTraceMetrics implements TraceMetrics {

    @Override
    public void eventEmitted(EventKind kind) {
    }

    @Override
    public void wakeupSuppressed() {
    }

    @Override
    public void futurePoisoned() {
    }

    @Override
    public void invariantViolated(TraceInvariantError.Kind kind) {
    }
}
