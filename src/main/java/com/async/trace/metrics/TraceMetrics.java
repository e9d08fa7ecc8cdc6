package com.async.trace.metrics;

import com.async.trace.core.model.EventKind;
import com.async.trace.state.TraceInvariantError;

/**
 * Interface for recording tracer metrics.
 * Implementations can integrate with Micrometer or other metrics systems.
 * The default {@link NoOpTraceMetrics} does nothing, ensuring the library works
 * without any metrics dependencies on the classpath.
 */
public interface TraceMetrics {

    void eventEmitted(EventKind kind);

    /**
     * A wakeup was relayed without being logged because the thread was already
     * logging one.
     */
    void wakeupSuppressed();

    void futurePoisoned();

    void invariantViolated(TraceInvariantError.Kind kind);
}
