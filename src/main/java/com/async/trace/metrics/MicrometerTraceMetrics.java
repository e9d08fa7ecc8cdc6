package com.async.trace.metrics;

import com.async.trace.core.model.EventKind;
import com.async.trace.state.TraceInvariantError;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

import java.util.EnumMap;
import java.util.Map;

/**
 * Micrometer-based implementation of {@link TraceMetrics}.
 * Requires {@code micrometer-core} on the classpath (optional dependency).
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code trace.events.emitted} (tag: kind)</li>
 *   <li>{@code trace.wakeups.suppressed}</li>
 *   <li>{@code trace.futures.poisoned}</li>
 *   <li>{@code trace.invariant.violations} (tag: kind)</li>
 * </ul>
 */
public class MicrometerTraceMetrics implements TraceMetrics {

    private final Map<EventKind, Counter> eventCounters = new EnumMap<>(EventKind.class);
    private final Map<TraceInvariantError.Kind, Counter> violationCounters =
            new EnumMap<>(TraceInvariantError.Kind.class);
    private final Counter wakeupsSuppressed;
    private final Counter futuresPoisoned;

    public MicrometerTraceMetrics(MeterRegistry registry) {
        for (EventKind kind : EventKind.values()) {
            eventCounters.put(kind, Counter.builder("trace.events.emitted")
                    .description("Number of trace events emitted")
                    .tag("kind", kind.name())
                    .register(registry));
        }
        for (TraceInvariantError.Kind kind : TraceInvariantError.Kind.values()) {
            violationCounters.put(kind, Counter.builder("trace.invariant.violations")
                    .description("Number of fatal span invariant violations")
                    .tag("kind", kind.name())
                    .register(registry));
        }
        this.wakeupsSuppressed = Counter.builder("trace.wakeups.suppressed")
                .description("Wakeups relayed without a wakeup event because one was already being logged")
                .register(registry);
        this.futuresPoisoned = Counter.builder("trace.futures.poisoned")
                .description("Instrumented futures that unwound during a poll")
                .register(registry);
    }

    @Override
    public void eventEmitted(EventKind kind) {
        eventCounters.get(kind).increment();
    }

    @Override
    public void wakeupSuppressed() {
        wakeupsSuppressed.increment();
    }

    @Override
    public void futurePoisoned() {
        futuresPoisoned.increment();
    }

    @Override
    public void invariantViolated(TraceInvariantError.Kind kind) {
        violationCounters.get(kind).increment();
    }
}
