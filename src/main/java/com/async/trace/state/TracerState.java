package com.async.trace.state;

import com.async.trace.api.Tracer;
import com.async.trace.core.model.SpanId;
import com.async.trace.core.model.TraceEvent;

import java.util.Objects;
import java.util.Optional;

/**
 * Per-thread trace context.
 *
 * <p>Tracks the span the calling code is currently inside, the last timestamp issued on
 * this thread and the guard that stops wakeup logging from feeding back into itself.
 * An instance belongs to exactly one thread and is never synchronized: every event is
 * logged from the thread on which it causally happened.</p>
 *
 * <p>Whenever a poll returns to its caller, {@link #currentSpan()} must hold the value it
 * had before the call.</p>
 */
public final class TracerState {

    private static final ThreadLocal<TracerState> STATE = ThreadLocal.withInitial(TracerState::new);

    private SpanId currentSpan;
    private boolean currentlyLoggingWakeup;
    private long lastTimestamp = Long.MIN_VALUE;
    private Tracer stampingTracer;

    private TracerState() {
    }

    /**
     * Returns the calling thread's state.
     */
    public static TracerState current() {
        return STATE.get();
    }

    public Optional<SpanId> currentSpan() {
        return Optional.ofNullable(currentSpan);
    }

    /**
     * Sets the span the calling context is inside; {@code null} clears it.
     */
    public void setCurrentSpan(SpanId span) {
        this.currentSpan = span;
    }

    public boolean isLoggingWakeup() {
        return currentlyLoggingWakeup;
    }

    public void setLoggingWakeup(boolean loggingWakeup) {
        this.currentlyLoggingWakeup = loggingWakeup;
    }

    /**
     * Returns a timestamp from the installed tracer's clock. With strict timestamps
     * enabled, successive calls on one thread never return the same value twice while
     * the same tracer stays installed.
     */
    public long now() {
        Tracer tracer = Tracer.global();
        if (tracer != stampingTracer) {
            stampingTracer = tracer;
            lastTimestamp = Long.MIN_VALUE;
        }
        long ts = tracer.clock().nanoTime();
        if (tracer.config().strictTimestamps() && ts <= lastTimestamp) {
            ts = lastTimestamp + 1;
        }
        lastTimestamp = ts;
        return ts;
    }

    /**
     * Hands a fully stamped event to the installed tracer's sink.
     */
    public void emit(TraceEvent event) {
        Tracer.global().emit(event);
    }

    /**
     * Makes {@code span} the current span until the returned scope is closed, at which
     * point the previous current span is restored.
     */
    public SpanScope enter(SpanId span) {
        Objects.requireNonNull(span, "span is required");
        SpanScope scope = new SpanScope(this, span, currentSpan);
        currentSpan = span;
        return scope;
    }

    /**
     * Scope returned by {@link #enter(SpanId)}.
     */
    public static final class SpanScope implements AutoCloseable {
        private final TracerState state;
        private final SpanId entered;
        private final SpanId previous;
        private boolean closed;

        private SpanScope(TracerState state, SpanId entered, SpanId previous) {
            this.state = state;
            this.entered = entered;
            this.previous = previous;
        }

        public SpanId entered() {
            return entered;
        }

        public Optional<SpanId> previous() {
            return Optional.ofNullable(previous);
        }

        @Override
        public void close() {
            if (closed) {
                return;
            }
            closed = true;
            if (!entered.equals(state.currentSpan)) {
                throw TraceInvariantError.violation(TraceInvariantError.Kind.UNBALANCED_SPAN,
                        "Span scope for " + entered + " closed while " + state.currentSpan + " is current");
            }
            state.currentSpan = previous;
        }
    }
}
