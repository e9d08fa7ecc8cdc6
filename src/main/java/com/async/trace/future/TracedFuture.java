package com.async.trace.future;

import com.async.trace.api.Tracer;
import com.async.trace.core.model.AsyncOutcome;
import com.async.trace.core.model.SpanId;
import com.async.trace.core.model.TraceEvent;
import com.async.trace.state.TraceInvariantError;
import com.async.trace.state.TracerState;
import com.async.trace.task.CurrentTask;
import com.async.trace.task.Poll;
import com.async.trace.task.Pollable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Instrumented wrapper around a {@link Pollable}.
 *
 * <p>The first poll opens a span whose parent is the polling thread's current span and
 * emits {@code AsyncStart}. Every poll is bracketed by {@code AsyncOnCPU} and
 * {@code AsyncOffCPU}, with this span as the current span in between. When the inner
 * computation returns a value or throws an exception, {@code AsyncEnd} records the
 * outcome. Values and exceptions pass through unchanged.</p>
 *
 * <p>While pending, the inner computation only sees a fresh {@link Notifier} as its
 * current task; waking it logs a wakeup against this span and wakes the driver that
 * polled this future.</p>
 *
 * <p>If the inner computation throws an {@link Error} the future is poisoned and the
 * error propagates. Polling a resolved or poisoned future, polling without a current
 * span, or polling under a different parent span than the first poll throws
 * {@link TraceInvariantError}. Polling with no current task throws
 * {@link IllegalStateException} and leaves the future untouched. Futures must not be
 * polled concurrently with themselves.</p>
 *
 * @param <T> the value type
 */
public final class TracedFuture<T> implements Pollable<T> {
    private static final Logger log = LoggerFactory.getLogger(TracedFuture.class);

    private final Pollable<T> inner;
    private State state;

    private TracedFuture(Pollable<T> inner, String name, Map<String, String> metadata) {
        this.inner = Objects.requireNonNull(inner, "inner is required");
        this.state = new Created(Objects.requireNonNull(name, "name is required"),
                metadata != null ? Map.copyOf(metadata) : Map.of());
    }

    public static <T> TracedFuture<T> of(Pollable<T> inner, String name) {
        return new TracedFuture<>(inner, name, Map.of());
    }

    public static <T> TracedFuture<T> of(Pollable<T> inner, String name, Map<String, String> metadata) {
        return new TracedFuture<>(inner, name, metadata);
    }

    /**
     * The wrapped computation.
     */
    public Pollable<T> inner() {
        return inner;
    }

    @Override
    public Poll<T> poll() throws Exception {
        if (!CurrentTask.isPolling()) {
            throw new IllegalStateException("Traced future polled outside of a task");
        }
        TracerState st = TracerState.current();
        State previous = state;
        state = Poisoned.INSTANCE;

        SpanId parent;
        SpanId id;
        if (previous instanceof Created created) {
            parent = st.currentSpan().orElseThrow(() -> TraceInvariantError.violation(
                    TraceInvariantError.Kind.MISSING_PARENT_SPAN,
                    "Missing parent span for '" + created.name() + "'"));
            id = SpanId.next();
            st.emit(new TraceEvent.AsyncStart(id, parent, created.name(), st.now(), created.metadata()));
        } else if (previous instanceof Executing executing) {
            parent = executing.parent();
            id = executing.id();
            if (!st.currentSpan().equals(Optional.of(parent))) {
                throw TraceInvariantError.violation(TraceInvariantError.Kind.PARENT_SPAN_CHANGED,
                        "Parent span changed across execution of " + id + ": expected " + parent
                                + ", found " + st.currentSpan().orElse(null));
            }
        } else if (previous instanceof Resolved) {
            throw TraceInvariantError.violation(TraceInvariantError.Kind.POLLED_AFTER_RESOLVED,
                    "Polled after resolved");
        } else {
            throw TraceInvariantError.violation(TraceInvariantError.Kind.POLLED_AFTER_PANIC,
                    "Polled after panic");
        }

        Notifier notifier = new Notifier(id);
        notifier.park();

        st.emit(new TraceEvent.AsyncOnCPU(id, st.now()));
        st.setCurrentSpan(id);
        Poll<T> result;
        try {
            result = CurrentTask.pollWith(notifier, inner);
        } catch (Exception e) {
            leave(st, parent, id);
            state = Resolved.INSTANCE;
            st.emit(new TraceEvent.AsyncEnd(id, st.now(), AsyncOutcome.error(e.toString())));
            throw e;
        } catch (Error e) {
            leave(st, parent, id);
            log.warn("async.poisoned span={} error={}", id.value(), e.toString());
            Tracer.global().metrics().futurePoisoned();
            throw e;
        }
        leave(st, parent, id);

        if (result.isReady()) {
            state = Resolved.INSTANCE;
            st.emit(new TraceEvent.AsyncEnd(id, st.now(), AsyncOutcome.success()));
        } else {
            state = new Executing(parent, id);
        }
        return result;
    }

    /**
     * Returns true once the inner computation has produced a value or an exception.
     */
    public boolean isResolved() {
        return state instanceof Resolved;
    }

    public boolean isPoisoned() {
        return state instanceof Poisoned;
    }

    private static void leave(TracerState st, SpanId parent, SpanId id) {
        st.setCurrentSpan(parent);
        st.emit(new TraceEvent.AsyncOffCPU(id, st.now()));
    }

    private interface State {
    }

    private record Created(String name, Map<String, String> metadata) implements State {
    }

    private record Executing(SpanId parent, SpanId id) implements State {
    }

    private enum Resolved implements State {
        INSTANCE
    }

    private enum Poisoned implements State {
        INSTANCE
    }
}
