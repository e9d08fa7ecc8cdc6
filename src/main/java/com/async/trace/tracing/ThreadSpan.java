package com.async.trace.tracing;

import com.async.trace.core.model.SpanId;
import com.async.trace.core.model.TraceEvent;
import com.async.trace.logging.LogContext;
import com.async.trace.state.TraceInvariantError;
import com.async.trace.state.TracerState;

/**
 * Root span covering the lifetime of a thread's traced work. Emits {@code ThreadStart}
 * when started and {@code ThreadEnd} when closed; while open it is the thread's current
 * span, so instrumented futures polled on the thread become its children.
 *
 * <p>Must be started on a thread with no current span and closed on the same thread.</p>
 */
public final class ThreadSpan implements Span {

    private final SpanId id;
    private final String name;
    private final LogContext logContext;
    private boolean closed;

    private ThreadSpan(SpanId id, String name) {
        this.id = id;
        this.name = name;
        this.logContext = LogContext.forSpan(id, name);
    }

    /**
     * Starts a root span named {@code name} on the calling thread.
     *
     * @throws TraceInvariantError if the thread already has a current span
     */
    public static ThreadSpan start(String name) {
        TracerState st = TracerState.current();
        st.currentSpan().ifPresent(current -> {
            throw TraceInvariantError.violation(TraceInvariantError.Kind.NESTED_THREAD_SPAN,
                    "Thread span '" + name + "' started inside " + current);
        });
        SpanId id = SpanId.next();
        st.emit(new TraceEvent.ThreadStart(id, name, st.now()));
        st.setCurrentSpan(id);
        return new ThreadSpan(id, name);
    }

    /**
     * Starts a root span named after the calling thread.
     */
    public static ThreadSpan start() {
        return start(Thread.currentThread().getName());
    }

    @Override
    public SpanId id() {
        return id;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        TracerState st = TracerState.current();
        try {
            if (!st.currentSpan().map(id::equals).orElse(false)) {
                throw TraceInvariantError.violation(TraceInvariantError.Kind.UNBALANCED_SPAN,
                        "Thread span " + id + " closed while " + st.currentSpan().orElse(null) + " is current");
            }
            st.setCurrentSpan(null);
            st.emit(new TraceEvent.ThreadEnd(id, st.now()));
        } finally {
            logContext.close();
        }
    }
}
