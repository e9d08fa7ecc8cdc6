package com.async.trace.tracing;

import com.async.trace.core.model.SpanId;
import com.async.trace.core.model.TraceEvent;
import com.async.trace.logging.LogContext;
import com.async.trace.state.TraceInvariantError;
import com.async.trace.state.TracerState;

import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Synchronous child span. Emits {@code SyncStart} with the current span as parent,
 * becomes the current span, and on close restores the parent and emits {@code SyncEnd}.
 */
public final class SyncSpan implements Span {

    private final SpanId id;
    private final SpanId parent;
    private final String name;
    private final LogContext logContext;
    private boolean closed;

    private SyncSpan(SpanId id, SpanId parent, String name) {
        this.id = id;
        this.parent = parent;
        this.name = name;
        this.logContext = LogContext.forSpan(id, name);
    }

    public static SyncSpan enter(String name) {
        return enter(name, Map.of());
    }

    /**
     * Opens a span named {@code name} under the calling thread's current span.
     *
     * @throws TraceInvariantError if the thread has no current span
     */
    public static SyncSpan enter(String name, Map<String, String> metadata) {
        TracerState st = TracerState.current();
        SpanId parent = st.currentSpan().orElseThrow(() -> TraceInvariantError.violation(
                TraceInvariantError.Kind.MISSING_PARENT_SPAN, "Missing parent span for '" + name + "'"));
        SpanId id = SpanId.next();
        st.emit(new TraceEvent.SyncStart(id, parent, name, st.now(), metadata));
        st.setCurrentSpan(id);
        return new SyncSpan(id, parent, name);
    }

    /**
     * Runs {@code body} inside a span named {@code name}.
     */
    public static <T> T call(String name, Callable<T> body) throws Exception {
        try (SyncSpan ignored = enter(name)) {
            return body.call();
        }
    }

    @Override
    public SpanId id() {
        return id;
    }

    public SpanId parent() {
        return parent;
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
                        "Sync span " + id + " closed while " + st.currentSpan().orElse(null) + " is current");
            }
            st.setCurrentSpan(parent);
            st.emit(new TraceEvent.SyncEnd(id, st.now()));
        } finally {
            logContext.close();
        }
    }
}
