package com.async.trace.state;

import com.async.trace.api.Tracer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fatal breach of a span invariant: a parent span that changed across polls, a future
 * polled after it resolved or unwound, a missing root span, or an unbalanced span close.
 *
 * <p>These indicate a bug in how the instrumentation is integrated, not a transient
 * condition. This is an {@link Error} so that it is not caught by code handling the
 * wrapped computation's own exceptions, and so that it poisons every instrumented
 * future it unwinds through.</p>
 */
public class TraceInvariantError extends Error {
    private static final Logger log = LoggerFactory.getLogger(TraceInvariantError.class);

    private final Kind kind;

    public TraceInvariantError(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    /**
     * Logs and counts a violation, returning the error for the caller to throw.
     */
    public static TraceInvariantError violation(Kind kind, String message) {
        log.error("trace.invariant.violated kind={} message='{}'", kind, message);
        Tracer.global().metrics().invariantViolated(kind);
        return new TraceInvariantError(kind, message);
    }

    public Kind getKind() {
        return kind;
    }

    public enum Kind {
        MISSING_PARENT_SPAN,
        PARENT_SPAN_CHANGED,
        POLLED_AFTER_RESOLVED,
        POLLED_AFTER_PANIC,
        UNBALANCED_SPAN,
        NESTED_THREAD_SPAN
    }
}
