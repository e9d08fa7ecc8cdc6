package com.async.trace.logging;

import com.async.trace.core.model.SpanId;
import org.slf4j.MDC;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * AutoCloseable MDC (Mapped Diagnostic Context) wrapper for structured logging.
 * Adds key-value pairs to SLF4J MDC and restores the previous values on close, so
 * contexts can nest.
 *
 * <p>Usage with try-with-resources:</p>
 * <pre>
 * try (LogContext ctx = LogContext.forSpan(id, "load-config")) {
 *     log.info("config.loaded entries={}", count);
 * } // the enclosing span's MDC entries are back in place
 * </pre>
 */
public class LogContext implements AutoCloseable {

    public static final String SPAN_ID = "spanId";
    public static final String SPAN_NAME = "spanName";

    private final Map<String, String> previous = new LinkedHashMap<>();

    private LogContext() {
    }

    /**
     * Creates a log context carrying the id and name of a span.
     */
    public static LogContext forSpan(SpanId spanId, String spanName) {
        LogContext ctx = new LogContext();
        ctx.put(SPAN_ID, Long.toString(spanId.value()));
        ctx.put(SPAN_NAME, spanName);
        return ctx;
    }

    /**
     * Adds an additional key-value pair to this log context.
     */
    public LogContext with(String key, String value) {
        put(key, value);
        return this;
    }

    private void put(String key, String value) {
        if (!previous.containsKey(key)) {
            previous.put(key, MDC.get(key));
        }
        MDC.put(key, value);
    }

    @Override
    public void close() {
        previous.forEach((key, value) -> {
            if (value == null) {
                MDC.remove(key);
            } else {
                MDC.put(key, value);
            }
        });
        previous.clear();
    }
}
