package com.async.trace.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Opaque identifier of one instrumented execution of a span.
 * Identifiers come from a process-wide counter, so they are unique and strictly
 * increasing within the process. Wraparound is not handled.
 */
public record SpanId(long value) implements Comparable<SpanId> {

    private static final AtomicLong NEXT = new AtomicLong(1);

    public SpanId {
        if (value <= 0) {
            throw new IllegalArgumentException("span id must be > 0");
        }
    }

    /**
     * Allocates a fresh span id.
     */
    public static SpanId next() {
        return new SpanId(NEXT.getAndIncrement());
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static SpanId of(long value) {
        return new SpanId(value);
    }

    @JsonValue
    @Override
    public long value() {
        return value;
    }

    @Override
    public int compareTo(SpanId other) {
        return Long.compare(value, other.value);
    }

    @Override
    public String toString() {
        return "SpanId(" + value + ")";
    }
}
