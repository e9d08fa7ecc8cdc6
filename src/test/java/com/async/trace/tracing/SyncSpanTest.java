package com.async.trace.tracing;

import com.async.trace.api.Tracer;
import com.async.trace.core.model.EventKind;
import com.async.trace.core.model.SpanId;
import com.async.trace.core.model.TraceEvent;
import com.async.trace.logging.LogContext;
import com.async.trace.sink.CollectingTraceSink;
import com.async.trace.state.TraceInvariantError;
import com.async.trace.state.TracerState;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("SyncSpan Tests")
class SyncSpanTest {

    private CollectingTraceSink sink;

    @BeforeEach
    void setUp() {
        sink = new CollectingTraceSink();
        Tracer.builder().sink(sink).build().install();
    }

    @AfterEach
    void tearDown() {
        TracerState.current().setCurrentSpan(null);
        Tracer.reset();
        MDC.clear();
    }

    @Test
    @DisplayName("Should open a child of the current span and restore it on close")
    void childOfCurrentSpan() {
        try (ThreadSpan root = ThreadSpan.start("main")) {
            try (SyncSpan span = SyncSpan.enter("parse", Map.of("format", "jsonl"))) {
                assertEquals(root.id(), span.parent());
                assertEquals(Optional.of(span.id()), TracerState.current().currentSpan());
                assertEquals(Long.toString(span.id().value()), MDC.get(LogContext.SPAN_ID));
            }
            assertEquals(Optional.of(root.id()), TracerState.current().currentSpan());
            assertEquals(Long.toString(root.id().value()), MDC.get(LogContext.SPAN_ID));
        }

        assertEquals(List.of(EventKind.THREAD_START, EventKind.SYNC_START, EventKind.SYNC_END, EventKind.THREAD_END),
                sink.kinds());
        TraceEvent.SyncStart start = sink.events(TraceEvent.SyncStart.class).get(0);
        assertEquals("parse", start.name());
        assertEquals(Map.of("format", "jsonl"), start.metadata());
    }

    @Test
    @DisplayName("Nested sync spans should chain their parents")
    void nestedSpans() {
        try (ThreadSpan root = ThreadSpan.start("main");
             SyncSpan outer = SyncSpan.enter("outer");
             SyncSpan inner = SyncSpan.enter("inner")) {
            assertEquals(root.id(), outer.parent());
            assertEquals(outer.id(), inner.parent());
        }
        assertEquals(Optional.empty(), TracerState.current().currentSpan());
    }

    @Test
    @DisplayName("Entering without a current span should fail fatally")
    void missingParent() {
        TraceInvariantError error = assertThrows(TraceInvariantError.class, () -> SyncSpan.enter("orphan"));
        assertEquals(TraceInvariantError.Kind.MISSING_PARENT_SPAN, error.getKind());
        assertEquals(0, sink.size());
    }

    @Test
    @DisplayName("call() should return the body's value inside the span")
    void callReturnsValue() throws Exception {
        try (ThreadSpan ignored = ThreadSpan.start("main")) {
            String value = SyncSpan.call("compute", () -> {
                SpanId current = TracerState.current().currentSpan().orElseThrow();
                return "in " + current.value();
            });

            SpanId syncId = sink.events(TraceEvent.SyncStart.class).get(0).id();
            assertEquals("in " + syncId.value(), value);
        }
    }

    @Test
    @DisplayName("call() should close the span when the body throws")
    void callClosesOnFailure() {
        try (ThreadSpan root = ThreadSpan.start("main")) {
            IOException failure = new IOException("disk");
            IOException thrown = assertThrows(IOException.class, () -> SyncSpan.call("read", () -> {
                throw failure;
            }));

            assertSame(failure, thrown);
            assertEquals(Optional.of(root.id()), TracerState.current().currentSpan());
            assertEquals(1, sink.events(TraceEvent.SyncEnd.class).size());
        }
    }

    @Test
    @DisplayName("Closing out of order should fail fatally")
    void outOfOrderClose() {
        try (ThreadSpan root = ThreadSpan.start("main")) {
            SyncSpan outer = SyncSpan.enter("outer");
            SyncSpan inner = SyncSpan.enter("inner");

            TraceInvariantError error = assertThrows(TraceInvariantError.class, outer::close);
            assertEquals(TraceInvariantError.Kind.UNBALANCED_SPAN, error.getKind());

            inner.close();
            TracerState.current().setCurrentSpan(root.id());
        }
    }
}
