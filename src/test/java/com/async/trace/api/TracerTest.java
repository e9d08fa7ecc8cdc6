package com.async.trace.api;

import com.async.trace.core.model.EventKind;
import com.async.trace.core.model.SpanId;
import com.async.trace.core.model.TraceEvent;
import com.async.trace.metrics.TraceMetrics;
import com.async.trace.sink.TraceSink;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@DisplayName("Tracer Tests")
class TracerTest {

    @AfterEach
    void tearDown() {
        Tracer.reset();
    }

    @Test
    @DisplayName("Install should replace the global tracer")
    void installReplacesGlobal() {
        Tracer tracer = Tracer.builder().build();

        assertSame(tracer, tracer.install());
        assertSame(tracer, Tracer.global());
    }

    @Test
    @DisplayName("Reset should reinstall the no-op tracer")
    void resetRestoresNoop() {
        Tracer.builder().build().install();
        Tracer.reset();

        assertSame(TraceSink.NOOP, Tracer.global().sink());
    }

    @Test
    @DisplayName("Emit should pass the event to the sink before counting it")
    void emitForwardsToSinkAndMetrics() {
        TraceSink sink = mock(TraceSink.class);
        TraceMetrics metrics = mock(TraceMetrics.class);
        Tracer tracer = Tracer.builder().sink(sink).metrics(metrics).build();
        TraceEvent event = new TraceEvent.AsyncOnCPU(SpanId.next(), 1L);

        tracer.emit(event);

        InOrder order = inOrder(sink, metrics);
        order.verify(sink).accept(event);
        order.verify(metrics).eventEmitted(EventKind.ASYNC_ON_CPU);
    }

    @Test
    @DisplayName("Sink failures should propagate to the emitter")
    void sinkFailurePropagates() {
        TraceMetrics metrics = mock(TraceMetrics.class);
        Tracer tracer = Tracer.builder()
                .sink(event -> {
                    throw new IllegalStateException("sink down");
                })
                .metrics(metrics)
                .build();

        assertThrows(IllegalStateException.class,
                () -> tracer.emit(new TraceEvent.SyncEnd(SpanId.next(), 1L)));
        verifyNoInteractions(metrics);
    }

    @Test
    @DisplayName("Builder should reject null collaborators")
    void builderRejectsNulls() {
        Tracer.Builder builder = Tracer.builder();
        assertThrows(NullPointerException.class, () -> builder.sink(null));
        assertThrows(NullPointerException.class, () -> builder.clock(null));
        assertThrows(NullPointerException.class, () -> builder.metrics(null));
        assertThrows(NullPointerException.class, () -> builder.config(null));
    }
}
