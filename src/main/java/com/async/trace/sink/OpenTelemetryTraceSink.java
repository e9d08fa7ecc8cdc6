package com.async.trace.sink;

import com.async.trace.core.model.AsyncOutcome;
import com.async.trace.core.model.SpanId;
import com.async.trace.core.model.TraceEvent;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Context;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Sink that replays the event stream as OpenTelemetry spans.
 * Requires {@code opentelemetry-api} on the classpath (optional dependency).
 *
 * <p>Every start event opens an OpenTelemetry span, parented on the span of its
 * {@code parent_id} when that span is still open. On/off-CPU transitions and wakeups
 * become span events; end events set the status and end the span. Spans of futures
 * that are dropped before completing are never ended.</p>
 */
public class OpenTelemetryTraceSink implements TraceSink {

    static final AttributeKey<Long> SPAN_ID = AttributeKey.longKey("async.span.id");
    static final AttributeKey<Long> WAKING_SPAN_ID = AttributeKey.longKey("async.waking_span.id");

    private final Tracer tracer;
    private final Map<SpanId, Span> openSpans = new ConcurrentHashMap<>();

    public OpenTelemetryTraceSink(Tracer tracer) {
        this.tracer = tracer;
    }

    @Override
    public void accept(TraceEvent event) {
        if (event instanceof TraceEvent.AsyncStart start) {
            open(start.id(), start.parentId(), start.name(), start.metadata());
        } else if (event instanceof TraceEvent.SyncStart start) {
            open(start.id(), start.parentId(), start.name(), start.metadata());
        } else if (event instanceof TraceEvent.ThreadStart start) {
            open(start.id(), null, start.name(), Map.of());
        } else if (event instanceof TraceEvent.AsyncOnCPU onCpu) {
            addEvent(onCpu.id(), "on_cpu");
        } else if (event instanceof TraceEvent.AsyncOffCPU offCpu) {
            addEvent(offCpu.id(), "off_cpu");
        } else if (event instanceof TraceEvent.Wakeup wakeup) {
            Span parked = openSpans.get(wakeup.parkedSpan());
            if (parked != null) {
                parked.addEvent("wakeup", Attributes.of(WAKING_SPAN_ID, wakeup.wakingSpan().value()));
            }
        } else if (event instanceof TraceEvent.AsyncEnd end) {
            Span span = openSpans.remove(end.id());
            if (span != null) {
                AsyncOutcome outcome = end.outcome();
                if (outcome.isSuccess()) {
                    span.setStatus(StatusCode.OK);
                } else {
                    span.setStatus(StatusCode.ERROR, outcome.description());
                }
                span.end();
            }
        } else {
            // SyncEnd, ThreadEnd
            Span span = openSpans.remove(event.spanId());
            if (span != null) {
                span.end();
            }
        }
    }

    /**
     * Number of spans started but not yet ended.
     */
    public int openSpanCount() {
        return openSpans.size();
    }

    private void open(SpanId id, SpanId parentId, String name, Map<String, String> metadata) {
        SpanBuilder builder = tracer.spanBuilder(name);
        Span parent = parentId != null ? openSpans.get(parentId) : null;
        if (parent != null) {
            builder.setParent(Context.root().with(parent));
        } else {
            builder.setNoParent();
        }
        builder.setAttribute(SPAN_ID, id.value());
        metadata.forEach(builder::setAttribute);
        openSpans.put(id, builder.startSpan());
    }

    private void addEvent(SpanId id, String name) {
        Span span = openSpans.get(id);
        if (span != null) {
            span.addEvent(name);
        }
    }
}
