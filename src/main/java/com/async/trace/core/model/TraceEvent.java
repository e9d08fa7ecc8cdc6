package com.async.trace.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.Map;
import java.util.Objects;

/**
 * Immutable, timestamped trace event.
 *
 * <p>Timestamps are nanoseconds since the origin of the tracer clock. Events are
 * emitted in strictly increasing timestamp order per thread; there is no global
 * order across threads beyond the timestamps themselves.</p>
 *
 * <p>A parent/child relation is reconstructed by following {@code parent_id} on the
 * start events, an execution interval by pairing a span's start event with its end
 * event, and scheduling gaps by the on/off-CPU pairs in between.</p>
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = TraceEvent.AsyncStart.class, name = "AsyncStart"),
        @JsonSubTypes.Type(value = TraceEvent.AsyncOnCPU.class, name = "AsyncOnCPU"),
        @JsonSubTypes.Type(value = TraceEvent.AsyncOffCPU.class, name = "AsyncOffCPU"),
        @JsonSubTypes.Type(value = TraceEvent.AsyncEnd.class, name = "AsyncEnd"),
        @JsonSubTypes.Type(value = TraceEvent.SyncStart.class, name = "SyncStart"),
        @JsonSubTypes.Type(value = TraceEvent.SyncEnd.class, name = "SyncEnd"),
        @JsonSubTypes.Type(value = TraceEvent.ThreadStart.class, name = "ThreadStart"),
        @JsonSubTypes.Type(value = TraceEvent.ThreadEnd.class, name = "ThreadEnd"),
        @JsonSubTypes.Type(value = TraceEvent.Wakeup.class, name = "Wakeup")
})
public interface TraceEvent {

    /**
     * Timestamp in nanoseconds.
     */
    long ts();

    EventKind kind();

    /**
     * The span this event belongs to. For a wakeup this is the parked span.
     */
    SpanId spanId();

    record AsyncStart(
            SpanId id,
            @JsonProperty("parent_id") SpanId parentId,
            String name,
            long ts,
            Map<String, String> metadata
    ) implements TraceEvent {
        public AsyncStart {
            Objects.requireNonNull(id, "id is required");
            Objects.requireNonNull(parentId, "parentId is required");
            Objects.requireNonNull(name, "name is required");
            metadata = metadata != null ? Map.copyOf(metadata) : Map.of();
        }

        @Override
        public EventKind kind() {
            return EventKind.ASYNC_START;
        }

        @Override
        public SpanId spanId() {
            return id;
        }
    }

    record AsyncOnCPU(SpanId id, long ts) implements TraceEvent {
        public AsyncOnCPU {
            Objects.requireNonNull(id, "id is required");
        }

        @Override
        public EventKind kind() {
            return EventKind.ASYNC_ON_CPU;
        }

        @Override
        public SpanId spanId() {
            return id;
        }
    }

    record AsyncOffCPU(SpanId id, long ts) implements TraceEvent {
        public AsyncOffCPU {
            Objects.requireNonNull(id, "id is required");
        }

        @Override
        public EventKind kind() {
            return EventKind.ASYNC_OFF_CPU;
        }

        @Override
        public SpanId spanId() {
            return id;
        }
    }

    record AsyncEnd(SpanId id, long ts, AsyncOutcome outcome) implements TraceEvent {
        public AsyncEnd {
            Objects.requireNonNull(id, "id is required");
            Objects.requireNonNull(outcome, "outcome is required");
        }

        @Override
        public EventKind kind() {
            return EventKind.ASYNC_END;
        }

        @Override
        public SpanId spanId() {
            return id;
        }
    }

    record SyncStart(
            SpanId id,
            @JsonProperty("parent_id") SpanId parentId,
            String name,
            long ts,
            Map<String, String> metadata
    ) implements TraceEvent {
        public SyncStart {
            Objects.requireNonNull(id, "id is required");
            Objects.requireNonNull(parentId, "parentId is required");
            Objects.requireNonNull(name, "name is required");
            metadata = metadata != null ? Map.copyOf(metadata) : Map.of();
        }

        @Override
        public EventKind kind() {
            return EventKind.SYNC_START;
        }

        @Override
        public SpanId spanId() {
            return id;
        }
    }

    record SyncEnd(SpanId id, long ts) implements TraceEvent {
        public SyncEnd {
            Objects.requireNonNull(id, "id is required");
        }

        @Override
        public EventKind kind() {
            return EventKind.SYNC_END;
        }

        @Override
        public SpanId spanId() {
            return id;
        }
    }

    record ThreadStart(SpanId id, String name, long ts) implements TraceEvent {
        public ThreadStart {
            Objects.requireNonNull(id, "id is required");
            Objects.requireNonNull(name, "name is required");
        }

        @Override
        public EventKind kind() {
            return EventKind.THREAD_START;
        }

        @Override
        public SpanId spanId() {
            return id;
        }
    }

    record ThreadEnd(SpanId id, long ts) implements TraceEvent {
        public ThreadEnd {
            Objects.requireNonNull(id, "id is required");
        }

        @Override
        public EventKind kind() {
            return EventKind.THREAD_END;
        }

        @Override
        public SpanId spanId() {
            return id;
        }
    }

    /**
     * Correlates the span that triggered a resumption with the span that was parked.
     */
    record Wakeup(
            @JsonProperty("waking_span") SpanId wakingSpan,
            @JsonProperty("parked_span") SpanId parkedSpan,
            long ts
    ) implements TraceEvent {
        public Wakeup {
            Objects.requireNonNull(wakingSpan, "wakingSpan is required");
            Objects.requireNonNull(parkedSpan, "parkedSpan is required");
        }

        @Override
        public EventKind kind() {
            return EventKind.WAKEUP;
        }

        @Override
        public SpanId spanId() {
            return parkedSpan;
        }
    }
}
