package com.async.trace.sink;

import com.async.trace.core.model.EventKind;
import com.async.trace.core.model.SpanId;
import com.async.trace.core.model.TraceEvent;

import java.util.ArrayList;
import java.util.List;

/**
 * Thread-safe in-memory sink. Keeps events in arrival order.
 */
public class CollectingTraceSink implements TraceSink {

    private final List<TraceEvent> events = new ArrayList<>();

    @Override
    public synchronized void accept(TraceEvent event) {
        events.add(event);
    }

    /**
     * Returns a snapshot of all events received so far.
     */
    public synchronized List<TraceEvent> events() {
        return List.copyOf(events);
    }

    public synchronized <T extends TraceEvent> List<T> events(Class<T> type) {
        return events.stream()
                .filter(type::isInstance)
                .map(type::cast)
                .toList();
    }

    public synchronized List<TraceEvent> eventsForSpan(SpanId span) {
        return events.stream()
                .filter(e -> e.spanId().equals(span))
                .toList();
    }

    public synchronized List<EventKind> kinds() {
        return events.stream()
                .map(TraceEvent::kind)
                .toList();
    }

    public synchronized int size() {
        return events.size();
    }

    public synchronized void clear() {
        events.clear();
    }
}
