package com.async.trace.sink;

import com.async.trace.core.model.TraceEvent;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.UncheckedIOException;

/**
 * JSON encoding of trace events: one self-contained object per event, discriminated by
 * a {@code type} field.
 *
 * <pre>
 * {"type":"AsyncStart","id":7,"parent_id":1,"name":"fetch","ts":1200,"metadata":{}}
 * {"type":"AsyncOnCPU","id":7,"ts":1350}
 * {"type":"Wakeup","waking_span":3,"parked_span":7,"ts":9800}
 * {"type":"AsyncEnd","id":7,"ts":12000,"outcome":{"status":"SUCCESS"}}
 * </pre>
 */
public class TraceEventCodec {

    private final ObjectMapper objectMapper;

    public TraceEventCodec() {
        this.objectMapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    /**
     * Encodes an event as a single line of JSON (no trailing newline).
     */
    public String encode(TraceEvent event) {
        try {
            return objectMapper.writerFor(TraceEvent.class).writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to encode " + event.kind() + " event", e);
        }
    }

    /**
     * Decodes one line produced by {@link #encode(TraceEvent)}.
     *
     * @throws UncheckedIOException if the line is not a valid event record
     */
    public TraceEvent decode(String line) {
        try {
            return objectMapper.readValue(line, TraceEvent.class);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to decode trace event: " + e.getOriginalMessage(), e);
        }
    }
}
