package com.async.trace.sink;

import com.async.trace.api.Tracer;
import com.async.trace.core.model.SpanId;
import com.async.trace.core.model.TraceEvent;
import com.async.trace.future.TracedFuture;
import com.async.trace.state.TracerState;
import com.async.trace.task.BlockingDriver;
import com.async.trace.task.ManualPollable;
import com.async.trace.tracing.ThreadSpan;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("JsonLinesTraceSink Tests")
class JsonLinesTraceSinkTest {

    private final TraceEventCodec codec = new TraceEventCodec();

    @AfterEach
    void tearDown() {
        TracerState.current().setCurrentSpan(null);
        Tracer.reset();
    }

    private List<TraceEvent> parse(String output) {
        return output.lines().map(codec::decode).toList();
    }

    @Nested
    @DisplayName("Writing")
    class WriteTests {

        @Test
        @DisplayName("Should write one line per event")
        void oneLinePerEvent() throws IOException {
            StringWriter out = new StringWriter();
            TraceEvent first = new TraceEvent.ThreadStart(SpanId.of(1), "main", 1L);
            TraceEvent second = new TraceEvent.ThreadEnd(SpanId.of(1), 2L);

            try (JsonLinesTraceSink sink = new JsonLinesTraceSink(out)) {
                sink.accept(first);
                sink.accept(second);
                assertEquals(2, sink.written());
            }

            assertTrue(out.toString().endsWith("\n"));
            assertEquals(List.of(first, second), parse(out.toString()));
        }

        @Test
        @DisplayName("Concurrent writers should never interleave lines")
        void concurrentWriters() throws Exception {
            StringWriter out = new StringWriter();
            JsonLinesTraceSink sink = new JsonLinesTraceSink(out);
            int threads = 8;
            int perThread = 500;
            ExecutorService pool = Executors.newFixedThreadPool(threads);
            CountDownLatch start = new CountDownLatch(1);
            CountDownLatch done = new CountDownLatch(threads);

            for (int t = 0; t < threads; t++) {
                long spanValue = t + 1;
                pool.execute(() -> {
                    try {
                        start.await();
                        for (int i = 0; i < perThread; i++) {
                            sink.accept(new TraceEvent.AsyncOnCPU(SpanId.of(spanValue), i));
                        }
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    } finally {
                        done.countDown();
                    }
                });
            }
            start.countDown();
            assertTrue(done.await(30, TimeUnit.SECONDS));
            pool.shutdown();
            sink.close();

            List<TraceEvent> events = parse(out.toString());
            assertEquals(threads * perThread, events.size());
            assertEquals(threads * perThread, sink.written());
        }

        @Test
        @DisplayName("Should reject events after close")
        void rejectsAfterClose() throws IOException {
            JsonLinesTraceSink sink = new JsonLinesTraceSink(new StringWriter());
            sink.close();

            assertThrows(IllegalStateException.class,
                    () -> sink.accept(new TraceEvent.SyncEnd(SpanId.of(1), 1L)));
            assertDoesNotThrow(sink::close);
        }

        @Test
        @DisplayName("Write failures should surface as UncheckedIOException")
        void writeFailure() {
            Writer broken = new Writer() {
                @Override
                public void write(char[] buf, int off, int len) throws IOException {
                    throw new IOException("disk full");
                }

                @Override
                public void write(String str) throws IOException {
                    throw new IOException("disk full");
                }

                @Override
                public void flush() {
                }

                @Override
                public void close() {
                }
            };
            JsonLinesTraceSink sink = new JsonLinesTraceSink(broken);

            UncheckedIOException e = assertThrows(UncheckedIOException.class,
                    () -> sink.accept(new TraceEvent.SyncEnd(SpanId.of(1), 1L)));
            assertEquals("disk full", e.getCause().getMessage());
            assertEquals(0, sink.written());
        }

        @Test
        @DisplayName("Should write a UTF-8 file")
        void writesFile(@TempDir Path dir) throws IOException {
            Path file = dir.resolve("trace.jsonl");

            try (JsonLinesTraceSink sink = JsonLinesTraceSink.toFile(file)) {
                sink.accept(new TraceEvent.ThreadStart(SpanId.of(1), "größe", 1L));
            }

            List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
            assertEquals(1, lines.size());
            assertEquals(new TraceEvent.ThreadStart(SpanId.of(1), "größe", 1L), codec.decode(lines.get(0)));
        }
    }

    @Nested
    @DisplayName("Recorded traces")
    class StreamTests {

        @Test
        @DisplayName("A traced run should produce a self-consistent stream")
        void tracedRunIsConsistent() throws Exception {
            StringWriter out = new StringWriter();
            try (JsonLinesTraceSink sink = new JsonLinesTraceSink(out)) {
                Tracer.builder().sink(sink).build().install();

                try (ThreadSpan ignored = ThreadSpan.start("main")) {
                    ManualPollable<String> leaf = new ManualPollable<>();
                    TracedFuture<String> inner = TracedFuture.of(leaf, "inner");
                    TracedFuture<String> outer = TracedFuture.of(inner, "outer");

                    Thread producer = new Thread(() -> {
                        try {
                            Thread.sleep(20);
                        } catch (InterruptedException e) {
                            Thread.currentThread().interrupt();
                        }
                        leaf.complete("done");
                    });
                    producer.start();
                    assertEquals("done", BlockingDriver.blockOn(outer));
                    producer.join();
                }
            }

            List<TraceEvent> events = parse(out.toString());
            Set<SpanId> started = new HashSet<>();
            Set<SpanId> ended = new HashSet<>();
            Map<SpanId, Long> lastTs = new HashMap<>();

            for (TraceEvent event : events) {
                if (event instanceof TraceEvent.ThreadStart start) {
                    started.add(start.id());
                } else if (event instanceof TraceEvent.AsyncStart start) {
                    assertTrue(started.contains(start.parentId()), "parent started first: " + start);
                    started.add(start.id());
                } else if (event instanceof TraceEvent.AsyncEnd || event instanceof TraceEvent.ThreadEnd) {
                    assertTrue(started.contains(event.spanId()));
                    assertTrue(ended.add(event.spanId()), "ended once: " + event);
                } else if (!(event instanceof TraceEvent.Wakeup)) {
                    assertTrue(started.contains(event.spanId()));
                    assertFalse(ended.contains(event.spanId()));
                }
                if (!(event instanceof TraceEvent.Wakeup)) {
                    Long previous = lastTs.put(event.spanId(), event.ts());
                    if (previous != null) {
                        assertTrue(event.ts() > previous, "timestamps increase per span: " + event);
                    }
                }
            }
            assertEquals(started, ended);
            assertEquals(3, started.size());
        }
    }
}
