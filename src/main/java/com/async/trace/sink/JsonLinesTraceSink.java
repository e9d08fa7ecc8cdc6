package com.async.trace.sink;

import com.async.trace.core.model.TraceEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.Closeable;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.locks.ReentrantLock;

/**
 * JSON Lines (JSONL) sink: writes one independently parseable JSON record per event,
 * terminated by a newline. See {@link TraceEventCodec} for the record format.
 *
 * <p>Events from many threads are serialized under a lock, so each line is written
 * whole. Encoding happens outside the lock.</p>
 */
public class JsonLinesTraceSink implements TraceSink, Closeable {
    private static final Logger log = LoggerFactory.getLogger(JsonLinesTraceSink.class);

    private final Writer writer;
    private final TraceEventCodec codec;
    private final boolean flushEachEvent;
    private final ReentrantLock lock = new ReentrantLock();
    private long written;
    private boolean closed;

    public JsonLinesTraceSink(Writer writer) {
        this(writer, new TraceEventCodec(), false);
    }

    public JsonLinesTraceSink(Writer writer, TraceEventCodec codec, boolean flushEachEvent) {
        this.writer = writer;
        this.codec = codec;
        this.flushEachEvent = flushEachEvent;
    }

    /**
     * Opens (creating or truncating) {@code path} as a UTF-8 JSONL trace file.
     */
    public static JsonLinesTraceSink toFile(Path path) throws IOException {
        BufferedWriter writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8);
        log.info("trace.sink.opened path={}", path);
        return new JsonLinesTraceSink(writer);
    }

    @Override
    public void accept(TraceEvent event) {
        String line = codec.encode(event);
        lock.lock();
        try {
            if (closed) {
                throw new IllegalStateException("Trace sink is closed");
            }
            writer.write(line);
            writer.write('\n');
            written++;
            if (flushEachEvent) {
                writer.flush();
            }
        } catch (IOException e) {
            log.error("trace.sink.write_failed kind={} error={}", event.kind(), e.getMessage());
            throw new UncheckedIOException("Failed to write trace event", e);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Number of events written so far.
     */
    public long written() {
        lock.lock();
        try {
            return written;
        } finally {
            lock.unlock();
        }
    }

    public void flush() throws IOException {
        lock.lock();
        try {
            writer.flush();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void close() throws IOException {
        lock.lock();
        try {
            if (closed) {
                return;
            }
            closed = true;
            writer.close();
            log.debug("trace.sink.closed events={}", written);
        } finally {
            lock.unlock();
        }
    }
}
