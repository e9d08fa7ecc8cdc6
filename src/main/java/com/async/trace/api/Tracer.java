package com.async.trace.api;

import com.async.trace.core.model.TraceEvent;
import com.async.trace.metrics.NoOpTraceMetrics;
import com.async.trace.metrics.TraceMetrics;
import com.async.trace.sink.TraceSink;
import com.async.trace.state.TraceClock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Process-wide tracer: the sink events are emitted to, the clock that stamps them,
 * the metrics recorder and the configuration.
 *
 * <p>Exactly one tracer is installed at a time. Every thread's
 * {@link com.async.trace.state.TracerState} emits through it. Until a tracer is
 * installed, events go to {@link TraceSink#NOOP}.</p>
 *
 * <h2>Example usage:</h2>
 * <pre>
 * try (JsonLinesTraceSink sink = JsonLinesTraceSink.toFile(Path.of("trace.jsonl"))) {
 *     Tracer.builder().sink(sink).build().install();
 *     try (ThreadSpan root = ThreadSpan.start("main")) {
 *         String body = BlockingDriver.blockOn(fetch(url).traced("fetch"));
 *     }
 * }
 * </pre>
 */
public final class Tracer {
    private static final Logger log = LoggerFactory.getLogger(Tracer.class);

    private static final Tracer NOOP = builder().build();

    private static volatile Tracer global = NOOP;

    private final TraceSink sink;
    private final TraceClock clock;
    private final TraceMetrics metrics;
    private final TracerConfig config;

    private Tracer(Builder builder) {
        this.sink = builder.sink;
        this.clock = builder.clock;
        this.metrics = builder.metrics;
        this.config = builder.config;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns the installed tracer.
     */
    public static Tracer global() {
        return global;
    }

    /**
     * Reinstalls the no-op tracer.
     */
    public static void reset() {
        global = NOOP;
    }

    /**
     * Installs this tracer process-wide, replacing the previous one.
     */
    public Tracer install() {
        global = this;
        log.info("tracer.installed sink={} recordWakeups={} strictTimestamps={}",
                sink.getClass().getSimpleName(), config.recordWakeups(), config.strictTimestamps());
        return this;
    }

    /**
     * Passes {@code event} to the sink on the calling thread.
     */
    public void emit(TraceEvent event) {
        sink.accept(event);
        metrics.eventEmitted(event.kind());
    }

    public TraceSink sink() {
        return sink;
    }

    public TraceClock clock() {
        return clock;
    }

    public TraceMetrics metrics() {
        return metrics;
    }

    public TracerConfig config() {
        return config;
    }

    public static class Builder {
        private TraceSink sink = TraceSink.NOOP;
        private TraceClock clock = TraceClock.system();
        private TraceMetrics metrics = new NoOpTraceMetrics();
        private TracerConfig config = TracerConfig.defaults();

        public Builder sink(TraceSink sink) {
            this.sink = Objects.requireNonNull(sink, "sink is required");
            return this;
        }

        public Builder clock(TraceClock clock) {
            this.clock = Objects.requireNonNull(clock, "clock is required");
            return this;
        }

        public Builder metrics(TraceMetrics metrics) {
            this.metrics = Objects.requireNonNull(metrics, "metrics is required");
            return this;
        }

        public Builder config(TracerConfig config) {
            this.config = Objects.requireNonNull(config, "config is required");
            return this;
        }

        public Tracer build() {
            return new Tracer(this);
        }
    }
}
