package com.async.trace.task;

import com.async.trace.core.model.SpanId;
import com.async.trace.state.TracerState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs {@link Pollable}s on a thread pool, polling again whenever they are woken.
 *
 * <p>Each spawned task is polled by at most one thread at a time; a wakeup that arrives
 * during a poll causes one more poll once the current one returns. The span that was
 * current on the spawning thread is re-entered around every poll, so instrumented
 * futures see the same parent span regardless of which worker polls them.</p>
 */
public class TaskExecutor implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(TaskExecutor.class);

    private final Executor executor;
    private final ExecutorService ownedExecutor;

    /**
     * Creates an executor backed by its own fixed pool of daemon threads.
     */
    public TaskExecutor(int threads) {
        if (threads <= 0) {
            throw new IllegalArgumentException("threads must be > 0");
        }
        this.ownedExecutor = Executors.newFixedThreadPool(threads, new WorkerThreadFactory());
        this.executor = ownedExecutor;
    }

    /**
     * Creates an executor that submits polls to {@code executor}, which the caller owns.
     */
    public TaskExecutor(Executor executor) {
        this.executor = executor;
        this.ownedExecutor = null;
    }

    /**
     * Schedules the first poll of {@code pollable} and returns a future for its result.
     * The returned future completes exceptionally with whatever the computation threw.
     */
    public <T> CompletableFuture<T> spawn(Pollable<T> pollable) {
        SpanId root = TracerState.current().currentSpan().orElse(null);
        SpawnedTask<T> task = new SpawnedTask<>(pollable, root, executor);
        task.schedule();
        return task.result;
    }

    @Override
    public void close() {
        if (ownedExecutor == null) {
            return;
        }
        ownedExecutor.shutdown();
        try {
            if (!ownedExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                ownedExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            ownedExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static final class SpawnedTask<T> implements Waker, Runnable {
        private static final int IDLE = 0;
        private static final int SCHEDULED = 1;
        private static final int RUNNING = 2;
        private static final int NOTIFIED = 3;
        private static final int DONE = 4;

        private final Pollable<T> pollable;
        private final SpanId root;
        private final Executor executor;
        private final AtomicInteger status = new AtomicInteger(SCHEDULED);
        private final CompletableFuture<T> result = new CompletableFuture<>();

        SpawnedTask(Pollable<T> pollable, SpanId root, Executor executor) {
            this.pollable = pollable;
            this.root = root;
            this.executor = executor;
        }

        void schedule() {
            try {
                executor.execute(this);
            } catch (RuntimeException e) {
                status.set(DONE);
                log.warn("task.rejected error={}", e.getMessage());
                result.completeExceptionally(e);
            }
        }

        @Override
        public void wake() {
            while (true) {
                int current = status.get();
                if (current == IDLE) {
                    if (status.compareAndSet(IDLE, SCHEDULED)) {
                        schedule();
                        return;
                    }
                } else if (current == RUNNING) {
                    if (status.compareAndSet(RUNNING, NOTIFIED)) {
                        return;
                    }
                } else {
                    return;
                }
            }
        }

        @Override
        public void run() {
            status.set(RUNNING);
            while (true) {
                Poll<T> poll;
                try {
                    poll = pollOnce();
                } catch (Throwable t) {
                    status.set(DONE);
                    log.debug("task.failed error={}", t.toString());
                    result.completeExceptionally(t);
                    return;
                }
                if (poll.isReady()) {
                    status.set(DONE);
                    result.complete(poll.value());
                    return;
                }
                if (status.compareAndSet(RUNNING, IDLE)) {
                    return;
                }
                // woken while polling
                status.set(RUNNING);
            }
        }

        private Poll<T> pollOnce() throws Exception {
            if (root == null) {
                return CurrentTask.pollWith(this, pollable);
            }
            try (TracerState.SpanScope scope = TracerState.current().enter(root)) {
                return CurrentTask.pollWith(this, pollable);
            }
        }
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger count = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "async-trace-worker-" + count.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
