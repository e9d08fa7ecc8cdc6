package com.async.trace.task;

import java.time.Duration;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.LockSupport;

/**
 * Drives a {@link Pollable} to completion on the calling thread, parking the thread
 * between wakeups.
 */
public final class BlockingDriver {

    private BlockingDriver() {
    }

    /**
     * Polls until ready and returns the value, or rethrows what the computation threw.
     */
    public static <T> T blockOn(Pollable<T> pollable) throws Exception {
        ThreadWaker waker = new ThreadWaker(Thread.currentThread());
        while (true) {
            Poll<T> poll = CurrentTask.pollWith(waker, pollable);
            if (poll.isReady()) {
                return poll.value();
            }
            waker.await();
        }
    }

    /**
     * Like {@link #blockOn(Pollable)}, giving up once {@code timeout} elapses without
     * the computation completing.
     *
     * @throws TimeoutException if the computation is still pending at the deadline
     */
    public static <T> T blockOn(Pollable<T> pollable, Duration timeout) throws Exception {
        long deadline = System.nanoTime() + timeout.toNanos();
        ThreadWaker waker = new ThreadWaker(Thread.currentThread());
        while (true) {
            Poll<T> poll = CurrentTask.pollWith(waker, pollable);
            if (poll.isReady()) {
                return poll.value();
            }
            if (!waker.await(deadline)) {
                throw new TimeoutException("Computation still pending after " + timeout.toMillis() + "ms");
            }
        }
    }

    static final class ThreadWaker implements Waker {
        private final Thread thread;
        private final AtomicBoolean notified = new AtomicBoolean();

        ThreadWaker(Thread thread) {
            this.thread = thread;
        }

        @Override
        public void wake() {
            notified.set(true);
            LockSupport.unpark(thread);
        }

        void await() throws InterruptedException {
            while (!notified.getAndSet(false)) {
                LockSupport.park(this);
                if (Thread.interrupted()) {
                    throw new InterruptedException();
                }
            }
        }

        boolean await(long deadlineNanos) throws InterruptedException {
            while (!notified.getAndSet(false)) {
                long remaining = deadlineNanos - System.nanoTime();
                if (remaining <= 0) {
                    return false;
                }
                LockSupport.parkNanos(this, remaining);
                if (Thread.interrupted()) {
                    throw new InterruptedException();
                }
            }
            return true;
        }
    }
}
