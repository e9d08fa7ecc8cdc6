package com.async.trace.task;

/**
 * Thread-local record of the waker belonging to the task currently being polled.
 */
public final class CurrentTask {

    private static final ThreadLocal<Waker> CURRENT = new ThreadLocal<>();

    private CurrentTask() {
    }

    /**
     * Returns the waker of the task currently being polled on this thread.
     *
     * @throws IllegalStateException if no task is being polled
     */
    public static Waker current() {
        Waker waker = CURRENT.get();
        if (waker == null) {
            throw new IllegalStateException("No task is currently being polled on this thread");
        }
        return waker;
    }

    public static boolean isPolling() {
        return CURRENT.get() != null;
    }

    /**
     * Polls {@code pollable} once with {@code waker} installed as the current task.
     * The previously installed waker is restored on every exit path.
     */
    public static <T> Poll<T> pollWith(Waker waker, Pollable<T> pollable) throws Exception {
        Waker previous = CURRENT.get();
        CURRENT.set(waker);
        try {
            return pollable.poll();
        } finally {
            if (previous == null) {
                CURRENT.remove();
            } else {
                CURRENT.set(previous);
            }
        }
    }
}
