package com.async.trace.task;

/**
 * Wait handle of a driver. Waking it tells the driver to poll its task again.
 * Implementations must tolerate being woken any number of times, from any thread.
 */
@FunctionalInterface
public interface Waker {

    void wake();

    /**
     * Returns true if waking this handle already produces a wakeup equivalent to waking
     * {@code other}. Used to avoid replacing a parked handle with an equivalent one.
     */
    default boolean willWake(Waker other) {
        return this == other;
    }
}
