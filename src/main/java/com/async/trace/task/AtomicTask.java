package com.async.trace.task;

import java.util.concurrent.locks.ReentrantLock;

/**
 * Atomic slot holding the waker of a single parked task.
 *
 * <p><b>Only one waiter is supported.</b> Parking a second task replaces the first,
 * so a data structure that needs to wake potentially many waiters must not share one
 * {@code AtomicTask} between them: every waiter except the last to park would never be
 * woken and would deadlock. Use one slot per waiter for fan-out.</p>
 *
 * <p>The protocol is: {@link #park()} records the intent of the current task to be
 * woken, {@link #notifyWaiter()} consumes that intent and wakes exactly the
 * last-recorded task. The lock is held only while the slot is read or written, never
 * while a waker runs.</p>
 */
public class AtomicTask {

    private final ReentrantLock lock = new ReentrantLock();
    private Waker waker;

    /**
     * Records the current task as the one to wake next, unless the recorded waker
     * already wakes it.
     *
     * @throws IllegalStateException if called outside of a poll
     */
    public void park() {
        Waker current = CurrentTask.current();
        lock.lock();
        try {
            if (waker != null && waker.willWake(current)) {
                return;
            }
            waker = current;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Takes the recorded waker, if any, and wakes it. The slot is empty afterwards,
     * so a second call without an intervening {@link #park()} does nothing.
     *
     * @return true if a waker was woken
     */
    public boolean notifyWaiter() {
        Waker taken;
        lock.lock();
        try {
            taken = waker;
            waker = null;
        } finally {
            lock.unlock();
        }
        if (taken == null) {
            return false;
        }
        taken.wake();
        return true;
    }

    /**
     * Returns true if a waker is currently recorded.
     */
    public boolean isParked() {
        lock.lock();
        try {
            return waker != null;
        } finally {
            lock.unlock();
        }
    }
}
