package com.async.trace.state;

/**
 * Monotonic clock used to timestamp trace events.
 */
@FunctionalInterface
public interface TraceClock {

    /**
     * Returns the current time in nanoseconds since the clock's origin.
     */
    long nanoTime();

    /**
     * Process-wide monotonic clock whose origin is the moment this class was initialized.
     */
    static TraceClock system() {
        return SystemClock.INSTANCE;
    }

    final class SystemClock implements TraceClock {
        private static final SystemClock INSTANCE = new SystemClock();

        private final long origin = System.nanoTime();

        private SystemClock() {
        }

        @Override
        public long nanoTime() {
            return System.nanoTime() - origin;
        }
    }
}
