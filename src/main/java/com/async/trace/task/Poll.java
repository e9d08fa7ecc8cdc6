package com.async.trace.task;

import java.util.Objects;
import java.util.function.Function;

/**
 * Result of a single poll attempt: either ready with a value, or pending.
 *
 * @param <T> the value type
 */
public final class Poll<T> {

    private static final Poll<?> PENDING = new Poll<>(false, null);

    private final boolean ready;
    private final T value;

    private Poll(boolean ready, T value) {
        this.ready = ready;
        this.value = value;
    }

    public static <T> Poll<T> ready(T value) {
        return new Poll<>(true, value);
    }

    @SuppressWarnings("unchecked")
    public static <T> Poll<T> pending() {
        return (Poll<T>) PENDING;
    }

    public boolean isReady() {
        return ready;
    }

    public boolean isPending() {
        return !ready;
    }

    /**
     * Returns the value of a ready poll.
     *
     * @throws IllegalStateException if this poll is pending
     */
    public T value() {
        if (!ready) {
            throw new IllegalStateException("Poll is pending");
        }
        return value;
    }

    public <U> Poll<U> map(Function<? super T, ? extends U> mapper) {
        return ready ? Poll.ready(mapper.apply(value)) : Poll.pending();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Poll<?> other)) return false;
        return ready == other.ready && Objects.equals(value, other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(ready, value);
    }

    @Override
    public String toString() {
        return ready ? "Ready(" + value + ")" : "Pending";
    }
}
