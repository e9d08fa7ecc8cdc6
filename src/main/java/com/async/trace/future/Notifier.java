package com.async.trace.future;

import com.async.trace.api.Tracer;
import com.async.trace.core.model.SpanId;
import com.async.trace.core.model.TraceEvent;
import com.async.trace.state.TracerState;
import com.async.trace.task.AtomicTask;
import com.async.trace.task.Waker;

import java.util.Optional;

/**
 * Wakeup relay installed as the current task while an instrumented future polls its
 * inner computation.
 *
 * <p>When woken, from any thread and any number of times, it logs a
 * {@link TraceEvent.Wakeup} linking the waking thread's current span to the parked
 * span, then wakes the driver recorded in its {@link AtomicTask}. A thread that is
 * already logging a wakeup does not log another one, so wakeups triggered while
 * emitting or relaying a wakeup are forwarded silently.</p>
 *
 * <p>One notifier is created per poll attempt and never reused.</p>
 */
final class Notifier implements Waker {

    private final AtomicTask parentTask = new AtomicTask();
    private final SpanId parkedSpan;

    Notifier(SpanId parkedSpan) {
        this.parkedSpan = parkedSpan;
    }

    /**
     * Records the driver currently polling as the one to wake.
     */
    void park() {
        parentTask.park();
    }

    SpanId parkedSpan() {
        return parkedSpan;
    }

    @Override
    public void wake() {
        TracerState state = TracerState.current();
        boolean shouldLog = !state.isLoggingWakeup();
        if (shouldLog) {
            state.setLoggingWakeup(true);
        } else {
            Tracer.global().metrics().wakeupSuppressed();
        }
        try {
            if (shouldLog && Tracer.global().config().recordWakeups()) {
                Optional<SpanId> waking = state.currentSpan();
                if (waking.isPresent()) {
                    state.emit(new TraceEvent.Wakeup(waking.get(), parkedSpan, state.now()));
                }
            }
            parentTask.notifyWaiter();
        } finally {
            if (shouldLog) {
                state.setLoggingWakeup(false);
            }
        }
    }
}
