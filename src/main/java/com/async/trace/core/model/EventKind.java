package com.async.trace.core.model;

/**
 * Kinds of trace events. The async kinds are produced by instrumented futures,
 * the sync and thread kinds by scoped spans that share the same schema.
 */
public enum EventKind {
    ASYNC_START,
    ASYNC_ON_CPU,
    ASYNC_OFF_CPU,
    ASYNC_END,
    SYNC_START,
    SYNC_END,
    THREAD_START,
    THREAD_END,
    WAKEUP
}
