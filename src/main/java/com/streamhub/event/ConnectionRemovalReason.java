package com.streamhub.event;

public enum ConnectionRemovalReason {
    /** Explicit unsubscribe or leave. */
    UNSUBSCRIBED,
    /** Removed by the idle sweep. */
    TIMED_OUT,
    /** The transport stream closed or failed. */
    DISCONNECTED
}
