package com.streamhub.domain.enums;

/** State of the market summary refresh cycle. */
public enum SchedulerState {
    /** No periodic task is scheduled. */
    IDLE,
    /** A periodic refresh task is scheduled and ticking. */
    REFRESHING
}
