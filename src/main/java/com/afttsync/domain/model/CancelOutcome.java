package com.afttsync.domain.model;

public enum CancelOutcome {
    /** The running task will stop before its next unit. */
    ACKNOWLEDGED,
    /** The task already reached a terminal state. */
    NOT_RUNNING
}
