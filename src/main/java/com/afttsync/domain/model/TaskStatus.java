package com.afttsync.domain.model;

/**
 * Task lifecycle: {@code RUNNING} moves exactly once to one of the terminal states.
 */
public enum TaskStatus {
    RUNNING,
    SUCCESS,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this != RUNNING;
    }
}
