package com.afttsync.domain.exception;

import com.afttsync.domain.model.TaskKind;

/**
 * A task of the same kind is already running.
 */
public class TaskConflictException extends RuntimeException {

    private final TaskKind kind;
    private final long runningTaskId;

    public TaskConflictException(TaskKind kind, long runningTaskId) {
        super("A " + kind.getTag() + " task is already running (task " + runningTaskId + ")");
        this.kind = kind;
        this.runningTaskId = runningTaskId;
    }

    public TaskKind getKind() {
        return kind;
    }

    public long getRunningTaskId() {
        return runningTaskId;
    }
}
