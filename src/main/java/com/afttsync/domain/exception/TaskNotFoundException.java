package com.afttsync.domain.exception;

public class TaskNotFoundException extends RuntimeException {

    public TaskNotFoundException(long taskId) {
        super("Unknown task " + taskId);
    }
}
