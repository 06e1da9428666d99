package com.afttsync.application.usecase;

import com.afttsync.domain.exception.TaskConflictException;
import com.afttsync.domain.model.TaskKind;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Non-terminal tasks keyed by kind. Reservation is atomic per kind; different kinds never wait on
 * each other.
 */
public class TaskRegistry {

    private final Map<TaskKind, RunningTask> running = new ConcurrentHashMap<>();

    /**
     * Registers the task built by {@code factory} unless a task of the same kind is already running.
     * The factory runs under the per-kind reservation and is not called on conflict.
     *
     * @throws TaskConflictException when the kind is taken
     */
    public RunningTask reserve(TaskKind kind, Supplier<RunningTask> factory) {
        return running.compute(kind, (key, existing) -> {
            if (existing != null) {
                throw new TaskConflictException(key, existing.id());
            }
            return factory.get();
        });
    }

    public void release(RunningTask task) {
        running.remove(task.kind(), task);
    }

    public Optional<RunningTask> find(long taskId) {
        return running.values().stream().filter(task -> task.id() == taskId).findFirst();
    }
}
