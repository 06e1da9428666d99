package com.afttsync.application.usecase;

import com.afttsync.domain.model.TaskKind;
import com.afttsync.domain.model.TaskSnapshot;
import com.afttsync.domain.model.TaskStatus;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;

/**
 * In-memory state of a task while it runs. Readers get the last published snapshot without blocking.
 */
public class RunningTask {

    private final long id;
    private final TaskKind kind;
    private final CancellationToken token = new CancellationToken();
    private final AtomicReference<TaskSnapshot> progress;
    private final TaskLog log;

    public RunningTask(TaskSnapshot initial, TaskLog log) {
        this.id = initial.id();
        this.kind = initial.kind();
        this.progress = new AtomicReference<>(initial);
        this.log = log;
    }

    public long id() {
        return id;
    }

    public TaskKind kind() {
        return kind;
    }

    public CancellationToken token() {
        return token;
    }

    public TaskLog log() {
        return log;
    }

    public TaskSnapshot snapshot() {
        return progress.get();
    }

    /** Only the worker thread publishes, so read-modify-write needs no retry loop. */
    TaskSnapshot publish(UnaryOperator<TaskSnapshot> change) {
        return progress.updateAndGet(change);
    }

    /**
     * Sets the cancellation flag unless the task already reached a terminal status.
     *
     * @return {@code true} when the request was accepted and the task will end as cancelled
     */
    synchronized boolean requestCancel() {
        if (!progress.get().isRunning()) {
            return false;
        }
        token.cancel();
        return true;
    }

    /**
     * Publishes the terminal snapshot. A success requested after an accepted cancellation ends as cancelled.
     */
    synchronized TaskSnapshot complete(TaskStatus status, String error, Instant finishedAt) {
        TaskStatus terminal = status == TaskStatus.SUCCESS && token.isCancelled() ? TaskStatus.CANCELLED : status;
        return publish(snapshot -> {
            TaskSnapshot withError = error == null ? snapshot : snapshot.withError(error);
            return withError.finished(terminal, finishedAt);
        });
    }
}
