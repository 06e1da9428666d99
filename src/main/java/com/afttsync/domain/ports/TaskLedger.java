package com.afttsync.domain.ports;

import com.afttsync.domain.model.TaskKind;
import com.afttsync.domain.model.TaskLogEntry;
import com.afttsync.domain.model.TaskSnapshot;
import com.afttsync.domain.model.TriggerOrigin;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Durable record of every task run.
 */
public interface TaskLedger {

    /**
     * Creates a running task row and returns its id. Ids are sequential.
     */
    long create(TaskKind kind, TriggerOrigin trigger, Instant startedAt);

    /**
     * Overwrites the progress fields and logs of a task row.
     */
    void update(TaskSnapshot snapshot, List<TaskLogEntry> logs);

    Optional<TaskSnapshot> findById(long taskId);

    List<TaskLogEntry> findLogs(long taskId);

    /** Most recent tasks first. */
    List<TaskSnapshot> findRecent(int limit);

    /**
     * Finalizes rows still marked running, left behind by a previous process, as cancelled.
     *
     * @return number of rows finalized
     */
    int cancelStaleRunning(Instant finishedAt);
}
