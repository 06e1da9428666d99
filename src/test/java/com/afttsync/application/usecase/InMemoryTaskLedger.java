package com.afttsync.application.usecase;

import com.afttsync.domain.model.TaskKind;
import com.afttsync.domain.model.TaskLogEntry;
import com.afttsync.domain.model.TaskSnapshot;
import com.afttsync.domain.model.TaskStatus;
import com.afttsync.domain.model.TriggerOrigin;
import com.afttsync.domain.ports.TaskLedger;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Task ledger kept in memory.
 */
class InMemoryTaskLedger implements TaskLedger {

    private final AtomicLong sequence = new AtomicLong();
    private final Map<Long, TaskSnapshot> rows = new ConcurrentHashMap<>();
    private final Map<Long, List<TaskLogEntry>> logs = new ConcurrentHashMap<>();

    @Override
    public long create(TaskKind kind, TriggerOrigin trigger, Instant startedAt) {
        long id = sequence.incrementAndGet();
        rows.put(id, TaskSnapshot.started(id, kind, trigger, startedAt));
        logs.put(id, List.of());
        return id;
    }

    @Override
    public void update(TaskSnapshot snapshot, List<TaskLogEntry> entries) {
        rows.put(snapshot.id(), snapshot);
        logs.put(snapshot.id(), List.copyOf(entries));
    }

    @Override
    public Optional<TaskSnapshot> findById(long taskId) {
        return Optional.ofNullable(rows.get(taskId));
    }

    @Override
    public List<TaskLogEntry> findLogs(long taskId) {
        return logs.getOrDefault(taskId, List.of());
    }

    @Override
    public List<TaskSnapshot> findRecent(int limit) {
        return rows.values().stream()
            .sorted(Comparator.comparingLong(TaskSnapshot::id).reversed())
            .limit(limit)
            .toList();
    }

    @Override
    public int cancelStaleRunning(Instant finishedAt) {
        int count = 0;
        for (TaskSnapshot row : rows.values()) {
            if (row.status() == TaskStatus.RUNNING) {
                rows.put(row.id(), row.withError("Interrupted by a service restart")
                    .finished(TaskStatus.CANCELLED, finishedAt));
                count++;
            }
        }
        return count;
    }

    int size() {
        return rows.size();
    }
}
