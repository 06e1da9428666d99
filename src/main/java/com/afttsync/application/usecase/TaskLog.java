package com.afttsync.application.usecase;

import com.afttsync.domain.model.TaskLogEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Bounded, timestamped log of one task. The oldest lines are dropped once the capacity is reached.
 * Every line is also written to the application log.
 */
public class TaskLog {

    private static final Logger logger = LoggerFactory.getLogger(TaskLog.class);

    private final long taskId;
    private final int capacity;
    private final Clock clock;
    private final Deque<TaskLogEntry> entries = new ArrayDeque<>();
    private final Object lock = new Object();

    public TaskLog(long taskId, int capacity, Clock clock) {
        this.taskId = taskId;
        this.capacity = Math.max(1, capacity);
        this.clock = clock;
    }

    public void info(String message) {
        logger.info("[task {}] {}", taskId, message);
        append(message);
    }

    public void warn(String message) {
        logger.warn("[task {}] {}", taskId, message);
        append(message);
    }

    private void append(String message) {
        TaskLogEntry entry = new TaskLogEntry(clock.instant(), message);
        synchronized (lock) {
            if (entries.size() == capacity) {
                entries.removeFirst();
            }
            entries.addLast(entry);
        }
    }

    public List<TaskLogEntry> entries() {
        synchronized (lock) {
            return List.copyOf(entries);
        }
    }
}
