package com.afttsync.domain.model;

import java.time.Instant;

/**
 * One timestamped line of a task's log.
 */
public record TaskLogEntry(Instant timestamp, String message) {
}
