package com.afttsync.domain.model;

/**
 * Who started a task.
 */
public enum TriggerOrigin {
    MANUAL,
    SCHEDULED
}
