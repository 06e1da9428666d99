package com.afttsync.application.usecase;

import java.time.Duration;

/**
 * Orchestration settings.
 *
 * @param pacingDelay        pause between two units
 * @param profilePacingDelay pause between two profile sheets inside one unit
 * @param logCapacity        maximum log lines kept per task
 */
public record ScrapeSettings(Duration pacingDelay, Duration profilePacingDelay, int logCapacity) {

    public static final int DEFAULT_LOG_CAPACITY = 1000;
}
