package com.afttsync.infrastructure.scheduling;

import com.afttsync.application.usecase.ScrapeTaskOrchestrator;
import com.afttsync.domain.exception.TaskConflictException;
import com.afttsync.domain.model.TaskKind;
import com.afttsync.domain.model.TriggerOrigin;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Starts a task on a cron schedule. Disabled unless {@code scrape.schedule.cron} is set.
 */
@Component
public class ScheduledScrapeTrigger {

    private static final Logger logger = LoggerFactory.getLogger(ScheduledScrapeTrigger.class);

    private final ScrapeTaskOrchestrator orchestrator;
    private final TaskKind kind;

    public ScheduledScrapeTrigger(ScrapeTaskOrchestrator orchestrator,
                                  @Value("${scrape.schedule.kind:full}") String kind) {
        this.orchestrator = orchestrator;
        this.kind = TaskKind.fromTag(kind)
            .orElseThrow(() -> new IllegalArgumentException("Unknown scrape.schedule.kind '" + kind + "'"));
    }

    @Scheduled(cron = "${scrape.schedule.cron:-}")
    public void trigger() {
        try {
            long taskId = orchestrator.start(kind, TriggerOrigin.SCHEDULED);
            logger.info("Scheduled {} task started as task {}", kind.getTag(), taskId);
        } catch (TaskConflictException e) {
            logger.warn("Scheduled {} task skipped: {}", kind.getTag(), e.getMessage());
        }
    }
}
