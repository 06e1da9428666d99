package com.afttsync.infrastructure.scheduling;

import com.afttsync.application.usecase.ScrapeTaskOrchestrator;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Closes ledger rows that a previous process left running.
 */
@Component
public class StartupRecovery {

    private final ScrapeTaskOrchestrator orchestrator;

    public StartupRecovery(ScrapeTaskOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void recover() {
        orchestrator.recoverStaleTasks();
    }
}
