package com.afttsync.infrastructure.rest;

import com.afttsync.application.usecase.ScrapeTaskOrchestrator;
import com.afttsync.domain.exception.TaskConflictException;
import com.afttsync.domain.exception.TaskNotFoundException;
import com.afttsync.domain.model.CancelOutcome;
import com.afttsync.domain.model.TaskKind;
import com.afttsync.domain.model.TaskLogEntry;
import com.afttsync.domain.model.TaskSnapshot;
import com.afttsync.domain.model.TriggerOrigin;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * REST controller for scrape tasks.
 */
@RestController
@RequestMapping("/scrape")
public class ScrapeController {

    private static final Logger logger = LoggerFactory.getLogger(ScrapeController.class);

    static final int DEFAULT_HISTORY_LIMIT = 20;
    static final int MAX_HISTORY_LIMIT = 100;

    private final ScrapeTaskOrchestrator orchestrator;

    public ScrapeController(ScrapeTaskOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    /**
     * Starts a task in the background.
     *
     * POST /scrape/{kind}
     *
     * @return 202 with the task id, 409 when a task of the same kind runs, 400 for an unknown kind
     */
    @PostMapping("/{kind}")
    public ResponseEntity<Map<String, Object>> start(@PathVariable String kind,
                                                     @RequestParam(defaultValue = "manual") String trigger) {
        TaskKind taskKind = TaskKind.fromTag(kind).orElse(null);
        if (taskKind == null) {
            return ResponseEntity.badRequest().body(Map.of("error", "Unknown task kind '" + kind + "'"));
        }
        TriggerOrigin origin;
        try {
            origin = TriggerOrigin.valueOf(trigger.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", "Unknown trigger '" + trigger + "'"));
        }
        logger.info("Received request to start a {} task ({})", taskKind.getTag(), origin);
        long taskId = orchestrator.start(taskKind, origin);
        return ResponseEntity.status(HttpStatus.ACCEPTED)
            .body(Map.of("taskId", taskId, "kind", taskKind.getTag(), "status", "running"));
    }

    @GetMapping("/tasks/{id}")
    public ResponseEntity<TaskSnapshot> status(@PathVariable long id) {
        return ResponseEntity.ok(orchestrator.status(id));
    }

    /**
     * POST /scrape/tasks/{id}/cancel
     *
     * @return 202 when cancellation was requested, 409 when the task is already finished
     */
    @PostMapping("/tasks/{id}/cancel")
    public ResponseEntity<Map<String, Object>> cancel(@PathVariable long id) {
        CancelOutcome outcome = orchestrator.cancel(id);
        HttpStatus status = outcome == CancelOutcome.ACKNOWLEDGED ? HttpStatus.ACCEPTED : HttpStatus.CONFLICT;
        return ResponseEntity.status(status).body(Map.of("taskId", id, "outcome", outcome.name().toLowerCase(Locale.ROOT)));
    }

    @GetMapping("/tasks/{id}/logs")
    public ResponseEntity<List<TaskLogEntry>> logs(@PathVariable long id) {
        return ResponseEntity.ok(orchestrator.logs(id));
    }

    @GetMapping("/history")
    public ResponseEntity<List<TaskSnapshot>> history(
            @RequestParam(defaultValue = "" + DEFAULT_HISTORY_LIMIT) int limit) {
        int clamped = Math.max(1, Math.min(MAX_HISTORY_LIMIT, limit));
        return ResponseEntity.ok(orchestrator.history(clamped));
    }

    @ExceptionHandler(TaskConflictException.class)
    public ResponseEntity<Map<String, Object>> onConflict(TaskConflictException e) {
        logger.info("Start refused: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.CONFLICT)
            .body(Map.of("error", e.getMessage(), "runningTaskId", e.getRunningTaskId()));
    }

    @ExceptionHandler(TaskNotFoundException.class)
    public ResponseEntity<Map<String, Object>> onNotFound(TaskNotFoundException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", e.getMessage()));
    }
}
