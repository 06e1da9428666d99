package com.afttsync.infrastructure.rest;

import com.afttsync.application.usecase.ScrapeSettings;
import com.afttsync.application.usecase.ScrapeTaskOrchestrator;
import com.afttsync.application.usecase.TaskRegistry;
import com.afttsync.domain.model.TaskKind;
import com.afttsync.domain.model.TaskLogEntry;
import com.afttsync.domain.model.TaskSnapshot;
import com.afttsync.domain.model.TaskStatus;
import com.afttsync.domain.model.TriggerOrigin;
import com.afttsync.domain.ports.TaskLedger;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ScrapeController request handling.
 */
class ScrapeControllerTest {

    private final RecordingLedger ledger = new RecordingLedger();
    private final ScrapeController controller = new ScrapeController(new ScrapeTaskOrchestrator(
        List.of(), new TaskRegistry(), ledger, null, null, null, null,
        new ScrapeSettings(Duration.ZERO, Duration.ZERO, 100), Executors.newSingleThreadExecutor(), Clock.systemUTC()));

    @Test
    void testUnknownKindIsBadRequest() {
        ResponseEntity<Map<String, Object>> response = controller.start("everything", "manual");

        assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
        assertTrue(ledger.rows.isEmpty());
        assertEquals(HttpStatus.BAD_REQUEST, controller.start("full", "cron").getStatusCode());
    }

    @Test
    void testHistoryLimitIsClamped() {
        controller.history(500);
        assertEquals(100, ledger.lastLimit);

        controller.history(0);
        assertEquals(1, ledger.lastLimit);
    }

    @Test
    void testCancelFinishedTaskIsConflict() {
        ledger.rows.add(TaskSnapshot.started(4, TaskKind.FULL, TriggerOrigin.MANUAL, Instant.now())
            .finished(TaskStatus.SUCCESS, Instant.now()));

        assertEquals(HttpStatus.CONFLICT, controller.cancel(4).getStatusCode());
        assertEquals(HttpStatus.OK, controller.status(4).getStatusCode());
    }

    private static class RecordingLedger implements TaskLedger {
        private final List<TaskSnapshot> rows = new ArrayList<>();
        private int lastLimit;

        @Override
        public long create(TaskKind kind, TriggerOrigin trigger, Instant startedAt) {
            throw new UnsupportedOperationException();
        }

        @Override
        public void update(TaskSnapshot snapshot, List<TaskLogEntry> logs) {
        }

        @Override
        public Optional<TaskSnapshot> findById(long taskId) {
            return rows.stream().filter(row -> row.id() == taskId).findFirst();
        }

        @Override
        public List<TaskLogEntry> findLogs(long taskId) {
            return List.of();
        }

        @Override
        public List<TaskSnapshot> findRecent(int limit) {
            lastLimit = limit;
            return rows;
        }

        @Override
        public int cancelStaleRunning(Instant finishedAt) {
            return 0;
        }
    }
}
