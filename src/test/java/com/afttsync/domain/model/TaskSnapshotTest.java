package com.afttsync.domain.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class TaskSnapshotTest {

    private static final Instant START = Instant.parse("2026-03-01T10:00:00Z");

    @Test
    void testUnitProgressAccumulates() {
        TaskSnapshot snapshot = TaskSnapshot.started(7, TaskKind.ORGANIZATIONS, TriggerOrigin.MANUAL, START)
            .withTotalUnits(2)
            .withCurrentUnit("H004")
            .withUnitProcessed(false, Map.of(EntityKind.ORGANIZATION, 1, EntityKind.MEMBER, 12), 0, List.of())
            .withCurrentUnit("H010")
            .withUnitProcessed(true, Map.of(), 0, List.of("H010: HTTP 404"));

        assertEquals(2, snapshot.completedUnits());
        assertEquals(1, snapshot.failedUnits());
        assertEquals(12, snapshot.entityCount(EntityKind.MEMBER));
        assertEquals(0, snapshot.entityCount(EntityKind.MATCH));
        assertEquals(List.of("H010: HTTP 404"), snapshot.errors());
        assertTrue(snapshot.isRunning());
    }

    @Test
    void testFinishedRequiresTerminalStatus() {
        TaskSnapshot snapshot = TaskSnapshot.started(1, TaskKind.FULL, TriggerOrigin.SCHEDULED, START)
            .withCurrentUnit("H004");

        assertThrows(IllegalArgumentException.class, () -> snapshot.finished(TaskStatus.RUNNING, START));

        TaskSnapshot done = snapshot.finished(TaskStatus.CANCELLED, START.plusSeconds(5));
        assertEquals(TaskStatus.CANCELLED, done.status());
        assertNull(done.currentUnit());
        assertEquals(START.plusSeconds(5), done.finishedAt());
    }
}
