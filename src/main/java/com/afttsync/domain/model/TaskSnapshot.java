package com.afttsync.domain.model;

import java.time.Instant;
import java.util.Collections;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable view of a task's progress. Running tasks publish a fresh snapshot after every change;
 * finished tasks are read back from the ledger in the same shape.
 */
public record TaskSnapshot(
    long id,
    TaskKind kind,
    TaskStatus status,
    TriggerOrigin trigger,
    Instant startedAt,
    Instant finishedAt,
    int totalUnits,
    int completedUnits,
    int failedUnits,
    Map<EntityKind, Integer> entityCounters,
    int rejectedRecords,
    List<String> errors,
    String currentUnit
) {

    public TaskSnapshot {
        entityCounters = entityCounters == null || entityCounters.isEmpty()
            ? Map.of()
            : Collections.unmodifiableMap(new EnumMap<>(entityCounters));
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public static TaskSnapshot started(long id, TaskKind kind, TriggerOrigin trigger, Instant startedAt) {
        return new TaskSnapshot(id, kind, TaskStatus.RUNNING, trigger, startedAt, null,
            0, 0, 0, Map.of(), 0, List.of(), null);
    }

    public boolean isRunning() {
        return status == TaskStatus.RUNNING;
    }

    public TaskSnapshot withTotalUnits(int total) {
        return new TaskSnapshot(id, kind, status, trigger, startedAt, finishedAt, total, completedUnits,
            failedUnits, entityCounters, rejectedRecords, errors, currentUnit);
    }

    public TaskSnapshot withCurrentUnit(String unit) {
        return new TaskSnapshot(id, kind, status, trigger, startedAt, finishedAt, totalUnits, completedUnits,
            failedUnits, entityCounters, rejectedRecords, errors, unit);
    }

    /**
     * Folds one processed unit into the snapshot.
     *
     * @param failed      whether the unit ended with an error
     * @param applied     applied merges per entity kind
     * @param rejected    number of records the store rejected
     * @param unitErrors  error entries produced by the unit, in order
     */
    public TaskSnapshot withUnitProcessed(boolean failed, Map<EntityKind, Integer> applied, int rejected,
                                          List<String> unitErrors) {
        Map<EntityKind, Integer> counters = new EnumMap<>(EntityKind.class);
        counters.putAll(entityCounters);
        applied.forEach((entity, count) -> counters.merge(entity, count, Integer::sum));
        List<String> allErrors = new ArrayList<>(errors);
        allErrors.addAll(unitErrors);
        return new TaskSnapshot(id, kind, status, trigger, startedAt, finishedAt, totalUnits,
            completedUnits + 1, failedUnits + (failed ? 1 : 0), counters, rejectedRecords + rejected,
            allErrors, currentUnit);
    }

    public TaskSnapshot withError(String error) {
        List<String> allErrors = new ArrayList<>(errors);
        allErrors.add(error);
        return new TaskSnapshot(id, kind, status, trigger, startedAt, finishedAt, totalUnits, completedUnits,
            failedUnits, entityCounters, rejectedRecords, allErrors, currentUnit);
    }

    public TaskSnapshot finished(TaskStatus terminal, Instant at) {
        if (!terminal.isTerminal()) {
            throw new IllegalArgumentException("Not a terminal status: " + terminal);
        }
        return new TaskSnapshot(id, kind, terminal, trigger, startedAt, at, totalUnits, completedUnits,
            failedUnits, entityCounters, rejectedRecords, errors, null);
    }

    public int entityCount(EntityKind entity) {
        return entityCounters.getOrDefault(entity, 0);
    }
}
