package com.afttsync.application.usecase;

import com.afttsync.domain.exception.ExtractionException;
import com.afttsync.domain.exception.StoreUnavailableException;
import com.afttsync.domain.exception.TaskNotFoundException;
import com.afttsync.domain.exception.UpstreamException;
import com.afttsync.domain.model.CancelOutcome;
import com.afttsync.domain.model.EntityKind;
import com.afttsync.domain.model.ExtractedRecord;
import com.afttsync.domain.model.MergeResult;
import com.afttsync.domain.model.TaskKind;
import com.afttsync.domain.model.TaskLogEntry;
import com.afttsync.domain.model.TaskSnapshot;
import com.afttsync.domain.model.TaskStatus;
import com.afttsync.domain.model.TriggerOrigin;
import com.afttsync.domain.ports.CatalogRequests;
import com.afttsync.domain.ports.EntityStore;
import com.afttsync.domain.ports.RecordExtractor;
import com.afttsync.domain.ports.TaskLedger;
import com.afttsync.domain.ports.UpstreamGateway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;

/**
 * Runs scrape tasks in the background and answers status, cancel, logs and history queries.
 *
 * <p>A task enumerates its units, then processes them in order: fetch and extract everything a unit
 * needs, merge each record, publish progress, pace. A failing unit adds one error entry and the task
 * moves on; an unreachable store fails the task. Cancellation is checked before every unit, and a
 * cancellation acknowledged during the last unit still ends the task as cancelled.
 */
public class ScrapeTaskOrchestrator {

    private static final Logger logger = LoggerFactory.getLogger(ScrapeTaskOrchestrator.class);

    private final Map<TaskKind, ScrapePlan> plans = new EnumMap<>(TaskKind.class);
    private final TaskRegistry registry;
    private final TaskLedger ledger;
    private final EntityStore store;
    private final UpstreamGateway gateway;
    private final RecordExtractor extractor;
    private final CatalogRequests requests;
    private final ScrapeSettings settings;
    private final ExecutorService executorService;
    private final Clock clock;

    public ScrapeTaskOrchestrator(List<ScrapePlan> plans, TaskRegistry registry, TaskLedger ledger, EntityStore store,
                                  UpstreamGateway gateway, RecordExtractor extractor, CatalogRequests requests,
                                  ScrapeSettings settings, ExecutorService executorService, Clock clock) {
        plans.forEach(plan -> this.plans.put(plan.kind(), plan));
        this.registry = registry;
        this.ledger = ledger;
        this.store = store;
        this.gateway = gateway;
        this.extractor = extractor;
        this.requests = requests;
        this.settings = settings;
        this.executorService = executorService;
        this.clock = clock;
    }

    /**
     * Starts a task and returns its id at once.
     *
     * @throws com.afttsync.domain.exception.TaskConflictException when a task of the same kind is running;
     *         no ledger row is created in that case
     */
    public long start(TaskKind kind, TriggerOrigin trigger) {
        ScrapePlan plan = plans.get(kind);
        if (plan == null) {
            throw new IllegalArgumentException("No plan registered for " + kind);
        }

        RunningTask task = registry.reserve(kind, () -> {
            Instant startedAt = clock.instant();
            long id = ledger.create(kind, trigger, startedAt);
            return new RunningTask(TaskSnapshot.started(id, kind, trigger, startedAt),
                new TaskLog(id, settings.logCapacity(), clock));
        });

        try {
            executorService.submit(() -> run(task, plan));
        } catch (RejectedExecutionException e) {
            logger.error("Executor refused task {}", task.id(), e);
            finish(task, TaskStatus.FAILED, "Task could not be scheduled: " + e.getMessage());
            throw e;
        }
        logger.info("Started {} task {} ({})", kind.getTag(), task.id(), trigger);
        return task.id();
    }

    /**
     * Live snapshot while the task runs, the ledger row afterwards.
     */
    public TaskSnapshot status(long taskId) {
        return registry.find(taskId)
            .map(RunningTask::snapshot)
            .or(() -> ledger.findById(taskId))
            .orElseThrow(() -> new TaskNotFoundException(taskId));
    }

    public CancelOutcome cancel(long taskId) {
        var running = registry.find(taskId);
        if (running.isPresent()) {
            RunningTask task = running.get();
            if (task.requestCancel()) {
                task.log().info("Cancellation requested");
                return CancelOutcome.ACKNOWLEDGED;
            }
            return CancelOutcome.NOT_RUNNING;
        }
        ledger.findById(taskId).orElseThrow(() -> new TaskNotFoundException(taskId));
        return CancelOutcome.NOT_RUNNING;
    }

    public List<TaskLogEntry> logs(long taskId) {
        var running = registry.find(taskId);
        if (running.isPresent()) {
            return running.get().log().entries();
        }
        ledger.findById(taskId).orElseThrow(() -> new TaskNotFoundException(taskId));
        return ledger.findLogs(taskId);
    }

    /**
     * Most recent tasks first. Running tasks show their live snapshot.
     */
    public List<TaskSnapshot> history(int limit) {
        return ledger.findRecent(limit).stream()
            .map(row -> registry.find(row.id()).map(RunningTask::snapshot).orElse(row))
            .toList();
    }

    /**
     * Finalizes ledger rows left running by a previous process.
     */
    public int recoverStaleTasks() {
        int recovered = ledger.cancelStaleRunning(clock.instant());
        if (recovered > 0) {
            logger.warn("Marked {} task(s) left running by a previous process as cancelled", recovered);
        }
        return recovered;
    }

    void run(RunningTask task, ScrapePlan plan) {
        ScrapeContext context = new ScrapeContext(gateway, extractor, requests, store, settings, task);
        TaskLog log = task.log();
        log.info("Task #" + task.id() + " started (" + task.kind().getTag() + ", trigger "
            + task.snapshot().trigger().name().toLowerCase(Locale.ROOT) + ")");

        try {
            List<WorkUnit> units;
            try {
                units = plan.enumerate(context);
            } catch (UpstreamException | ExtractionException e) {
                log.warn("Enumeration failed: " + e.getMessage());
                finish(task, TaskStatus.FAILED, "enumeration: " + e.getMessage());
                return;
            }
            int total = units.size();
            task.publish(snapshot -> snapshot.withTotalUnits(total));
            log.info(units.size() + " unit(s) to process");
            ledger.update(task.snapshot(), log.entries());

            for (int i = 0; i < units.size(); i++) {
                if (task.token().isCancelled()) {
                    log.info("Task #" + task.id() + " cancelled before unit " + (i + 1) + "/" + units.size());
                    finish(task, TaskStatus.CANCELLED, null);
                    return;
                }
                processUnit(task, context, units.get(i));
                ledger.update(task.snapshot(), log.entries());

                if (i < units.size() - 1) {
                    task.token().pause(settings.pacingDelay());
                }
            }

            TaskSnapshot done = task.snapshot();
            log.info("Task #" + task.id() + " finished: " + done.completedUnits() + "/" + done.totalUnits()
                + " unit(s), " + done.failedUnits() + " failed");
            finish(task, TaskStatus.SUCCESS, null);
        } catch (StoreUnavailableException e) {
            logger.error("Task {} aborted, store unavailable", task.id(), e);
            log.warn("Store unavailable: " + e.getMessage());
            finish(task, TaskStatus.FAILED, "store unavailable: " + e.getMessage());
        } catch (RuntimeException e) {
            logger.error("Task {} failed unexpectedly", task.id(), e);
            finish(task, TaskStatus.FAILED, "unexpected error: " + e);
        } finally {
            registry.release(task);
        }
    }

    private void processUnit(RunningTask task, ScrapeContext context, WorkUnit unit) {
        String label = unit.label();
        task.publish(snapshot -> snapshot.withCurrentUnit(label));

        Map<EntityKind, Integer> applied = new EnumMap<>(EntityKind.class);
        List<String> errors = new ArrayList<>();
        int rejected = 0;
        boolean failed = true;

        try {
            UnitHarvest harvest = unit.collect(context);
            for (ExtractedRecord record : harvest.records()) {
                MergeResult result = store.merge(record);
                if (result.applied()) {
                    applied.merge(result.kind(), 1, Integer::sum);
                } else {
                    rejected++;
                    errors.add(label + ": rejected " + result.kind() + " '" + result.key() + "': " + result.reason());
                }
            }
            harvest.problems().forEach(problem -> errors.add(label + ": " + problem));
            task.log().info(label + ": " + harvest.records().size() + " record(s) merged");
            failed = false;
        } catch (UpstreamException | ExtractionException e) {
            errors.add(label + ": " + e.getMessage());
            task.log().warn(label + " failed: " + e.getMessage());
        } finally {
            // records merged before a store outage stay merged and are counted
            boolean unitFailed = failed;
            int unitRejected = rejected;
            task.publish(snapshot -> snapshot.withUnitProcessed(unitFailed, applied, unitRejected, errors));
        }
    }

    private void finish(RunningTask task, TaskStatus status, String error) {
        TaskSnapshot last = task.complete(status, error, clock.instant());
        task.log().info("Task #" + task.id() + " " + last.status().name().toLowerCase(Locale.ROOT));
        try {
            ledger.update(last, task.log().entries());
        } catch (StoreUnavailableException e) {
            logger.error("Could not persist final state of task {}", task.id(), e);
        } finally {
            registry.release(task);
        }
    }
}
