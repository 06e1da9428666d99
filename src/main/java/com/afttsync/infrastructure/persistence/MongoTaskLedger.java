package com.afttsync.infrastructure.persistence;

import com.afttsync.domain.exception.StoreUnavailableException;
import com.afttsync.domain.model.EntityKind;
import com.afttsync.domain.model.TaskKind;
import com.afttsync.domain.model.TaskLogEntry;
import com.afttsync.domain.model.TaskSnapshot;
import com.afttsync.domain.model.TaskStatus;
import com.afttsync.domain.model.TriggerOrigin;
import com.afttsync.domain.ports.TaskLedger;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Date;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Task ledger stored in {@code scrape_tasks}, with sequential ids taken from {@code ledger_counters}.
 */
public class MongoTaskLedger implements TaskLedger {

    private static final Logger logger = LoggerFactory.getLogger(MongoTaskLedger.class);

    static final String TASKS = "scrape_tasks";
    static final String COUNTERS = "ledger_counters";
    static final String RESTART_ERROR = "Interrupted by a service restart";

    private final MongoTemplate mongoTemplate;

    public MongoTaskLedger(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    @Override
    public long create(TaskKind kind, TriggerOrigin trigger, Instant startedAt) {
        return guarded(() -> {
            Document counter = mongoTemplate.findAndModify(
                Query.query(Criteria.where("_id").is(TASKS)),
                new Update().inc("seq", 1L),
                FindAndModifyOptions.options().returnNew(true).upsert(true),
                Document.class,
                COUNTERS);
            long id = ((Number) counter.get("seq")).longValue();

            Document row = new Document("_id", id)
                .append("kind", kind.getTag())
                .append("status", tag(TaskStatus.RUNNING))
                .append("trigger", tag(trigger))
                .append("startedAt", Date.from(startedAt))
                .append("finishedAt", null)
                .append("totalUnits", 0)
                .append("completedUnits", 0)
                .append("failedUnits", 0)
                .append("entityCounters", new Document())
                .append("rejectedRecords", 0)
                .append("errors", List.of())
                .append("currentUnit", null)
                .append("logs", List.of());
            mongoTemplate.insert(row, TASKS);
            logger.debug("Created task {} ({})", id, kind.getTag());
            return id;
        });
    }

    @Override
    public void update(TaskSnapshot snapshot, List<TaskLogEntry> logs) {
        Document counters = new Document();
        snapshot.entityCounters().forEach((entity, count) -> counters.append(entity.name(), count));
        List<Document> logDocuments = logs.stream()
            .map(entry -> new Document("timestamp", Date.from(entry.timestamp())).append("message", entry.message()))
            .toList();

        Update update = new Update()
            .set("status", tag(snapshot.status()))
            .set("finishedAt", snapshot.finishedAt() == null ? null : Date.from(snapshot.finishedAt()))
            .set("totalUnits", snapshot.totalUnits())
            .set("completedUnits", snapshot.completedUnits())
            .set("failedUnits", snapshot.failedUnits())
            .set("entityCounters", counters)
            .set("rejectedRecords", snapshot.rejectedRecords())
            .set("errors", snapshot.errors())
            .set("currentUnit", snapshot.currentUnit())
            .set("logs", logDocuments);

        guarded(() -> mongoTemplate.updateFirst(Query.query(Criteria.where("_id").is(snapshot.id())), update, TASKS));
    }

    @Override
    public Optional<TaskSnapshot> findById(long taskId) {
        return guarded(() -> Optional.ofNullable(
            mongoTemplate.findOne(Query.query(Criteria.where("_id").is(taskId)), Document.class, TASKS))
            .map(MongoTaskLedger::toSnapshot));
    }

    @Override
    public List<TaskLogEntry> findLogs(long taskId) {
        return guarded(() -> {
            Query query = Query.query(Criteria.where("_id").is(taskId));
            query.fields().include("logs");
            Document row = mongoTemplate.findOne(query, Document.class, TASKS);
            if (row == null) {
                return List.of();
            }
            List<TaskLogEntry> entries = new ArrayList<>();
            for (Document entry : row.getList("logs", Document.class, List.of())) {
                entries.add(new TaskLogEntry(entry.getDate("timestamp").toInstant(), entry.getString("message")));
            }
            return entries;
        });
    }

    @Override
    public List<TaskSnapshot> findRecent(int limit) {
        return guarded(() -> {
            Query query = new Query().with(Sort.by(Sort.Direction.DESC, "_id")).limit(limit);
            query.fields().exclude("logs");
            return mongoTemplate.find(query, Document.class, TASKS).stream()
                .map(MongoTaskLedger::toSnapshot)
                .toList();
        });
    }

    @Override
    public int cancelStaleRunning(Instant finishedAt) {
        return guarded(() -> {
            Update update = new Update()
                .set("status", tag(TaskStatus.CANCELLED))
                .set("finishedAt", Date.from(finishedAt))
                .set("currentUnit", null)
                .push("errors", RESTART_ERROR);
            long modified = mongoTemplate.updateMulti(
                Query.query(Criteria.where("status").is(tag(TaskStatus.RUNNING))), update, TASKS).getModifiedCount();
            return (int) modified;
        });
    }

    static TaskSnapshot toSnapshot(Document row) {
        Map<EntityKind, Integer> counters = new EnumMap<>(EntityKind.class);
        Document storedCounters = row.get("entityCounters", Document.class);
        if (storedCounters != null) {
            storedCounters.forEach((name, count) -> counters.put(EntityKind.valueOf(name), ((Number) count).intValue()));
        }
        Date finishedAt = row.getDate("finishedAt");
        return new TaskSnapshot(
            ((Number) row.get("_id")).longValue(),
            TaskKind.fromTag(row.getString("kind")).orElseThrow(),
            TaskStatus.valueOf(row.getString("status").toUpperCase(Locale.ROOT)),
            TriggerOrigin.valueOf(row.getString("trigger").toUpperCase(Locale.ROOT)),
            row.getDate("startedAt").toInstant(),
            finishedAt == null ? null : finishedAt.toInstant(),
            row.getInteger("totalUnits", 0),
            row.getInteger("completedUnits", 0),
            row.getInteger("failedUnits", 0),
            counters,
            row.getInteger("rejectedRecords", 0),
            row.getList("errors", String.class, List.of()),
            row.getString("currentUnit"));
    }

    private static String tag(Enum<?> value) {
        return value.name().toLowerCase(Locale.ROOT);
    }

    private static <T> T guarded(Supplier<T> call) {
        try {
            return call.get();
        } catch (DataAccessResourceFailureException e) {
            throw new StoreUnavailableException("MongoDB unavailable: " + e.getMessage(), e);
        }
    }
}
