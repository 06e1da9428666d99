package com.afttsync.infrastructure.persistence;

import com.afttsync.domain.exception.StoreUnavailableException;
import com.afttsync.domain.merge.MergedEntity;
import com.afttsync.domain.merge.NonRegressionMerger;
import com.afttsync.domain.model.Competition;
import com.afttsync.domain.model.CompetitionRecord;
import com.afttsync.domain.model.EntityKind;
import com.afttsync.domain.model.ExtractedRecord;
import com.afttsync.domain.model.Match;
import com.afttsync.domain.model.MatchRecord;
import com.afttsync.domain.model.Member;
import com.afttsync.domain.model.MemberRecord;
import com.afttsync.domain.model.MergeResult;
import com.afttsync.domain.model.OpponentStat;
import com.afttsync.domain.model.Organization;
import com.afttsync.domain.model.OrganizationRecord;
import com.afttsync.domain.model.Rank;
import com.afttsync.domain.ports.EntityStore;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.mongodb.ErrorCategory;
import com.mongodb.MongoClientException;
import com.mongodb.MongoSocketException;
import com.mongodb.MongoWriteException;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.model.Filters;
import com.mongodb.client.model.IndexOptions;
import com.mongodb.client.model.Indexes;
import com.mongodb.client.model.ReplaceOptions;
import com.mongodb.client.model.Sorts;
import com.mongodb.client.result.UpdateResult;
import org.bson.Document;
import org.bson.conversions.Bson;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * MongoDB reconciliation store. One collection per entity kind, documents keyed by natural key.
 *
 * <p>Every merge is a read-merge-replace of a single document guarded by a {@code _rev} counter:
 * when another writer changed the document in between, the merge is redone on the fresh copy.
 */
public class MongoEntityStore implements EntityStore {

    private static final Logger logger = LoggerFactory.getLogger(MongoEntityStore.class);
    private static final ObjectMapper OBJECT_MAPPER;
    private static final int MAX_REVISION_RETRIES = 5;
    static final String ID = "_id";
    static final String REVISION = "_rev";

    static {
        OBJECT_MAPPER = new ObjectMapper();
        OBJECT_MAPPER.registerModule(new JavaTimeModule());
        OBJECT_MAPPER.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    private final MongoClient mongoClient;
    private final String databaseName;
    private final NonRegressionMerger merger;

    public MongoEntityStore(MongoClient mongoClient, String databaseName, NonRegressionMerger merger) {
        this.mongoClient = mongoClient;
        this.databaseName = databaseName;
        this.merger = merger;

        initializeIndexes();
    }

    private void initializeIndexes() {
        try {
            collection(EntityKind.ORGANIZATION).createIndex(Indexes.ascending(OrganizationRecord.REGION),
                new IndexOptions().background(true));
            collection(EntityKind.MEMBER).createIndex(Indexes.ascending(MemberRecord.ORGANIZATION_CODE),
                new IndexOptions().background(true));
            collection(EntityKind.MATCH).createIndex(
                Indexes.compoundIndex(Indexes.ascending(MatchRecord.PLAYER_LICENCE), Indexes.ascending(MatchRecord.DATE)),
                new IndexOptions().background(true));
            collection(EntityKind.OPPONENT_STAT).createIndex(Indexes.ascending(MatchRecord.PLAYER_LICENCE),
                new IndexOptions().background(true));
            collection(EntityKind.COMPETITION).createIndex(Indexes.ascending(CompetitionRecord.DATE_START),
                new IndexOptions().background(true));
            logger.info("MongoDB indexes initialized for database: {}", databaseName);
        } catch (Exception e) {
            logger.warn("Failed to create indexes (may already exist): {}", e.getMessage());
        }
    }

    @Override
    public MergeResult merge(ExtractedRecord record) {
        EntityKind kind = record.kind();
        String key = record.naturalKey();
        Optional<String> rejection = merger.rejectionReason(record);
        if (rejection.isPresent()) {
            logger.debug("Rejected {}: {}", record, rejection.get());
            return MergeResult.rejected(kind, key, rejection.get());
        }

        return guarded(() -> {
            MongoCollection<Document> collection = collection(kind);
            for (int attempt = 1; attempt <= MAX_REVISION_RETRIES; attempt++) {
                Document existing = collection.find(Filters.eq(ID, key)).first();
                MergedEntity merged = merger.merge(existing, record);
                long revision = existing == null ? 0L : revisionOf(existing);

                Document document = new Document(merged.values());
                document.put(ID, key);
                document.put(REVISION, revision + 1);

                if (existing == null) {
                    try {
                        collection.insertOne(document);
                        return MergeResult.applied(kind, key, true);
                    } catch (MongoWriteException e) {
                        if (e.getError().getCategory() != ErrorCategory.DUPLICATE_KEY) {
                            throw e;
                        }
                        logger.debug("{} inserted concurrently, merging again", record);
                        continue;
                    }
                }

                UpdateResult result = collection.replaceOne(
                    Filters.and(Filters.eq(ID, key), revisionFilter(revision)),
                    document,
                    new ReplaceOptions().upsert(false));
                if (result.getMatchedCount() == 1) {
                    return MergeResult.applied(kind, key, false);
                }
                logger.debug("{} changed concurrently (attempt {}), merging again", record, attempt);
            }
            logger.warn("Gave up merging {} after {} concurrent modifications", record, MAX_REVISION_RETRIES);
            return MergeResult.rejected(kind, key, "concurrent modification");
        });
    }

    @Override
    public Optional<Organization> findOrganization(String code) {
        return findById(EntityKind.ORGANIZATION, code, Organization.class);
    }

    @Override
    public List<Organization> listOrganizations() {
        return list(EntityKind.ORGANIZATION, Filters.empty(), Sorts.ascending(ID), Organization.class);
    }

    @Override
    public List<Organization> listOrganizationsByRegion(String region) {
        return list(EntityKind.ORGANIZATION, Filters.eq(OrganizationRecord.REGION, region), Sorts.ascending(ID),
            Organization.class);
    }

    @Override
    public Optional<Member> findMember(String licence) {
        return findById(EntityKind.MEMBER, licence, Member.class);
    }

    @Override
    public List<String> listMemberLicences() {
        return guarded(() -> {
            List<String> licences = new ArrayList<>();
            collection(EntityKind.MEMBER).find()
                .projection(new Document(ID, 1))
                .sort(Sorts.ascending(ID))
                .forEach(doc -> licences.add(doc.getString(ID)));
            return licences;
        });
    }

    @Override
    public List<Member> listMembersOfOrganization(String organizationCode) {
        List<Member> members = new ArrayList<>(list(EntityKind.MEMBER,
            Filters.eq(MemberRecord.ORGANIZATION_CODE, organizationCode), Sorts.ascending(MemberRecord.NAME),
            Member.class));
        members.sort(BEST_RANK_FIRST);
        return members;
    }

    @Override
    public List<Match> findMatches(String licence, LocalDate from, LocalDate to) {
        List<Bson> filters = new ArrayList<>();
        filters.add(Filters.eq(MatchRecord.PLAYER_LICENCE, licence));
        if (from != null) {
            filters.add(Filters.gte(MatchRecord.DATE, from.toString()));
        }
        if (to != null) {
            filters.add(Filters.lte(MatchRecord.DATE, to.toString()));
        }
        return list(EntityKind.MATCH, Filters.and(filters), Sorts.descending(MatchRecord.DATE), Match.class);
    }

    @Override
    public List<OpponentStat> findOpponentStats(String licence) {
        return list(EntityKind.OPPONENT_STAT, Filters.eq(MatchRecord.PLAYER_LICENCE, licence), Sorts.ascending(ID),
            OpponentStat.class);
    }

    @Override
    public Optional<Competition> findCompetition(long competitionId) {
        return findById(EntityKind.COMPETITION, Long.toString(competitionId), Competition.class);
    }

    @Override
    public List<Competition> listCompetitionsBetween(LocalDate from, LocalDate to) {
        List<Bson> filters = new ArrayList<>();
        filters.add(Filters.exists(CompetitionRecord.DATE_START));
        if (from != null) {
            filters.add(Filters.gte(CompetitionRecord.DATE_START, from.toString()));
        }
        if (to != null) {
            filters.add(Filters.lte(CompetitionRecord.DATE_START, to.toString()));
        }
        return list(EntityKind.COMPETITION, Filters.and(filters), Sorts.ascending(CompetitionRecord.DATE_START),
            Competition.class);
    }

    /**
     * Best rank first, unknown tokens last, then by name.
     */
    static final Comparator<Member> BEST_RANK_FIRST = Comparator
        .comparing((Member member) -> Rank.parse(member.getRank()).orElse(null),
            Comparator.nullsLast(Rank.BEST_FIRST))
        .thenComparing(Member::getName, Comparator.nullsLast(Comparator.naturalOrder()));

    private <T> Optional<T> findById(EntityKind kind, String id, Class<T> type) {
        return guarded(() -> {
            Document document = collection(kind).find(Filters.eq(ID, id)).first();
            return Optional.ofNullable(document).map(doc -> OBJECT_MAPPER.convertValue(doc, type));
        });
    }

    private <T> List<T> list(EntityKind kind, Bson filter, Bson sort, Class<T> type) {
        return guarded(() -> {
            List<T> results = new ArrayList<>();
            collection(kind).find(filter).sort(sort).forEach(doc -> results.add(OBJECT_MAPPER.convertValue(doc, type)));
            return results;
        });
    }

    private MongoCollection<Document> collection(EntityKind kind) {
        return mongoClient.getDatabase(databaseName).getCollection(kind.getCollectionName());
    }

    private static long revisionOf(Document document) {
        Object revision = document.get(REVISION);
        return revision instanceof Number number ? number.longValue() : 0L;
    }

    private static Bson revisionFilter(long revision) {
        if (revision == 0L) {
            return Filters.or(Filters.eq(REVISION, 0L), Filters.exists(REVISION, false));
        }
        return Filters.eq(REVISION, revision);
    }

    /**
     * Runs a database call, turning connectivity failures into {@link StoreUnavailableException}.
     */
    static <T> T guarded(Supplier<T> call) {
        try {
            return call.get();
        } catch (MongoClientException | MongoSocketException e) {
            throw new StoreUnavailableException("MongoDB unavailable: " + e.getMessage(), e);
        }
    }
}
