package com.afttsync.application.usecase;

import com.afttsync.domain.merge.MergedEntity;
import com.afttsync.domain.merge.NonRegressionMerger;
import com.afttsync.domain.merge.RegionDerivation;
import com.afttsync.domain.model.Competition;
import com.afttsync.domain.model.EntityKind;
import com.afttsync.domain.model.ExtractedRecord;
import com.afttsync.domain.model.Match;
import com.afttsync.domain.model.Member;
import com.afttsync.domain.model.MergeResult;
import com.afttsync.domain.model.OpponentStat;
import com.afttsync.domain.model.Organization;
import com.afttsync.domain.ports.EntityStore;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Entity store kept in memory, merging with the same rules as the MongoDB store.
 */
class InMemoryEntityStore implements EntityStore {

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private final NonRegressionMerger merger = new NonRegressionMerger(List.of(new RegionDerivation()));
    private final Map<EntityKind, Map<String, Map<String, Object>>> collections = new EnumMap<>(EntityKind.class);

    @Override
    public synchronized MergeResult merge(ExtractedRecord record) {
        Optional<String> rejection = merger.rejectionReason(record);
        if (rejection.isPresent()) {
            return MergeResult.rejected(record.kind(), record.naturalKey(), rejection.get());
        }
        Map<String, Map<String, Object>> collection = collection(record.kind());
        MergedEntity merged = merger.merge(collection.get(record.naturalKey()), record);
        collection.put(record.naturalKey(), merged.values());
        return MergeResult.applied(record.kind(), record.naturalKey(), merged.inserted());
    }

    synchronized Map<String, Object> raw(EntityKind kind, String key) {
        return collection(kind).get(key);
    }

    synchronized int count(EntityKind kind) {
        return collection(kind).size();
    }

    @Override
    public synchronized Optional<Organization> findOrganization(String code) {
        return Optional.ofNullable(collection(EntityKind.ORGANIZATION).get(code))
            .map(values -> OBJECT_MAPPER.convertValue(values, Organization.class));
    }

    @Override
    public synchronized List<Organization> listOrganizations() {
        return all(EntityKind.ORGANIZATION, Organization.class);
    }

    @Override
    public synchronized List<Organization> listOrganizationsByRegion(String region) {
        return listOrganizations().stream().filter(org -> Objects.equals(region, org.getRegion())).toList();
    }

    @Override
    public synchronized Optional<Member> findMember(String licence) {
        return Optional.ofNullable(collection(EntityKind.MEMBER).get(licence))
            .map(values -> OBJECT_MAPPER.convertValue(values, Member.class));
    }

    @Override
    public synchronized List<String> listMemberLicences() {
        return new ArrayList<>(collection(EntityKind.MEMBER).keySet());
    }

    @Override
    public synchronized List<Member> listMembersOfOrganization(String organizationCode) {
        return all(EntityKind.MEMBER, Member.class).stream()
            .filter(member -> Objects.equals(organizationCode, member.getOrganizationCode()))
            .toList();
    }

    @Override
    public synchronized List<Match> findMatches(String licence, LocalDate from, LocalDate to) {
        return all(EntityKind.MATCH, Match.class).stream()
            .filter(match -> licence.equals(match.getPlayerLicence()))
            .filter(match -> from == null || !match.getDate().isBefore(from))
            .filter(match -> to == null || !match.getDate().isAfter(to))
            .toList();
    }

    @Override
    public synchronized List<OpponentStat> findOpponentStats(String licence) {
        return all(EntityKind.OPPONENT_STAT, OpponentStat.class).stream()
            .filter(stat -> licence.equals(stat.getPlayerLicence()))
            .toList();
    }

    @Override
    public synchronized Optional<Competition> findCompetition(long competitionId) {
        return Optional.ofNullable(collection(EntityKind.COMPETITION).get(Long.toString(competitionId)))
            .map(values -> OBJECT_MAPPER.convertValue(values, Competition.class));
    }

    @Override
    public synchronized List<Competition> listCompetitionsBetween(LocalDate from, LocalDate to) {
        return all(EntityKind.COMPETITION, Competition.class).stream()
            .filter(competition -> competition.getDateStart() != null)
            .filter(competition -> from == null || !competition.getDateStart().isBefore(from))
            .filter(competition -> to == null || !competition.getDateStart().isAfter(to))
            .toList();
    }

    private <T> List<T> all(EntityKind kind, Class<T> type) {
        return collection(kind).values().stream().map(values -> OBJECT_MAPPER.convertValue(values, type)).toList();
    }

    private Map<String, Map<String, Object>> collection(EntityKind kind) {
        return collections.computeIfAbsent(kind, k -> new TreeMap<>());
    }
}
