package com.afttsync.domain.ports;

import com.afttsync.domain.model.Competition;
import com.afttsync.domain.model.ExtractedRecord;
import com.afttsync.domain.model.Match;
import com.afttsync.domain.model.Member;
import com.afttsync.domain.model.MergeResult;
import com.afttsync.domain.model.OpponentStat;
import com.afttsync.domain.model.Organization;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Port for the reconciliation store: merge writes plus the read accessors.
 */
public interface EntityStore {

    /**
     * Merges one record into the stored entity with the same identity, following the record kind's
     * merge mode. Malformed keys yield a rejected result.
     *
     * @throws com.afttsync.domain.exception.StoreUnavailableException when the database is unreachable
     */
    MergeResult merge(ExtractedRecord record);

    Optional<Organization> findOrganization(String code);

    List<Organization> listOrganizations();

    List<Organization> listOrganizationsByRegion(String region);

    Optional<Member> findMember(String licence);

    List<String> listMemberLicences();

    /**
     * Members of an organization, best rank first. Unknown rank tokens come last.
     */
    List<Member> listMembersOfOrganization(String organizationCode);

    /**
     * Matches of a player between two dates, both inclusive. Either bound may be null.
     */
    List<Match> findMatches(String licence, LocalDate from, LocalDate to);

    List<OpponentStat> findOpponentStats(String licence);

    Optional<Competition> findCompetition(long competitionId);

    /**
     * Competitions whose start date falls between the two dates, both inclusive.
     */
    List<Competition> listCompetitionsBetween(LocalDate from, LocalDate to);
}
