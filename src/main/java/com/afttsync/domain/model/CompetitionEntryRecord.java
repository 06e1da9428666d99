package com.afttsync.domain.model;

/**
 * A player's entry in a competition series.
 */
public class CompetitionEntryRecord extends ExtractedRecord {

    public static final String COMPETITION_ID = "competitionId";
    public static final String SERIES_NAME = "seriesName";
    public static final String LICENCE = "licence";
    public static final String PLAYER_NAME = "playerName";
    public static final String PLAYER_CLUB = "playerClub";
    public static final String PLAYER_RANK = "playerRank";

    private final long competitionId;
    private final String seriesName;
    private final String licence;

    public CompetitionEntryRecord(long competitionId, String seriesName, String licence) {
        super(EntityKind.COMPETITION_ENTRY);
        this.competitionId = competitionId;
        this.seriesName = seriesName == null ? "" : seriesName;
        this.licence = licence;
        identity(COMPETITION_ID, competitionId);
        identity(SERIES_NAME, this.seriesName);
        identity(LICENCE, licence);
    }

    @Override
    public String naturalKey() {
        return competitionId + "|" + seriesName + "|" + licence;
    }

    @Override
    public boolean hasValidKey() {
        return competitionId > 0 && MemberRecord.isValidLicence(licence);
    }

    public String licence() {
        return licence;
    }

    public CompetitionEntryRecord playerName(Field<String> value) { attribute(PLAYER_NAME, value); return this; }
    public CompetitionEntryRecord playerClub(Field<String> value) { attribute(PLAYER_CLUB, value); return this; }
    public CompetitionEntryRecord playerRank(Field<String> value) { attribute(PLAYER_RANK, value); return this; }

    public Field<String> playerName() { return attribute(PLAYER_NAME); }
    public Field<String> playerClub() { return attribute(PLAYER_CLUB); }
    public Field<String> playerRank() { return attribute(PLAYER_RANK); }
}
