package com.afttsync.domain.model;

import java.time.LocalDate;

/**
 * One individual match from a player's profile sheet.
 *
 * <p>Identity is (player, bracket, date, division, opponent). The opponent is identified by licence,
 * or by the normalized opponent name when the sheet does not expose the licence.
 */
public class MatchRecord extends ExtractedRecord {

    public static final String PLAYER_LICENCE = "playerLicence";
    public static final String COMPETITION_TYPE = "competitionType";
    public static final String DATE = "date";
    public static final String DIVISION = "division";
    public static final String OPPONENT_KEY = "opponentKey";
    public static final String OPPONENT_LICENCE = "opponentLicence";
    public static final String OPPONENT_NAME = "opponentName";
    public static final String OPPONENT_RANK = "opponentRank";
    public static final String OPPONENT_POINTS = "opponentPoints";
    public static final String OPPONENT_CLUB = "opponentClub";
    public static final String SCORE = "score";
    public static final String WON = "won";
    public static final String POINTS_DELTA = "pointsDelta";

    private final String playerLicence;
    private final CompetitionType competitionType;
    private final LocalDate date;
    private final String division;
    private final String opponentKey;

    public MatchRecord(String playerLicence, CompetitionType competitionType, LocalDate date,
                       Field<String> division, Field<String> opponentLicence, Field<String> opponentName) {
        super(EntityKind.MATCH);
        this.playerLicence = playerLicence;
        this.competitionType = competitionType;
        this.date = date;
        this.division = division.orElse("");
        this.opponentKey = opponentLicence.isPresent()
            ? opponentLicence.get()
            : NormalizationUtils.normalizeText(opponentName.orElse(""));
        identity(PLAYER_LICENCE, playerLicence);
        identity(COMPETITION_TYPE, competitionType.name());
        identity(DATE, date);
        identity(DIVISION, this.division);
        identity(OPPONENT_KEY, opponentKey);
        attribute(OPPONENT_LICENCE, opponentLicence);
        attribute(OPPONENT_NAME, opponentName);
    }

    @Override
    public String naturalKey() {
        return String.join("|", String.valueOf(playerLicence), competitionType.name(),
            String.valueOf(date), division, opponentKey);
    }

    @Override
    public boolean hasValidKey() {
        return MemberRecord.isValidLicence(playerLicence) && date != null && !opponentKey.isEmpty();
    }

    public String playerLicence() {
        return playerLicence;
    }

    public CompetitionType competitionType() {
        return competitionType;
    }

    public LocalDate date() {
        return date;
    }

    public MatchRecord opponentRank(Field<String> value) { attribute(OPPONENT_RANK, value); return this; }
    public MatchRecord opponentPoints(Field<Double> value) { attribute(OPPONENT_POINTS, value); return this; }
    public MatchRecord opponentClub(Field<String> value) { attribute(OPPONENT_CLUB, value); return this; }
    public MatchRecord score(Field<String> value) { attribute(SCORE, value); return this; }
    public MatchRecord won(Field<Boolean> value) { attribute(WON, value); return this; }
    public MatchRecord pointsDelta(Field<Double> value) { attribute(POINTS_DELTA, value); return this; }

    public Field<String> opponentLicence() { return attribute(OPPONENT_LICENCE); }
    public Field<String> opponentName() { return attribute(OPPONENT_NAME); }
    public Field<String> opponentRank() { return attribute(OPPONENT_RANK); }
    public Field<Double> opponentPoints() { return attribute(OPPONENT_POINTS); }
    public Field<String> score() { return attribute(SCORE); }
    public Field<Boolean> won() { return attribute(WON); }
    public Field<Double> pointsDelta() { return attribute(POINTS_DELTA); }
}
