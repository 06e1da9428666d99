package com.afttsync.domain.model;

import java.time.LocalDate;
import java.util.regex.Pattern;

/**
 * Member or player profile, keyed by licence number.
 *
 * <p>Directory rows fill the basic attributes; profile sheets add points, position and results.
 * Women's-bracket figures live in their own attributes so a men's sheet never hides them.
 */
public class MemberRecord extends ExtractedRecord {

    public static final String LICENCE = "licence";
    public static final String NAME = "name";
    public static final String RANK = "rank";
    public static final String ORGANIZATION_CODE = "organizationCode";
    public static final String CATEGORY = "category";
    public static final String POINTS_START = "pointsStart";
    public static final String POINTS_CURRENT = "pointsCurrent";
    public static final String RANKING_POSITION = "rankingPosition";
    public static final String TOTAL_WINS = "totalWins";
    public static final String TOTAL_LOSSES = "totalLosses";
    public static final String WOMEN_RANK = "womenRank";
    public static final String WOMEN_POINTS_START = "womenPointsStart";
    public static final String WOMEN_POINTS_CURRENT = "womenPointsCurrent";
    public static final String WOMEN_TOTAL_WINS = "womenTotalWins";
    public static final String WOMEN_TOTAL_LOSSES = "womenTotalLosses";
    public static final String LAST_UPDATE = "lastUpdate";

    private static final Pattern LICENCE_PATTERN = Pattern.compile("^\\d{3,7}$");

    private final String licence;

    public MemberRecord(String licence) {
        super(EntityKind.MEMBER);
        this.licence = licence == null ? null : licence.trim();
        identity(LICENCE, this.licence);
    }

    public static boolean isValidLicence(String licence) {
        return licence != null && LICENCE_PATTERN.matcher(licence).matches();
    }

    public String licence() {
        return licence;
    }

    @Override
    public String naturalKey() {
        return licence;
    }

    @Override
    public boolean hasValidKey() {
        return isValidLicence(licence);
    }

    public MemberRecord name(Field<String> value) { attribute(NAME, value); return this; }
    public MemberRecord rank(Field<String> value) { attribute(RANK, value); return this; }
    public MemberRecord organizationCode(Field<String> value) { attribute(ORGANIZATION_CODE, value); return this; }
    public MemberRecord category(Field<String> value) { attribute(CATEGORY, value); return this; }
    public MemberRecord pointsStart(Field<Double> value) { attribute(POINTS_START, value); return this; }
    public MemberRecord pointsCurrent(Field<Double> value) { attribute(POINTS_CURRENT, value); return this; }
    public MemberRecord rankingPosition(Field<Integer> value) { attribute(RANKING_POSITION, value); return this; }
    public MemberRecord totalWins(Field<Integer> value) { attribute(TOTAL_WINS, value); return this; }
    public MemberRecord totalLosses(Field<Integer> value) { attribute(TOTAL_LOSSES, value); return this; }
    public MemberRecord womenRank(Field<String> value) { attribute(WOMEN_RANK, value); return this; }
    public MemberRecord womenPointsStart(Field<Double> value) { attribute(WOMEN_POINTS_START, value); return this; }
    public MemberRecord womenPointsCurrent(Field<Double> value) { attribute(WOMEN_POINTS_CURRENT, value); return this; }
    public MemberRecord womenTotalWins(Field<Integer> value) { attribute(WOMEN_TOTAL_WINS, value); return this; }
    public MemberRecord womenTotalLosses(Field<Integer> value) { attribute(WOMEN_TOTAL_LOSSES, value); return this; }
    public MemberRecord lastUpdate(Field<LocalDate> value) { attribute(LAST_UPDATE, value); return this; }

    public Field<String> name() { return attribute(NAME); }
    public Field<String> rank() { return attribute(RANK); }
    public Field<String> organizationCode() { return attribute(ORGANIZATION_CODE); }
    public Field<String> category() { return attribute(CATEGORY); }
    public Field<Double> pointsStart() { return attribute(POINTS_START); }
    public Field<Double> pointsCurrent() { return attribute(POINTS_CURRENT); }
    public Field<Integer> rankingPosition() { return attribute(RANKING_POSITION); }
    public Field<Integer> totalWins() { return attribute(TOTAL_WINS); }
    public Field<Integer> totalLosses() { return attribute(TOTAL_LOSSES); }
    public Field<String> womenRank() { return attribute(WOMEN_RANK); }
    public Field<Double> womenPointsCurrent() { return attribute(WOMEN_POINTS_CURRENT); }
    public Field<Integer> womenTotalWins() { return attribute(WOMEN_TOTAL_WINS); }
    public Field<LocalDate> lastUpdate() { return attribute(LAST_UPDATE); }
}
