package com.afttsync.domain.model;

import java.time.LocalDate;

/**
 * One series of a competition (e.g. "E6-D6"), keyed by competition id and series name.
 */
public class CompetitionSeriesRecord extends ExtractedRecord {

    public static final String COMPETITION_ID = "competitionId";
    public static final String SERIES_NAME = "seriesName";
    public static final String DATE = "date";
    public static final String TIME = "time";
    public static final String ENTRIES_COUNT = "entriesCount";
    public static final String ENTRIES_MAX = "entriesMax";

    private final long competitionId;
    private final String seriesName;

    public CompetitionSeriesRecord(long competitionId, String seriesName) {
        super(EntityKind.COMPETITION_SERIES);
        this.competitionId = competitionId;
        this.seriesName = seriesName;
        identity(COMPETITION_ID, competitionId);
        identity(SERIES_NAME, seriesName);
    }

    @Override
    public String naturalKey() {
        return competitionId + "|" + seriesName;
    }

    @Override
    public boolean hasValidKey() {
        return competitionId > 0 && seriesName != null && !seriesName.isBlank();
    }

    public String seriesName() {
        return seriesName;
    }

    public CompetitionSeriesRecord date(Field<LocalDate> value) { attribute(DATE, value); return this; }
    public CompetitionSeriesRecord time(Field<String> value) { attribute(TIME, value); return this; }
    public CompetitionSeriesRecord entriesCount(Field<Integer> value) { attribute(ENTRIES_COUNT, value); return this; }
    public CompetitionSeriesRecord entriesMax(Field<Integer> value) { attribute(ENTRIES_MAX, value); return this; }

    public Field<LocalDate> date() { return attribute(DATE); }
    public Field<String> time() { return attribute(TIME); }
    public Field<Integer> entriesCount() { return attribute(ENTRIES_COUNT); }
    public Field<Integer> entriesMax() { return attribute(ENTRIES_MAX); }
}
