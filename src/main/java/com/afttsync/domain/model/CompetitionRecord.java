package com.afttsync.domain.model;

import java.time.LocalDate;

/**
 * Competition (tournament) listing entry, keyed by its numeric catalog id.
 */
public class CompetitionRecord extends ExtractedRecord {

    public static final String COMPETITION_ID = "competitionId";
    public static final String NAME = "name";
    public static final String LEVEL = "level";
    public static final String DATE_START = "dateStart";
    public static final String DATE_END = "dateEnd";
    public static final String REFERENCE = "reference";
    public static final String SERIES_COUNT = "seriesCount";

    private final long competitionId;

    public CompetitionRecord(long competitionId) {
        super(EntityKind.COMPETITION);
        this.competitionId = competitionId;
        identity(COMPETITION_ID, competitionId);
    }

    public long competitionId() {
        return competitionId;
    }

    @Override
    public String naturalKey() {
        return Long.toString(competitionId);
    }

    @Override
    public boolean hasValidKey() {
        return competitionId > 0;
    }

    public CompetitionRecord name(Field<String> value) { attribute(NAME, value); return this; }
    public CompetitionRecord level(Field<String> value) { attribute(LEVEL, value); return this; }
    public CompetitionRecord reference(Field<String> value) { attribute(REFERENCE, value); return this; }
    public CompetitionRecord seriesCount(Field<Integer> value) { attribute(SERIES_COUNT, value); return this; }

    public CompetitionRecord dates(Field<DateRange> value) {
        attribute(DATE_START, value.map(DateRange::start));
        attribute(DATE_END, value.map(DateRange::end));
        return this;
    }

    public Field<String> name() { return attribute(NAME); }
    public Field<String> level() { return attribute(LEVEL); }
    public Field<LocalDate> dateStart() { return attribute(DATE_START); }
    public Field<LocalDate> dateEnd() { return attribute(DATE_END); }
    public Field<Integer> seriesCount() { return attribute(SERIES_COUNT); }
}
