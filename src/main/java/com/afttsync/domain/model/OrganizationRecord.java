package com.afttsync.domain.model;

import java.util.regex.Pattern;

/**
 * Organization (club) as observed on the organization list or on its directory page.
 */
public class OrganizationRecord extends ExtractedRecord {

    public static final String CODE = "code";
    public static final String NAME = "name";
    public static final String REGION = "region";
    public static final String FULL_NAME = "fullName";
    public static final String EMAIL = "email";
    public static final String PHONE = "phone";
    public static final String STATUS = "status";
    public static final String WEBSITE = "website";
    public static final String HAS_SHOWER = "hasShower";
    public static final String VENUE_NAME = "venueName";
    public static final String VENUE_ADDRESS = "venueAddress";
    public static final String VENUE_PHONE = "venuePhone";
    public static final String VENUE_ACCESSIBLE = "venueAccessible";
    public static final String VENUE_REMARKS = "venueRemarks";
    public static final String TEAMS_MEN = "teamsMen";
    public static final String TEAMS_WOMEN = "teamsWomen";
    public static final String TEAMS_YOUTH = "teamsYouth";
    public static final String TEAMS_VETERANS = "teamsVeterans";
    public static final String LABEL = "label";
    public static final String PALETTE = "palette";

    // Letters (optionally with an inner hyphen, e.g. "Vl-B") followed by digits.
    private static final Pattern CODE_PATTERN = Pattern.compile("^[A-Za-z]+(-[A-Za-z]+)?\\d{2,4}$");

    private final String code;

    public OrganizationRecord(String code) {
        super(EntityKind.ORGANIZATION);
        this.code = code == null ? null : code.trim();
        identity(CODE, this.code);
    }

    public String code() {
        return code;
    }

    @Override
    public String naturalKey() {
        return code;
    }

    @Override
    public boolean hasValidKey() {
        return code != null && CODE_PATTERN.matcher(code).matches();
    }

    public OrganizationRecord name(Field<String> value) { attribute(NAME, value); return this; }
    public OrganizationRecord region(Field<String> value) { attribute(REGION, value); return this; }
    public OrganizationRecord fullName(Field<String> value) { attribute(FULL_NAME, value); return this; }
    public OrganizationRecord email(Field<String> value) { attribute(EMAIL, value); return this; }
    public OrganizationRecord phone(Field<String> value) { attribute(PHONE, value); return this; }
    public OrganizationRecord status(Field<String> value) { attribute(STATUS, value); return this; }
    public OrganizationRecord website(Field<String> value) { attribute(WEBSITE, value); return this; }
    public OrganizationRecord hasShower(Field<Boolean> value) { attribute(HAS_SHOWER, value); return this; }
    public OrganizationRecord venueName(Field<String> value) { attribute(VENUE_NAME, value); return this; }
    public OrganizationRecord venueAddress(Field<String> value) { attribute(VENUE_ADDRESS, value); return this; }
    public OrganizationRecord venuePhone(Field<String> value) { attribute(VENUE_PHONE, value); return this; }
    public OrganizationRecord venueAccessible(Field<Boolean> value) { attribute(VENUE_ACCESSIBLE, value); return this; }
    public OrganizationRecord venueRemarks(Field<String> value) { attribute(VENUE_REMARKS, value); return this; }
    public OrganizationRecord teamsMen(Field<Integer> value) { attribute(TEAMS_MEN, value); return this; }
    public OrganizationRecord teamsWomen(Field<Integer> value) { attribute(TEAMS_WOMEN, value); return this; }
    public OrganizationRecord teamsYouth(Field<Integer> value) { attribute(TEAMS_YOUTH, value); return this; }
    public OrganizationRecord teamsVeterans(Field<Integer> value) { attribute(TEAMS_VETERANS, value); return this; }
    public OrganizationRecord label(Field<String> value) { attribute(LABEL, value); return this; }
    public OrganizationRecord palette(Field<String> value) { attribute(PALETTE, value); return this; }

    public Field<String> name() { return attribute(NAME); }
    public Field<String> region() { return attribute(REGION); }
    public Field<String> fullName() { return attribute(FULL_NAME); }
    public Field<String> email() { return attribute(EMAIL); }
    public Field<String> phone() { return attribute(PHONE); }
    public Field<String> status() { return attribute(STATUS); }
    public Field<String> website() { return attribute(WEBSITE); }
    public Field<Boolean> hasShower() { return attribute(HAS_SHOWER); }
    public Field<String> venueName() { return attribute(VENUE_NAME); }
    public Field<String> venueAddress() { return attribute(VENUE_ADDRESS); }
    public Field<Integer> teamsMen() { return attribute(TEAMS_MEN); }
    public Field<Integer> teamsWomen() { return attribute(TEAMS_WOMEN); }
    public Field<String> label() { return attribute(LABEL); }
    public Field<String> palette() { return attribute(PALETTE); }
}
