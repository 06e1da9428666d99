package com.afttsync.domain.model;

/**
 * Wins and losses of a player against one opponent rank bucket, for one bracket.
 * Always supplied whole, so it replaces the stored value.
 */
public class OpponentBucketStatRecord extends ExtractedRecord {

    public static final String PLAYER_LICENCE = "playerLicence";
    public static final String COMPETITION_TYPE = "competitionType";
    public static final String BUCKET = "bucket";
    public static final String WINS = "wins";
    public static final String LOSSES = "losses";
    public static final String RATIO = "ratio";

    private final String playerLicence;
    private final CompetitionType competitionType;
    private final String bucket;

    public OpponentBucketStatRecord(String playerLicence, CompetitionType competitionType, String bucket,
                                    int wins, int losses, Field<Double> ratio) {
        super(EntityKind.OPPONENT_STAT);
        this.playerLicence = playerLicence;
        this.competitionType = competitionType;
        this.bucket = bucket;
        identity(PLAYER_LICENCE, playerLicence);
        identity(COMPETITION_TYPE, competitionType.name());
        identity(BUCKET, bucket);
        attribute(WINS, Field.of(wins));
        attribute(LOSSES, Field.of(losses));
        attribute(RATIO, ratio);
    }

    @Override
    public String naturalKey() {
        return String.join("|", String.valueOf(playerLicence), competitionType.name(), String.valueOf(bucket));
    }

    @Override
    public boolean hasValidKey() {
        return MemberRecord.isValidLicence(playerLicence) && bucket != null && !bucket.isBlank();
    }

    public String bucket() {
        return bucket;
    }

    public int wins() {
        return this.<Integer>attribute(WINS).get();
    }

    public int losses() {
        return this.<Integer>attribute(LOSSES).get();
    }

    public Field<Double> ratio() {
        return attribute(RATIO);
    }
}
