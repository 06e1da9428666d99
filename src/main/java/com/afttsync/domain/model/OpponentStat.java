package com.afttsync.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Stored wins/losses of a player against one rank bucket.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class OpponentStat {

    private String playerLicence;

    private CompetitionType competitionType;

    private String bucket;

    private Integer wins;

    private Integer losses;

    private Double ratio;

    public String getPlayerLicence() {
        return playerLicence;
    }

    public void setPlayerLicence(String playerLicence) {
        this.playerLicence = playerLicence;
    }

    public CompetitionType getCompetitionType() {
        return competitionType;
    }

    public void setCompetitionType(CompetitionType competitionType) {
        this.competitionType = competitionType;
    }

    public String getBucket() {
        return bucket;
    }

    public void setBucket(String bucket) {
        this.bucket = bucket;
    }

    public Integer getWins() {
        return wins;
    }

    public void setWins(Integer wins) {
        this.wins = wins;
    }

    public Integer getLosses() {
        return losses;
    }

    public void setLosses(Integer losses) {
        this.losses = losses;
    }

    public Double getRatio() {
        return ratio;
    }

    public void setRatio(Double ratio) {
        this.ratio = ratio;
    }
}
