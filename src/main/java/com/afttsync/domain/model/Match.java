package com.afttsync.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.time.LocalDate;

/**
 * Stored individual match of a player.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class Match {

    private String playerLicence;

    private CompetitionType competitionType;

    private LocalDate date;

    private String division;

    /** Opponent licence, or normalized opponent name when the licence is unknown. */
    private String opponentKey;

    private String opponentLicence;

    private String opponentName;

    private String opponentRank;

    private Double opponentPoints;

    private String opponentClub;

    private String score;

    private Boolean won;

    private Double pointsDelta;

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

    public LocalDate getDate() {
        return date;
    }

    public void setDate(LocalDate date) {
        this.date = date;
    }

    public String getDivision() {
        return division;
    }

    public void setDivision(String division) {
        this.division = division;
    }

    public String getOpponentKey() {
        return opponentKey;
    }

    public void setOpponentKey(String opponentKey) {
        this.opponentKey = opponentKey;
    }

    public String getOpponentLicence() {
        return opponentLicence;
    }

    public void setOpponentLicence(String opponentLicence) {
        this.opponentLicence = opponentLicence;
    }

    public String getOpponentName() {
        return opponentName;
    }

    public void setOpponentName(String opponentName) {
        this.opponentName = opponentName;
    }

    public String getOpponentRank() {
        return opponentRank;
    }

    public void setOpponentRank(String opponentRank) {
        this.opponentRank = opponentRank;
    }

    public Double getOpponentPoints() {
        return opponentPoints;
    }

    public void setOpponentPoints(Double opponentPoints) {
        this.opponentPoints = opponentPoints;
    }

    public String getOpponentClub() {
        return opponentClub;
    }

    public void setOpponentClub(String opponentClub) {
        this.opponentClub = opponentClub;
    }

    public String getScore() {
        return score;
    }

    public void setScore(String score) {
        this.score = score;
    }

    public Boolean getWon() {
        return won;
    }

    public void setWon(Boolean won) {
        this.won = won;
    }

    public Double getPointsDelta() {
        return pointsDelta;
    }

    public void setPointsDelta(Double pointsDelta) {
        this.pointsDelta = pointsDelta;
    }
}
