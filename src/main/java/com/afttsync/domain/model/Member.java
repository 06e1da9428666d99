package com.afttsync.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.time.LocalDate;

/**
 * Stored member profile.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class Member {

    private String licence;

    private String name;

    /** Rank token, e.g. {@code D0} or {@code NC}. */
    private String rank;

    private String organizationCode;

    private String category;

    private Double pointsStart;

    private Double pointsCurrent;

    private Integer rankingPosition;

    private Integer totalWins;

    private Integer totalLosses;

    private String womenRank;

    private Double womenPointsStart;

    private Double womenPointsCurrent;

    private Integer womenTotalWins;

    private Integer womenTotalLosses;

    /** Date printed on the profile sheet. */
    private LocalDate lastUpdate;

    public String getLicence() {
        return licence;
    }

    public void setLicence(String licence) {
        this.licence = licence;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getRank() {
        return rank;
    }

    public void setRank(String rank) {
        this.rank = rank;
    }

    public String getOrganizationCode() {
        return organizationCode;
    }

    public void setOrganizationCode(String organizationCode) {
        this.organizationCode = organizationCode;
    }

    public String getCategory() {
        return category;
    }

    public void setCategory(String category) {
        this.category = category;
    }

    public Double getPointsStart() {
        return pointsStart;
    }

    public void setPointsStart(Double pointsStart) {
        this.pointsStart = pointsStart;
    }

    public Double getPointsCurrent() {
        return pointsCurrent;
    }

    public void setPointsCurrent(Double pointsCurrent) {
        this.pointsCurrent = pointsCurrent;
    }

    public Integer getRankingPosition() {
        return rankingPosition;
    }

    public void setRankingPosition(Integer rankingPosition) {
        this.rankingPosition = rankingPosition;
    }

    public Integer getTotalWins() {
        return totalWins;
    }

    public void setTotalWins(Integer totalWins) {
        this.totalWins = totalWins;
    }

    public Integer getTotalLosses() {
        return totalLosses;
    }

    public void setTotalLosses(Integer totalLosses) {
        this.totalLosses = totalLosses;
    }

    public String getWomenRank() {
        return womenRank;
    }

    public void setWomenRank(String womenRank) {
        this.womenRank = womenRank;
    }

    public Double getWomenPointsStart() {
        return womenPointsStart;
    }

    public void setWomenPointsStart(Double womenPointsStart) {
        this.womenPointsStart = womenPointsStart;
    }

    public Double getWomenPointsCurrent() {
        return womenPointsCurrent;
    }

    public void setWomenPointsCurrent(Double womenPointsCurrent) {
        this.womenPointsCurrent = womenPointsCurrent;
    }

    public Integer getWomenTotalWins() {
        return womenTotalWins;
    }

    public void setWomenTotalWins(Integer womenTotalWins) {
        this.womenTotalWins = womenTotalWins;
    }

    public Integer getWomenTotalLosses() {
        return womenTotalLosses;
    }

    public void setWomenTotalLosses(Integer womenTotalLosses) {
        this.womenTotalLosses = womenTotalLosses;
    }

    public LocalDate getLastUpdate() {
        return lastUpdate;
    }

    public void setLastUpdate(LocalDate lastUpdate) {
        this.lastUpdate = lastUpdate;
    }
}
