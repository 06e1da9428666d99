package com.afttsync.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Stored organization as returned by the store's read accessors.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class Organization {

    private String code;

    private String name;

    /** Province or federation; derived from the code prefix when the catalog omits it. */
    private String region;

    private String fullName;

    private String email;

    private String phone;

    private String status;

    private String website;

    private Boolean hasShower;

    private String venueName;

    private String venueAddress;

    private String venuePhone;

    private Boolean venueAccessible;

    private String venueRemarks;

    private Integer teamsMen;

    private Integer teamsWomen;

    private Integer teamsYouth;

    private Integer teamsVeterans;

    private String label;

    private String palette;

    public String getCode() {
        return code;
    }

    public void setCode(String code) {
        this.code = code;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getRegion() {
        return region;
    }

    public void setRegion(String region) {
        this.region = region;
    }

    public String getFullName() {
        return fullName;
    }

    public void setFullName(String fullName) {
        this.fullName = fullName;
    }

    public String getEmail() {
        return email;
    }

    public void setEmail(String email) {
        this.email = email;
    }

    public String getPhone() {
        return phone;
    }

    public void setPhone(String phone) {
        this.phone = phone;
    }

    public String getStatus() {
        return status;
    }

    public void setStatus(String status) {
        this.status = status;
    }

    public String getWebsite() {
        return website;
    }

    public void setWebsite(String website) {
        this.website = website;
    }

    public Boolean getHasShower() {
        return hasShower;
    }

    public void setHasShower(Boolean hasShower) {
        this.hasShower = hasShower;
    }

    public String getVenueName() {
        return venueName;
    }

    public void setVenueName(String venueName) {
        this.venueName = venueName;
    }

    public String getVenueAddress() {
        return venueAddress;
    }

    public void setVenueAddress(String venueAddress) {
        this.venueAddress = venueAddress;
    }

    public String getVenuePhone() {
        return venuePhone;
    }

    public void setVenuePhone(String venuePhone) {
        this.venuePhone = venuePhone;
    }

    public Boolean getVenueAccessible() {
        return venueAccessible;
    }

    public void setVenueAccessible(Boolean venueAccessible) {
        this.venueAccessible = venueAccessible;
    }

    public String getVenueRemarks() {
        return venueRemarks;
    }

    public void setVenueRemarks(String venueRemarks) {
        this.venueRemarks = venueRemarks;
    }

    public Integer getTeamsMen() {
        return teamsMen;
    }

    public void setTeamsMen(Integer teamsMen) {
        this.teamsMen = teamsMen;
    }

    public Integer getTeamsWomen() {
        return teamsWomen;
    }

    public void setTeamsWomen(Integer teamsWomen) {
        this.teamsWomen = teamsWomen;
    }

    public Integer getTeamsYouth() {
        return teamsYouth;
    }

    public void setTeamsYouth(Integer teamsYouth) {
        this.teamsYouth = teamsYouth;
    }

    public Integer getTeamsVeterans() {
        return teamsVeterans;
    }

    public void setTeamsVeterans(Integer teamsVeterans) {
        this.teamsVeterans = teamsVeterans;
    }

    public String getLabel() {
        return label;
    }

    public void setLabel(String label) {
        this.label = label;
    }

    public String getPalette() {
        return palette;
    }

    public void setPalette(String palette) {
        this.palette = palette;
    }
}
