package com.afttsync.domain.model;

/**
 * Men's or women's bracket. The catalog publishes a separate profile sheet for each.
 */
public enum CompetitionType {
    MEN,
    WOMEN
}
