package com.afttsync.domain.model;

/**
 * Known document layouts of the catalog.
 */
public enum DocumentKind {
    ORGANIZATION_LIST,
    MEMBER_DIRECTORY,
    PROFILE_MEN,
    PROFILE_WOMEN,
    COMPETITION_LIST,
    COMPETITION_SERIES,
    COMPETITION_ENTRIES
}
