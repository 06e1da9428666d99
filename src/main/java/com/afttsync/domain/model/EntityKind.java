package com.afttsync.domain.model;

/**
 * Entity kinds known to the reconciliation store, with their collection and merge rule.
 */
public enum EntityKind {
    ORGANIZATION("organizations", MergeMode.NON_REGRESSION),
    MEMBER("members", MergeMode.NON_REGRESSION),
    MATCH("matches", MergeMode.REPLACE),
    OPPONENT_STAT("opponent_stats", MergeMode.REPLACE),
    COMPETITION("competitions", MergeMode.NON_REGRESSION),
    COMPETITION_SERIES("competition_series", MergeMode.NON_REGRESSION),
    COMPETITION_ENTRY("competition_entries", MergeMode.NON_REGRESSION);

    private final String collectionName;
    private final MergeMode mergeMode;

    EntityKind(String collectionName, MergeMode mergeMode) {
        this.collectionName = collectionName;
        this.mergeMode = mergeMode;
    }

    public String getCollectionName() {
        return collectionName;
    }

    public MergeMode getMergeMode() {
        return mergeMode;
    }
}
