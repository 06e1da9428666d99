package com.afttsync.domain.model;

/**
 * Outcome of merging one record. A rejection is a normal result, not an error.
 */
public record MergeResult(EntityKind kind, String key, boolean applied, boolean inserted, String reason) {

    public static MergeResult applied(EntityKind kind, String key, boolean inserted) {
        return new MergeResult(kind, key, true, inserted, null);
    }

    public static MergeResult rejected(EntityKind kind, String key, String reason) {
        return new MergeResult(kind, key, false, false, reason);
    }

    public boolean rejected() {
        return !applied;
    }
}
