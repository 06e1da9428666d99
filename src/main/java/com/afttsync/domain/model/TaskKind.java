package com.afttsync.domain.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Kinds of scrape task. At most one task of each kind runs at a time.
 */
public enum TaskKind {
    ORGANIZATIONS("organizations"),
    PROFILES_ALL("profiles-all"),
    COMPETITIONS("competitions"),
    FULL("full");

    private final String tag;

    TaskKind(String tag) {
        this.tag = tag;
    }

    public String getTag() {
        return tag;
    }

    /**
     * Resolves a kind from its tag ({@code profiles-all}) or its constant name, ignoring case.
     */
    public static Optional<TaskKind> fromTag(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String trimmed = value.trim();
        return Arrays.stream(values())
            .filter(kind -> kind.tag.equalsIgnoreCase(trimmed) || kind.name().equalsIgnoreCase(trimmed))
            .findFirst();
    }
}
