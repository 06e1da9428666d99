package com.afttsync.domain.model;

import java.text.Normalizer;
import java.util.Locale;

/**
 * Text normalization for identity keys built from free-form names.
 */
public final class NormalizationUtils {

    private NormalizationUtils() {
    }

    /**
     * Normalizes a name for use inside a natural key.
     *
     * Rules:
     * 1. Remove accents (Sébastien -> SEBASTIEN)
     * 2. Convert to uppercase
     * 3. Replace runs of non-alphanumeric characters with one underscore
     * 4. Remove leading/trailing underscores
     */
    public static String normalizeText(String text) {
        if (text == null || text.isBlank()) {
            return "";
        }

        String normalized = Normalizer.normalize(text, Normalizer.Form.NFD);
        normalized = normalized.replaceAll("\\p{M}", "");
        normalized = normalized.toUpperCase(Locale.ROOT);
        normalized = normalized.replaceAll("[^A-Z0-9]+", "_");
        return normalized.replaceAll("^_+|_+$", "");
    }

    /**
     * Collapses internal whitespace (including non-breaking spaces) to single spaces and trims.
     */
    public static String collapseWhitespace(String text) {
        if (text == null) {
            return "";
        }
        return text.replace('\u00a0', ' ').replaceAll("\\s+", " ").trim();
    }
}
