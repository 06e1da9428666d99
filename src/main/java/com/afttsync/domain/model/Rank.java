package com.afttsync.domain.model;

import java.util.Comparator;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Skill rank token such as {@code NC}, {@code E6}, {@code D0} or {@code B2}.
 *
 * <p>Ordering: unranked (NC) is lowest, then tiers E &lt; D &lt; C &lt; B &lt; A. Within a tier the
 * numeric sub-level runs the other way, so {@code E6} &lt; {@code E4} &lt; {@code E0}.
 */
public final class Rank implements Comparable<Rank> {

    public static final String UNRANKED_TOKEN = "NC";
    public static final Rank UNRANKED = new Rank(UNRANKED_TOKEN, -1, 0);

    private static final String TIERS = "EDCBA";
    private static final Pattern TOKEN = Pattern.compile("^([A-E])(\\d)$");

    /** Best rank first; usable for member listings. */
    public static final Comparator<Rank> BEST_FIRST = Comparator.<Rank>naturalOrder().reversed();

    private final String token;
    private final int tier;
    private final int level;

    private Rank(String token, int tier, int level) {
        this.token = token;
        this.tier = tier;
        this.level = level;
    }

    /**
     * Parses a rank token. Returns empty for blank or unknown tokens.
     */
    public static Optional<Rank> parse(String token) {
        if (token == null) {
            return Optional.empty();
        }
        String normalized = token.trim().toUpperCase(Locale.ROOT);
        if (normalized.equals(UNRANKED_TOKEN)) {
            return Optional.of(UNRANKED);
        }
        Matcher matcher = TOKEN.matcher(normalized);
        if (!matcher.matches()) {
            return Optional.empty();
        }
        int tier = TIERS.indexOf(matcher.group(1).charAt(0));
        int level = Integer.parseInt(matcher.group(2));
        return Optional.of(new Rank(normalized, tier, level));
    }

    public static boolean isRankToken(String token) {
        return parse(token).isPresent();
    }

    public String getToken() {
        return token;
    }

    public boolean isUnranked() {
        return tier < 0;
    }

    @Override
    public int compareTo(Rank other) {
        if (tier != other.tier) {
            return Integer.compare(tier, other.tier);
        }
        return Integer.compare(other.level, level);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Rank other && token.equals(other.token);
    }

    @Override
    public int hashCode() {
        return token.hashCode();
    }

    @Override
    public String toString() {
        return token;
    }
}
