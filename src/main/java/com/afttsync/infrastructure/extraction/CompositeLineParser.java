package com.afttsync.infrastructure.extraction;

import com.afttsync.domain.model.Field;
import com.afttsync.domain.model.NormalizationUtils;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses {@code "id - full name - rank"} lines such as {@code 103603 - JEAN-FRANCOIS CULOT - D0}.
 *
 * <p>A separator is a hyphen with whitespace on both sides, so hyphens inside compound names are
 * kept. A trailing bare hyphen ({@code 151410 - LUCAS MENIER -}) means the rank is not published.
 */
public final class CompositeLineParser {

    private static final Pattern SHEET_LINK_SUFFIX = Pattern.compile("\\s*Voir fiche.*$",
        Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    private static final Pattern HEAD = Pattern.compile("^(\\d+)\\s+-\\s+(.*)$");
    private static final Pattern TRAILING_HYPHEN = Pattern.compile("^(.*?)\\s+-$");
    private static final Pattern SEPARATOR = Pattern.compile("\\s+-\\s+");
    private static final Pattern RANK_TOKEN = Pattern.compile("^[A-Za-z0-9]+$");

    private CompositeLineParser() {
    }

    public static Optional<CompositeLine> parse(String line) {
        if (line == null) {
            return Optional.empty();
        }
        String text = NormalizationUtils.collapseWhitespace(line);
        text = SHEET_LINK_SUFFIX.matcher(text).replaceFirst("");

        Matcher head = HEAD.matcher(text);
        if (!head.matches()) {
            return Optional.empty();
        }
        String id = head.group(1);
        String rest = head.group(2).trim();

        if (rest.equals("-")) {
            return Optional.of(new CompositeLine(id, Field.absent(), Field.absent()));
        }
        Matcher trailing = TRAILING_HYPHEN.matcher(rest);
        if (trailing.matches()) {
            return Optional.of(new CompositeLine(id, Field.ofText(trailing.group(1)), Field.absent()));
        }

        int lastSeparatorStart = -1;
        int lastSeparatorEnd = -1;
        Matcher separator = SEPARATOR.matcher(rest);
        while (separator.find()) {
            lastSeparatorStart = separator.start();
            lastSeparatorEnd = separator.end();
        }
        if (lastSeparatorStart >= 0) {
            String tail = rest.substring(lastSeparatorEnd).trim();
            if (RANK_TOKEN.matcher(tail).matches()) {
                return Optional.of(new CompositeLine(id, Field.ofText(rest.substring(0, lastSeparatorStart)),
                    Field.ofText(tail)));
            }
        }
        return Optional.of(new CompositeLine(id, Field.ofText(rest), Field.absent()));
    }
}
