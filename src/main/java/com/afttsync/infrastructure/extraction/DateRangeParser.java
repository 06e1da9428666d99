package com.afttsync.infrastructure.extraction;

import com.afttsync.domain.model.DateRange;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Catalog date formats: {@code dd/MM/yyyy}, {@code dd/MM/yy} and ranges {@code dd/MM-dd/MM/yyyy}.
 */
public final class DateRangeParser {

    private static final Pattern RANGE = Pattern.compile("(\\d{1,2})/(\\d{1,2})\\s*-\\s*(\\d{1,2})/(\\d{1,2})/(\\d{4})");
    private static final Pattern SINGLE = Pattern.compile("(\\d{1,2})/(\\d{1,2})/(\\d{4}|\\d{2})(?!\\d)");

    private DateRangeParser() {
    }

    /**
     * Parses text starting with a date or a date range. Returns empty when no valid date leads the text.
     */
    public static Optional<DateRange> parse(String text) {
        if (text == null) {
            return Optional.empty();
        }
        String trimmed = text.trim();
        Matcher range = RANGE.matcher(trimmed);
        if (range.lookingAt()) {
            return toRange(range);
        }
        Matcher single = SINGLE.matcher(trimmed);
        if (single.lookingAt()) {
            return toDate(single).map(DateRange::single);
        }
        return Optional.empty();
    }

    /**
     * Finds the first single date anywhere in the text.
     */
    public static Optional<LocalDate> findDate(String text) {
        if (text == null) {
            return Optional.empty();
        }
        Matcher single = SINGLE.matcher(text);
        while (single.find()) {
            Optional<LocalDate> date = toDate(single);
            if (date.isPresent()) {
                return date;
            }
        }
        return Optional.empty();
    }

    private static Optional<DateRange> toRange(Matcher range) {
        try {
            int year = Integer.parseInt(range.group(5));
            LocalDate end = LocalDate.of(year, Integer.parseInt(range.group(4)), Integer.parseInt(range.group(3)));
            LocalDate start = LocalDate.of(year, Integer.parseInt(range.group(2)), Integer.parseInt(range.group(1)));
            if (start.isAfter(end)) {
                // Range across new year: the year belongs to the end date.
                start = start.minusYears(1);
            }
            return Optional.of(new DateRange(start, end));
        } catch (DateTimeException e) {
            return Optional.empty();
        }
    }

    private static Optional<LocalDate> toDate(Matcher single) {
        try {
            int year = Integer.parseInt(single.group(3));
            if (single.group(3).length() == 2) {
                year += 2000;
            }
            return Optional.of(LocalDate.of(year, Integer.parseInt(single.group(2)), Integer.parseInt(single.group(1))));
        } catch (DateTimeException e) {
            return Optional.empty();
        }
    }
}
