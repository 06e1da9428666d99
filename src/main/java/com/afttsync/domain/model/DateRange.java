package com.afttsync.domain.model;

import java.time.LocalDate;
import java.util.Objects;

/**
 * Normalized date span. A single date is a range whose start equals its end.
 */
public record DateRange(LocalDate start, LocalDate end) {

    public DateRange {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        if (end.isBefore(start)) {
            throw new IllegalArgumentException("Range end " + end + " is before start " + start);
        }
    }

    public static DateRange single(LocalDate date) {
        return new DateRange(date, date);
    }

    public boolean isSingleDay() {
        return start.equals(end);
    }
}
