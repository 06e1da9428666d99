package com.afttsync.infrastructure.extraction;

import com.afttsync.domain.model.DateRange;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;

class DateRangeParserTest {

    @Test
    void testSingleDate() {
        DateRange range = DateRangeParser.parse("14/09/2025").orElseThrow();

        assertTrue(range.isSingleDay());
        assertEquals(LocalDate.of(2025, 9, 14), range.start());
    }

    @Test
    void testTwoDigitYear() {
        assertEquals(LocalDate.of(2025, 9, 14), DateRangeParser.parse("14/09/25").orElseThrow().start());
    }

    @Test
    void testRangeSharesYear() {
        DateRange range = DateRangeParser.parse("13/09-14/09/2025").orElseThrow();

        assertEquals(LocalDate.of(2025, 9, 13), range.start());
        assertEquals(LocalDate.of(2025, 9, 14), range.end());
    }

    @Test
    void testRangeAcrossNewYear() {
        DateRange range = DateRangeParser.parse("30/12 - 02/01/2026").orElseThrow();

        assertEquals(LocalDate.of(2025, 12, 30), range.start());
        assertEquals(LocalDate.of(2026, 1, 2), range.end());
    }

    @Test
    void testInvalidDates() {
        assertTrue(DateRangeParser.parse("31/02/2025").isEmpty());
        assertTrue(DateRangeParser.parse("soon").isEmpty());
        assertTrue(DateRangeParser.parse(null).isEmpty());
    }

    @Test
    void testFindDateInsideText() {
        assertEquals(LocalDate.of(2026, 1, 10),
            DateRangeParser.findDate("Samedi 10/01/2026 - Division 3").orElseThrow());
    }
}
