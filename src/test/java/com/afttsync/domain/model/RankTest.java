package com.afttsync.domain.model;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RankTest {

    @Test
    void testParse() {
        assertEquals("D0", Rank.parse(" d0 ").orElseThrow().getToken());
        assertTrue(Rank.parse("NC").orElseThrow().isUnranked());
        assertTrue(Rank.parse("F1").isEmpty());
        assertTrue(Rank.parse("").isEmpty());
        assertTrue(Rank.parse(null).isEmpty());
    }

    @Test
    void testOrdering() {
        Rank unranked = Rank.UNRANKED;
        Rank e6 = Rank.parse("E6").orElseThrow();
        Rank e0 = Rank.parse("E0").orElseThrow();
        Rank d6 = Rank.parse("D6").orElseThrow();
        Rank b2 = Rank.parse("B2").orElseThrow();

        assertTrue(unranked.compareTo(e6) < 0);
        assertTrue(e6.compareTo(e0) < 0);
        assertTrue(e0.compareTo(d6) < 0);
        assertTrue(d6.compareTo(b2) < 0);
    }

    @Test
    void testBestFirst() {
        List<Rank> ranks = new ArrayList<>(List.of(
            Rank.parse("E2").orElseThrow(), Rank.UNRANKED, Rank.parse("C4").orElseThrow(),
            Rank.parse("E0").orElseThrow()));

        ranks.sort(Rank.BEST_FIRST);

        assertEquals(List.of("C4", "E0", "E2", "NC"), ranks.stream().map(Rank::getToken).toList());
    }
}
