package com.afttsync.domain.merge;

import com.afttsync.domain.model.CompetitionType;
import com.afttsync.domain.model.Field;
import com.afttsync.domain.model.MatchRecord;
import com.afttsync.domain.model.MemberRecord;
import com.afttsync.domain.model.OrganizationRecord;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class NonRegressionMergerTest {

    private final NonRegressionMerger merger = new NonRegressionMerger(List.of(new RegionDerivation()));

    @Test
    void testDirectoryPageDoesNotEraseListName() {
        OrganizationRecord fromList = new OrganizationRecord("H004").name(Field.of("CTT Mons"));
        MergedEntity first = merger.merge(null, fromList);

        assertTrue(first.inserted());
        assertEquals("CTT Mons", first.values().get(OrganizationRecord.NAME));
        assertEquals("Hainaut", first.values().get(OrganizationRecord.REGION));

        OrganizationRecord fromDirectory = new OrganizationRecord("H004")
            .name(Field.absent())
            .email(Field.of("info@cttmons.be"))
            .region(Field.absent());
        MergedEntity second = merger.merge(first.values(), fromDirectory);

        assertFalse(second.inserted());
        assertEquals("CTT Mons", second.values().get(OrganizationRecord.NAME));
        assertEquals("info@cttmons.be", second.values().get(OrganizationRecord.EMAIL));
        assertEquals("Hainaut", second.values().get(OrganizationRecord.REGION));
    }

    @Test
    void testPresentValueReplacesStored() {
        Map<String, Object> stored = merger.merge(null, new MemberRecord("123456").rank(Field.of("E2"))).values();

        Map<String, Object> merged = merger.merge(stored, new MemberRecord("123456").rank(Field.of("D6"))).values();

        assertEquals("D6", merged.get(MemberRecord.RANK));
    }

    @Test
    void testMergeIsIdempotent() {
        MemberRecord member = new MemberRecord("123456")
            .name(Field.of("JEAN-FRANCOIS CULOT"))
            .pointsCurrent(Field.of(1234.5))
            .lastUpdate(Field.of(LocalDate.of(2026, 2, 1)));
        Map<String, Object> once = merger.merge(null, member).values();

        Map<String, Object> twice = merger.merge(new HashMap<>(once), member).values();

        assertEquals(once, twice);
        assertEquals("2026-02-01", twice.get(MemberRecord.LAST_UPDATE));
    }

    @Test
    void testAttributesOfOtherSourcesAreKept() {
        Map<String, Object> stored = merger.merge(null, new MemberRecord("123456")
            .womenRank(Field.of("C2"))).values();

        Map<String, Object> merged = merger.merge(stored, new MemberRecord("123456")
            .rank(Field.of("B4"))).values();

        assertEquals("C2", merged.get(MemberRecord.WOMEN_RANK));
        assertEquals("B4", merged.get(MemberRecord.RANK));
    }

    @Test
    void testStoreManagedKeysCarriedOver() {
        Map<String, Object> stored = new HashMap<>(merger.merge(null, new MemberRecord("123456")).values());
        stored.put("_rev", 3L);

        Map<String, Object> merged = merger.merge(stored, new MemberRecord("123456")).values();

        assertEquals(3L, merged.get("_rev"));
    }

    @Test
    void testReplaceModeDropsAbsentValues() {
        MatchRecord withScore = new MatchRecord("123456", CompetitionType.MEN, LocalDate.of(2026, 1, 10),
            Field.of("Div 3"), Field.of("654321"), Field.of("DUPONT PIERRE")).score(Field.of("3-1"));
        Map<String, Object> stored = merger.merge(null, withScore).values();

        MatchRecord withoutScore = new MatchRecord("123456", CompetitionType.MEN, LocalDate.of(2026, 1, 10),
            Field.of("Div 3"), Field.of("654321"), Field.of("DUPONT PIERRE")).score(Field.absent());
        Map<String, Object> merged = merger.merge(stored, withoutScore).values();

        assertNull(merged.get(MatchRecord.SCORE));
        assertEquals("MEN", merged.get(MatchRecord.COMPETITION_TYPE));
        assertEquals("2026-01-10", merged.get(MatchRecord.DATE));
    }

    @Test
    void testMalformedKeyRejected() {
        assertTrue(merger.rejectionReason(new MemberRecord("12a")).isPresent());
        assertTrue(merger.rejectionReason(new OrganizationRecord("")).isPresent());
        assertTrue(merger.rejectionReason(new OrganizationRecord("Vl-B123")).isEmpty());
    }

    @Test
    void testRegionLongestPrefixWins() {
        assertEquals("Luxembourg", RegionDerivation.regionOf("Lx123").orElseThrow());
        assertEquals("Liège", RegionDerivation.regionOf("L120").orElseThrow());
        assertEquals("Vlaams-Brabant", RegionDerivation.regionOf("Vl-B123").orElseThrow());
        assertEquals("Antwerpen", RegionDerivation.regionOf("A123").orElseThrow());
        assertTrue(RegionDerivation.regionOf("Z999").isEmpty());
    }
}
