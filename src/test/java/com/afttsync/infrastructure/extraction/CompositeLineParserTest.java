package com.afttsync.infrastructure.extraction;

import com.afttsync.domain.model.Field;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CompositeLineParserTest {

    @Test
    void testCompoundNameKeepsInnerHyphen() {
        CompositeLine line = CompositeLineParser.parse("103603 - JEAN-FRANCOIS CULOT - D0").orElseThrow();

        assertEquals("103603", line.id());
        assertEquals("JEAN-FRANCOIS CULOT", line.name().get());
        assertEquals("D0", line.rank().get());
    }

    @Test
    void testTrailingHyphenMeansNoRank() {
        CompositeLine line = CompositeLineParser.parse("151410 - LUCAS MENIER -").orElseThrow();

        assertEquals("LUCAS MENIER", line.name().get());
        assertTrue(line.rank().isAbsent());
    }

    @Test
    void testNameWithoutRank() {
        CompositeLine line = CompositeLineParser.parse("151410 - VAN DEN BERGHE - DE SMET").orElseThrow();

        assertEquals("VAN DEN BERGHE - DE SMET", line.name().get());
        assertTrue(line.rank().isAbsent());
    }

    @Test
    void testSheetLinkAndWhitespaceIgnored() {
        CompositeLine line = CompositeLineParser.parse("  103603 -  MARIE  DUBOIS - NC   Voir fiche ").orElseThrow();

        assertEquals("MARIE DUBOIS", line.name().get());
        assertEquals("NC", line.rank().get());
    }

    @Test
    void testOnlyHyphenAfterId() {
        CompositeLine line = CompositeLineParser.parse("103603 - -").orElseThrow();

        assertEquals(Field.absent(), line.name());
        assertEquals(Field.absent(), line.rank());
    }

    @Test
    void testLineWithoutIdIsRejected() {
        assertTrue(CompositeLineParser.parse("JEAN CULOT - D0").isEmpty());
        assertTrue(CompositeLineParser.parse(null).isEmpty());
    }
}
