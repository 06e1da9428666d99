package com.afttsync.domain.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for NormalizationUtils.
 */
class NormalizationUtilsTest {

    @Test
    void testNormalizeText() {
        // Test uppercase conversion
        assertEquals("DUPONT", NormalizationUtils.normalizeText("dupont"));

        // Test accent removal
        assertEquals("SEBASTIEN_LEFEVRE", NormalizationUtils.normalizeText("Sébastien Lefèvre"));

        // Hyphenated compound names
        assertEquals("JEAN_FRANCOIS_CULOT", NormalizationUtils.normalizeText("Jean-François Culot"));

        // Test collapse multiple underscores
        assertEquals("TEST_VALUE", NormalizationUtils.normalizeText("test  value"));

        // Test leading/trailing removal
        assertEquals("VALUE", NormalizationUtils.normalizeText(" value "));
    }

    @Test
    void testNormalizeTextWithNullOrEmpty() {
        assertEquals("", NormalizationUtils.normalizeText(null));
        assertEquals("", NormalizationUtils.normalizeText(""));
        assertEquals("", NormalizationUtils.normalizeText("   "));
    }

    @Test
    void testCollapseWhitespace() {
        assertEquals("TTC Ciney", NormalizationUtils.collapseWhitespace("  TTC  Ciney \n"));
        assertEquals("", NormalizationUtils.collapseWhitespace(null));
    }
}
