package com.leadscore.matcher;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class NameNormalizerTest {

    @Test
    void normalize_shouldDropCorporateSuffix() {
        assertEquals("supercell", NameNormalizer.normalize("Supercell Oy"));
        assertEquals("moon active", NameNormalizer.normalize("Moon-Active, Inc."));
    }

    @Test
    void normalize_shouldReturnEmpty_forNullOrBlank() {
        assertEquals("", NameNormalizer.normalize(null));
        assertEquals("", NameNormalizer.normalize("   "));
        assertEquals("", NameNormalizer.normalize("(stealth)"));
    }

    @Test
    void normalize_shouldDropParentheticalsDomainsAndShortNumbers() {
        assertEquals("rovio", NameNormalizer.normalize("Rovio Entertainment (Angry Birds)"));
        assertEquals("playtika", NameNormalizer.normalize("Playtika Ltd playtika.com"));
        assertEquals("zynga", NameNormalizer.normalize("Zynga Games 2007"));
        assertEquals("nexters 12345", NameNormalizer.normalize("Nexters 12345"), "only short numbers are dropped");
    }

    @Test
    void normalize_shouldKeepIndustryWords_whenPreserved() {
        assertEquals("zynga games", NameNormalizer.normalize("Zynga Games", true));
        assertEquals("zynga", NameNormalizer.normalize("Zynga Games", false));
    }

    @Test
    void normalize_shouldBeCaseInsensitive() {
        assertEquals(NameNormalizer.normalize("supercell oy"), NameNormalizer.normalize("SUPERCELL OY"));
        assertEquals(NameNormalizer.normalize("Big Fish Games"), NameNormalizer.normalize("big FISH games"));
    }

    @Test
    void normalize_shouldBeIdempotent() {
        List<String> names = List.of("Supercell Oy", "Rovio Entertainment (Angry Birds)", "Moon-Active, Inc.",
                "Scopely Mobile Games LLC", "N3TWORK Holdings", "Playtika Ltd playtika.com", "Big Fish Games, Inc.");
        for (String name : names) {
            String once = NameNormalizer.normalize(name);
            assertEquals(once, NameNormalizer.normalize(once), "normalize twice: " + name);
        }
    }
}
