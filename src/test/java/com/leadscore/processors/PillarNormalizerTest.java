package com.leadscore.processors;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PillarNormalizerTest {

    @Test
    void normalizePillar_shouldMapIdenticalValuesTo50() {
        assertEquals(List.of(50.0, 50.0, 50.0), PillarNormalizer.normalizePillar(List.of(5.0, 5.0, 5.0)));
        assertEquals(List.of(50.0, 50.0), PillarNormalizer.normalizePillar(List.of(0.0, 0.0)));
    }

    @Test
    void normalizePillar_shouldRescaleAndRoundToOneDecimal() {
        assertEquals(List.of(0.0, 50.0, 100.0), PillarNormalizer.normalizePillar(List.of(2.0, 6.0, 10.0)));
        assertEquals(List.of(0.0, 33.3, 100.0), PillarNormalizer.normalizePillar(List.of(0.0, 1.0, 3.0)));
    }

    @Test
    void normalizeComponent_shouldKeepAllZeroColumnAtZero() {
        assertEquals(List.of(0.0, 0.0, 0.0), PillarNormalizer.normalizeComponent(List.of(0.0, 0.0, 0.0)));
        assertEquals(List.of(50.0, 50.0), PillarNormalizer.normalizeComponent(List.of(7.0, 7.0)));
        assertEquals(List.of(100.0, 0.0), PillarNormalizer.normalizeComponent(List.of(8.0, 0.0)));
    }

    @Test
    void normalize_shouldReturnEmpty_forEmptyInput() {
        assertTrue(PillarNormalizer.normalizePillar(List.of()).isEmpty());
        assertTrue(PillarNormalizer.normalizeComponent(List.of()).isEmpty());
    }
}
