package com.leadscore.processors;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;

class FunnelStatusTest {

    private static final LocalDate TODAY = LocalDate.of(2025, 1, 1);

    @Test
    void resolve_shouldMatchBySubstring_inTableOrder() {
        assertEquals(FunnelStatus.PREVIOUS_CUSTOMER_6, FunnelStatus.resolve("6 - Previous Customer").orElseThrow());
        assertEquals(FunnelStatus.CUSTOMER, FunnelStatus.resolve("  5 - CUSTOMER (renewal) ").orElseThrow());
        assertEquals(FunnelStatus.QUARTERLY_FOLLOWUP, FunnelStatus.resolve("LT (Quarterly) Followup").orElseThrow());
        assertTrue(FunnelStatus.resolve("1 - cold").isEmpty());
        assertTrue(FunnelStatus.resolve(null).isEmpty());
    }

    @Test
    void decayedScore_shouldHalvePerHalfLife() {
        assertEquals(5.0, FunnelStatus.decayedScore("6 - previous customer", "2023-01-02", TODAY), 1e-9);
        assertEquals(1.0, FunnelStatus.decayedScore("Disco Incoming", "12/2/2024", TODAY), 1e-9);
    }

    @Test
    void decayedScore_shouldDecayTheSame_forEveryExportDateLayout() {
        LocalDate today = LocalDate.of(2024, 9, 1);
        double expected = 5.0 * Math.pow(0.5, 92.0 / 90.0);

        for (String changed : new String[]{"2024-06-01", "2024-06-01 10:00:00+00:00", "2024-06-01 10:00:00.123",
                "2024-06-01T10:00:00.000+0000", "Jun 1, 2024", "06/01/2024 10:00 AM"}) {
            assertEquals(expected, FunnelStatus.decayedScore("qualified", changed, today), 1e-9, changed);
        }
    }

    @Test
    void decayedScore_shouldUseBasePoints_withoutReadableDate() {
        assertEquals(5.0, FunnelStatus.decayedScore("Qualified", "", TODAY));
        assertEquals(8.0, FunnelStatus.decayedScore("4 - Contract Out", "sometime", TODAY));
    }

    @Test
    void decayedScore_shouldTreatFutureDatesAsToday() {
        assertEquals(6.0, FunnelStatus.decayedScore("Met with Matt", "2025-03-01", TODAY), 1e-9);
    }

    @Test
    void decayedScore_shouldBeZero_forUnknownStatus() {
        assertEquals(0.0, FunnelStatus.decayedScore("lost", "2024-12-01", TODAY));
        assertEquals(0.0, FunnelStatus.decayedScore(null, null, TODAY));
    }
}
