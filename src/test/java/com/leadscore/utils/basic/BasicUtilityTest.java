package com.leadscore.utils.basic;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class BasicUtilityTest {

    @Test
    void parseNumber_shouldIgnoreCurrencyAndSeparators() {
        assertEquals(1234.5, BasicUtility.parseNumber("$1,234.5").getAsDouble(), 1e-9);
        assertEquals(12.0, BasicUtility.parseNumber(" 12% ").getAsDouble(), 1e-9);
        assertEquals(-3.0, BasicUtility.parseNumber("-3").getAsDouble(), 1e-9);
    }

    @Test
    void parseNumber_shouldReportMissing_forBlankOrText() {
        assertTrue(BasicUtility.parseNumber(null).isEmpty());
        assertTrue(BasicUtility.parseNumber("  ").isEmpty());
        assertTrue(BasicUtility.parseNumber("n/a").isEmpty());
        assertTrue(BasicUtility.parseNumber("NaN").isEmpty());
    }

    @Test
    void parseDate_shouldAcceptCommonSheetFormats_andDropTimeOfDay() {
        LocalDate expected = LocalDate.of(2024, 3, 15);

        assertEquals(Optional.of(expected), BasicUtility.parseDate("2024-03-15"));
        assertEquals(Optional.of(expected), BasicUtility.parseDate("2024-03-15T10:20:30"));
        assertEquals(Optional.of(expected), BasicUtility.parseDate("2024-03-15T10:20:30Z"));
        assertEquals(Optional.of(expected), BasicUtility.parseDate("2024-03-15 10:20:30"));
        assertEquals(Optional.of(expected), BasicUtility.parseDate("2024-03-15 10:20"));
        assertEquals(Optional.of(expected), BasicUtility.parseDate("3/15/2024"));
        assertEquals(Optional.of(expected), BasicUtility.parseDate(" 3/15/2024 9:05 "));
    }

    @Test
    void parseDate_shouldAcceptOffsetsFractionsAndMonthNames() {
        LocalDate expected = LocalDate.of(2024, 6, 1);

        assertEquals(Optional.of(expected), BasicUtility.parseDate("2024-06-01 10:00:00+00:00"));
        assertEquals(Optional.of(expected), BasicUtility.parseDate("2024-06-01 10:00:00.123"));
        assertEquals(Optional.of(expected), BasicUtility.parseDate("2024-06-01T10:00:00.000+0000"));
        assertEquals(Optional.of(expected), BasicUtility.parseDate("2024-06-01T10:00:00.123456Z"));
        assertEquals(Optional.of(expected), BasicUtility.parseDate("2024-06-01 10:00:00 -0500"));
        assertEquals(Optional.of(expected), BasicUtility.parseDate("2024-06-01 10:00:00 UTC"));
        assertEquals(Optional.of(expected), BasicUtility.parseDate("2024-06-01T10:00+05"));
        assertEquals(Optional.of(expected), BasicUtility.parseDate("2024/6/1"));
        assertEquals(Optional.of(expected), BasicUtility.parseDate("Jun 1, 2024"));
        assertEquals(Optional.of(expected), BasicUtility.parseDate("June 1, 2024"));
        assertEquals(Optional.of(expected), BasicUtility.parseDate("01-Jun-2024"));
        assertEquals(Optional.of(expected), BasicUtility.parseDate("1 jun 2024"));
        assertEquals(Optional.of(expected), BasicUtility.parseDate("06/01/2024 10:00 AM"));
        assertEquals(Optional.of(expected), BasicUtility.parseDate("6/1/2024 1:30:15 pm"));
        assertEquals(Optional.of(expected), BasicUtility.parseDate("6/1/24"));
    }

    @Test
    void parseDate_shouldReportMissing_forUnparseableCells() {
        assertTrue(BasicUtility.parseDate(null).isEmpty());
        assertTrue(BasicUtility.parseDate("").isEmpty());
        assertTrue(BasicUtility.parseDate("last spring").isEmpty());
        assertTrue(BasicUtility.parseDate("2024-06-01 later").isEmpty());
        assertTrue(BasicUtility.parseDate("13/45/2024").isEmpty());
    }

    @Test
    void roundScore_shouldRoundHalfToEven() {
        assertEquals(2, BasicUtility.roundScore(2.5));
        assertEquals(4, BasicUtility.roundScore(3.5));
        assertEquals(3, BasicUtility.roundScore(2.51));
        assertEquals(0, BasicUtility.roundScore(0.4));
    }

    @Test
    void formatScore_shouldDropFractionForWholeNumbers() {
        assertEquals("80", BasicUtility.formatScore(80.0));
        assertEquals("36.8", BasicUtility.formatScore(36.75));
        assertEquals("0", BasicUtility.formatScore(0.04));
        assertEquals("12.3", BasicUtility.formatScore(12.34));
    }

    @Test
    void isFlagSet_shouldMatchMarkerCaseInsensitively() {
        assertTrue(BasicUtility.isFlagSet(" x "));
        assertTrue(BasicUtility.isFlagSet("X"));
        assertFalse(BasicUtility.isFlagSet("yes"));
        assertFalse(BasicUtility.isFlagSet(null));
    }
}
