package com.leadscore.utils.basic;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.temporal.ChronoField;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.OptionalDouble;


@Slf4j
public final class BasicUtility {

    /**
     * Date cell layouts seen in CRM and sheet exports, tried in order. Each must consume the whole
     * cell.
     */
    private static final List<DateTimeFormatter> DATE_CELL_FORMATS = List.of(
            yearFirstDateTime("uuuu-M-d"),
            yearFirstDateTime("uuuu/M/d"),
            textFormat("M/d/uuuu[ H:mm[:ss]]"),
            textFormat("M/d/uuuu h:mm[:ss] a"),
            textFormat("M/d/yy[ H:mm[:ss]]"),
            textFormat("M/d/yy h:mm[:ss] a"),
            textFormat("MMM d, uuuu[ h:mm[:ss] a]"),
            textFormat("MMMM d, uuuu[ h:mm[:ss] a]"),
            textFormat("d-MMM-uuuu[ H:mm[:ss]]"),
            textFormat("d MMM uuuu[ H:mm[:ss]]"),
            textFormat("d MMMM uuuu"));

    private BasicUtility() {
        throw new UnsupportedOperationException("Not supported");
    }

    public static String safeExtract(Object obj) {
        return obj != null ? obj.toString() : "";
    }

    /**
     * Parses a spreadsheet numeric cell. Currency signs, thousands separators and percent signs are
     * ignored; anything else that does not parse is reported as missing.
     */
    public static OptionalDouble parseNumber(String raw) {
        if (StringUtils.isBlank(raw)) {
            return OptionalDouble.empty();
        }
        String cleaned = raw.replace("$", "").replace(",", "").replace("%", "").trim();
        try {
            double value = Double.parseDouble(cleaned);
            return Double.isNaN(value) ? OptionalDouble.empty() : OptionalDouble.of(value);
        } catch (NumberFormatException e) {
            log.debug("Unparseable numeric cell '{}'", raw);
            return OptionalDouble.empty();
        }
    }

    /**
     * Parses a date cell into a calendar date; the time of day, when present, is dropped.
     */
    public static Optional<LocalDate> parseDate(String raw) {
        if (StringUtils.isBlank(raw)) {
            return Optional.empty();
        }
        String text = raw.trim();
        DateTimeException lastError = null;
        for (DateTimeFormatter format : DATE_CELL_FORMATS) {
            try {
                return Optional.of(format.parse(text, LocalDate::from));
            } catch (DateTimeException e) {
                lastError = e;
            }
        }
        log.debug("Unparseable date cell '{}': {}", raw, lastError.getMessage());
        return Optional.empty();
    }

    /**
     * Year-first date with an optional time of day ('T' or space separated, fractional seconds
     * allowed) and an optional UTC offset in any of the +HH:MM, +HHMM, +HH, Z or UTC spellings.
     */
    private static DateTimeFormatter yearFirstDateTime(String datePattern) {
        return new DateTimeFormatterBuilder()
                .parseCaseInsensitive()
                .appendPattern(datePattern)
                .optionalStart()
                .optionalStart().appendLiteral('T').optionalEnd()
                .optionalStart().appendLiteral(' ').optionalEnd()
                .appendPattern("H:mm")
                .optionalStart()
                .appendPattern(":ss")
                .optionalStart().appendFraction(ChronoField.NANO_OF_SECOND, 1, 9, true).optionalEnd()
                .optionalEnd()
                .optionalStart().appendLiteral(' ').optionalEnd()
                .optionalStart().appendOffset("+HH:MM", "Z").optionalEnd()
                .optionalStart().appendOffset("+HHMM", "Z").optionalEnd()
                .optionalStart().appendOffset("+HH", "Z").optionalEnd()
                .optionalStart().appendLiteral("UTC").optionalEnd()
                .optionalEnd()
                .toFormatter(Locale.ENGLISH);
    }

    private static DateTimeFormatter textFormat(String pattern) {
        return new DateTimeFormatterBuilder()
                .parseCaseInsensitive()
                .appendPattern(pattern)
                .toFormatter(Locale.ENGLISH);
    }

    public static boolean isFlagSet(String raw) {
        return raw != null && Constant.FLAG_MARKER.equalsIgnoreCase(raw.trim());
    }

    /**
     * Rounds to the nearest integer, ties to even.
     */
    public static long roundScore(double value) {
        return (long) Math.rint(value);
    }

    public static double roundToTenth(double value) {
        return Math.rint(value * 10.0) / 10.0;
    }

    /**
     * Renders a score the way the sheets show it: whole numbers without a fraction, everything else
     * with one decimal.
     */
    public static String formatScore(double value) {
        double tenth = roundToTenth(value);
        if (tenth == Math.rint(tenth)) {
            return Long.toString((long) tenth);
        }
        return BigDecimal.valueOf(tenth).setScale(1, RoundingMode.HALF_UP).toPlainString();
    }
}
