package com.leadscore.utils.media.csv;

public final class ValueSanitizer {

    private static final char BOM = '\uFEFF';
    private static final char NBSP = '\u00A0';

    private ValueSanitizer() {
        throw new UnsupportedOperationException("Unsupported operation");
    }

    /**
     * Trims a cell and flattens it onto one line. Byte-order marks are dropped and non-breaking
     * spaces read as plain spaces.
     */
    public static String sanitize(String value) {
        if (value == null || value.isEmpty()) {
            return "";
        }

        int start = 0;
        int end = value.length();
        while (start < end && isPadding(value.charAt(start))) {
            start++;
        }
        while (end > start && isPadding(value.charAt(end - 1))) {
            end--;
        }

        StringBuilder sanitized = new StringBuilder(end - start);
        for (int i = start; i < end; i++) {
            char c = value.charAt(i);
            if (c == BOM) {
                continue;
            }
            sanitized.append((c == '\n' || c == '\r' || c == NBSP) ? ' ' : c);
        }
        return sanitized.toString();
    }

    private static boolean isPadding(char c) {
        return c == ' ' || c == '\t' || c == NBSP || c == BOM;
    }
}
