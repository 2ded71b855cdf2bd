package com.leadscore.utils.media.csv;

import com.google.common.collect.ImmutableMap;
import com.leadscore.utils.basic.Constant;

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Maps raw sheet headers onto the canonical column names, ignoring case and surrounding
 * whitespace. Headers the scorer does not know are kept, trimmed.
 */
public final class HeaderNormalizer {

    private HeaderNormalizer() {
        throw new UnsupportedOperationException("Unsupported operation");
    }

    private static final char BOM = '\uFEFF';

    private static final List<String> CANONICAL = List.of(
            Constant.COMPANY_NAME, Constant.NORMALIZED_NAME, Constant.NORMAL_COMPANY,
            Constant.REVENUE, Constant.REVENUE_FALLBACK, Constant.REVENUE_CHANGE,
            Constant.TOTAL_FUNDING, Constant.LATEST_FUNDING_AMOUNT, Constant.LATEST_FUNDING_DATE,
            Constant.EMPLOYEE_COUNT, Constant.EMPLOYEE_CHANGE,
            Constant.CLOSE_STATUS, Constant.CLOSE_STATUS_CHANGE_DATE,
            Constant.MAKES_GAMES, Constant.F2P, Constant.MOBILE, Constant.FOUNDED_YEAR, Constant.TYPE,
            Constant.WEBSITE_URL, Constant.LINKEDIN_URL, Constant.COUNTRY, Constant.FLAG, Constant.NOTES,
            Constant.DISCOVER_SOURCE, Constant.CREATED_DATE,
            Constant.FIRST_NAME, Constant.LAST_NAME, Constant.JOB_TITLE, Constant.SOURCE,
            Constant.EXTRA_DATA, Constant.DATE_CREATED, Constant.DATE_UPDATED);

    private static final Map<String, String> ALIASES = ImmutableMap.of(
            Constant.COMPANY.toLowerCase(Locale.ROOT), Constant.COMPANY_NAME);

    private static final Map<String, String> BY_LOWERCASE = byLowercase();

    /**
     * Column index by canonical header. An alias only fills a column that the sheet does not carry
     * under its canonical name; otherwise the first occurrence of a header wins.
     */
    public static Map<String, Integer> normalizeHeaders(String[] headers) {
        Map<String, Integer> headerMap = new HashMap<>();
        Map<String, Integer> aliased = new HashMap<>();
        for (int i = 0; i < headers.length; i++) {
            String header = clean(headers[i]);
            if (header.isEmpty()) {
                continue;
            }
            String key = header.toLowerCase(Locale.ROOT);
            String alias = ALIASES.get(key);
            if (alias != null) {
                aliased.putIfAbsent(alias, i);
            } else {
                headerMap.putIfAbsent(normalize(header), i);
            }
        }
        aliased.forEach(headerMap::putIfAbsent);
        return headerMap;
    }

    static String normalize(String header) {
        String cleaned = clean(header);
        return BY_LOWERCASE.getOrDefault(cleaned.toLowerCase(Locale.ROOT), cleaned);
    }

    private static String clean(String header) {
        if (header == null) {
            return "";
        }
        String value = header.trim();
        while (!value.isEmpty() && value.charAt(0) == BOM) {
            value = value.substring(1).trim();
        }
        return value;
    }

    private static Map<String, String> byLowercase() {
        Map<String, String> map = new HashMap<>();
        for (String canonical : CANONICAL) {
            map.put(canonical.toLowerCase(Locale.ROOT), canonical);
        }
        return Map.copyOf(map);
    }
}
