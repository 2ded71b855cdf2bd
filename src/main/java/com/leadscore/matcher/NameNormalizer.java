package com.leadscore.matcher;

import com.google.common.collect.ImmutableSet;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Canonicalizes free-text company names into comparison keys.
 * <p>
 * The key is lower case and keeps only letters, digits and single spaces. Parenthetical asides,
 * web-domain tokens, corporate-entity words, industry filler words and short numeric tokens
 * (founding years and the like) are removed. Normalizing a key again returns the same key.
 * </p>
 */
public final class NameNormalizer {

    private static final Pattern PARENTHETICAL = Pattern.compile("\\([^)]*\\)");
    private static final Pattern NON_ALPHANUMERIC = Pattern.compile("[^a-z0-9\\s]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    static final ImmutableSet<String> CORPORATE_SUFFIXES = ImmutableSet.of(
            "llc", "inc", "ltd", "gmbh", "limited", "corporation", "corp", "plc", "sa", "srl",
            "ag", "ab", "oy", "as", "bv", "sas", "sarl", "sro", "spa",
            "global", "international", "group", "holdings", "holding", "enterprises", "enterprise",
            "company", "companies", "co", "pty", "proprietary", "private",
            "public", "incorporated", "llp",
            "sp", "z", "o", "s", "a", "b", "v", "n", "r", "l");

    static final ImmutableSet<String> INDUSTRY_SUFFIXES = ImmutableSet.of(
            "games", "game", "gaming", "studio", "studios", "entertainment", "interactive",
            "digital", "media", "publishing", "publisher", "publishers", "software", "tech",
            "technology", "solutions", "services", "service",
            "casino", "casinos", "slots", "slot", "777", "gambling", "betting", "bets",
            "mobile", "apps", "applications", "application", "app",
            "billionaire", "millionaire", "jackpot", "jackpots", "win", "wins", "winning", "winners",
            "prize", "prizes", "tournament", "tournaments",
            "championship", "championships", "league", "leagues", "challenge", "challenges");

    static final ImmutableSet<String> DOMAIN_SUFFIXES = ImmutableSet.of(
            ".com", ".org", ".net", ".io", ".xyz", ".ai", ".co", ".biz", ".info", ".app",
            ".games", ".game", ".tech", ".studio", ".dev", ".cloud", ".digital");

    private NameNormalizer() {
        throw new UnsupportedOperationException("Utility class");
    }

    public static String normalize(String name) {
        return normalize(name, false);
    }

    /**
     * @param name                    raw company name, may be null
     * @param preserveIndustrySuffix  keep words such as "games" or "studio" in the key
     * @return the comparison key, empty for null or blank input
     */
    public static String normalize(String name, boolean preserveIndustrySuffix) {
        if (name == null || name.isBlank()) {
            return "";
        }

        String lowered = PARENTHETICAL.matcher(name.toLowerCase(Locale.ROOT)).replaceAll(" ");

        List<String> kept = new ArrayList<>();
        for (String token : WHITESPACE.split(lowered.trim())) {
            if (!isDomainToken(token)) {
                kept.add(token);
            }
        }

        String stripped = NON_ALPHANUMERIC.matcher(String.join(" ", kept)).replaceAll(" ").trim();
        if (stripped.isEmpty()) {
            return "";
        }

        List<String> words = new ArrayList<>();
        for (String word : WHITESPACE.split(stripped)) {
            if (CORPORATE_SUFFIXES.contains(word)) continue;
            if (!preserveIndustrySuffix && INDUSTRY_SUFFIXES.contains(word)) continue;
            if (isShortNumber(word)) continue;
            words.add(word);
        }
        return String.join(" ", words);
    }

    private static boolean isDomainToken(String token) {
        for (String suffix : DOMAIN_SUFFIXES) {
            if (token.endsWith(suffix)) {
                return true;
            }
        }
        return false;
    }

    private static boolean isShortNumber(String word) {
        if (word.length() > 4) {
            return false;
        }
        for (int i = 0; i < word.length(); i++) {
            if (!Character.isDigit(word.charAt(i))) {
                return false;
            }
        }
        return true;
    }
}
