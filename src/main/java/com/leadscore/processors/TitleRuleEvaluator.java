package com.leadscore.processors;

import com.leadscore.models.Keyword;
import com.leadscore.models.ScoreRule;
import com.leadscore.models.ScoringComponent;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.OptionalInt;

/**
 * Evaluates the keyword components of one pillar against a lower-cased job title.
 */
@Slf4j
public final class TitleRuleEvaluator {

    private TitleRuleEvaluator() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * Highest base score among matching components, empty if none matches.
     */
    public static OptionalInt maxBaseScore(String loweredTitle, List<ScoringComponent> components) {
        return components.stream()
                .filter(c -> c.getRule() instanceof ScoreRule.BaseScore)
                .filter(c -> c.matches(loweredTitle))
                .mapToInt(c -> ((ScoreRule.BaseScore) c.getRule()).value())
                .max();
    }

    /**
     * Sum of the deltas of every matching modifier component.
     */
    public static int sumModifiers(String loweredTitle, List<ScoringComponent> components) {
        int total = 0;
        for (ScoringComponent component : components) {
            if (component.getRule() instanceof ScoreRule.ScoreModifier modifier && component.matches(loweredTitle)) {
                total += modifier.delta();
            }
        }
        return total;
    }

    /**
     * Longest matching keyword decides the score, across every keyword of every base component.
     * On equal length the first keyword in configuration order wins. A higher-scoring match that
     * lost to a longer keyword is logged.
     */
    public static int longestKeywordScore(String loweredTitle, List<ScoringComponent> components) {
        Keyword longest = null;
        int longestScore = 0;
        Keyword highest = null;
        int highestScore = Integer.MIN_VALUE;

        for (ScoringComponent component : components) {
            if (!(component.getRule() instanceof ScoreRule.BaseScore base)) {
                continue;
            }
            for (Keyword keyword : component.getKeywords()) {
                if (!keyword.matches(loweredTitle)) {
                    continue;
                }
                if (longest == null || keyword.text().length() > longest.text().length()) {
                    longest = keyword;
                    longestScore = base.value();
                }
                if (base.value() > highestScore) {
                    highest = keyword;
                    highestScore = base.value();
                }
            }
        }

        if (longest == null) {
            return 0;
        }
        if (highestScore > longestScore) {
            log.info("Longest match rule: '{}' - using '{}' ({}) over '{}' ({})",
                    loweredTitle, longest.text(), longestScore, highest.text(), highestScore);
        }
        return longestScore;
    }
}
