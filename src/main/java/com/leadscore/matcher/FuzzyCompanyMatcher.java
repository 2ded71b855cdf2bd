package com.leadscore.matcher;

import com.leadscore.dto.MatchResult;
import com.leadscore.dto.ScoredCompany;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Strict fuzzy matcher over normalized company keys. Anything short of a near-identical name
 * scores 0, so a wrong company is far less likely than a missed one.
 */
@Slf4j
@Component
public class FuzzyCompanyMatcher implements CompanyMatcher {

    static final double MIN_LENGTH_RATIO = 0.8;
    static final double CONTAINMENT_LENGTH_RATIO = 0.9;
    static final int CONTAINMENT_MIN_LENGTH = 5;
    static final double CONTAINMENT_SCORE = 97.0;
    static final double MIN_SEQUENCE_RATIO = 0.98;
    /** A contact counts as matched exactly when the best score reaches this. */
    public static final double MIN_MATCH_CONFIDENCE = 90.0;

    @Override
    public double matchScore(String keyA, String keyB) {
        if (StringUtils.isEmpty(keyA) || StringUtils.isEmpty(keyB)) {
            return 0.0;
        }
        if (keyA.equals(keyB)) {
            return 100.0;
        }

        int lenA = keyA.length();
        int lenB = keyB.length();
        double lengthRatio = (double) Math.min(lenA, lenB) / Math.max(lenA, lenB);
        if (lengthRatio < MIN_LENGTH_RATIO) {
            return 0.0;
        }

        boolean contained = keyA.contains(keyB) || keyB.contains(keyA);
        if (contained && lenA >= CONTAINMENT_MIN_LENGTH && lenB >= CONTAINMENT_MIN_LENGTH
                && lengthRatio > CONTAINMENT_LENGTH_RATIO) {
            return CONTAINMENT_SCORE;
        }

        double ratio = SequenceSimilarity.ratio(keyA, keyB);
        return ratio >= MIN_SEQUENCE_RATIO ? ratio * 100.0 : 0.0;
    }

    @Override
    public MatchResult findBestMatch(String key, List<ScoredCompany> candidates) {
        return findBestMatch(key, candidates, MIN_MATCH_CONFIDENCE);
    }

    @Override
    public MatchResult findBestMatch(String key, List<ScoredCompany> candidates, double minConfidence) {
        if (StringUtils.isBlank(key) || candidates == null || candidates.isEmpty()) {
            return MatchResult.noMatch();
        }

        ScoredCompany best = null;
        double bestScore = 0.0;
        for (ScoredCompany candidate : candidates) {
            String candidateKey = candidate.getNormalizedName();
            if (StringUtils.isBlank(candidateKey)) {
                continue;
            }
            double score = matchScore(key, candidateKey);
            if (score >= minConfidence && score > bestScore) {
                best = candidate;
                bestScore = score;
            }
        }

        if (best == null) {
            log.debug("No company match for key '{}'", key);
            return MatchResult.noMatch();
        }
        return MatchResult.builder()
                .matchedName(best.getCompanyName())
                .confidence(bestScore)
                .companyScore(best.getCompanyScore())
                .build();
    }
}
