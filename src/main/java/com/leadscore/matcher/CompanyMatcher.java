package com.leadscore.matcher;

import com.leadscore.dto.MatchResult;
import com.leadscore.dto.ScoredCompany;

import java.util.List;

public interface CompanyMatcher {

    /**
     * Confidence (0-100) that two normalized company keys name the same company.
     */
    double matchScore(String keyA, String keyB);

    MatchResult findBestMatch(String key, List<ScoredCompany> candidates);

    MatchResult findBestMatch(String key, List<ScoredCompany> candidates, double minConfidence);
}
