package com.leadscore.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;

/**
 * Outcome of linking a contact's company to the scored company set. A result below the
 * confidence gate is represented by {@link #noMatch()}: empty name, zero confidence and no
 * company score.
 */
@Builder
@AllArgsConstructor
@Data
public class MatchResult {
    private String matchedName;
    private double confidence;
    private Double companyScore;

    public static MatchResult noMatch() {
        return new MatchResult("", 0.0, null);
    }

    public boolean isMatched() {
        return companyScore != null;
    }
}
