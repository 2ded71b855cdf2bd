package com.leadscore.processors;

import org.springframework.stereotype.Component;

/**
 * Lead score from a contact score and the matched company's score.
 * <ul>
 *     <li>match and title: {@code contact / 100 * company}</li>
 *     <li>match, no title: {@code company * 0.3}</li>
 *     <li>title, no match: {@code contact * 0.3}</li>
 *     <li>neither: {@code 5.0}</li>
 * </ul>
 */
@Component
public class LeadScoreCombiner {

    static final double MISSING_SIGNAL_FACTOR = 0.3;
    static final double FLOOR_SCORE = 5.0;

    public double combine(double contactScore, double companyScore, boolean hasCompanyMatch, boolean hasJobTitle) {
        double leadScore;
        if (hasCompanyMatch && hasJobTitle) {
            leadScore = (contactScore / 100.0) * companyScore;
        } else if (hasCompanyMatch) {
            leadScore = companyScore * MISSING_SIGNAL_FACTOR;
        } else if (hasJobTitle) {
            leadScore = contactScore * MISSING_SIGNAL_FACTOR;
        } else {
            leadScore = FLOOR_SCORE;
        }
        return Math.max(0.0, Math.min(100.0, leadScore));
    }
}
