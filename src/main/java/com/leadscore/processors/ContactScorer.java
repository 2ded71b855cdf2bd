package com.leadscore.processors;

import com.leadscore.dto.ContactRecord;
import com.leadscore.dto.ContactScores;
import com.leadscore.models.Pillars;
import com.leadscore.models.ScoringComponent;
import com.leadscore.models.ScoringConfig;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.OptionalInt;

/**
 * Scores a contact from the job title alone.
 * <p>
 * Seniority takes the best matching base rule plus every matching modifier. Domain follows the
 * longest keyword match. A matching One-Offs rule overrides both with its own score, seniority
 * modifiers still applied. Warmth has no signal yet and is always 0.
 * </p>
 */
@Slf4j
@Component
public class ContactScorer {

    static final double MIN_SCORE = 0.0;
    static final double MAX_SCORE = 100.0;

    public ContactScores score(ContactRecord contact, ScoringConfig config) {
        return score(contact.getJobTitle(), config);
    }

    public ContactScores score(String jobTitle, ScoringConfig config) {
        double seniority = 0.0;
        double domain = 0.0;
        double warmth = 0.0;

        if (StringUtils.isNotBlank(jobTitle)) {
            String title = jobTitle.toLowerCase(Locale.ROOT);
            List<ScoringComponent> seniorityRules = config.components(Pillars.SENIORITY);
            int modifiers = TitleRuleEvaluator.sumModifiers(title, seniorityRules);

            OptionalInt oneOff = TitleRuleEvaluator.maxBaseScore(title, config.components(Pillars.ONE_OFFS));
            if (oneOff.isPresent()) {
                log.debug("One-off rule matched '{}' with score {}", jobTitle, oneOff.getAsInt());
                seniority = clamp(oneOff.getAsInt() + modifiers);
                domain = oneOff.getAsInt();
            } else {
                int base = TitleRuleEvaluator.maxBaseScore(title, seniorityRules).orElse(0);
                seniority = clamp(base + modifiers);
                domain = TitleRuleEvaluator.longestKeywordScore(title, config.components(Pillars.DOMAIN));
            }
        }

        return new ContactScores(seniority, domain, warmth, contactScore(seniority, domain, warmth, config));
    }

    /**
     * Weighted average of the people pillars.
     */
    public double contactScore(double seniority, double domain, double warmth, ScoringConfig config) {
        double seniorityWeight = config.peopleWeight(Pillars.SENIORITY);
        double domainWeight = config.peopleWeight(Pillars.DOMAIN);
        double warmthWeight = config.peopleWeight(Pillars.WARMTH);
        double totalWeight = seniorityWeight + domainWeight + warmthWeight;
        if (totalWeight <= 0) {
            return 0.0;
        }
        return (seniority * seniorityWeight + domain * domainWeight + warmth * warmthWeight) / totalWeight;
    }

    private static double clamp(double score) {
        return Math.max(MIN_SCORE, Math.min(MAX_SCORE, score));
    }
}
