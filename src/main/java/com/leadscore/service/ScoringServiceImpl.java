package com.leadscore.service;

import com.leadscore.dto.CompanyRecord;
import com.leadscore.dto.ContactRecord;
import com.leadscore.dto.ContactScores;
import com.leadscore.dto.MatchResult;
import com.leadscore.dto.NormalizationBaseline;
import com.leadscore.dto.ScoredCompany;
import com.leadscore.dto.ScoredContact;
import com.leadscore.dto.ScoringSummary;
import com.leadscore.matcher.CompanyMatcher;
import com.leadscore.matcher.NameNormalizer;
import com.leadscore.metrics.ScoringMetrics;
import com.leadscore.models.ScoringConfig;
import com.leadscore.processors.CompanyScorer;
import com.leadscore.processors.ContactScorer;
import com.leadscore.processors.LeadScoreCombiner;
import com.leadscore.processors.ScoreNormalizer;
import com.leadscore.utils.basic.BasicUtility;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.OptionalDouble;

@Slf4j
@Service
@RequiredArgsConstructor
public class ScoringServiceImpl implements ScoringService {

    private final CompanyScorer companyScorer;
    private final ContactScorer contactScorer;
    private final CompanyMatcher companyMatcher;
    private final LeadScoreCombiner leadScoreCombiner;
    private final ScoreNormalizer scoreNormalizer;
    private final ScoringMetrics scoringMetrics;

    @Override
    public List<ScoredCompany> scoreCompanies(List<CompanyRecord> companies, ScoringConfig config) {
        long start = System.currentTimeMillis();
        try {
            List<ScoredCompany> scored = new ArrayList<>(companyScorer.score(companies, config));
            scored.sort(Comparator.comparingDouble(ScoredCompany::getCompanyScore).reversed());
            scoringMetrics.incrementCompaniesScored(scored.size());
            if (!scored.isEmpty()) {
                log.info("Company scoring complete: {} companies, highest score {}", scored.size(),
                        BasicUtility.formatScore(scored.get(0).getCompanyScore()));
            }
            return scored;
        } catch (RuntimeException e) {
            scoringMetrics.recordRunError("companies");
            throw e;
        } finally {
            scoringMetrics.recordCompanyRunDuration(System.currentTimeMillis() - start);
        }
    }

    @Override
    public List<ScoredContact> scoreContacts(List<ContactRecord> contacts, List<ScoredCompany> scoredCompanies,
                                             ScoringConfig config, NormalizationBaseline baseline) {
        if (contacts == null || contacts.isEmpty()) {
            log.info("No contacts to score");
            return List.of();
        }
        NormalizationBaseline bounds = baseline != null ? baseline : NormalizationBaseline.none();
        List<ScoredCompany> companies = scoredCompanies != null ? scoredCompanies : List.of();
        long start = System.currentTimeMillis();
        try {
            log.info("Scoring {} contacts against {} companies", contacts.size(), companies.size());
            List<ScoredContact> scored = new ArrayList<>(contacts.size());
            List<Double> rawContactScores = new ArrayList<>(contacts.size());
            List<Double> rawLeadScores = new ArrayList<>(contacts.size());

            for (ContactRecord contact : contacts) {
                ScoredContact result = scoreContact(contact, companies, config);
                scored.add(result);
                rawContactScores.add(result.getRawContactScore());
                rawLeadScores.add(result.getRawLeadScore());
            }

            List<Double> contactScores = scoreNormalizer.normalize(rawContactScores,
                    bounds.contactScoreMin(), bounds.contactScoreMax());
            List<Double> leadScores = scoreNormalizer.normalize(rawLeadScores,
                    bounds.leadScoreMin(), bounds.leadScoreMax());
            for (int i = 0; i < scored.size(); i++) {
                scored.get(i).setContactScore(BasicUtility.roundScore(contactScores.get(i)));
                scored.get(i).setLeadScore(BasicUtility.roundScore(leadScores.get(i)));
            }

            log.info("Normalization applied: contact scores {}-{} -> {}-{}, lead scores {}-{} -> {}-{}",
                    BasicUtility.formatScore(Collections.min(rawContactScores)),
                    BasicUtility.formatScore(Collections.max(rawContactScores)),
                    BasicUtility.formatScore(Collections.min(contactScores)),
                    BasicUtility.formatScore(Collections.max(contactScores)),
                    BasicUtility.formatScore(Collections.min(rawLeadScores)),
                    BasicUtility.formatScore(Collections.max(rawLeadScores)),
                    BasicUtility.formatScore(Collections.min(leadScores)),
                    BasicUtility.formatScore(Collections.max(leadScores)));

            // List.sort is stable
            scored.sort(Comparator.comparingLong(ScoredContact::getLeadScore).reversed());
            recordContactMetrics(scored);
            return scored;
        } catch (RuntimeException e) {
            scoringMetrics.recordRunError("contacts");
            throw e;
        } finally {
            scoringMetrics.recordContactRunDuration(System.currentTimeMillis() - start);
        }
    }

    @Override
    public ScoringSummary summarize(List<ScoredContact> scoredContacts) {
        if (scoredContacts == null || scoredContacts.isEmpty()) {
            return ScoringSummary.builder().build();
        }
        int total = scoredContacts.size();
        List<ScoredContact> matched = scoredContacts.stream()
                .filter(c -> c.getMatchConfidence() != null)
                .toList();
        OptionalDouble averageConfidence = matched.stream()
                .mapToDouble(c -> c.getMatchConfidence().doubleValue())
                .average();

        ScoringSummary summary = ScoringSummary.builder()
                .totalContacts(total)
                .matchedContacts(matched.size())
                .matchRate(BasicUtility.roundToTenth(matched.size() * 100.0 / total))
                .averageLeadScore(BasicUtility.roundToTenth(
                        scoredContacts.stream().mapToLong(ScoredContact::getLeadScore).average().orElse(0)))
                .averageMatchConfidence(averageConfidence.isPresent()
                        ? BasicUtility.roundToTenth(averageConfidence.getAsDouble()) : null)
                .rawContactMin(scoredContacts.stream().mapToDouble(ScoredContact::getRawContactScore).min().orElse(0))
                .rawContactMax(scoredContacts.stream().mapToDouble(ScoredContact::getRawContactScore).max().orElse(0))
                .rawLeadMin(scoredContacts.stream().mapToDouble(ScoredContact::getRawLeadScore).min().orElse(0))
                .rawLeadMax(scoredContacts.stream().mapToDouble(ScoredContact::getRawLeadScore).max().orElse(0))
                .contactScoreMin(scoredContacts.stream().mapToLong(ScoredContact::getContactScore).min().orElse(0))
                .contactScoreMax(scoredContacts.stream().mapToLong(ScoredContact::getContactScore).max().orElse(0))
                .leadScoreMin(scoredContacts.stream().mapToLong(ScoredContact::getLeadScore).min().orElse(0))
                .leadScoreMax(scoredContacts.stream().mapToLong(ScoredContact::getLeadScore).max().orElse(0))
                .build();
        log.info("Scoring summary: {}", summary);
        return summary;
    }

    private ScoredContact scoreContact(ContactRecord contact, List<ScoredCompany> scoredCompanies, ScoringConfig config) {
        ContactScores scores = contactScorer.score(contact, config);
        MatchResult match = companyMatcher.findBestMatch(companyKey(contact), scoredCompanies);

        boolean hasJobTitle = StringUtils.isNotBlank(contact.getJobTitle());
        double companyScore = match.isMatched() ? match.getCompanyScore() : 0.0;
        double rawLeadScore = leadScoreCombiner.combine(scores.contactScore(), companyScore, match.isMatched(), hasJobTitle);

        String firstName = StringUtils.defaultString(contact.getFirstName());
        String lastName = StringUtils.defaultString(contact.getLastName());
        return ScoredContact.builder()
                .firstName(firstName)
                .lastName(lastName)
                .fullName((firstName + " " + lastName).trim())
                .jobTitle(StringUtils.defaultString(contact.getJobTitle()))
                .companyName(StringUtils.defaultString(contact.getCompanyName()))
                .rawContactScore(scores.contactScore())
                .rawLeadScore(rawLeadScore)
                .seniority(BasicUtility.roundScore(scores.seniority()))
                .domain(BasicUtility.roundScore(scores.domain()))
                .warmth(BasicUtility.roundScore(scores.warmth()))
                .companyScore(match.isMatched() ? BasicUtility.roundScore(match.getCompanyScore()) : null)
                .matchedCompany(match.getMatchedName())
                .matchConfidence(match.isMatched() ? BasicUtility.roundScore(match.getConfidence()) : null)
                .source(StringUtils.defaultString(contact.getSource()))
                .dateCreated(StringUtils.defaultString(contact.getDateCreated()))
                .dateUpdated(StringUtils.defaultString(contact.getDateUpdated()))
                .extraData(StringUtils.defaultString(contact.getExtraData()))
                .build();
    }

    /**
     * The pre-normalized key when the sheet has one, otherwise the normalized company name.
     */
    static String companyKey(ContactRecord contact) {
        if (StringUtils.isNotBlank(contact.getNormalCompany())) {
            return contact.getNormalCompany().trim();
        }
        return NameNormalizer.normalize(contact.getCompanyName());
    }

    private void recordContactMetrics(List<ScoredContact> scored) {
        long matched = 0;
        for (ScoredContact contact : scored) {
            scoringMetrics.recordLeadScore(contact.getLeadScore());
            if (contact.getMatchConfidence() != null) {
                matched++;
                scoringMetrics.recordMatchConfidence(contact.getMatchConfidence());
            }
        }
        scoringMetrics.incrementContactsScored(scored.size());
        scoringMetrics.incrementContactsMatched(matched);
    }
}
