package com.leadscore.service;

import com.leadscore.dto.CompanyRecord;
import com.leadscore.dto.ContactRecord;
import com.leadscore.dto.NormalizationBaseline;
import com.leadscore.dto.ScoredCompany;
import com.leadscore.dto.ScoredContact;
import com.leadscore.dto.ScoringSummary;
import com.leadscore.models.ScoringConfig;

import java.util.List;

public interface ScoringService {

    /**
     * Scores the company table; the result is sorted by descending company score.
     */
    List<ScoredCompany> scoreCompanies(List<CompanyRecord> companies, ScoringConfig config);

    /**
     * Scores contacts, links each to at most one scored company and derives the lead score. Contact
     * and lead scores are normalized across the batch, against the baseline bounds where present.
     * The result is sorted by descending lead score; equal scores keep input order.
     */
    List<ScoredContact> scoreContacts(List<ContactRecord> contacts, List<ScoredCompany> scoredCompanies,
                                      ScoringConfig config, NormalizationBaseline baseline);

    ScoringSummary summarize(List<ScoredContact> scoredContacts);
}
