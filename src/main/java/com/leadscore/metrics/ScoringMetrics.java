package com.leadscore.metrics;

import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

@Component
public class ScoringMetrics {
    static final String TYPE = "type";
    static final String COMPANIES = "companies";
    static final String CONTACTS = "contacts";

    private final MeterRegistry meterRegistry;
    private final DistributionSummary leadScoreSummary;
    private final DistributionSummary matchConfidenceSummary;

    public ScoringMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        this.leadScoreSummary = DistributionSummary.builder("lead_score")
                .description("Normalized lead score of scored contacts")
                .register(meterRegistry);
        this.matchConfidenceSummary = DistributionSummary.builder("company_match_confidence")
                .description("Confidence of accepted company matches")
                .register(meterRegistry);
    }

    public void incrementCompaniesScored(long count) {
        meterRegistry.counter("companies_scored").increment(count);
    }

    public void incrementContactsScored(long count) {
        meterRegistry.counter("contacts_scored").increment(count);
    }

    public void incrementContactsMatched(long count) {
        meterRegistry.counter("contacts_matched").increment(count);
    }

    public void recordLeadScore(double score) {
        leadScoreSummary.record(score);
    }

    public void recordMatchConfidence(double confidence) {
        matchConfidenceSummary.record(confidence);
    }

    public void recordCompanyRunDuration(long durationMs) {
        meterRegistry.timer("scoring_run_duration", TYPE, COMPANIES).record(durationMs, TimeUnit.MILLISECONDS);
    }

    public void recordContactRunDuration(long durationMs) {
        meterRegistry.timer("scoring_run_duration", TYPE, CONTACTS).record(durationMs, TimeUnit.MILLISECONDS);
    }

    public void recordRunError(String type) {
        meterRegistry.counter("scoring_run_errors", TYPE, type).increment();
    }
}
