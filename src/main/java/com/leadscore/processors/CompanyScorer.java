package com.leadscore.processors;

import com.leadscore.dto.CompanyRecord;
import com.leadscore.dto.ScoredCompany;
import com.leadscore.exceptions.BadRequestException;
import com.leadscore.matcher.NameNormalizer;
import com.leadscore.models.Pillars;
import com.leadscore.models.ScoringConfig;
import com.leadscore.utils.basic.BasicUtility;
import com.leadscore.utils.basic.Constant;
import com.leadscore.utils.basic.DefaultValuesPopulator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.function.Function;
import java.util.function.ToDoubleFunction;

/**
 * Scores companies on Alignment, Budget and Demand.
 * <p>
 * Scoring runs in two phases. The first collects the batch statistics every record is ranked
 * against (percentile columns, runway amounts); the second applies the per-record formulas, which
 * depend only on the record, those statistics and the run date. Pillars and the final score are
 * then min-max normalized across the batch. Output order follows input order.
 * </p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CompanyScorer {

    static final int DEV_POINTS = 10;
    static final int F2P_POINTS = 8;
    static final int MOBILE_POINTS = 7;
    static final int FRESH_POINTS = 5;
    static final int FRESH_MAX_AGE_YEARS = 3;

    static final double REVENUE_POINTS = 10.0;
    static final double FUNDING_POINTS = 8.0;
    static final double HEADCOUNT_POINTS = 5.0;

    static final double VOLATILITY_POINTS = 7.0;
    static final double REVENUE_CHANGE_WEIGHT = 5.0;
    static final double RUNWAY_WEIGHT = 4.0;
    static final double HEADCOUNT_CHANGE_WEIGHT = 3.0;
    static final double RUNWAY_HALF_LIFE_DAYS = 365.0;

    private final Clock scoringClock;

    public List<ScoredCompany> score(List<CompanyRecord> companies, ScoringConfig config) {
        if (companies == null || companies.isEmpty()) {
            return List.of();
        }
        LocalDate today = LocalDate.now(scoringClock);
        log.info("Scoring {} companies as of {}", companies.size(), today);

        BatchStatistics stats = BatchStatistics.collect(companies, today);
        List<RawComponents> raw = new ArrayList<>(companies.size());
        for (CompanyRecord company : companies) {
            raw.add(rawComponents(company, stats, today));
        }

        List<Double> alignment = PillarNormalizer.normalizePillar(column(raw, RawComponents::alignment));
        List<Double> budget = PillarNormalizer.normalizePillar(column(raw, RawComponents::budget));
        List<Double> demand = PillarNormalizer.normalizePillar(column(raw, RawComponents::demand));
        List<Double> companyScores = PillarNormalizer.normalizePillar(
                weightedAverage(alignment, budget, demand, config));

        List<Double> dev = PillarNormalizer.normalizeComponent(column(raw, RawComponents::dev));
        List<Double> freeToPlay = PillarNormalizer.normalizeComponent(column(raw, RawComponents::freeToPlay));
        List<Double> mobile = PillarNormalizer.normalizeComponent(column(raw, RawComponents::mobile));
        List<Double> fresh = PillarNormalizer.normalizeComponent(column(raw, RawComponents::fresh));
        List<Double> revenue = PillarNormalizer.normalizeComponent(column(raw, RawComponents::revenue));
        List<Double> funding = PillarNormalizer.normalizeComponent(column(raw, RawComponents::funding));
        List<Double> headcount = PillarNormalizer.normalizeComponent(column(raw, RawComponents::headcount));
        List<Double> status = PillarNormalizer.normalizeComponent(column(raw, RawComponents::status));
        List<Double> volatility = PillarNormalizer.normalizeComponent(column(raw, RawComponents::volatility));
        List<Double> revenueDelta = PillarNormalizer.normalizeComponent(column(raw, RawComponents::revenueChange));
        List<Double> runwayDelta = PillarNormalizer.normalizeComponent(column(raw, RawComponents::runway));
        List<Double> headcountDelta = PillarNormalizer.normalizeComponent(column(raw, RawComponents::headcountChange));
        List<Double> hiring = PillarNormalizer.normalizeComponent(column(raw, RawComponents::hiring));

        String runDate = DefaultValuesPopulator.getRunDate(scoringClock);
        List<ScoredCompany> scored = new ArrayList<>(companies.size());
        for (int i = 0; i < companies.size(); i++) {
            CompanyRecord company = companies.get(i);
            scored.add(ScoredCompany.builder()
                    .companyName(StringUtils.defaultString(company.getCompanyName()))
                    .companyScore(companyScores.get(i))
                    .alignment(alignment.get(i))
                    .budget(budget.get(i))
                    .demand(demand.get(i))
                    .dev(dev.get(i))
                    .freeToPlay(freeToPlay.get(i))
                    .mobile(mobile.get(i))
                    .fresh(fresh.get(i))
                    .revenue(revenue.get(i))
                    .funding(funding.get(i))
                    .headcount(headcount.get(i))
                    .status(status.get(i))
                    .volatility(volatility.get(i))
                    .revenueDelta(revenueDelta.get(i))
                    .runwayDelta(runwayDelta.get(i))
                    .headcountDelta(headcountDelta.get(i))
                    .hiring(hiring.get(i))
                    .url(resolveUrl(company))
                    .country(StringUtils.defaultString(company.getCountry()))
                    .flag(StringUtils.defaultString(company.getFlag()))
                    .notes(StringUtils.defaultString(company.getNotes()))
                    .discoverSource(StringUtils.defaultString(company.getDiscoverSource()))
                    .createdDate(StringUtils.defaultString(company.getCreatedDate()))
                    .updatedDate(runDate)
                    .normalizedName(resolveNormalizedName(company))
                    .build());
        }
        log.info("Scored {} companies", scored.size());
        return scored;
    }

    static String resolveUrl(CompanyRecord company) {
        if (StringUtils.isNotBlank(company.getWebsiteUrl())) {
            return company.getWebsiteUrl().trim();
        }
        if (StringUtils.isNotBlank(company.getLinkedinUrl())) {
            return company.getLinkedinUrl().trim();
        }
        return "";
    }

    static String resolveNormalizedName(CompanyRecord company) {
        if (StringUtils.isNotBlank(company.getNormalizedName())) {
            return company.getNormalizedName().trim();
        }
        return NameNormalizer.normalize(company.getCompanyName());
    }

    private RawComponents rawComponents(CompanyRecord company, BatchStatistics stats, LocalDate today) {
        boolean coDeveloper = Constant.CO_DEVELOPER.equalsIgnoreCase(StringUtils.trimToEmpty(company.getType()));
        double dev = !coDeveloper && BasicUtility.isFlagSet(company.getMakesGames()) ? DEV_POINTS : 0;
        double freeToPlay = BasicUtility.isFlagSet(company.getFreeToPlay()) ? F2P_POINTS : 0;
        double mobile = BasicUtility.isFlagSet(company.getMobile()) ? MOBILE_POINTS : 0;
        double fresh = freshness(company, today);

        double revenue = stats.revenue.rank(revenueOf(company)) / 100.0 * REVENUE_POINTS;
        double funding = stats.funding.rank(BasicUtility.parseNumber(company.getTotalFunding())) / 100.0 * FUNDING_POINTS;
        double headcount = stats.headcount.rank(BasicUtility.parseNumber(company.getEmployeeCount())) / 100.0 * HEADCOUNT_POINTS;

        double status = FunnelStatus.decayedScore(company.getCloseStatus(), company.getCloseStatusChangeDate(), today);
        double revenueChange = stats.revenueChange.rank(BasicUtility.parseNumber(company.getRevenueChange()), true);
        double runway = stats.runway.rank(decayedFunding(company, today));
        double headcountChange = stats.headcountChange.rank(BasicUtility.parseNumber(company.getEmployeeChange()), true);
        double volatility = ((revenueChange * REVENUE_CHANGE_WEIGHT + runway * RUNWAY_WEIGHT
                + headcountChange * HEADCOUNT_CHANGE_WEIGHT)
                / (REVENUE_CHANGE_WEIGHT + RUNWAY_WEIGHT + HEADCOUNT_CHANGE_WEIGHT)) / 100.0 * VOLATILITY_POINTS;

        return new RawComponents(dev, freeToPlay, mobile, fresh, revenue, funding, headcount,
                status, volatility, revenueChange, runway, headcountChange, 0.0);
    }

    private static double freshness(CompanyRecord company, LocalDate today) {
        OptionalDouble founded = BasicUtility.parseNumber(company.getFoundedYear());
        if (founded.isEmpty()) {
            return 0;
        }
        return today.getYear() - founded.getAsDouble() <= FRESH_MAX_AGE_YEARS ? FRESH_POINTS : 0;
    }

    static OptionalDouble revenueOf(CompanyRecord company) {
        OptionalDouble primary = BasicUtility.parseNumber(company.getRevenue());
        return primary.isPresent() ? primary : BasicUtility.parseNumber(company.getRevenueFallback());
    }

    /**
     * Latest funding amount halved for every year since the round closed; missing unless both the
     * amount and the date parse.
     */
    static OptionalDouble decayedFunding(CompanyRecord company, LocalDate today) {
        OptionalDouble amount = BasicUtility.parseNumber(company.getLatestFundingAmount());
        Optional<LocalDate> fundedOn = BasicUtility.parseDate(company.getLatestFundingDate());
        if (amount.isEmpty() || fundedOn.isEmpty()) {
            return OptionalDouble.empty();
        }
        long daysOld = Math.max(0, ChronoUnit.DAYS.between(fundedOn.get(), today));
        return OptionalDouble.of(amount.getAsDouble() * Math.pow(0.5, daysOld / RUNWAY_HALF_LIFE_DAYS));
    }

    private List<Double> weightedAverage(List<Double> alignment, List<Double> budget, List<Double> demand,
                                         ScoringConfig config) {
        double alignmentWeight = config.companyWeight(Pillars.ALIGNMENT);
        double budgetWeight = config.companyWeight(Pillars.BUDGET);
        double demandWeight = config.companyWeight(Pillars.DEMAND);
        double totalWeight = alignmentWeight + budgetWeight + demandWeight;
        if (totalWeight <= 0) {
            throw new BadRequestException("Company pillar weights must not all be zero");
        }

        List<Double> scores = new ArrayList<>(alignment.size());
        for (int i = 0; i < alignment.size(); i++) {
            scores.add((alignment.get(i) * alignmentWeight + budget.get(i) * budgetWeight
                    + demand.get(i) * demandWeight) / totalWeight);
        }
        return scores;
    }

    private static List<Double> column(List<RawComponents> raw, ToDoubleFunction<RawComponents> getter) {
        List<Double> values = new ArrayList<>(raw.size());
        for (RawComponents components : raw) {
            values.add(getter.applyAsDouble(components));
        }
        return values;
    }

    private record RawComponents(double dev, double freeToPlay, double mobile, double fresh,
                                 double revenue, double funding, double headcount,
                                 double status, double volatility,
                                 double revenueChange, double runway, double headcountChange,
                                 double hiring) {

        double alignment() {
            return dev + freeToPlay + mobile + fresh;
        }

        double budget() {
            return revenue + funding + headcount;
        }

        double demand() {
            return status + volatility + hiring;
        }
    }

    private record BatchStatistics(PercentileRanker revenue, PercentileRanker funding, PercentileRanker headcount,
                                   PercentileRanker revenueChange, PercentileRanker runway,
                                   PercentileRanker headcountChange) {

        static BatchStatistics collect(List<CompanyRecord> companies, LocalDate today) {
            return new BatchStatistics(
                    ranker(companies, CompanyScorer::revenueOf),
                    ranker(companies, c -> BasicUtility.parseNumber(c.getTotalFunding())),
                    ranker(companies, c -> BasicUtility.parseNumber(c.getEmployeeCount())),
                    ranker(companies, c -> BasicUtility.parseNumber(c.getRevenueChange())),
                    ranker(companies, c -> decayedFunding(c, today)),
                    ranker(companies, c -> BasicUtility.parseNumber(c.getEmployeeChange())));
        }

        private static PercentileRanker ranker(List<CompanyRecord> companies,
                                               Function<CompanyRecord, OptionalDouble> extractor) {
            return PercentileRanker.of(companies.stream().map(extractor).toList());
        }
    }
}
