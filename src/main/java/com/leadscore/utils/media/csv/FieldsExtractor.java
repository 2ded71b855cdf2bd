package com.leadscore.utils.media.csv;

import com.leadscore.dto.ScoredCompany;
import com.leadscore.dto.ScoredContact;
import com.leadscore.utils.basic.BasicUtility;
import com.leadscore.utils.basic.Constant;

import java.util.List;
import java.util.function.Function;


public final class FieldsExtractor {

    private FieldsExtractor() {
        throw new UnsupportedOperationException("Unsupported");
    }

    public static List<CsvExporter.FieldExtractor<ScoredCompany>> getScoredCompanyFieldExtractors() {
        return List.of(
                company(Constant.COMPANY_NAME, ScoredCompany::getCompanyName),
                company("Company Score", c -> BasicUtility.formatScore(c.getCompanyScore())),
                company("Alignment", c -> BasicUtility.formatScore(c.getAlignment())),
                company("Budget", c -> BasicUtility.formatScore(c.getBudget())),
                company("Demand", c -> BasicUtility.formatScore(c.getDemand())),
                company("Dev", c -> BasicUtility.formatScore(c.getDev())),
                company(Constant.F2P, c -> BasicUtility.formatScore(c.getFreeToPlay())),
                company(Constant.MOBILE, c -> BasicUtility.formatScore(c.getMobile())),
                company("Fresh", c -> BasicUtility.formatScore(c.getFresh())),
                company("Revenue", c -> BasicUtility.formatScore(c.getRevenue())),
                company("Funding", c -> BasicUtility.formatScore(c.getFunding())),
                company("Headcount", c -> BasicUtility.formatScore(c.getHeadcount())),
                company("Status", c -> BasicUtility.formatScore(c.getStatus())),
                company("Volatility", c -> BasicUtility.formatScore(c.getVolatility())),
                company("Revenue ∆", c -> BasicUtility.formatScore(c.getRevenueDelta())),
                company("Runway ∆", c -> BasicUtility.formatScore(c.getRunwayDelta())),
                company("Headcount ∆", c -> BasicUtility.formatScore(c.getHeadcountDelta())),
                company("Hiring", c -> BasicUtility.formatScore(c.getHiring())),
                company("URL", ScoredCompany::getUrl),
                company(Constant.COUNTRY, ScoredCompany::getCountry),
                company(Constant.FLAG, ScoredCompany::getFlag),
                company(Constant.NOTES, ScoredCompany::getNotes),
                company(Constant.DISCOVER_SOURCE, ScoredCompany::getDiscoverSource),
                company(Constant.CREATED_DATE, ScoredCompany::getCreatedDate),
                company("Updated Date", ScoredCompany::getUpdatedDate),
                company(Constant.NORMALIZED_NAME, ScoredCompany::getNormalizedName)
        );
    }

    public static List<CsvExporter.FieldExtractor<ScoredContact>> getScoredContactFieldExtractors() {
        return List.of(
                contact(Constant.FIRST_NAME, ScoredContact::getFirstName),
                contact(Constant.LAST_NAME, ScoredContact::getLastName),
                contact("Full Name", ScoredContact::getFullName),
                contact(Constant.JOB_TITLE, ScoredContact::getJobTitle),
                contact(Constant.COMPANY_NAME, ScoredContact::getCompanyName),
                contact("Lead Score", c -> BasicUtility.safeExtract(c.getLeadScore())),
                contact("Contact Score", c -> BasicUtility.safeExtract(c.getContactScore())),
                contact("Company Score", c -> BasicUtility.safeExtract(c.getCompanyScore())),
                contact("Seniority", c -> BasicUtility.safeExtract(c.getSeniority())),
                contact("Domain", c -> BasicUtility.safeExtract(c.getDomain())),
                contact("Warmth", c -> BasicUtility.safeExtract(c.getWarmth())),
                contact("Matched Company", ScoredContact::getMatchedCompany),
                contact("Match Confidence", c -> BasicUtility.safeExtract(c.getMatchConfidence())),
                contact(Constant.SOURCE, ScoredContact::getSource),
                contact(Constant.DATE_CREATED, ScoredContact::getDateCreated),
                contact(Constant.DATE_UPDATED, ScoredContact::getDateUpdated),
                contact(Constant.EXTRA_DATA, ScoredContact::getExtraData)
        );
    }

    private static CsvExporter.FieldExtractor<ScoredCompany> company(String header, Function<ScoredCompany, String> extractor) {
        return CsvExporter.FieldExtractor.of(header, extractor);
    }

    private static CsvExporter.FieldExtractor<ScoredContact> contact(String header, Function<ScoredContact, String> extractor) {
        return CsvExporter.FieldExtractor.of(header, extractor);
    }
}
