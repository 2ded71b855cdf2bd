package com.leadscore.dto;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * One row of the company table. Numeric and date cells stay as the raw text of the sheet and are
 * parsed leniently by the scorer.
 */
@Builder
@Getter
@ToString
public class CompanyRecord {
    private final String companyName;
    private final String normalizedName;
    private final String revenue;
    private final String revenueFallback;
    private final String revenueChange;
    private final String totalFunding;
    private final String latestFundingAmount;
    private final String latestFundingDate;
    private final String employeeCount;
    private final String employeeChange;
    private final String closeStatus;
    private final String closeStatusChangeDate;
    private final String makesGames;
    private final String freeToPlay;
    private final String mobile;
    private final String foundedYear;
    private final String type;
    private final String websiteUrl;
    private final String linkedinUrl;
    private final String country;
    private final String flag;
    private final String notes;
    private final String discoverSource;
    private final String createdDate;
}
