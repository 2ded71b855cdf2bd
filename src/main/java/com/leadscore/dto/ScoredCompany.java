package com.leadscore.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class ScoredCompany {
    private String companyName;
    private double companyScore;
    private double alignment;
    private double budget;
    private double demand;

    private double dev;
    private double freeToPlay;
    private double mobile;
    private double fresh;
    private double revenue;
    private double funding;
    private double headcount;
    private double status;
    private double volatility;
    private double revenueDelta;
    private double runwayDelta;
    private double headcountDelta;
    private double hiring;

    private String url;
    private String country;
    private String flag;
    private String notes;
    private String discoverSource;
    private String createdDate;
    private String updatedDate;
    private String normalizedName;
}
