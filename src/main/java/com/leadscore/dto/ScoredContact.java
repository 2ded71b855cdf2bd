package com.leadscore.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A scored contact. {@code companyScore} and {@code matchConfidence} are null when the contact
 * could not be matched to a scored company.
 */
@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class ScoredContact {
    private String firstName;
    private String lastName;
    private String fullName;
    private String jobTitle;
    private String companyName;

    private long leadScore;
    private long contactScore;
    private double rawLeadScore;
    private double rawContactScore;
    private Long companyScore;
    private long seniority;
    private long domain;
    private long warmth;

    private String matchedCompany;
    private Long matchConfidence;

    private String source;
    private String dateCreated;
    private String dateUpdated;
    private String extraData;
}
