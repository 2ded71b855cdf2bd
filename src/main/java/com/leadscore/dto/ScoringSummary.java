package com.leadscore.dto;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class ScoringSummary {
    private int totalContacts;
    private int matchedContacts;
    private double matchRate;
    private double averageLeadScore;
    private Double averageMatchConfidence;
    private double rawContactMin;
    private double rawContactMax;
    private double rawLeadMin;
    private double rawLeadMax;
    private long contactScoreMin;
    private long contactScoreMax;
    private long leadScoreMin;
    private long leadScoreMax;
}
