package com.leadscore.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Min/max of contact and lead scores from a prior run. A null bound means "derive from the batch".
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record NormalizationBaseline(
        @JsonProperty("contact_score_min") Double contactScoreMin,
        @JsonProperty("contact_score_max") Double contactScoreMax,
        @JsonProperty("lead_score_min") Double leadScoreMin,
        @JsonProperty("lead_score_max") Double leadScoreMax) {

    public static NormalizationBaseline none() {
        return new NormalizationBaseline(null, null, null, null);
    }

    public boolean isEmpty() {
        return contactScoreMin == null && contactScoreMax == null && leadScoreMin == null && leadScoreMax == null;
    }
}
