package com.leadscore.models;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Immutable scoring configuration for one run. People pillars carry weights and keyword
 * components; company pillars carry weights only. A pillar that was absent from the source
 * document is simply missing here and contributes nothing.
 */
@Builder
@Getter
@ToString
public class ScoringConfig {
    private final ImmutableMap<String, PillarConfig> peoplePillars;
    private final ImmutableMap<String, Double> companyWeights;

    public ImmutableList<ScoringComponent> components(String pillar) {
        PillarConfig config = peoplePillars.get(pillar);
        return config != null ? config.getComponents() : ImmutableList.of();
    }

    public double peopleWeight(String pillar) {
        PillarConfig config = peoplePillars.get(pillar);
        return config != null ? config.getWeight() : 0.0;
    }

    public double companyWeight(String pillar) {
        return companyWeights.getOrDefault(pillar, 0.0);
    }
}
