package com.leadscore.models;

import com.google.common.collect.ImmutableList;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

@Builder
@Getter
@ToString
public class PillarConfig {
    private final String name;
    private final double weight;
    @Builder.Default
    private final ImmutableList<ScoringComponent> components = ImmutableList.of();
}
