package com.leadscore.models;

import com.google.common.collect.ImmutableList;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.regex.Pattern;

/**
 * A single keyword rule inside a pillar, compiled once when the configuration is loaded.
 */
@Builder
@Getter
@ToString(exclude = "pattern")
public class ScoringComponent {
    private final String name;
    private final ImmutableList<Keyword> keywords;
    private final Pattern pattern;
    private final ScoreRule rule;

    public boolean matches(String loweredTitle) {
        return pattern.matcher(loweredTitle).find();
    }
}
