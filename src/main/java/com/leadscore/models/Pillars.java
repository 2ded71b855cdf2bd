package com.leadscore.models;

import com.google.common.collect.ImmutableList;

public final class Pillars {

    private Pillars() {
        throw new UnsupportedOperationException("Not supported");
    }

    public static final String SENIORITY = "Seniority";
    public static final String DOMAIN = "Domain";
    public static final String WARMTH = "Warmth";
    public static final String ONE_OFFS = "One-Offs";

    public static final String ALIGNMENT = "Alignment";
    public static final String BUDGET = "Budget";
    public static final String DEMAND = "Demand";

    public static final ImmutableList<String> WEIGHTED_PEOPLE = ImmutableList.of(SENIORITY, DOMAIN, WARMTH);
    public static final ImmutableList<String> PEOPLE = ImmutableList.of(SENIORITY, DOMAIN, WARMTH, ONE_OFFS);
    public static final ImmutableList<String> COMPANY = ImmutableList.of(ALIGNMENT, BUDGET, DEMAND);
}
