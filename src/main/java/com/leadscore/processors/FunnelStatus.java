package com.leadscore.processors;

import com.leadscore.utils.basic.BasicUtility;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Locale;
import java.util.Optional;

/**
 * Sales-funnel statuses worth demand points. Declaration order is the lookup order: the first
 * status whose key occurs in the cell wins.
 */
public enum FunnelStatus {
    PREVIOUS_CUSTOMER_6("6 - previous customer", 10, 730),
    PREVIOUS_CUSTOMER_7("7 - previous customer", 10, 730),
    STAND_DOWN("8 - stand down", 10, 730),
    CUSTOMER("5 - customer", 8, 365),
    CONTRACT_OUT("4 - contract out", 8, 365),
    MET_WITH_MATT("met with matt", 6, 180),
    QUARTERLY_FOLLOWUP("lt (quarterly) followup", 6, 180),
    QUALIFIED("qualified", 5, 90),
    DISCO_INCOMING("disco incoming", 2, 30);

    private final String key;
    private final int points;
    private final int halfLifeDays;

    FunnelStatus(String key, int points, int halfLifeDays) {
        this.key = key;
        this.points = points;
        this.halfLifeDays = halfLifeDays;
    }

    public static Optional<FunnelStatus> resolve(String status) {
        if (status == null || status.isBlank()) {
            return Optional.empty();
        }
        String lowered = status.toLowerCase(Locale.ROOT).trim();
        for (FunnelStatus candidate : values()) {
            if (lowered.contains(candidate.key)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    /**
     * Points for a status cell, halved every half-life since the status changed. Without a
     * readable change date the full points apply.
     */
    public static double decayedScore(String status, String changeDate, LocalDate today) {
        Optional<FunnelStatus> match = resolve(status);
        if (match.isEmpty()) {
            return 0.0;
        }
        FunnelStatus funnelStatus = match.get();
        Optional<LocalDate> changed = BasicUtility.parseDate(changeDate);
        if (changed.isEmpty()) {
            return funnelStatus.points;
        }
        long daysOld = Math.max(0, ChronoUnit.DAYS.between(changed.get(), today));
        return funnelStatus.points * Math.pow(0.5, (double) daysOld / funnelStatus.halfLifeDays);
    }
}
