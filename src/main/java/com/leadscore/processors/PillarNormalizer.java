package com.leadscore.processors;

import com.leadscore.utils.basic.BasicUtility;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Min-max normalization used inside company scoring. Unlike {@link ScoreNormalizer}, a batch
 * whose values are all equal lands on 50 rather than being left as is.
 */
public final class PillarNormalizer {

    static final double DEGENERATE_SCORE = 50.0;

    private PillarNormalizer() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * Rescales pillar sums to 0-100, rounded to one decimal; all-equal input maps to 50.
     */
    public static List<Double> normalizePillar(List<Double> raw) {
        if (raw.isEmpty()) {
            return List.of();
        }
        double min = Collections.min(raw);
        double max = Collections.max(raw);
        if (max == min) {
            return Collections.nCopies(raw.size(), DEGENERATE_SCORE);
        }
        return rescale(raw, min, max);
    }

    /**
     * Rescales a reporting sub-component to 0-100. A column with no signal at all (every value
     * zero) stays at zero.
     */
    public static List<Double> normalizeComponent(List<Double> raw) {
        if (raw.isEmpty()) {
            return List.of();
        }
        if (raw.stream().allMatch(v -> v == 0.0)) {
            return Collections.nCopies(raw.size(), 0.0);
        }
        return normalizePillar(raw);
    }

    private static List<Double> rescale(List<Double> raw, double min, double max) {
        List<Double> normalized = new ArrayList<>(raw.size());
        for (double value : raw) {
            normalized.add(BasicUtility.roundToTenth((value - min) / (max - min) * 100.0));
        }
        return normalized;
    }
}
