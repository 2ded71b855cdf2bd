package com.leadscore.processors;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Rescales a batch of contact or lead scores to 0-100.
 * <p>
 * Bounds come from the caller (a prior-run baseline) or, when absent, from the batch itself. A
 * batch with a zero-width range is returned unchanged. Results are not clamped: a baseline that is
 * narrower than the batch produces values outside 0-100.
 * </p>
 */
@Component
public class ScoreNormalizer {

    public List<Double> normalize(List<Double> values) {
        return normalize(values, null, null);
    }

    public List<Double> normalize(List<Double> values, Double min, Double max) {
        if (values == null || values.isEmpty()) {
            return values;
        }
        double lo = min != null ? min : Collections.min(values);
        double hi = max != null ? max : Collections.max(values);
        if (hi == lo) {
            return new ArrayList<>(values);
        }

        List<Double> normalized = new ArrayList<>(values.size());
        for (double value : values) {
            normalized.add((value - lo) / (hi - lo) * 100.0);
        }
        return normalized;
    }
}
