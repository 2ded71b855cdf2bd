package com.leadscore.processors;

import java.util.Arrays;
import java.util.List;
import java.util.OptionalDouble;

/**
 * Rank percentile (0-100) of a value within one column of the batch. Missing values take no part
 * in the distribution and always rank 0.
 */
public final class PercentileRanker {

    private final double[] sorted;

    private PercentileRanker(double[] sorted) {
        this.sorted = sorted;
    }

    public static PercentileRanker of(List<OptionalDouble> column) {
        double[] values = column.stream()
                .filter(OptionalDouble::isPresent)
                .mapToDouble(OptionalDouble::getAsDouble)
                .sorted()
                .toArray();
        return new PercentileRanker(values);
    }

    public double rank(OptionalDouble value) {
        return rank(value, false);
    }

    /**
     * @param invert rank so that lower values score higher
     */
    public double rank(OptionalDouble value, boolean invert) {
        if (value.isEmpty() || sorted.length == 0) {
            return 0.0;
        }
        double x = value.getAsDouble();
        int below = lowerBound(x);
        int atOrBelow = upperBound(x);
        int tie = atOrBelow > below ? 1 : 0;
        double percentile = (below + atOrBelow + tie) * (50.0 / sorted.length);
        return invert ? 100.0 - percentile : percentile;
    }

    private int lowerBound(double x) {
        int lo = 0, hi = sorted.length;
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (sorted[mid] < x) lo = mid + 1;
            else hi = mid;
        }
        return lo;
    }

    private int upperBound(double x) {
        int lo = 0, hi = sorted.length;
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (sorted[mid] <= x) lo = mid + 1;
            else hi = mid;
        }
        return lo;
    }

    @Override
    public String toString() {
        return "PercentileRanker" + Arrays.toString(sorted);
    }
}
