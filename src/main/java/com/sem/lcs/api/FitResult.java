package com.sem.lcs.api;

import java.util.Map;

/**
 * Output of an {@link EstimationEngine}: estimates keyed by parameter label
 * (or by path for unlabeled free paths) plus fit statistics.
 */
public record FitResult(Map<String, Double> estimates, Map<String, Double> fitStatistics) {

    public FitResult {
        estimates = Map.copyOf(estimates);
        fitStatistics = Map.copyOf(fitStatistics);
    }

    public double estimate(String label) {
        Double v = estimates.get(label);
        if (v == null)
            throw new IllegalArgumentException("No estimate for " + label);
        return v;
    }
}
