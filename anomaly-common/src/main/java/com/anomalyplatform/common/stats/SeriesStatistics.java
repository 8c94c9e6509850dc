package com.anomalyplatform.common.stats;

import java.util.Arrays;
import java.util.List;

/**
 * Pure calculation utilities shared by the detectors.
 * Input values are expected oldest-first (index 0 = earliest sample).
 */
public final class SeriesStatistics {

    private SeriesStatistics() {}

    // ── Central tendency ────────────────────────────────────────────────────

    /**
     * @return arithmetic mean, or 0.0 for an empty array
     */
    public static double mean(double[] values) {
        return mean(values, 0, values.length);
    }

    /**
     * Mean of {@code values[from, to)}.
     */
    public static double mean(double[] values, int from, int to) {
        if (to <= from) return 0.0;
        double sum = 0;
        for (int i = from; i < to; i++) sum += values[i];
        return sum / (to - from);
    }

    public static double mean(List<Double> values) {
        return mean(toArray(values));
    }

    // ── Dispersion ──────────────────────────────────────────────────────────

    /**
     * Sample standard deviation (n − 1 denominator).
     * @return std-dev, or 0.0 when fewer than two values are present
     */
    public static double sampleStdDev(double[] values) {
        return sampleStdDev(values, 0, values.length);
    }

    /**
     * Sample standard deviation of {@code values[from, to)}.
     */
    public static double sampleStdDev(double[] values, int from, int to) {
        int n = to - from;
        if (n < 2) return 0.0;
        double mean = mean(values, from, to);
        double variance = 0;
        for (int i = from; i < to; i++) {
            double diff = values[i] - mean;
            variance += diff * diff;
        }
        return Math.sqrt(variance / (n - 1));
    }

    public static double sampleStdDev(List<Double> values) {
        return sampleStdDev(toArray(values));
    }

    // ── Percentiles ─────────────────────────────────────────────────────────

    /**
     * Percentile with linear interpolation between the two closest ranks.
     * @param percentile value in [0, 100]
     * @return interpolated percentile, or NaN for an empty array
     */
    public static double percentile(double[] values, double percentile) {
        if (values.length == 0) return Double.NaN;
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        double rank = percentile / 100.0 * (sorted.length - 1);
        int lower = (int) Math.floor(rank);
        int upper = (int) Math.ceil(rank);
        double fraction = rank - lower;
        return sorted[lower] + (sorted[upper] - sorted[lower]) * fraction;
    }

    // ── Regression ──────────────────────────────────────────────────────────

    /**
     * Least-squares slope of value against sample index.
     * @return slope, or 0.0 when fewer than two values are present
     */
    public static double linearSlope(double[] values) {
        int n = values.length;
        if (n < 2) return 0.0;
        double meanX = (n - 1) / 2.0;
        double meanY = mean(values);
        double numerator = 0;
        double denominator = 0;
        for (int i = 0; i < n; i++) {
            double dx = i - meanX;
            numerator   += dx * (values[i] - meanY);
            denominator += dx * dx;
        }
        return numerator / denominator;
    }

    /**
     * Sample std-dev divided by the mean; 0.0 when the mean is zero.
     */
    public static double coefficientOfVariation(double[] values) {
        double mean = mean(values);
        if (mean == 0.0) return 0.0;
        return sampleStdDev(values) / Math.abs(mean);
    }

    // ── Helpers ─────────────────────────────────────────────────────────────

    public static double clamp01(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }

    private static double[] toArray(List<Double> values) {
        return values.stream().mapToDouble(Double::doubleValue).toArray();
    }
}
