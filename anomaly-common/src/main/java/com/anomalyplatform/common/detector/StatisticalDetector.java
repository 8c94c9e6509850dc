package com.anomalyplatform.common.detector;

import com.anomalyplatform.common.model.Anomaly;
import com.anomalyplatform.common.model.AnomalyType;
import com.anomalyplatform.common.model.MetricPoint;
import com.anomalyplatform.common.model.MetricSeries;
import com.anomalyplatform.common.stats.SeriesStatistics;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Global outlier detection over the whole series using two independent passes.
 *
 * <h3>Z-score pass</h3>
 * <pre>
 *   z = |value − mean| / sampleStd          (skipped when sampleStd = 0)
 *   z &gt; zThreshold → SPIKE (value &gt; mean) or DROP
 *   severity   = min(z / (2 × zThreshold), 1.0)
 *   confidence = 0.8
 * </pre>
 *
 * <h3>IQR pass</h3>
 * <pre>
 *   bounds = [Q1 − k × IQR, Q3 + k × IQR]
 *   outside bounds → SPIKE (above) or DROP (below), expected = (Q1 + Q3) / 2
 *   severity   = min(distance outside / (upper − lower), 1.0)
 *   confidence = 0.75
 * </pre>
 *
 * <p>Results of both passes are concatenated and de-duplicated on (timestamp, actualValue),
 * keeping the z-score finding. Requires {@value #MIN_POINTS} points.
 */
public class StatisticalDetector implements AnomalyDetector {

    static final int    MIN_POINTS          = 10;
    static final double Z_SCORE_CONFIDENCE  = 0.8;
    static final double IQR_CONFIDENCE      = 0.75;

    public static final double DEFAULT_Z_THRESHOLD   = 3.0;
    public static final double DEFAULT_IQR_MULTIPLIER = 1.5;

    private final double zThreshold;
    private final double iqrMultiplier;

    public StatisticalDetector() {
        this(DEFAULT_Z_THRESHOLD, DEFAULT_IQR_MULTIPLIER);
    }

    public StatisticalDetector(double zThreshold, double iqrMultiplier) {
        if (zThreshold <= 0) throw new IllegalArgumentException("zThreshold must be positive: " + zThreshold);
        if (iqrMultiplier <= 0) throw new IllegalArgumentException("iqrMultiplier must be positive: " + iqrMultiplier);
        this.zThreshold    = zThreshold;
        this.iqrMultiplier = iqrMultiplier;
    }

    @Override
    public String detectorName() { return "StatisticalDetector"; }

    @Override
    public List<Anomaly> detect(MetricSeries series) {
        AnomalyDetector.requirePoints(detectorName(), series);
        if (series.size() < MIN_POINTS) {
            return new ArrayList<>();
        }

        double[] values = series.values();
        List<Anomaly> candidates = new ArrayList<>(detectZScore(series, values));
        candidates.addAll(detectIqr(series, values));

        Set<Map.Entry<Instant, Double>> seen = new HashSet<>();
        List<Anomaly> unique = new ArrayList<>();
        for (Anomaly anomaly : candidates) {
            if (seen.add(Map.entry(anomaly.timestamp(), anomaly.actualValue()))) {
                unique.add(anomaly);
            }
        }
        return unique;
    }

    List<Anomaly> detectZScore(MetricSeries series, double[] values) {
        double mean = SeriesStatistics.mean(values);
        double std  = SeriesStatistics.sampleStdDev(values);
        List<Anomaly> anomalies = new ArrayList<>();
        if (std == 0) {
            return anomalies;
        }

        for (MetricPoint point : series.points()) {
            double zScore = Math.abs(point.value() - mean) / std;
            if (zScore <= zThreshold) continue;

            AnomalyType type = point.value() > mean ? AnomalyType.SPIKE : AnomalyType.DROP;
            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put(Anomaly.METHOD_KEY, "z_score");
            metadata.put("z_score", zScore);

            anomalies.add(Anomaly.of(series.metricType(), type, point.timestamp(),
                Math.min(zScore / (zThreshold * 2), 1.0), mean, point.value(), Z_SCORE_CONFIDENCE,
                String.format("Value deviates %.1f standard deviations from mean", zScore),
                metadata));
        }
        return anomalies;
    }

    List<Anomaly> detectIqr(MetricSeries series, double[] values) {
        double q1  = SeriesStatistics.percentile(values, 25);
        double q3  = SeriesStatistics.percentile(values, 75);
        double iqr = q3 - q1;
        double lower = q1 - iqrMultiplier * iqr;
        double upper = q3 + iqrMultiplier * iqr;
        double expected = (q1 + q3) / 2;

        List<Anomaly> anomalies = new ArrayList<>();
        for (MetricPoint point : series.points()) {
            double value = point.value();
            if (value >= lower && value <= upper) continue;

            AnomalyType type = value > upper ? AnomalyType.SPIKE : AnomalyType.DROP;
            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put(Anomaly.METHOD_KEY, "iqr");
            metadata.put("bounds", List.of(lower, upper));

            anomalies.add(Anomaly.of(series.metricType(), type, point.timestamp(),
                iqrSeverity(value, lower, upper), expected, value, IQR_CONFIDENCE,
                String.format("Value outside IQR bounds [%.2f, %.2f]", lower, upper),
                metadata));
        }
        return anomalies;
    }

    static double iqrSeverity(double value, double lower, double upper) {
        if (value >= lower && value <= upper) return 0.0;
        double distance = value < lower ? lower - value : value - upper;
        double range = upper - lower;
        // zero-width band: anything outside it is maximally severe
        if (range <= 0) return 1.0;
        return Math.min(distance / range, 1.0);
    }
}
