package com.anomalyplatform.common.detector;

import com.anomalyplatform.common.model.Anomaly;
import com.anomalyplatform.common.model.AnomalyType;
import com.anomalyplatform.common.model.MetricPoint;
import com.anomalyplatform.common.model.MetricSeries;
import com.anomalyplatform.common.stats.SeriesStatistics;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Detects windows whose event count deviates from the typical count per window.
 *
 * <p>Points are sorted by timestamp and bucketed into contiguous, non-overlapping windows of
 * {@code windowMinutes} anchored at the earliest point. Only non-empty windows participate:
 * <pre>
 *   z = |count − mean| / sampleStd      (needs ≥ 3 windows and std &gt; 0)
 *   z &gt; 2.5 → UNUSUAL_FREQUENCY, severity = min(z / 4, 1.0), confidence = 0.7
 * </pre>
 * The anomaly is timestamped at its window start; {@code actualValue} is the count.
 */
public class FrequencyDetector implements AnomalyDetector {

    static final int    MIN_POINTS     = 10;
    static final int    MIN_WINDOWS    = 3;
    static final double Z_THRESHOLD    = 2.5;
    static final double SEVERITY_SCALE = 4.0;
    static final double CONFIDENCE     = 0.7;

    public static final int DEFAULT_WINDOW_MINUTES = 60;

    private final int windowMinutes;

    public FrequencyDetector() {
        this(DEFAULT_WINDOW_MINUTES);
    }

    public FrequencyDetector(int windowMinutes) {
        if (windowMinutes <= 0) throw new IllegalArgumentException("windowMinutes must be positive: " + windowMinutes);
        this.windowMinutes = windowMinutes;
    }

    @Override
    public String detectorName() { return "FrequencyDetector"; }

    @Override
    public List<Anomaly> detect(MetricSeries series) {
        AnomalyDetector.requirePoints(detectorName(), series);
        List<Anomaly> anomalies = new ArrayList<>();
        if (series.size() < MIN_POINTS) {
            return anomalies;
        }

        Map<Instant, Integer> frequencies = windowFrequencies(series.points());
        if (frequencies.size() < MIN_WINDOWS) {
            return anomalies;
        }

        double[] counts = frequencies.values().stream().mapToDouble(Integer::doubleValue).toArray();
        double mean = SeriesStatistics.mean(counts);
        double std  = SeriesStatistics.sampleStdDev(counts);
        if (std == 0) {
            return anomalies;
        }

        for (Map.Entry<Instant, Integer> window : frequencies.entrySet()) {
            int count = window.getValue();
            double zScore = Math.abs(count - mean) / std;
            if (zScore <= Z_THRESHOLD) continue;

            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put(Anomaly.METHOD_KEY, "frequency");
            metadata.put("window_minutes", windowMinutes);
            metadata.put("z_score", zScore);

            anomalies.add(Anomaly.of(series.metricType(), AnomalyType.UNUSUAL_FREQUENCY, window.getKey(),
                Math.min(zScore / SEVERITY_SCALE, 1.0), mean, count, CONFIDENCE,
                String.format("Unusual event frequency: %.1f events per window", (double) count),
                metadata));
        }
        return anomalies;
    }

    /**
     * Counts points per window, keyed by window start in chronological order. Empty windows are absent.
     */
    Map<Instant, Integer> windowFrequencies(List<MetricPoint> points) {
        Map<Instant, Integer> frequencies = new TreeMap<>();
        if (points.isEmpty()) {
            return frequencies;
        }

        List<MetricPoint> sorted = new ArrayList<>(points);
        sorted.sort(Comparator.comparing(MetricPoint::timestamp));

        Instant origin = sorted.get(0).timestamp();
        Duration window = Duration.ofMinutes(windowMinutes);
        long windowMillis = window.toMillis();
        for (MetricPoint point : sorted) {
            long index = Duration.between(origin, point.timestamp()).toMillis() / windowMillis;
            Instant windowStart = origin.plus(window.multipliedBy(index));
            frequencies.merge(windowStart, 1, Integer::sum);
        }
        return frequencies;
    }
}
