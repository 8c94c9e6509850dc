package com.anomalyplatform.common.detector;

import com.anomalyplatform.common.model.Anomaly;
import com.anomalyplatform.common.model.AnomalyType;
import com.anomalyplatform.common.model.MetricPoint;
import com.anomalyplatform.common.model.MetricSeries;
import com.anomalyplatform.common.stats.SeriesStatistics;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Flags values that leave the band around their trailing moving average.
 *
 * <p>For every index {@code i ≥ windowSize} the band is built from the previous
 * {@code windowSize} values (the current point is excluded):
 * <pre>
 *   band       = mean ± deviationMultiplier × sampleStd
 *   severity   = min(|value − mean| / std / (2 × deviationMultiplier), 1.0)   (0.5 when std = 0)
 *   confidence = 0.7
 * </pre>
 */
public class MovingAverageDetector implements AnomalyDetector {

    static final double CONFIDENCE         = 0.7;
    static final double FLAT_WINDOW_SEVERITY = 0.5;

    public static final int    DEFAULT_WINDOW_SIZE          = 10;
    public static final double DEFAULT_DEVIATION_MULTIPLIER = 2.0;

    private final int windowSize;
    private final double deviationMultiplier;

    public MovingAverageDetector() {
        this(DEFAULT_WINDOW_SIZE, DEFAULT_DEVIATION_MULTIPLIER);
    }

    public MovingAverageDetector(int windowSize, double deviationMultiplier) {
        if (windowSize < 1) throw new IllegalArgumentException("windowSize must be at least 1: " + windowSize);
        if (deviationMultiplier <= 0) {
            throw new IllegalArgumentException("deviationMultiplier must be positive: " + deviationMultiplier);
        }
        this.windowSize          = windowSize;
        this.deviationMultiplier = deviationMultiplier;
    }

    @Override
    public String detectorName() { return "MovingAverageDetector"; }

    @Override
    public List<Anomaly> detect(MetricSeries series) {
        AnomalyDetector.requirePoints(detectorName(), series);
        List<Anomaly> anomalies = new ArrayList<>();
        if (series.size() < windowSize) {
            return anomalies;
        }

        double[] values = series.values();
        for (int i = windowSize; i < values.length; i++) {
            double movingAverage = SeriesStatistics.mean(values, i - windowSize, i);
            double std           = SeriesStatistics.sampleStdDev(values, i - windowSize, i);
            double upperBand     = movingAverage + deviationMultiplier * std;
            double lowerBand     = movingAverage - deviationMultiplier * std;

            double current = values[i];
            if (current <= upperBand && current >= lowerBand) continue;

            MetricPoint point = series.points().get(i);
            AnomalyType type = current > upperBand ? AnomalyType.SPIKE : AnomalyType.DROP;

            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put(Anomaly.METHOD_KEY, "moving_average");
            metadata.put("window_size", windowSize);
            metadata.put("ma", movingAverage);
            metadata.put("bands", List.of(lowerBand, upperBand));

            anomalies.add(Anomaly.of(series.metricType(), type, point.timestamp(),
                bandSeverity(current, movingAverage, std), movingAverage, current, CONFIDENCE,
                String.format("Value outside %.1fσ bands of moving average", deviationMultiplier),
                metadata));
        }
        return anomalies;
    }

    double bandSeverity(double value, double movingAverage, double std) {
        if (std == 0) return FLAT_WINDOW_SEVERITY;
        double deviation = Math.abs(value - movingAverage) / std;
        return Math.min(deviation / (deviationMultiplier * 2), 1.0);
    }
}
