package com.anomalyplatform.common.model;

import com.anomalyplatform.common.classifier.TrendClassifier;
import com.anomalyplatform.common.stats.SeriesStatistics;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * Chronologically ordered samples of one metric.
 *
 * <p>Immutable: the point list is copied on construction. Points need not be uniformly spaced.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record MetricSeries(
    @JsonProperty("metricType") MetricType metricType,
    @JsonProperty("points") List<MetricPoint> points,
    @JsonProperty("granularity") TimeGranularity granularity
) {
    public MetricSeries {
        points = points == null ? null : List.copyOf(points);
    }

    public static MetricSeries of(MetricType metricType, List<MetricPoint> points,
                                  TimeGranularity granularity) {
        return new MetricSeries(metricType, points, granularity);
    }

    public int size() {
        return points == null ? 0 : points.size();
    }

    public double[] values() {
        if (points == null) return new double[0];
        double[] values = new double[points.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = points.get(i).value();
        }
        return values;
    }

    /** Arithmetic mean of the point values; 0 when the series is empty. */
    public double average() {
        return SeriesStatistics.mean(values());
    }

    public TrendDirection trend() {
        return TrendClassifier.classify(values());
    }

    public Instant startTime() {
        return size() == 0 ? null : points.get(0).timestamp();
    }

    public Instant endTime() {
        return size() == 0 ? null : points.get(points.size() - 1).timestamp();
    }
}
