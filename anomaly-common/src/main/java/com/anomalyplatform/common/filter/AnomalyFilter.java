package com.anomalyplatform.common.filter;

import com.anomalyplatform.common.model.Anomaly;
import com.anomalyplatform.common.model.AnomalyType;
import com.anomalyplatform.common.model.MetricType;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Post-ensemble selection applied by consumers of the ranked anomaly list.
 *
 * <p>Every criterion is optional ({@code null} = no restriction). Order of the input list is preserved.
 *
 * @param metricType  keep only this metric
 * @param anomalyType keep only this kind of anomaly
 * @param minSeverity keep anomalies with {@code severity >= minSeverity}
 * @param withinHours keep anomalies no older than this many hours before {@code now}
 */
public record AnomalyFilter(
    MetricType metricType,
    AnomalyType anomalyType,
    Double minSeverity,
    Integer withinHours
) {
    public static AnomalyFilter none() {
        return new AnomalyFilter(null, null, null, null);
    }

    public List<Anomaly> apply(List<Anomaly> anomalies, Instant now) {
        Instant cutoff = withinHours != null ? now.minus(Duration.ofHours(withinHours)) : null;
        return anomalies.stream()
            .filter(a -> metricType == null || a.metricType() == metricType)
            .filter(a -> anomalyType == null || a.anomalyType() == anomalyType)
            .filter(a -> minSeverity == null || a.severity() >= minSeverity)
            .filter(a -> cutoff == null || !a.timestamp().isBefore(cutoff))
            .collect(Collectors.toList());
    }
}
