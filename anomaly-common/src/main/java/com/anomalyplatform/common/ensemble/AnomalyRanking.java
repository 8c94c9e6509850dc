package com.anomalyplatform.common.ensemble;

import com.anomalyplatform.common.model.Anomaly;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Final ordering of ensemble output: most severe first, then most recent first.
 * Metric type, anomaly type and id complete the order so equal-severity results never reshuffle.
 * Missing keys sort last.
 */
public final class AnomalyRanking {

    public static final Comparator<Anomaly> SEVERITY_THEN_RECENCY =
        Comparator.comparingDouble(Anomaly::severity).reversed()
            .thenComparing(Anomaly::timestamp, Comparator.nullsLast(Comparator.reverseOrder()))
            .thenComparing(Anomaly::metricType, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(Anomaly::anomalyType, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(Anomaly::id, Comparator.nullsLast(Comparator.naturalOrder()));

    private AnomalyRanking() {}

    public static List<Anomaly> rank(List<Anomaly> anomalies) {
        List<Anomaly> ranked = new ArrayList<>(anomalies);
        ranked.sort(SEVERITY_THEN_RECENCY);
        return ranked;
    }
}
