package com.anomalyplatform.common.ensemble;

import com.anomalyplatform.common.model.Anomaly;
import com.anomalyplatform.common.model.AnomalyType;
import com.anomalyplatform.common.model.MetricType;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Default {@link AnomalyMergeStrategy}: agreement between independent detectors raises trust.
 *
 * <h3>Algorithm</h3>
 * <ol>
 *   <li>Group candidates by the exact key (metricType, timestamp, anomalyType),
 *       in order of first appearance.</li>
 *   <li>Singleton groups pass through unchanged.</li>
 *   <li>Larger groups collapse onto the highest-confidence candidate (first wins on ties):
 *     <pre>
 *   severity   = mean(group.severity)
 *   confidence = min(mean(group.confidence) × {@value #CORROBORATION_BOOST}, 1.0)
 *   metadata.detection_count = |group|
 *     </pre>
 *   </li>
 * </ol>
 *
 * <p>This class is stateless and thread-safe. Input {@link Anomaly} instances are never modified.
 */
public class CorroborationMergeStrategy implements AnomalyMergeStrategy {

    static final double CORROBORATION_BOOST = 1.2;

    @Override
    public List<Anomaly> merge(List<Anomaly> candidates) {
        Map<GroupKey, List<Anomaly>> grouped = new LinkedHashMap<>();
        for (Anomaly anomaly : candidates) {
            GroupKey key = new GroupKey(anomaly.metricType(), anomaly.timestamp(), anomaly.anomalyType());
            grouped.computeIfAbsent(key, k -> new ArrayList<>()).add(anomaly);
        }

        List<Anomaly> merged = new ArrayList<>(grouped.size());
        for (List<Anomaly> group : grouped.values()) {
            merged.add(group.size() == 1 ? group.get(0) : combine(group));
        }
        return merged;
    }

    Anomaly combine(List<Anomaly> group) {
        Anomaly base = group.get(0);
        for (Anomaly candidate : group) {
            if (candidate.confidence() > base.confidence()) base = candidate;
        }

        double avgSeverity   = group.stream().mapToDouble(Anomaly::severity).average().orElse(0.0);
        double avgConfidence = group.stream().mapToDouble(Anomaly::confidence).average().orElse(0.0);

        Set<String> methods = new LinkedHashSet<>();
        for (Anomaly candidate : group) {
            String method = candidate.method();
            if (method != null) methods.add(method);
        }

        Map<String, Object> metadata = new HashMap<>(base.metadata());
        metadata.put(Anomaly.DETECTION_COUNT_KEY, group.size());

        return new Anomaly(
            base.id(),
            base.metricType(),
            base.anomalyType(),
            base.timestamp(),
            avgSeverity,
            base.expectedValue(),
            base.actualValue(),
            Math.min(avgConfidence * CORROBORATION_BOOST, 1.0),
            "Detected by " + group.size() + " methods: " + String.join(", ", methods),
            metadata);
    }

    private record GroupKey(MetricType metricType, Instant timestamp, AnomalyType anomalyType) {}
}
