package com.anomalyplatform.common.ensemble;

import com.anomalyplatform.common.model.Anomaly;
import com.anomalyplatform.common.stats.SeriesStatistics;

import java.util.ArrayList;
import java.util.List;

/**
 * Applies the caller's sensitivity to detector confidence before merging.
 *
 * <pre>
 *   confidence' = clamp(confidence × sensitivity, 0.0, 1.0)
 * </pre>
 * Sensitivity below 1.0 suppresses weak findings downstream; above 1.0 promotes them.
 */
public final class ConfidenceCalibrator {

    public static final double DEFAULT_SENSITIVITY = 1.0;

    private ConfidenceCalibrator() {}

    public static List<Anomaly> applySensitivity(List<Anomaly> candidates, double sensitivity) {
        List<Anomaly> adjusted = new ArrayList<>(candidates.size());
        for (Anomaly candidate : candidates) {
            adjusted.add(candidate.withConfidence(
                SeriesStatistics.clamp01(candidate.confidence() * sensitivity)));
        }
        return adjusted;
    }
}
