package com.anomalyplatform.common.model;

/**
 * Overall direction of a {@link MetricSeries}, as classified by
 * {@link com.anomalyplatform.common.classifier.TrendClassifier}.
 */
public enum TrendDirection {
    INCREASING,
    DECREASING,
    STABLE,
    VOLATILE
}
