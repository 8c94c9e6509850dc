package com.anomalyplatform.common.exception;

import com.anomalyplatform.common.model.MetricType;

/**
 * Raised by a detector that was handed a series it cannot score at all.
 * The coordinator treats it like any other single-detector failure.
 */
public class DetectorException extends RuntimeException {

    private final String detectorName;
    private final MetricType metricType;

    public DetectorException(String detectorName, MetricType metricType, String message) {
        super(detectorName + " rejected " + (metricType != null ? metricType : "unknown metric") + ": " + message);
        this.detectorName = detectorName;
        this.metricType = metricType;
    }

    public String getDetectorName() {
        return detectorName;
    }

    /** Metric of the rejected series; {@code null} when the series itself was missing. */
    public MetricType getMetricType() {
        return metricType;
    }
}
