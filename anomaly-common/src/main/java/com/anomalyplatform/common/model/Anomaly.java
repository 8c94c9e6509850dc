package com.anomalyplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * A single finding produced by a detector, or the merged record of several corroborating findings.
 *
 * <p>{@code severity} and {@code confidence} are always within [0.0, 1.0].
 * {@code metadata} always carries the detection {@code method} plus detector-specific diagnostics.
 */
public record Anomaly(
    @JsonProperty("id") UUID id,
    @JsonProperty("metricType") MetricType metricType,
    @JsonProperty("anomalyType") AnomalyType anomalyType,
    @JsonProperty("timestamp") Instant timestamp,
    @JsonProperty("severity") double severity,
    @JsonProperty("expectedValue") double expectedValue,
    @JsonProperty("actualValue") double actualValue,
    @JsonProperty("confidence") double confidence,
    @JsonProperty("description") String description,
    @JsonProperty("metadata") Map<String, Object> metadata
) {
    public static final String METHOD_KEY          = "method";
    public static final String DETECTION_COUNT_KEY = "detection_count";

    public Anomaly {
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new HashMap<>(metadata));
    }

    /**
     * Creates a detector finding whose id is derived from
     * (metricType, anomalyType, timestamp, method), so identical input always yields identical ids.
     */
    public static Anomaly of(MetricType metricType, AnomalyType anomalyType, Instant timestamp,
                             double severity, double expectedValue, double actualValue,
                             double confidence, String description, Map<String, Object> metadata) {
        Object method = metadata != null ? metadata.get(METHOD_KEY) : null;
        String key = metricType + "|" + anomalyType + "|" + timestamp + "|" + method;
        UUID id = UUID.nameUUIDFromBytes(key.getBytes(StandardCharsets.UTF_8));
        return new Anomaly(id, metricType, anomalyType, timestamp, severity,
            expectedValue, actualValue, confidence, description, metadata);
    }

    public String method() {
        Object method = metadata.get(METHOD_KEY);
        return method != null ? String.valueOf(method) : null;
    }

    public Anomaly withConfidence(double newConfidence) {
        return new Anomaly(id, metricType, anomalyType, timestamp, severity,
            expectedValue, actualValue, newConfidence, description, metadata);
    }
}
