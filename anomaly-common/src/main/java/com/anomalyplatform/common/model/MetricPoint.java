package com.anomalyplatform.common.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Single timestamped sample. Producers guarantee {@code value} is finite and non-negative.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record MetricPoint(
    @JsonProperty("timestamp") Instant timestamp,
    @JsonProperty("value") double value,
    @JsonProperty("metadata") Map<String, Object> metadata
) {
    public MetricPoint {
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new HashMap<>(metadata));
    }

    public static MetricPoint of(Instant timestamp, double value) {
        return new MetricPoint(timestamp, value, Map.of());
    }
}
