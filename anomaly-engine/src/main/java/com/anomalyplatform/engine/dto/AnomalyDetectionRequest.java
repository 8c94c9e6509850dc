package com.anomalyplatform.engine.dto;

import com.anomalyplatform.common.model.MetricSeries;
import com.anomalyplatform.common.model.MetricType;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@JsonIgnoreProperties(ignoreUnknown = true)
public record AnomalyDetectionRequest(
    @JsonProperty("metrics") List<MetricSeries> metrics,
    @JsonProperty("sensitivity") Double sensitivity
) {
    /**
     * Keyed by metric type in request order; a repeated metric type keeps its last series.
     */
    public Map<MetricType, MetricSeries> toMetricMap() {
        Map<MetricType, MetricSeries> byType = new LinkedHashMap<>();
        if (metrics == null) return byType;
        for (MetricSeries series : metrics) {
            if (series != null && series.metricType() != null) {
                byType.put(series.metricType(), series);
            }
        }
        return byType;
    }
}
