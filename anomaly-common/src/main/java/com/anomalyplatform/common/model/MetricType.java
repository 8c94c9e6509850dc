package com.anomalyplatform.common.model;

/**
 * Metric families produced by the collectors that feed the anomaly engine.
 */
public enum MetricType {
    MEMORY_COUNT,
    MEMORY_GROWTH,
    QUERY_PERFORMANCE,
    EMBEDDING_QUALITY,
    RELATIONSHIP_DENSITY,
    KNOWLEDGE_COVERAGE,
    REVIEW_COMPLETION,
    RETENTION_RATE,
    API_USAGE,
    SYSTEM_HEALTH
}
