package com.anomalyplatform.common.model;

public enum TimeGranularity {
    MINUTE,
    HOUR,
    DAY,
    WEEK,
    MONTH,
    QUARTER,
    YEAR
}
