package com.anomalyplatform.common.model;

/**
 * Kind of deviation reported by a detector.
 *
 * <ul>
 *   <li>{@link #SPIKE} / {@link #DROP}     : value above / below its expected band</li>
 *   <li>{@link #PATTERN_BREAK}            : value breaks its own hourly or weekly cycle</li>
 *   <li>{@link #THRESHOLD_BREACH}         : reserved for fixed-limit collaborators</li>
 *   <li>{@link #UNUSUAL_FREQUENCY}        : abnormal number of events in a time window</li>
 * </ul>
 */
public enum AnomalyType {
    SPIKE,
    DROP,
    PATTERN_BREAK,
    THRESHOLD_BREACH,
    UNUSUAL_FREQUENCY
}
