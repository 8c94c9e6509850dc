package com.anomalyplatform.common.ensemble;

import com.anomalyplatform.common.model.Anomaly;

import java.util.List;

/**
 * Strategy contract for collapsing the candidates of several detectors into one de-duplicated list.
 *
 * <p>Implementations must be:
 * <ul>
 *   <li><b>Stateless</b>    : no mutable state; safe to call concurrently</li>
 *   <li><b>Pure</b>         : no logging, no reactive types, no side effects</li>
 *   <li><b>Deterministic</b>: the same input list always yields the same output list</li>
 * </ul>
 *
 * <p>Current implementation: {@link CorroborationMergeStrategy}.
 */
public interface AnomalyMergeStrategy {

    /**
     * @param candidates sensitivity-adjusted candidates from all detectors and metrics (may be empty)
     * @return merged anomalies, unordered with respect to ranking, never {@code null}
     */
    List<Anomaly> merge(List<Anomaly> candidates);
}
