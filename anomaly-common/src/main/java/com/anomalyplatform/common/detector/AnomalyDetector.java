package com.anomalyplatform.common.detector;

import com.anomalyplatform.common.exception.DetectorException;
import com.anomalyplatform.common.model.Anomaly;
import com.anomalyplatform.common.model.MetricSeries;

import java.util.List;

/**
 * Contract shared by every detection algorithm in the ensemble.
 *
 * <p>Implementations must be:
 * <ul>
 *   <li><b>Stateless</b>: configuration only; safe to call concurrently</li>
 *   <li><b>Pure</b>     : no logging, no I/O, never mutate the input series</li>
 *   <li><b>Quiet</b>    : insufficient data or zero variance yields an empty list, not an error</li>
 * </ul>
 */
public interface AnomalyDetector {

    /**
     * @param series immutable input series
     * @return freshly allocated list of candidates, never {@code null}
     * @throws DetectorException if the series, its point list or a point timestamp is missing
     */
    List<Anomaly> detect(MetricSeries series);

    String detectorName();

    static void requirePoints(String detectorName, MetricSeries series) {
        if (series == null) {
            throw new DetectorException(detectorName, null, "no series supplied");
        }
        if (series.points() == null) {
            throw new DetectorException(detectorName, series.metricType(), "no points supplied");
        }
        for (int i = 0; i < series.points().size(); i++) {
            if (series.points().get(i).timestamp() == null) {
                throw new DetectorException(detectorName, series.metricType(), "point " + i + " has no timestamp");
            }
        }
    }
}
