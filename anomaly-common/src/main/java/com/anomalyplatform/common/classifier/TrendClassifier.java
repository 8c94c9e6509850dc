package com.anomalyplatform.common.classifier;

import com.anomalyplatform.common.model.TrendDirection;
import com.anomalyplatform.common.stats.SeriesStatistics;

/**
 * Pure stateless classifier that maps a series of values to a {@link TrendDirection}.
 *
 * <p>Classification rules (evaluated in priority order):
 * <ol>
 *   <li>fewer than 2 values        → {@link TrendDirection#STABLE}</li>
 *   <li>coefficient of variation &gt; 0.5 → {@link TrendDirection#VOLATILE}</li>
 *   <li>|slope| &lt; 0.01           → {@link TrendDirection#STABLE}</li>
 *   <li>slope &gt; 0                → {@link TrendDirection#INCREASING}</li>
 *   <li>otherwise                 → {@link TrendDirection#DECREASING}</li>
 * </ol>
 *
 * <p>No logging. No side-effects.
 */
public final class TrendClassifier {

    static final double VOLATILE_CV     = 0.5;
    static final double STABLE_SLOPE    = 0.01;

    private TrendClassifier() {}

    public static TrendDirection classify(double[] values) {
        if (values == null || values.length < 2) {
            return TrendDirection.STABLE;
        }

        if (SeriesStatistics.coefficientOfVariation(values) > VOLATILE_CV) {
            return TrendDirection.VOLATILE;
        }

        double slope = SeriesStatistics.linearSlope(values);
        if (Math.abs(slope) < STABLE_SLOPE) {
            return TrendDirection.STABLE;
        }
        return slope > 0 ? TrendDirection.INCREASING : TrendDirection.DECREASING;
    }
}
