package com.anomalyplatform.common.detector;

import com.anomalyplatform.common.exception.DetectorException;
import com.anomalyplatform.common.model.Anomaly;
import com.anomalyplatform.common.model.AnomalyType;
import com.anomalyplatform.common.model.MetricPoint;
import com.anomalyplatform.common.model.MetricSeries;
import com.anomalyplatform.common.model.MetricType;
import com.anomalyplatform.common.model.TimeGranularity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.anomalyplatform.common.SeriesFixtures.constant;
import static com.anomalyplatform.common.SeriesFixtures.hour;
import static com.anomalyplatform.common.SeriesFixtures.hourly;
import static org.junit.jupiter.api.Assertions.*;

class StatisticalDetectorTest {

    private final StatisticalDetector detector = new StatisticalDetector();

    @Nested
    @DisplayName("early returns")
    class EarlyReturnTests {

        @Test
        @DisplayName("fewer than 10 points → empty")
        void tooFewPoints() {
            assertTrue(detector.detect(hourly(10, 10, 10, 10, 10, 10, 10, 50, 10)).isEmpty());
        }

        @Test
        @DisplayName("constant series → empty (zero variance, zero-width IQR band contains every point)")
        void constantSeries() {
            assertTrue(detector.detect(hourly(constant(20, 5.0))).isEmpty());
        }

        @Test
        @DisplayName("null series → DetectorException")
        void nullSeries() {
            DetectorException e = assertThrows(DetectorException.class, () -> detector.detect(null));
            assertEquals("StatisticalDetector", e.getDetectorName());
            assertNull(e.getMetricType());
        }

        @Test
        @DisplayName("point without timestamp → DetectorException naming the metric")
        void untimedPoint() {
            List<MetricPoint> points = new ArrayList<>(hourly(constant(12, 100.0)).points());
            points.add(new MetricPoint(null, 500, null));
            MetricSeries series = MetricSeries.of(MetricType.SYSTEM_HEALTH, points, TimeGranularity.HOUR);

            DetectorException e = assertThrows(DetectorException.class, () -> detector.detect(series));
            assertEquals(MetricType.SYSTEM_HEALTH, e.getMetricType());
            assertTrue(e.getMessage().contains("point 12"));
        }
    }

    @Nested
    @DisplayName("detect() combined passes")
    class CombinedTests {

        @Test
        @DisplayName("single spike in ten points → exactly one SPIKE with actualValue 50")
        void singleSpike() {
            List<Anomaly> anomalies = detector.detect(hourly(10, 10, 10, 10, 10, 10, 10, 50, 10, 10));

            assertEquals(1, anomalies.size());
            Anomaly spike = anomalies.get(0);
            assertEquals(50.0, spike.actualValue());
            assertEquals(AnomalyType.SPIKE, spike.anomalyType());
            assertEquals(hour(7), spike.timestamp());
            // z is bounded by 9/√10 ≈ 2.85 for ten points, so the IQR pass reports it
            assertEquals("iqr", spike.method());
            assertEquals(1.0, spike.severity());
            assertEquals(10.0, spike.expectedValue());
            assertEquals(0.75, spike.confidence());
        }

        @Test
        @DisplayName("point flagged by both passes is reported once, keeping the z-score finding")
        void deduplicatesAcrossPasses() {
            StatisticalDetector strict = new StatisticalDetector(1.0, 1.5);
            List<Anomaly> anomalies = strict.detect(hourly(10, 12, 11, 10, 11, 12, 10, 50, 11, 10));

            assertEquals(1, anomalies.size());
            assertEquals(50.0, anomalies.get(0).actualValue());
            assertEquals("z_score", anomalies.get(0).method());
            assertEquals(0.8, anomalies.get(0).confidence());
        }

        @Test
        @DisplayName("value far below the mean → DROP")
        void drop() {
            MetricSeries series = hourly(20, h -> h == 10 ? 0.0 : (h % 2 == 0 ? 100.0 : 102.0));
            List<Anomaly> anomalies = detector.detect(series);

            assertEquals(1, anomalies.size());
            Anomaly drop = anomalies.get(0);
            assertEquals(AnomalyType.DROP, drop.anomalyType());
            assertEquals(0.0, drop.actualValue());
            assertEquals("z_score", drop.method());
            assertTrue(drop.severity() > 0.5 && drop.severity() <= 1.0, "severity=" + drop.severity());
        }

        @Test
        @DisplayName("severity and confidence stay within [0, 1]")
        void bounded() {
            List<Anomaly> anomalies = new StatisticalDetector(0.5, 0.5)
                .detect(hourly(1, 900, 3, 4, 5, 0, 7, 8, 9, 1000, 11, 12));
            assertFalse(anomalies.isEmpty());
            for (Anomaly a : anomalies) {
                assertTrue(a.severity() >= 0.0 && a.severity() <= 1.0);
                assertTrue(a.confidence() >= 0.0 && a.confidence() <= 1.0);
            }
        }
    }

    @Nested
    @DisplayName("individual passes")
    class PassTests {

        @Test
        @DisplayName("z-score pass at threshold 2.0 catches the ten-point spike with z ≈ 2.85")
        void zScorePass() {
            MetricSeries series = hourly(10, 10, 10, 10, 10, 10, 10, 50, 10, 10);
            List<Anomaly> anomalies = new StatisticalDetector(2.0, 1.5).detectZScore(series, series.values());

            assertEquals(1, anomalies.size());
            assertEquals(14.0, anomalies.get(0).expectedValue(), 1e-9);
            assertEquals(36.0 / Math.sqrt(160.0) / 4.0, anomalies.get(0).severity(), 1e-9);
        }

        @Test
        @DisplayName("z-score pass skips a zero-variance series")
        void zScoreZeroVariance() {
            MetricSeries series = hourly(constant(12, 3.0));
            assertTrue(detector.detectZScore(series, series.values()).isEmpty());
        }

        @Test
        @DisplayName("IQR severity is the distance outside the band over the band width")
        void iqrSeverity() {
            assertEquals(0.0, StatisticalDetector.iqrSeverity(5, 0, 10));
            assertEquals(0.5, StatisticalDetector.iqrSeverity(15, 0, 10), 1e-9);
            assertEquals(0.2, StatisticalDetector.iqrSeverity(-2, 0, 10), 1e-9);
            assertEquals(1.0, StatisticalDetector.iqrSeverity(100, 0, 10));
            assertEquals(1.0, StatisticalDetector.iqrSeverity(50, 10, 10));
        }
    }

    @Test
    @DisplayName("non-positive thresholds are rejected")
    void rejectsBadConfiguration() {
        assertThrows(IllegalArgumentException.class, () -> new StatisticalDetector(0, 1.5));
        assertThrows(IllegalArgumentException.class, () -> new StatisticalDetector(3.0, -1));
    }
}
