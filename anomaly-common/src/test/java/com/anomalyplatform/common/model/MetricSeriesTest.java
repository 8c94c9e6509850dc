package com.anomalyplatform.common.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static com.anomalyplatform.common.SeriesFixtures.hour;
import static com.anomalyplatform.common.SeriesFixtures.hourly;
import static org.junit.jupiter.api.Assertions.*;

class MetricSeriesTest {

    @Nested
    @DisplayName("average()")
    class AverageTests {

        @Test
        @DisplayName("arithmetic mean of point values")
        void mean() {
            assertEquals(20.0, hourly(0, 10, 20, 30, 40).average(), 1e-9);
        }

        @Test
        @DisplayName("empty series → 0.0")
        void empty() {
            assertEquals(0.0, hourly().average());
        }
    }

    @Nested
    @DisplayName("trend()")
    class TrendTests {

        @Test
        @DisplayName("steady rise with low dispersion → INCREASING")
        void increasing() {
            assertEquals(TrendDirection.INCREASING, hourly(100, 110, 120, 130, 140).trend());
        }

        @Test
        @DisplayName("steady fall with low dispersion → DECREASING")
        void decreasing() {
            assertEquals(TrendDirection.DECREASING, hourly(140, 130, 120, 110, 100).trend());
        }

        @Test
        @DisplayName("flat series → STABLE")
        void stable() {
            assertEquals(TrendDirection.STABLE, hourly(50, 50, 50, 50).trend());
        }

        @Test
        @DisplayName("coefficient of variation above 0.5 → VOLATILE regardless of slope")
        void volatileSeries() {
            assertEquals(TrendDirection.VOLATILE, hourly(1, 100, 2, 90, 3).trend());
        }

        @Test
        @DisplayName("single point → STABLE")
        void singlePoint() {
            assertEquals(TrendDirection.STABLE, hourly(42).trend());
        }
    }

    @Nested
    @DisplayName("immutability and derived bounds")
    class ShapeTests {

        @Test
        @DisplayName("point list is copied on construction")
        void copiesPoints() {
            List<MetricPoint> source = new ArrayList<>();
            source.add(MetricPoint.of(hour(0), 1.0));
            MetricSeries series = MetricSeries.of(MetricType.API_USAGE, source, TimeGranularity.HOUR);

            source.add(MetricPoint.of(hour(1), 2.0));

            assertEquals(1, series.size());
            assertThrows(UnsupportedOperationException.class,
                () -> series.points().add(MetricPoint.of(hour(2), 3.0)));
        }

        @Test
        @DisplayName("start and end time follow first and last point")
        void startEnd() {
            MetricSeries series = hourly(1, 2, 3);
            assertEquals(hour(0), series.startTime());
            assertEquals(hour(2), series.endTime());
        }

        @Test
        @DisplayName("empty series has no start or end time")
        void emptyBounds() {
            MetricSeries series = hourly();
            assertNull(series.startTime());
            assertNull(series.endTime());
        }

        @Test
        @DisplayName("null point metadata becomes an empty map")
        void nullMetadata() {
            MetricPoint point = new MetricPoint(hour(0), 1.0, null);
            assertEquals(Map.of(), point.metadata());
        }
    }
}
