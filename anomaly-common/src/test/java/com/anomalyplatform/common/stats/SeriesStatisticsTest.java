package com.anomalyplatform.common.stats;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SeriesStatisticsTest {

    @Test
    @DisplayName("sample std-dev uses n − 1")
    void sampleStdDev() {
        double[] values = {2, 4, 4, 4, 5, 5, 7, 9};
        assertEquals(Math.sqrt(32.0 / 7.0), SeriesStatistics.sampleStdDev(values), 1e-9);
    }

    @Test
    @DisplayName("std-dev of fewer than two values → 0.0")
    void stdDevTooFew() {
        assertEquals(0.0, SeriesStatistics.sampleStdDev(new double[] {5}));
        assertEquals(0.0, SeriesStatistics.sampleStdDev(List.of()));
    }

    @Test
    @DisplayName("windowed mean and std-dev only see [from, to)")
    void windowed() {
        double[] values = {100, 1, 2, 3, 100};
        assertEquals(2.0, SeriesStatistics.mean(values, 1, 4), 1e-9);
        assertEquals(1.0, SeriesStatistics.sampleStdDev(values, 1, 4), 1e-9);
    }

    @Test
    @DisplayName("percentile interpolates linearly between ranks")
    void percentile() {
        double[] values = {4, 1, 3, 2};
        assertEquals(1.75, SeriesStatistics.percentile(values, 25), 1e-9);
        assertEquals(3.25, SeriesStatistics.percentile(values, 75), 1e-9);
        assertEquals(2.5, SeriesStatistics.percentile(values, 50), 1e-9);
    }

    @Test
    @DisplayName("percentile does not reorder the caller's array")
    void percentileLeavesInput() {
        double[] values = {4, 1, 3, 2};
        SeriesStatistics.percentile(values, 50);
        assertArrayEquals(new double[] {4, 1, 3, 2}, values);
    }

    @Test
    @DisplayName("linear slope of evenly rising values")
    void slope() {
        assertEquals(2.0, SeriesStatistics.linearSlope(new double[] {1, 3, 5}), 1e-9);
        assertEquals(0.0, SeriesStatistics.linearSlope(new double[] {7}));
    }

    @Test
    @DisplayName("coefficient of variation is 0 for a zero mean")
    void cvZeroMean() {
        assertEquals(0.0, SeriesStatistics.coefficientOfVariation(new double[] {0, 0, 0}));
    }

    @Test
    @DisplayName("clamp01 bounds both ends")
    void clamp() {
        assertEquals(0.0, SeriesStatistics.clamp01(-0.2));
        assertEquals(1.0, SeriesStatistics.clamp01(1.7));
        assertEquals(0.4, SeriesStatistics.clamp01(0.4));
    }
}
