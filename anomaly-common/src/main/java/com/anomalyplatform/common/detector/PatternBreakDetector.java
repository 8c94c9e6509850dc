package com.anomalyplatform.common.detector;

import com.anomalyplatform.common.model.Anomaly;
import com.anomalyplatform.common.model.AnomalyType;
import com.anomalyplatform.common.model.MetricPoint;
import com.anomalyplatform.common.model.MetricSeries;
import com.anomalyplatform.common.stats.SeriesStatistics;

import java.time.DayOfWeek;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.TextStyle;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;

/**
 * Detects values that break their own recurring cycle, even when they look normal globally.
 *
 * <p>Two tiers of cyclical baseline are learned from the series itself:
 * <ul>
 *   <li><b>Daily</b> : grouped by hour-of-day, groups need ≥ {@value #MIN_DAILY_OBSERVATIONS}
 *       observations; runs when the series has ≥ {@value #MIN_DAILY_POINTS} points.
 *       Confidence {@value #DAILY_CONFIDENCE}.</li>
 *   <li><b>Weekly</b>: grouped by (day-of-week, hour-of-day), groups need
 *       ≥ {@value #MIN_WEEKLY_OBSERVATIONS} observations; runs when the series has
 *       ≥ {@value #MIN_WEEKLY_POINTS} points. Confidence {@value #WEEKLY_CONFIDENCE}.</li>
 * </ul>
 * A point whose group has non-zero std and {@code z > 3} is reported as
 * {@link AnomalyType#PATTERN_BREAK} with {@code severity = min(z / 5, 1.0)}.
 *
 * <p>Hours and days are taken in the configured zone (UTC by default).
 * Weekly findings carry {@code metadata.day} as a weekday index, 0 = Monday through 6 = Sunday.
 */
public class PatternBreakDetector implements AnomalyDetector {

    static final int    MIN_DAILY_POINTS        = 48;
    static final int    MIN_WEEKLY_POINTS       = 168;
    static final int    MIN_DAILY_OBSERVATIONS  = 2;
    static final int    MIN_WEEKLY_OBSERVATIONS = 3;
    static final double Z_THRESHOLD             = 3.0;
    static final double SEVERITY_SCALE          = 5.0;
    static final double DAILY_CONFIDENCE        = 0.65;
    static final double WEEKLY_CONFIDENCE       = 0.6;

    private final ZoneId zone;

    public PatternBreakDetector() {
        this(ZoneOffset.UTC);
    }

    public PatternBreakDetector(ZoneId zone) {
        if (zone == null) throw new IllegalArgumentException("zone must not be null");
        this.zone = zone;
    }

    @Override
    public String detectorName() { return "PatternBreakDetector"; }

    @Override
    public List<Anomaly> detect(MetricSeries series) {
        AnomalyDetector.requirePoints(detectorName(), series);
        List<Anomaly> anomalies = new ArrayList<>();
        if (series.size() < MIN_DAILY_POINTS) {
            return anomalies;
        }

        anomalies.addAll(detectDailyBreaks(series));
        if (series.size() >= MIN_WEEKLY_POINTS) {
            anomalies.addAll(detectWeeklyBreaks(series));
        }
        return anomalies;
    }

    List<Anomaly> detectDailyBreaks(MetricSeries series) {
        return detectBreaks(series,
            point -> new CycleSlot(null, localTime(point).getHour()),
            MIN_DAILY_OBSERVATIONS,
            DAILY_CONFIDENCE,
            "daily_pattern");
    }

    List<Anomaly> detectWeeklyBreaks(MetricSeries series) {
        return detectBreaks(series,
            point -> {
                ZonedDateTime local = localTime(point);
                return new CycleSlot(local.getDayOfWeek(), local.getHour());
            },
            MIN_WEEKLY_OBSERVATIONS,
            WEEKLY_CONFIDENCE,
            "weekly_pattern");
    }

    private List<Anomaly> detectBreaks(MetricSeries series,
                                       Function<MetricPoint, CycleSlot> slotOf,
                                       int minObservations,
                                       double confidence,
                                       String method) {
        // ── learn baseline per slot ────────────────────────────────────────
        Map<CycleSlot, List<Double>> grouped = new HashMap<>();
        for (MetricPoint point : series.points()) {
            grouped.computeIfAbsent(slotOf.apply(point), k -> new ArrayList<>()).add(point.value());
        }

        Map<CycleSlot, double[]> baselines = new HashMap<>();
        grouped.forEach((slot, values) -> {
            if (values.size() >= minObservations) {
                baselines.put(slot, new double[] {
                    SeriesStatistics.mean(values), SeriesStatistics.sampleStdDev(values) });
            }
        });

        // ── score every point against its own slot ─────────────────────────
        List<Anomaly> anomalies = new ArrayList<>();
        for (MetricPoint point : series.points()) {
            CycleSlot slot = slotOf.apply(point);
            double[] baseline = baselines.get(slot);
            if (baseline == null || baseline[1] <= 0) continue;

            double zScore = Math.abs(point.value() - baseline[0]) / baseline[1];
            if (zScore <= Z_THRESHOLD) continue;

            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put(Anomaly.METHOD_KEY, method);
            if (slot.day() != null) metadata.put("day", slot.day().getValue() - 1);
            metadata.put("hour", slot.hour());
            metadata.put("z_score", zScore);

            anomalies.add(Anomaly.of(series.metricType(), AnomalyType.PATTERN_BREAK, point.timestamp(),
                Math.min(zScore / SEVERITY_SCALE, 1.0), baseline[0], point.value(), confidence,
                slot.describe(), metadata));
        }
        return anomalies;
    }

    private ZonedDateTime localTime(MetricPoint point) {
        return point.timestamp().atZone(zone);
    }

    /** Grouping key; {@code day} is null for the daily tier. */
    private record CycleSlot(DayOfWeek day, int hour) {

        String describe() {
            if (day == null) {
                return "Breaks expected daily pattern for hour " + hour;
            }
            return String.format("Breaks weekly pattern for %s %02d:00",
                day.getDisplayName(TextStyle.SHORT, Locale.ENGLISH), hour);
        }
    }
}
