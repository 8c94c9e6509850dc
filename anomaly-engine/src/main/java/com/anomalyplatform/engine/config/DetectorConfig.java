package com.anomalyplatform.engine.config;

import com.anomalyplatform.common.detector.AnomalyDetector;
import com.anomalyplatform.common.detector.FrequencyDetector;
import com.anomalyplatform.common.detector.MovingAverageDetector;
import com.anomalyplatform.common.detector.PatternBreakDetector;
import com.anomalyplatform.common.detector.StatisticalDetector;
import com.anomalyplatform.common.ensemble.AnomalyMergeStrategy;
import com.anomalyplatform.common.ensemble.CorroborationMergeStrategy;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.annotation.Order;

import java.time.Clock;
import java.time.ZoneId;

@Configuration
public class DetectorConfig {

    @Value("${anomaly.detectors.statistical.z-threshold:3.0}")
    private double zThreshold;

    @Value("${anomaly.detectors.statistical.iqr-multiplier:1.5}")
    private double iqrMultiplier;

    @Value("${anomaly.detectors.moving-average.window-size:10}")
    private int windowSize;

    @Value("${anomaly.detectors.moving-average.deviation-multiplier:2.0}")
    private double deviationMultiplier;

    @Value("${anomaly.detectors.pattern-break.zone:UTC}")
    private String patternZone;

    @Value("${anomaly.detectors.frequency.window-minutes:60}")
    private int windowMinutes;

    @Bean
    @Order(1)
    public AnomalyDetector statisticalDetector() {
        return new StatisticalDetector(zThreshold, iqrMultiplier);
    }

    @Bean
    @Order(2)
    public AnomalyDetector movingAverageDetector() {
        return new MovingAverageDetector(windowSize, deviationMultiplier);
    }

    @Bean
    @Order(3)
    public AnomalyDetector patternBreakDetector() {
        return new PatternBreakDetector(ZoneId.of(patternZone));
    }

    @Bean
    @Order(4)
    public AnomalyDetector frequencyDetector() {
        return new FrequencyDetector(windowMinutes);
    }

    @Bean
    public AnomalyMergeStrategy anomalyMergeStrategy() {
        return new CorroborationMergeStrategy();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }
}
