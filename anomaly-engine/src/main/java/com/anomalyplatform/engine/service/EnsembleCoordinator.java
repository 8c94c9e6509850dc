package com.anomalyplatform.engine.service;

import com.anomalyplatform.common.detector.AnomalyDetector;
import com.anomalyplatform.common.ensemble.AnomalyMergeStrategy;
import com.anomalyplatform.common.ensemble.AnomalyRanking;
import com.anomalyplatform.common.ensemble.ConfidenceCalibrator;
import com.anomalyplatform.common.model.Anomaly;
import com.anomalyplatform.common.model.MetricSeries;
import com.anomalyplatform.common.model.MetricType;
import com.anomalyplatform.common.trace.RequestContextUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Runs every configured detector over every requested metric and folds the findings into one
 * ranked, de-duplicated list.
 *
 * <p>One task per metric is dispatched onto {@code detectionScheduler} and all tasks are awaited
 * together. Inside a task the detectors run sequentially. A failing detector only loses its own
 * candidates; a failing metric task only loses that metric; a failing merge yields an empty result.
 * Nothing but cancellation reaches the caller.
 */
@Service
public class EnsembleCoordinator {

    private static final Logger log = LoggerFactory.getLogger(EnsembleCoordinator.class);

    private final List<AnomalyDetector> detectors;
    private final AnomalyMergeStrategy mergeStrategy;
    private final Scheduler detectionScheduler;

    @Value("${anomaly.ensemble.default-sensitivity:1.0}")
    private double defaultSensitivity = ConfidenceCalibrator.DEFAULT_SENSITIVITY;

    @Autowired
    public EnsembleCoordinator(List<AnomalyDetector> detectors, AnomalyMergeStrategy mergeStrategy) {
        this(detectors, mergeStrategy, Schedulers.parallel());
    }

    public EnsembleCoordinator(List<AnomalyDetector> detectors, AnomalyMergeStrategy mergeStrategy,
                               Scheduler detectionScheduler) {
        this.detectors          = List.copyOf(detectors);
        this.mergeStrategy      = mergeStrategy;
        this.detectionScheduler = detectionScheduler;
    }

    public Mono<List<Anomaly>> detectAnomalies(Map<MetricType, MetricSeries> metrics) {
        return detectAnomalies(metrics, defaultSensitivity);
    }

    /**
     * @param metrics     series to scan, keyed by metric; iteration order drives tie-breaking in merges
     * @param sensitivity multiplier applied to every candidate's confidence before merging
     * @return merged anomalies ranked by severity then recency; empty when nothing was found
     */
    public Mono<List<Anomaly>> detectAnomalies(Map<MetricType, MetricSeries> metrics, double sensitivity) {
        if (metrics == null || metrics.isEmpty()) {
            return Mono.just(List.of());
        }
        String requestId = UUID.randomUUID().toString();
        List<Map.Entry<MetricType, MetricSeries>> entries = new ArrayList<>(metrics.entrySet());

        Mono<List<Anomaly>> pipeline = Mono.deferContextual(ctx -> {
            String id = RequestContextUtil.getRequestId(ctx);
            RequestContextUtil.withMdc(id, () ->
                log.info("Detection started. metrics={} detectors={} sensitivity={}",
                    entries.size(), detectors.size(), sensitivity));

            return Flux.fromIterable(entries)
                .flatMapSequential(entry -> Mono.fromCallable(() ->
                        detectMetric(entry.getKey(), entry.getValue(), sensitivity, id))
                    .subscribeOn(detectionScheduler)
                    .onErrorResume(e -> {
                        RequestContextUtil.withMdc(id, () ->
                            log.error("Metric task failed. metric={}", entry.getKey(), e));
                        return Mono.just(List.of());
                    }))
                .collectList()
                .map(this::mergeAndRank)
                .onErrorResume(e -> {
                    RequestContextUtil.withMdc(id, () ->
                        log.error("Merge and rank failed. metrics={}", entries.size(), e));
                    return Mono.just(List.of());
                })
                .doOnNext(result -> RequestContextUtil.withMdc(id, () ->
                    log.info("Detection complete. anomalies={}", result.size())));
        });
        return RequestContextUtil.withRequestId(pipeline, requestId);
    }

    /**
     * Blocking convenience for callers outside a reactive pipeline.
     */
    public List<Anomaly> detect(Map<MetricType, MetricSeries> metrics, double sensitivity) {
        List<Anomaly> result = detectAnomalies(metrics, sensitivity).block();
        return result != null ? result : List.of();
    }

    List<Anomaly> detectMetric(MetricType metricType, MetricSeries series, double sensitivity, String requestId) {
        List<Anomaly> candidates = new ArrayList<>();
        for (AnomalyDetector detector : detectors) {
            try {
                candidates.addAll(detector.detect(series));
            } catch (RuntimeException e) {
                RequestContextUtil.withMdc(requestId, () ->
                    log.error("Detector={} failed for metric={}", detector.detectorName(), metricType, e));
            }
        }

        RequestContextUtil.withMdc(requestId, () ->
            log.info("Metric scanned. metric={} candidates={}", metricType, candidates.size()));
        return ConfidenceCalibrator.applySensitivity(candidates, sensitivity);
    }

    private List<Anomaly> mergeAndRank(List<List<Anomaly>> perMetric) {
        List<Anomaly> all = new ArrayList<>();
        perMetric.forEach(all::addAll);
        return AnomalyRanking.rank(mergeStrategy.merge(all));
    }
}
