package com.anomalyplatform.engine.controller;

import com.anomalyplatform.common.filter.AnomalyFilter;
import com.anomalyplatform.common.model.Anomaly;
import com.anomalyplatform.common.model.AnomalyType;
import com.anomalyplatform.common.model.MetricType;
import com.anomalyplatform.engine.dto.AnomalyDetectionRequest;
import com.anomalyplatform.engine.service.EnsembleCoordinator;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.List;

@RestController
@RequestMapping("/api/v1/anomalies")
public class AnomalyController {

    private final EnsembleCoordinator coordinator;
    private final Clock clock;

    public AnomalyController(EnsembleCoordinator coordinator, Clock clock) {
        this.coordinator = coordinator;
        this.clock = clock;
    }

    @PostMapping("/detect")
    public Mono<ResponseEntity<List<Anomaly>>> detect(
            @RequestBody AnomalyDetectionRequest request,
            @RequestParam(name = "metricType", required = false) MetricType metricType,
            @RequestParam(name = "anomalyType", required = false) AnomalyType anomalyType,
            @RequestParam(name = "minSeverity", required = false) Double minSeverity,
            @RequestParam(name = "hours", required = false) Integer hours) {
        AnomalyFilter filter = new AnomalyFilter(metricType, anomalyType, minSeverity, hours);
        Mono<List<Anomaly>> detected = request.sensitivity() != null
            ? coordinator.detectAnomalies(request.toMetricMap(), request.sensitivity())
            : coordinator.detectAnomalies(request.toMetricMap());
        return detected
            .map(anomalies -> filter.apply(anomalies, clock.instant()))
            .map(ResponseEntity::ok);
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }
}
