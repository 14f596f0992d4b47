package com.z254.butterfly.prognos.anomaly;

import com.z254.butterfly.prognos.config.EngineSchedulers;
import com.z254.butterfly.prognos.config.PrognosProperties;
import com.z254.butterfly.prognos.domain.model.AnomalyAlgorithm;
import com.z254.butterfly.prognos.domain.model.AnomalyDetectionResult;
import com.z254.butterfly.prognos.exception.DetectorFailureException;
import com.z254.butterfly.prognos.feature.FeatureSet;
import com.z254.butterfly.prognos.observability.PrognosMetrics;
import com.z254.butterfly.prognos.observability.PrognosStructuredLogger;
import com.z254.butterfly.prognos.observability.PrognosStructuredLogger.AnomalyEventType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeoutException;

/**
 * Runs every enabled detector concurrently and fuses their results.
 * <p>
 * Fusion keeps results scoring strictly above the cutoff, keeps only the highest-scoring
 * result per (algorithm, affected metric), ranks by
 * {@code 0.4 * severityRank + 0.3 * score + 0.3 * businessImpactRank} and caps the list.
 * A detector that throws or misses its deadline is logged and left out of the scan.
 */
@Slf4j
@Component
public class AnomalyFusionEngine {

    private final List<AnomalyDetector> detectors;
    private final PrognosMetrics metrics;
    private final PrognosStructuredLogger structuredLogger;
    private final Scheduler scheduler;
    private final Duration deadline;
    private final double cutoff;
    private final int topN;

    public AnomalyFusionEngine(List<AnomalyDetector> detectors,
                               PrognosMetrics metrics,
                               PrognosStructuredLogger structuredLogger,
                               EngineSchedulers schedulers,
                               PrognosProperties properties) {
        this.detectors = detectors.stream().filter(AnomalyDetector::isEnabled).toList();
        this.metrics = metrics;
        this.structuredLogger = structuredLogger;
        this.scheduler = schedulers.getInference();
        this.deadline = properties.getAnomaly().getDetectorDeadline();
        this.cutoff = properties.getAnomaly().getFusionCutoff();
        this.topN = properties.getAnomaly().getTopN();
        log.info("Anomaly fusion initialized with detectors: {}",
                this.detectors.stream().map(AnomalyDetector::algorithm).toList());
    }

    public Mono<List<AnomalyDetectionResult>> detect(FeatureSet features) {
        metrics.recordAnomalyScan();
        return Flux.fromIterable(detectors)
                .flatMapSequential(detector -> runDetector(detector, features))
                .collectList()
                .map(perDetector -> {
                    List<AnomalyDetectionResult> all = new ArrayList<>();
                    perDetector.forEach(all::addAll);
                    List<AnomalyDetectionResult> fused = fuse(all);
                    fused.forEach(a -> metrics.recordAnomaly(a.getSeverity().name()));
                    return fused;
                });
    }

    private Mono<List<AnomalyDetectionResult>> runDetector(AnomalyDetector detector, FeatureSet features) {
        AnomalyAlgorithm algorithm = detector.algorithm();
        return Mono.fromCallable(() -> detector.detect(features))
                .subscribeOn(scheduler)
                .timeout(deadline)
                .onErrorResume(error -> {
                    DetectorFailureException failure = new DetectorFailureException(algorithm,
                            error instanceof TimeoutException
                                    ? new TimeoutException("exceeded deadline of " + deadline.toMillis() + "ms")
                                    : error);
                    metrics.recordDetectorFailure(algorithm.name());
                    structuredLogger.logAnomalyEvent(AnomalyEventType.DETECTOR_FAILED, failure.getMessage(),
                            Map.of("algorithm", algorithm.name()));
                    return Mono.just(List.of());
                });
    }

    /**
     * Filter, deduplicate and rank raw detector results.
     */
    public List<AnomalyDetectionResult> fuse(List<AnomalyDetectionResult> results) {
        List<AnomalyDetectionResult> candidates = results.stream()
                .filter(a -> a.getAnomalyScore() > cutoff)
                .sorted(Comparator.comparingDouble(AnomalyDetectionResult::getAnomalyScore).reversed())
                .toList();

        Set<String> claimed = new HashSet<>();
        List<AnomalyDetectionResult> deduplicated = new ArrayList<>();
        for (AnomalyDetectionResult candidate : candidates) {
            List<String> keys = candidate.getAffectedMetrics().stream()
                    .map(metric -> candidate.getAlgorithm() + "|" + metric)
                    .toList();
            if (keys.stream().anyMatch(claimed::contains)) {
                continue;
            }
            claimed.addAll(keys);
            deduplicated.add(candidate);
        }

        return deduplicated.stream()
                .sorted(Comparator.comparingDouble(AnomalyFusionEngine::rankScore).reversed())
                .limit(topN)
                .toList();
    }

    static double rankScore(AnomalyDetectionResult anomaly) {
        return 0.4 * anomaly.getSeverity().rank()
                + 0.3 * anomaly.getAnomalyScore()
                + 0.3 * anomaly.getBusinessImpact().rank();
    }
}
