package com.z254.butterfly.prognos.scheduling;

import com.z254.butterfly.prognos.config.PrognosProperties;
import com.z254.butterfly.prognos.domain.model.AnomalyDetectionResult;
import com.z254.butterfly.prognos.domain.model.PredictionConfidence;
import com.z254.butterfly.prognos.domain.model.PredictionOptions;
import com.z254.butterfly.prognos.domain.model.PredictionResult;
import com.z254.butterfly.prognos.domain.model.PredictionWindow;
import com.z254.butterfly.prognos.domain.model.PreventionStrategy;
import com.z254.butterfly.prognos.domain.model.StrategyExecutionContext;
import com.z254.butterfly.prognos.event.EventBus;
import com.z254.butterfly.prognos.event.EventTopics;
import com.z254.butterfly.prognos.observability.PrognosMetrics;
import com.z254.butterfly.prognos.observability.PrognosStructuredLogger;
import com.z254.butterfly.prognos.observability.PrognosStructuredLogger.AnomalyEventType;
import com.z254.butterfly.prognos.observability.PrognosStructuredLogger.PredictionEventType;
import com.z254.butterfly.prognos.observability.PrognosStructuredLogger.StrategyEventType;
import com.z254.butterfly.prognos.service.ErrorPredictionService;
import com.z254.butterfly.prognos.telemetry.TelemetryBuffer;
import com.z254.butterfly.prognos.training.PredictionAccuracyTracker;
import com.z254.butterfly.prognos.training.TrainingJobManager;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * The three background loops: prediction, anomaly scan and retraining check.
 */
@Slf4j
@Component
public class EngineLoops {

    public static final String PREDICTION_LOOP = "prediction";
    public static final String ANOMALY_LOOP = "anomaly-scan";
    public static final String RETRAINING_LOOP = "retraining-check";

    private final LoopScheduler loopScheduler;
    private final ErrorPredictionService predictionService;
    private final TrainingJobManager trainingJobManager;
    private final PredictionAccuracyTracker accuracyTracker;
    private final TelemetryBuffer buffer;
    private final EventBus eventBus;
    private final PrognosMetrics metrics;
    private final PrognosStructuredLogger structuredLogger;
    private final PrognosProperties properties;
    private final Clock clock;
    private final List<LoopHandle> handles = new ArrayList<>();

    public EngineLoops(LoopScheduler loopScheduler,
                       ErrorPredictionService predictionService,
                       TrainingJobManager trainingJobManager,
                       PredictionAccuracyTracker accuracyTracker,
                       TelemetryBuffer buffer,
                       EventBus eventBus,
                       PrognosMetrics metrics,
                       PrognosStructuredLogger structuredLogger,
                       PrognosProperties properties,
                       Clock clock) {
        this.loopScheduler = loopScheduler;
        this.predictionService = predictionService;
        this.trainingJobManager = trainingJobManager;
        this.accuracyTracker = accuracyTracker;
        this.buffer = buffer;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.structuredLogger = structuredLogger;
        this.properties = properties;
        this.clock = clock;
    }

    @PostConstruct
    public void start() {
        PrognosProperties.Loops loops = properties.getLoops();
        if (!loops.isEnabled()) {
            log.info("Engine loops disabled");
            return;
        }
        handles.add(loopScheduler.schedule(PREDICTION_LOOP, loops.getPrediction().getInterval(),
                loops.getPrediction().effectiveTimeout(), this::predictionCycle));
        handles.add(loopScheduler.schedule(ANOMALY_LOOP, loops.getAnomaly().getInterval(),
                loops.getAnomaly().effectiveTimeout(), this::anomalyScan));
        handles.add(loopScheduler.schedule(RETRAINING_LOOP, loops.getRetraining().getInterval(),
                loops.getRetraining().effectiveTimeout(), this::retrainingCheck));
    }

    @PreDestroy
    public void stop() {
        handles.forEach(LoopHandle::stop);
        handles.clear();
    }

    public List<LoopHandle> handles() {
        return List.copyOf(handles);
    }

    /**
     * Predict the next horizon and escalate critical business impact.
     */
    Mono<Void> predictionCycle() {
        if (buffer.size() < properties.getFeatures().getMinSamples()) {
            log.debug("Prediction loop idle: {} buffered samples", buffer.size());
            return Mono.empty();
        }
        PredictionWindow window = PredictionWindow.starting(clock.instant(),
                properties.getPrediction().getLoopHorizon());
        return predictionService.generatePredictions(window, null, PredictionOptions.defaults())
                .flatMap(this::escalate);
    }

    private Mono<Void> escalate(PredictionResult result) {
        if (!predictionService.isCriticalImpact(result)) {
            return Mono.empty();
        }
        metrics.recordCriticalAlert();
        eventBus.publish(EventTopics.CRITICAL_PREDICTION_ALERT, result);
        var impact = result.getPredictions().getBusinessImpact();
        structuredLogger.logPredictionEvent(result.getPredictionId(), PredictionEventType.CRITICAL_ALERT,
                "Critical business impact predicted", Map.of(
                        "businessImpact", impact.getLevel().name(),
                        "revenueAtRisk", impact.getRevenueAtRisk(),
                        "confidence", impact.getConfidence() != null ? impact.getConfidence().name() : "NONE"));

        if (impact.getConfidence() == null || !impact.getConfidence().isAtLeast(PredictionConfidence.HIGH)) {
            return Mono.empty();
        }
        return Flux.fromIterable(result.getPreventionStrategies())
                .filter(PreventionStrategy::isAutoExecutable)
                .concatMap(strategy -> predictionService.executePreventionStrategy(strategy.getStrategyId(),
                                StrategyExecutionContext.builder()
                                        .triggeredBy("prediction-loop")
                                        .businessImpact(impact.getLevel())
                                        .predictionId(result.getPredictionId())
                                        .build())
                        .doOnNext(outcome -> structuredLogger.logStrategyEvent(strategy.getStrategyId(),
                                StrategyEventType.AUTO_EXECUTED, "Auto-executed prevention strategy",
                                Map.of("success", outcome.isSuccess()))))
                .then();
    }

    /**
     * Scan the most recent samples and publish what the detectors found.
     */
    Mono<Void> anomalyScan() {
        PrognosProperties.Loops loops = properties.getLoops();
        if (buffer.size() < loops.getAnomalyMinSamples()) {
            structuredLogger.logAnomalyEvent(AnomalyEventType.SCAN_SKIPPED, "Not enough samples for anomaly scan",
                    Map.of("buffered", buffer.size(), "required", loops.getAnomalyMinSamples()));
            return Mono.empty();
        }
        structuredLogger.logAnomalyEvent(AnomalyEventType.SCAN_STARTED, "Anomaly scan started",
                Map.of("samples", loops.getAnomalyScanSize()));
        return predictionService.detectAnomalies(buffer.latest(loops.getAnomalyScanSize()))
                .doOnNext(this::publishAnomalies)
                .then();
    }

    private void publishAnomalies(List<AnomalyDetectionResult> anomalies) {
        if (anomalies.isEmpty()) {
            return;
        }
        eventBus.publish(EventTopics.ANOMALIES_DETECTED, anomalies);
        structuredLogger.logAnomalyEvent(AnomalyEventType.DETECTED, "Anomalies detected",
                Map.of("count", anomalies.size()));
        anomalies.stream()
                .filter(AnomalyDetectionResult::isCritical)
                .forEach(anomaly -> {
                    eventBus.publish(EventTopics.CRITICAL_ANOMALY, anomaly);
                    structuredLogger.logAnomalyEvent(AnomalyEventType.CRITICAL_ANOMALY, anomaly.getDescription(),
                            Map.of("anomalyId", anomaly.getAnomalyId(), "score", anomaly.getAnomalyScore()));
                });
    }

    /**
     * Score elapsed predictions, then submit retraining where it is due or accuracy degraded.
     */
    Mono<Void> retrainingCheck() {
        return Mono.fromRunnable(() -> {
            try (var scope = structuredLogger.withLoop(RETRAINING_LOOP)) {
                int scored = accuracyTracker.evaluate(buffer.snapshot(), clock.instant());
                List<String> jobs = trainingJobManager.checkRetraining();
                if (scored > 0 || !jobs.isEmpty()) {
                    log.info("Retraining check scored {} predictions and submitted {} jobs", scored, jobs.size());
                }
            }
        });
    }
}
