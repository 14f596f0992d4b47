package com.z254.butterfly.prognos.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.Getter;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Centralized metrics for the PROGNOS engine.
 * <p>
 * Provides metrics for:
 * <ul>
 *     <li>Telemetry ingestion and buffer occupancy</li>
 *     <li>Prediction cycles, cache effectiveness and model failures</li>
 *     <li>Anomaly detection and detector failures</li>
 *     <li>Strategy selection and execution</li>
 *     <li>Training jobs and periodic loops</li>
 * </ul>
 */
@Component
public class PrognosMetrics {

    private final MeterRegistry meterRegistry;

    // Telemetry metrics
    @Getter
    private final Counter dataPointsIngested;
    @Getter
    private final Counter dataPointsEvicted;
    @Getter
    private final Counter dataPointsRejected;
    private final AtomicInteger bufferSize;

    // Prediction metrics
    @Getter
    private final Counter predictionsGenerated;
    @Getter
    private final Counter predictionsFailed;
    @Getter
    private final Counter cacheHits;
    @Getter
    private final Counter cacheMisses;
    @Getter
    private final Counter cacheErrors;
    @Getter
    private final Counter criticalAlerts;
    private final Timer predictionLatency;
    private final DistributionSummary predictionConfidence;
    private final Map<String, Counter> modelFailuresByModel = new ConcurrentHashMap<>();

    // Anomaly metrics
    @Getter
    private final Counter anomalyScans;
    private final Map<String, Counter> anomaliesBySeverity = new ConcurrentHashMap<>();
    private final Map<String, Counter> detectorFailuresByAlgorithm = new ConcurrentHashMap<>();

    // Strategy metrics
    @Getter
    private final Counter strategiesSelected;
    @Getter
    private final Counter strategiesExecuted;
    @Getter
    private final Counter strategyExecutionsFailed;

    // Training metrics
    @Getter
    private final Counter trainingJobsSubmitted;
    @Getter
    private final Counter trainingJobsCompleted;
    @Getter
    private final Counter trainingJobsFailed;
    private final Timer trainingDuration;
    private final AtomicInteger activeTrainingJobs;

    // Loop metrics
    private final Map<String, Counter> loopCounters = new ConcurrentHashMap<>();

    public PrognosMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.dataPointsIngested = Counter.builder("prognos.telemetry.ingested")
                .description("Telemetry data points ingested")
                .register(meterRegistry);
        this.dataPointsEvicted = Counter.builder("prognos.telemetry.evicted")
                .description("Telemetry data points evicted from the buffer")
                .register(meterRegistry);
        this.dataPointsRejected = Counter.builder("prognos.telemetry.rejected")
                .description("Malformed telemetry data points refused at ingestion")
                .register(meterRegistry);
        this.bufferSize = meterRegistry.gauge("prognos.telemetry.buffer.size", new AtomicInteger(0));

        this.predictionsGenerated = Counter.builder("prognos.predictions.generated")
                .description("Prediction cycles completed")
                .register(meterRegistry);
        this.predictionsFailed = Counter.builder("prognos.predictions.failed")
                .description("Prediction cycles failed")
                .register(meterRegistry);
        this.cacheHits = Counter.builder("prognos.cache.hits")
                .description("Prediction cache hits")
                .register(meterRegistry);
        this.cacheMisses = Counter.builder("prognos.cache.misses")
                .description("Prediction cache misses")
                .register(meterRegistry);
        this.cacheErrors = Counter.builder("prognos.cache.errors")
                .description("Prediction cache read or write failures")
                .register(meterRegistry);
        this.criticalAlerts = Counter.builder("prognos.alerts.critical")
                .description("Critical prediction alerts published")
                .register(meterRegistry);
        this.predictionLatency = Timer.builder("prognos.predictions.latency")
                .description("End-to-end prediction cycle latency")
                .publishPercentiles(0.5, 0.75, 0.95, 0.99)
                .register(meterRegistry);
        this.predictionConfidence = DistributionSummary.builder("prognos.predictions.confidence")
                .description("Ensemble confidence scores")
                .publishPercentiles(0.5, 0.75, 0.95)
                .register(meterRegistry);

        this.anomalyScans = Counter.builder("prognos.anomalies.scans")
                .description("Anomaly fusion scans executed")
                .register(meterRegistry);

        this.strategiesSelected = Counter.builder("prognos.strategies.selected")
                .description("Prevention strategies recommended")
                .register(meterRegistry);
        this.strategiesExecuted = Counter.builder("prognos.strategies.executed")
                .description("Prevention strategies executed")
                .register(meterRegistry);
        this.strategyExecutionsFailed = Counter.builder("prognos.strategies.failed")
                .description("Prevention strategy executions that failed")
                .register(meterRegistry);

        this.trainingJobsSubmitted = Counter.builder("prognos.training.submitted")
                .description("Training jobs submitted")
                .register(meterRegistry);
        this.trainingJobsCompleted = Counter.builder("prognos.training.completed")
                .description("Training jobs completed")
                .register(meterRegistry);
        this.trainingJobsFailed = Counter.builder("prognos.training.failed")
                .description("Training jobs failed")
                .register(meterRegistry);
        this.trainingDuration = Timer.builder("prognos.training.duration")
                .description("Training job duration")
                .register(meterRegistry);
        this.activeTrainingJobs = meterRegistry.gauge("prognos.training.active", new AtomicInteger(0));
    }

    // ========== Telemetry Methods ==========

    public void recordDataPointIngested(int currentBufferSize, boolean evicted) {
        dataPointsIngested.increment();
        if (evicted) {
            dataPointsEvicted.increment();
        }
        bufferSize.set(currentBufferSize);
    }

    public void recordDataPointRejected() {
        dataPointsRejected.increment();
    }

    // ========== Prediction Methods ==========

    public Timer.Sample startPredictionTimer() {
        return Timer.start(meterRegistry);
    }

    public void recordPredictionCompleted(Timer.Sample sample, double confidence) {
        sample.stop(predictionLatency);
        predictionsGenerated.increment();
        predictionConfidence.record(confidence);
    }

    public void recordPredictionFailed(Timer.Sample sample) {
        sample.stop(predictionLatency);
        predictionsFailed.increment();
    }

    public void recordCacheHit() {
        cacheHits.increment();
    }

    public void recordCacheMiss() {
        cacheMisses.increment();
    }

    public void recordCacheError() {
        cacheErrors.increment();
    }

    public void recordCriticalAlert() {
        criticalAlerts.increment();
    }

    public void recordModelFailure(String modelId) {
        modelFailuresByModel.computeIfAbsent(modelId, id ->
                Counter.builder("prognos.models.failures")
                        .tag("model", id)
                        .description("Model inference failures or timeouts")
                        .register(meterRegistry)).increment();
    }

    // ========== Anomaly Methods ==========

    public void recordAnomalyScan() {
        anomalyScans.increment();
    }

    public void recordAnomaly(String severity) {
        anomaliesBySeverity.computeIfAbsent(severity, s ->
                Counter.builder("prognos.anomalies.detected")
                        .tag("severity", s)
                        .description("Anomalies retained after fusion")
                        .register(meterRegistry)).increment();
    }

    public void recordDetectorFailure(String algorithm) {
        detectorFailuresByAlgorithm.computeIfAbsent(algorithm, a ->
                Counter.builder("prognos.anomalies.detector.failures")
                        .tag("algorithm", a)
                        .description("Detector failures or timeouts")
                        .register(meterRegistry)).increment();
    }

    // ========== Strategy Methods ==========

    public void recordStrategiesSelected(int count) {
        strategiesSelected.increment(count);
    }

    public void recordStrategyExecuted(boolean success) {
        strategiesExecuted.increment();
        if (!success) {
            strategyExecutionsFailed.increment();
        }
    }

    // ========== Training Methods ==========

    public void recordTrainingSubmitted() {
        trainingJobsSubmitted.increment();
    }

    public Timer.Sample startTrainingTimer() {
        activeTrainingJobs.incrementAndGet();
        return Timer.start(meterRegistry);
    }

    public void recordTrainingCompleted(Timer.Sample sample) {
        sample.stop(trainingDuration);
        trainingJobsCompleted.increment();
        activeTrainingJobs.decrementAndGet();
    }

    public void recordTrainingFailed(Timer.Sample sample) {
        if (sample != null) {
            sample.stop(trainingDuration);
            activeTrainingJobs.decrementAndGet();
        }
        trainingJobsFailed.increment();
    }

    // ========== Loop Methods ==========

    public void recordLoopIteration(String loop, String outcome) {
        loopCounters.computeIfAbsent(loop + ":" + outcome, key ->
                Counter.builder("prognos.loops.iterations")
                        .tag("loop", loop)
                        .tag("outcome", outcome)
                        .description("Periodic loop iterations by outcome")
                        .register(meterRegistry)).increment();
    }
}
