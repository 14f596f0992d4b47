package com.z254.butterfly.prognos.training;

import com.z254.butterfly.prognos.config.EngineSchedulers;
import com.z254.butterfly.prognos.domain.model.ModelConfig;
import com.z254.butterfly.prognos.domain.model.PerformanceMetrics;
import com.z254.butterfly.prognos.domain.model.TelemetryDataPoint;
import com.z254.butterfly.prognos.domain.model.TrainingJob;
import com.z254.butterfly.prognos.domain.model.TrainingOptions;
import com.z254.butterfly.prognos.domain.model.TrainingStatus;
import com.z254.butterfly.prognos.domain.repository.ModelRegistry;
import com.z254.butterfly.prognos.domain.repository.TrainingJobRepository;
import com.z254.butterfly.prognos.exception.ModelNotFoundException;
import com.z254.butterfly.prognos.observability.PrognosMetrics;
import com.z254.butterfly.prognos.observability.PrognosStructuredLogger;
import com.z254.butterfly.prognos.observability.PrognosStructuredLogger.TrainingEventType;
import com.z254.butterfly.prognos.telemetry.TelemetryBuffer;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.UnaryOperator;

/**
 * Submits and runs (re)training jobs.
 * <p>
 * Jobs run on the training scheduler and never touch anything the prediction path locks.
 * A completed job swaps a rebuilt {@link ModelConfig} into the registry in one step; a
 * failed job leaves the registered configuration exactly as it was.
 */
@Slf4j
@Service
public class TrainingJobManager {

    private final ModelRegistry modelRegistry;
    private final TrainingJobRepository jobRepository;
    private final ModelTrainer trainer;
    private final TelemetryBuffer buffer;
    private final DegradationMonitor degradationMonitor;
    private final PrognosMetrics metrics;
    private final PrognosStructuredLogger structuredLogger;
    private final Scheduler scheduler;
    private final Clock clock;

    public TrainingJobManager(ModelRegistry modelRegistry,
                              TrainingJobRepository jobRepository,
                              ModelTrainer trainer,
                              TelemetryBuffer buffer,
                              DegradationMonitor degradationMonitor,
                              PrognosMetrics metrics,
                              PrognosStructuredLogger structuredLogger,
                              EngineSchedulers schedulers,
                              Clock clock) {
        this.modelRegistry = modelRegistry;
        this.jobRepository = jobRepository;
        this.trainer = trainer;
        this.buffer = buffer;
        this.degradationMonitor = degradationMonitor;
        this.metrics = metrics;
        this.structuredLogger = structuredLogger;
        this.scheduler = schedulers.getTraining();
        this.clock = clock;
    }

    /**
     * Submit a training job and start it asynchronously.
     *
     * @param data training data, or null to train on the buffered history
     * @return the job id
     * @throws ModelNotFoundException when no model is registered under {@code modelId}
     */
    public String submit(String modelId, List<TelemetryDataPoint> data, TrainingOptions options) {
        ModelConfig config = modelRegistry.get(modelId).orElseThrow(() -> new ModelNotFoundException(modelId));
        TrainingOptions effective = options != null ? options : TrainingOptions.defaults();

        TrainingJob job = jobRepository.save(TrainingJob.builder()
                .jobId("job_" + clock.millis() + "_" + UUID.randomUUID().toString().substring(0, 8))
                .modelId(modelId)
                .status(TrainingStatus.PENDING)
                .submittedAt(clock.instant())
                .trigger(effective.getTrigger())
                .build());
        metrics.recordTrainingSubmitted();
        structuredLogger.logTrainingEvent(job.getJobId(), modelId, TrainingEventType.SUBMITTED,
                "Training job submitted", Map.of("trigger", effective.getTrigger()));

        List<TelemetryDataPoint> snapshot = data != null ? List.copyOf(data) : null;
        double split = effective.getValidationSplit() != null
                ? effective.getValidationSplit() : config.getValidationSplit();

        Mono.fromRunnable(() -> run(job.getJobId(), modelId, snapshot, split))
                .subscribeOn(scheduler)
                .subscribe(
                        ignored -> { },
                        error -> log.error("Training job {} crashed outside its handler", job.getJobId(), error));
        return job.getJobId();
    }

    public Optional<TrainingJob> getJob(String jobId) {
        return jobRepository.findById(jobId);
    }

    public boolean hasActiveJob(String modelId) {
        return jobRepository.findByModelId(modelId).stream().anyMatch(TrainingJob::isActive);
    }

    /**
     * Submit retraining for every model whose schedule elapsed or whose observed accuracy
     * degraded, skipping models that already have a job in flight.
     *
     * @return ids of the submitted jobs
     */
    public List<String> checkRetraining() {
        Instant now = clock.instant();
        List<String> submitted = new ArrayList<>();
        for (ModelConfig config : modelRegistry.list()) {
            if (!config.isActive() || hasActiveJob(config.getModelId())) {
                continue;
            }
            String trigger = null;
            if (degradationMonitor.isDegraded(config.getModelId())) {
                trigger = "DEGRADED";
                structuredLogger.logTrainingEvent(null, config.getModelId(), TrainingEventType.DEGRADATION_DETECTED,
                        "Model accuracy degraded, scheduling retraining",
                        Map.of("rollingAccuracy", degradationMonitor.rollingAccuracy(config.getModelId()).orElse(0.0)));
            } else if (config.isRetrainDue(now)) {
                trigger = "SCHEDULED";
            }
            if (trigger != null) {
                submitted.add(submit(config.getModelId(), null,
                        TrainingOptions.builder().trigger(trigger).build()));
            }
        }
        return submitted;
    }

    void run(String jobId, String modelId, List<TelemetryDataPoint> data, double validationSplit) {
        Timer.Sample sample = null;
        try {
            TrainingJob running = transition(jobId, TrainingStatus.RUNNING,
                    builder -> builder.startedAt(clock.instant()));
            sample = metrics.startTrainingTimer();
            structuredLogger.logTrainingEvent(jobId, modelId, TrainingEventType.STARTED, "Training started",
                    Map.of("trigger", String.valueOf(running.getTrigger())));

            ModelConfig config = modelRegistry.get(modelId).orElseThrow(() -> new ModelNotFoundException(modelId));
            List<TelemetryDataPoint> trainingData = data != null ? data : trainingSlice(config);
            jobRepository.update(jobId, job -> job.toBuilder().totalSamples(trainingData.size()).build());

            PerformanceMetrics performance = trainer.train(config, trainingData, validationSplit,
                    (processed, total) -> jobRepository.update(jobId, job -> job.toBuilder()
                            .samplesProcessed(processed)
                            .progress(total > 0 ? 100.0 * processed / total : 0.0)
                            .build()));

            Instant completedAt = clock.instant();
            ModelConfig swapped = modelRegistry.update(modelId, current -> current.toBuilder()
                    .performance(performance.copy())
                    .lastTrained(completedAt)
                    .nextRetraining(completedAt.plus(current.getRetrainInterval()))
                    .build()).orElseThrow(() -> new ModelNotFoundException(modelId));
            degradationMonitor.reset(modelId);

            transition(jobId, TrainingStatus.COMPLETED, builder -> builder
                    .completedAt(completedAt)
                    .progress(100.0)
                    .performance(performance));
            metrics.recordTrainingCompleted(sample);
            structuredLogger.logTrainingEvent(jobId, modelId, TrainingEventType.MODEL_SWAPPED,
                    "Model configuration swapped in", Map.of(
                            "version", swapped.getVersion(),
                            "accuracy", performance.getAccuracy(),
                            "nextRetraining", String.valueOf(swapped.getNextRetraining())));
        } catch (Exception e) {
            fail(jobId, modelId, e, sample);
        }
    }

    private void fail(String jobId, String modelId, Exception error, Timer.Sample sample) {
        String message = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        try {
            transition(jobId, TrainingStatus.FAILED, builder -> builder
                    .completedAt(clock.instant())
                    .errorMessage(message));
        } catch (IllegalStateException e) {
            log.error("Training job {} could not be marked failed: {}", jobId, e.getMessage());
        }
        metrics.recordTrainingFailed(sample);
        structuredLogger.logTrainingEvent(jobId, modelId, TrainingEventType.FAILED,
                "Training failed, keeping previous model configuration", Map.of("error", message));
    }

    /**
     * Apply a one-directional status change.
     *
     * @throws IllegalStateException when the transition is not allowed from the current status
     */
    private TrainingJob transition(String jobId, TrainingStatus next,
                                   UnaryOperator<TrainingJob.TrainingJobBuilder> changes) {
        return jobRepository.update(jobId, current -> {
            if (!current.getStatus().canTransitionTo(next)) {
                throw new IllegalStateException(String.format("Illegal training transition %s -> %s for job %s",
                        current.getStatus(), next, jobId));
            }
            return changes.apply(current.toBuilder().status(next)).build();
        }).orElseThrow(() -> new IllegalStateException("Unknown training job: " + jobId));
    }

    /**
     * Buffered samples within the model's training window, measured back from the newest sample.
     */
    private List<TelemetryDataPoint> trainingSlice(ModelConfig config) {
        List<TelemetryDataPoint> snapshot = buffer.snapshot();
        if (snapshot.isEmpty()) {
            return snapshot;
        }
        Instant newest = snapshot.get(snapshot.size() - 1).getTimestamp();
        Instant cutoff = newest.minus(config.getTrainingWindow());
        return snapshot.stream().filter(p -> !p.getTimestamp().isBefore(cutoff)).toList();
    }
}
