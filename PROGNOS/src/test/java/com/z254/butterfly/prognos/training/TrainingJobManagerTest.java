package com.z254.butterfly.prognos.training;

import com.z254.butterfly.prognos.EngineFixtures;
import com.z254.butterfly.prognos.config.PrognosProperties;
import com.z254.butterfly.prognos.domain.model.ModelConfig;
import com.z254.butterfly.prognos.domain.model.ModelKind;
import com.z254.butterfly.prognos.domain.model.PerformanceMetrics;
import com.z254.butterfly.prognos.domain.model.TrainingJob;
import com.z254.butterfly.prognos.domain.model.TrainingOptions;
import com.z254.butterfly.prognos.domain.model.TrainingStatus;
import com.z254.butterfly.prognos.domain.repository.InMemoryModelRegistry;
import com.z254.butterfly.prognos.domain.repository.InMemoryTrainingJobRepository;
import com.z254.butterfly.prognos.domain.repository.ModelRegistry;
import com.z254.butterfly.prognos.exception.ModelNotFoundException;
import com.z254.butterfly.prognos.exception.TrainingFailureException;
import com.z254.butterfly.prognos.observability.PrognosMetrics;
import com.z254.butterfly.prognos.observability.PrognosStructuredLogger;
import com.z254.butterfly.prognos.telemetry.TelemetryBuffer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;

import static com.z254.butterfly.prognos.EngineFixtures.NOW;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TrainingJobManagerTest {

    private static final String MODEL_ID = "error_rate_holt";

    @Mock
    private ModelTrainer trainer;

    private ModelRegistry registry;
    private InMemoryTrainingJobRepository jobs;
    private TelemetryBuffer buffer;
    private DegradationMonitor degradationMonitor;
    private PrognosMetrics metrics;
    private TrainingJobManager manager;

    @BeforeEach
    void setUp() {
        PrognosProperties properties = EngineFixtures.properties();
        registry = new InMemoryModelRegistry();
        registry.upsert(EngineFixtures.model(MODEL_ID, ModelKind.REGRESSION, 0.8));
        jobs = new InMemoryTrainingJobRepository();
        buffer = new TelemetryBuffer(1_000);
        degradationMonitor = new DegradationMonitor(properties);
        metrics = new PrognosMetrics(new SimpleMeterRegistry());
        manager = new TrainingJobManager(registry, jobs, trainer, buffer, degradationMonitor, metrics,
                new PrognosStructuredLogger(), EngineFixtures.immediateSchedulers(), EngineFixtures.fixedClock());
    }

    private static PerformanceMetrics performance(double accuracy) {
        return PerformanceMetrics.builder()
                .accuracy(accuracy)
                .precision(accuracy)
                .recall(accuracy)
                .f1Score(accuracy)
                .build();
    }

    @Nested
    @DisplayName("Submission")
    class SubmissionTests {

        @Test
        @DisplayName("a successful job should swap in a new model version")
        void successSwapsConfig() {
            when(trainer.train(any(), anyList(), anyDouble(), any())).thenAnswer(inv -> {
                ModelTrainer.ProgressListener progress = inv.getArgument(3);
                progress.onProgress(6, 12);
                return performance(0.93);
            });

            String jobId = manager.submit(MODEL_ID, EngineFixtures.steadySeries(60), null);

            TrainingJob job = manager.getJob(jobId).orElseThrow();
            assertThat(jobId).startsWith("job_" + NOW.toEpochMilli() + "_");
            assertThat(job.getStatus()).isEqualTo(TrainingStatus.COMPLETED);
            assertThat(job.getProgress()).isEqualTo(100.0);
            assertThat(job.getSamplesProcessed()).isEqualTo(6);
            assertThat(job.getTotalSamples()).isEqualTo(60);
            assertThat(job.getTrigger()).isEqualTo("MANUAL");

            ModelConfig swapped = registry.get(MODEL_ID).orElseThrow();
            assertThat(swapped.getVersion()).isEqualTo(2);
            assertThat(swapped.accuracy()).isEqualTo(0.93);
            assertThat(swapped.getLastTrained()).isEqualTo(NOW);
            assertThat(swapped.getNextRetraining()).isEqualTo(NOW.plus(Duration.ofHours(24)));
            assertThat(metrics.getTrainingJobsCompleted().count()).isEqualTo(1.0);
            assertThat(manager.hasActiveJob(MODEL_ID)).isFalse();
        }

        @Test
        @DisplayName("a failed job should leave the registered configuration untouched")
        void failureKeepsConfig() {
            ModelConfig before = registry.get(MODEL_ID).orElseThrow();
            when(trainer.train(any(), anyList(), anyDouble(), any()))
                    .thenThrow(new TrainingFailureException("Insufficient training data"));

            String jobId = manager.submit(MODEL_ID, List.of(), null);

            TrainingJob job = manager.getJob(jobId).orElseThrow();
            assertThat(job.getStatus()).isEqualTo(TrainingStatus.FAILED);
            assertThat(job.getErrorMessage()).contains("Insufficient training data");
            assertThat(registry.get(MODEL_ID)).contains(before);
            assertThat(metrics.getTrainingJobsFailed().count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("the validation split option should override the model's split")
        void validationSplitOverride() {
            when(trainer.train(any(), anyList(), eq(0.3), any())).thenReturn(performance(0.9));

            String jobId = manager.submit(MODEL_ID, EngineFixtures.steadySeries(20),
                    TrainingOptions.builder().validationSplit(0.3).build());

            assertThat(manager.getJob(jobId)).get()
                    .extracting(TrainingJob::getStatus).isEqualTo(TrainingStatus.COMPLETED);
        }

        @Test
        @DisplayName("without explicit data the buffered history should be used")
        void trainsOnBuffer() {
            EngineFixtures.steadySeries(40).forEach(buffer::append);
            when(trainer.train(any(), anyList(), anyDouble(), any())).thenAnswer(inv -> {
                List<?> data = inv.getArgument(1);
                assertThat(data).hasSize(40);
                return performance(0.9);
            });

            String jobId = manager.submit(MODEL_ID, null, null);

            assertThat(manager.getJob(jobId)).get()
                    .extracting(TrainingJob::getStatus).isEqualTo(TrainingStatus.COMPLETED);
        }

        @Test
        @DisplayName("an unknown model should be rejected before a job is created")
        void unknownModel() {
            assertThatThrownBy(() -> manager.submit("nope", List.of(), null))
                    .isInstanceOf(ModelNotFoundException.class);
            assertThat(jobs.findAll()).isEmpty();
            verify(trainer, never()).train(any(), anyList(), anyDouble(), any());
        }
    }

    @Nested
    @DisplayName("Retraining checks")
    class RetrainingTests {

        @Test
        @DisplayName("a degraded model should be retrained with a DEGRADED trigger")
        void degraded() {
            when(trainer.train(any(), anyList(), anyDouble(), any())).thenReturn(performance(0.9));
            for (int i = 0; i < 3; i++) {
                degradationMonitor.record(MODEL_ID, 0.4);
            }

            List<String> submitted = manager.checkRetraining();

            assertThat(submitted).singleElement()
                    .satisfies(id -> assertThat(manager.getJob(id)).get()
                            .extracting(TrainingJob::getTrigger).isEqualTo("DEGRADED"));
            assertThat(degradationMonitor.observationCount(MODEL_ID)).isZero();
        }

        @Test
        @DisplayName("an elapsed schedule should be retrained with a SCHEDULED trigger")
        void scheduled() {
            when(trainer.train(any(), anyList(), anyDouble(), any())).thenReturn(performance(0.9));
            registry.update(MODEL_ID, config -> config.toBuilder().nextRetraining(NOW.minusSeconds(1)).build());

            List<String> submitted = manager.checkRetraining();

            assertThat(submitted).singleElement()
                    .satisfies(id -> assertThat(manager.getJob(id)).get()
                            .extracting(TrainingJob::getTrigger).isEqualTo("SCHEDULED"));
        }

        @Test
        @DisplayName("healthy, inactive or busy models should be skipped")
        void skipped() {
            registry.upsert(EngineFixtures.model("inactive", ModelKind.ANOMALY, 0.2).toBuilder()
                    .active(false).nextRetraining(NOW.minusSeconds(1)).build());
            registry.upsert(EngineFixtures.model("busy", ModelKind.ANOMALY, 0.8).toBuilder()
                    .nextRetraining(NOW.minusSeconds(1)).build());
            jobs.save(TrainingJob.builder().jobId("job_busy").modelId("busy")
                    .status(TrainingStatus.RUNNING).submittedAt(NOW).build());

            assertThat(manager.checkRetraining()).isEmpty();
            verify(trainer, never()).train(any(), anyList(), anyDouble(), any());
        }
    }
}
