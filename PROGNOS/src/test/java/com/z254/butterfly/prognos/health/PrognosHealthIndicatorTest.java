package com.z254.butterfly.prognos.health;

import com.github.benmanes.caffeine.cache.Caffeine;
import com.z254.butterfly.prognos.EngineFixtures;
import com.z254.butterfly.prognos.cache.PredictionCache;
import com.z254.butterfly.prognos.config.EngineSchedulers;
import com.z254.butterfly.prognos.config.PrognosProperties;
import com.z254.butterfly.prognos.domain.model.ModelKind;
import com.z254.butterfly.prognos.domain.model.PredictionResult;
import com.z254.butterfly.prognos.domain.repository.InMemoryModelRegistry;
import com.z254.butterfly.prognos.domain.repository.InMemoryTrainingJobRepository;
import com.z254.butterfly.prognos.observability.PrognosMetrics;
import com.z254.butterfly.prognos.scheduling.EngineLoops;
import com.z254.butterfly.prognos.scheduling.LoopHandle;
import com.z254.butterfly.prognos.scheduling.ReactorLoopScheduler;
import com.z254.butterfly.prognos.telemetry.TelemetryBuffer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.actuate.health.Status;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import reactor.test.StepVerifier;
import reactor.test.scheduler.VirtualTimeScheduler;

import java.time.Duration;
import java.util.List;

import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PrognosHealthIndicatorTest {

    @Mock
    private EngineLoops engineLoops;

    private PrognosProperties properties;
    private InMemoryModelRegistry registry;
    private VirtualTimeScheduler virtualTime;
    private ReactorLoopScheduler loopScheduler;
    private PrognosHealthIndicator indicator;

    @BeforeEach
    void setUp() {
        properties = EngineFixtures.properties();
        registry = new InMemoryModelRegistry();
        PrognosMetrics metrics = new PrognosMetrics(new SimpleMeterRegistry());
        virtualTime = VirtualTimeScheduler.create();
        loopScheduler = new ReactorLoopScheduler(
                new EngineSchedulers(Schedulers.immediate(), Schedulers.immediate(), virtualTime), metrics);
        indicator = new PrognosHealthIndicator(registry, new InMemoryTrainingJobRepository(),
                new TelemetryBuffer(100),
                new PredictionCache(Caffeine.newBuilder().<String, PredictionResult>build(), metrics),
                engineLoops, properties);
    }

    @AfterEach
    void tearDown() {
        virtualTime.dispose();
    }

    private LoopHandle loop(String name) {
        return loopScheduler.schedule(name, Duration.ofMinutes(1), Duration.ofMinutes(1), Mono::empty);
    }

    @Test
    void upWithActiveModelsAndRunningLoops() {
        registry.upsert(EngineFixtures.model("holt", ModelKind.REGRESSION, 0.8));
        when(engineLoops.handles()).thenReturn(List.of(loop(EngineLoops.PREDICTION_LOOP)));

        StepVerifier.create(indicator.health())
                .expectNextMatches(health -> health.getStatus().equals(Status.UP)
                        && health.getDetails().get("activeModels").equals(1)
                        && "RUNNING".equals(health.getDetails().get("loop.prediction"))
                        && "DRY_RUN".equals(health.getDetails().get("executionMode")))
                .verifyComplete();
    }

    @Test
    void downWithoutActiveModels() {
        registry.upsert(EngineFixtures.model("holt", ModelKind.REGRESSION, 0.8).toBuilder().active(false).build());
        when(engineLoops.handles()).thenReturn(List.of());

        StepVerifier.create(indicator.health())
                .expectNextMatches(health -> health.getStatus().equals(Status.DOWN)
                        && health.getDetails().get("registeredModels").equals(1)
                        && health.getDetails().containsKey("models.error"))
                .verifyComplete();
    }

    @Test
    void downWhenALoopHasStopped() {
        registry.upsert(EngineFixtures.model("holt", ModelKind.REGRESSION, 0.8));
        LoopHandle stopped = loop(EngineLoops.ANOMALY_LOOP);
        stopped.stop();
        when(engineLoops.handles()).thenReturn(List.of(loop(EngineLoops.PREDICTION_LOOP), stopped));

        StepVerifier.create(indicator.health())
                .expectNextMatches(health -> health.getStatus().equals(Status.DOWN)
                        && "STOPPED".equals(health.getDetails().get("loop.anomaly-scan")))
                .verifyComplete();
    }

    @Test
    void disabledLoopsDoNotAffectHealth() {
        properties.getLoops().setEnabled(false);
        registry.upsert(EngineFixtures.model("holt", ModelKind.REGRESSION, 0.8));

        StepVerifier.create(indicator.health())
                .expectNextMatches(health -> health.getStatus().equals(Status.UP)
                        && "DISABLED".equals(health.getDetails().get("loops")))
                .verifyComplete();
    }
}
