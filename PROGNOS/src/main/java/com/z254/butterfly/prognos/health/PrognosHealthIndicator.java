package com.z254.butterfly.prognos.health;

import com.z254.butterfly.prognos.cache.PredictionCache;
import com.z254.butterfly.prognos.config.PrognosProperties;
import com.z254.butterfly.prognos.domain.model.ModelConfig;
import com.z254.butterfly.prognos.domain.model.TrainingJob;
import com.z254.butterfly.prognos.domain.repository.ModelRegistry;
import com.z254.butterfly.prognos.domain.repository.TrainingJobRepository;
import com.z254.butterfly.prognos.scheduling.EngineLoops;
import com.z254.butterfly.prognos.scheduling.LoopHandle;
import com.z254.butterfly.prognos.telemetry.TelemetryBuffer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.ReactiveHealthIndicator;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Health indicator for the prediction engine.
 * <p>
 * DOWN when no model is active or an enabled loop has stopped.
 */
@Slf4j
@Component
public class PrognosHealthIndicator implements ReactiveHealthIndicator {

    private final ModelRegistry modelRegistry;
    private final TrainingJobRepository jobRepository;
    private final TelemetryBuffer buffer;
    private final PredictionCache cache;
    private final EngineLoops engineLoops;
    private final PrognosProperties properties;

    public PrognosHealthIndicator(ModelRegistry modelRegistry,
                                  TrainingJobRepository jobRepository,
                                  TelemetryBuffer buffer,
                                  PredictionCache cache,
                                  EngineLoops engineLoops,
                                  PrognosProperties properties) {
        this.modelRegistry = modelRegistry;
        this.jobRepository = jobRepository;
        this.buffer = buffer;
        this.cache = cache;
        this.engineLoops = engineLoops;
        this.properties = properties;
    }

    @Override
    public Mono<Health> health() {
        return Mono.fromCallable(this::checkHealth);
    }

    private Health checkHealth() {
        Map<String, Object> details = new HashMap<>();
        boolean healthy = true;

        List<ModelConfig> active = modelRegistry.listActive();
        details.put("activeModels", active.size());
        details.put("registeredModels", modelRegistry.list().size());
        if (active.isEmpty()) {
            healthy = false;
            details.put("models.error", "No active prediction models");
        }

        details.put("buffer.size", buffer.size());
        details.put("buffer.capacity", buffer.capacity());
        details.put("cache.size", cache.size());
        details.put("activeTrainingJobs", jobRepository.findAll().stream().filter(TrainingJob::isActive).count());
        details.put("executionMode", properties.getExecution().getMode().name());

        if (properties.getLoops().isEnabled()) {
            for (LoopHandle handle : engineLoops.handles()) {
                details.put("loop." + handle.getName(), handle.isRunning() ? "RUNNING" : "STOPPED");
                if (!handle.isRunning()) {
                    healthy = false;
                }
            }
        } else {
            details.put("loops", "DISABLED");
        }

        if (healthy) {
            return Health.up()
                    .withDetails(details)
                    .build();
        } else {
            log.warn("Prediction engine unhealthy: {}", details);
            return Health.down()
                    .withDetails(details)
                    .build();
        }
    }
}
