package com.z254.butterfly.prognos.config;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.z254.butterfly.prognos.domain.model.PredictionResult;
import com.z254.butterfly.prognos.domain.repository.InMemoryModelRegistry;
import com.z254.butterfly.prognos.domain.repository.InMemoryTrainingJobRepository;
import com.z254.butterfly.prognos.domain.repository.ModelRegistry;
import com.z254.butterfly.prognos.domain.repository.TrainingJobRepository;
import com.z254.butterfly.prognos.prediction.ensemble.LinearMetaAdjuster;
import com.z254.butterfly.prognos.prediction.ensemble.MetaAdjuster;
import com.z254.butterfly.prognos.prediction.ensemble.StackingCombiner;
import com.z254.butterfly.prognos.prediction.ensemble.WeightedAverageCombiner;
import com.z254.butterfly.prognos.telemetry.TelemetryBuffer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Instant;

/**
 * Core engine beans: clock, schedulers, telemetry buffer, registries and caches.
 */
@Slf4j
@Configuration
public class EngineConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean(destroyMethod = "dispose")
    public EngineSchedulers engineSchedulers() {
        return new EngineSchedulers(
                Schedulers.newBoundedElastic(Runtime.getRuntime().availableProcessors() * 2, 1_000, "prognos-inference"),
                Schedulers.newBoundedElastic(2, 100, "prognos-training"),
                Schedulers.newParallel("prognos-loops", 3));
    }

    @Bean
    public TelemetryBuffer telemetryBuffer(PrognosProperties properties) {
        return new TelemetryBuffer(properties.getBuffer().getCapacity());
    }

    @Bean
    public ModelRegistry modelRegistry(PrognosProperties properties, Clock clock) {
        InMemoryModelRegistry registry = new InMemoryModelRegistry();
        Instant now = clock.instant();
        properties.getModels().forEach(seed -> registry.upsert(seed.toModelConfig(now)));
        log.info("Seeded model registry with {} models", properties.getModels().size());
        return registry;
    }

    @Bean
    public TrainingJobRepository trainingJobRepository() {
        return new InMemoryTrainingJobRepository();
    }

    @Bean
    @ConditionalOnMissingBean
    public MetaAdjuster metaAdjuster() {
        return new LinearMetaAdjuster();
    }

    @Bean
    public StackingCombiner stackingCombiner(WeightedAverageCombiner weightedAverageCombiner,
                                             MetaAdjuster metaAdjuster) {
        return new StackingCombiner(weightedAverageCombiner, metaAdjuster);
    }

    @Bean
    public Cache<String, PredictionResult> predictionResultCache(PrognosProperties properties) {
        return Caffeine.newBuilder()
                .expireAfterWrite(properties.getCache().getTtl())
                .maximumSize(properties.getCache().getMaximumSize())
                .recordStats()
                .build();
    }
}
