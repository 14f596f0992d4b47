package com.z254.butterfly.prognos.domain.repository;

import com.z254.butterfly.prognos.domain.model.ModelConfig;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.UnaryOperator;

/**
 * In-memory model registry keyed by model id.
 */
@Slf4j
public class InMemoryModelRegistry implements ModelRegistry {

    private final Map<String, ModelConfig> models = new ConcurrentHashMap<>();
    private final CopyOnWriteArrayList<String> registrationOrder = new CopyOnWriteArrayList<>();

    @Override
    public Optional<ModelConfig> get(String modelId) {
        return Optional.ofNullable(models.get(modelId));
    }

    @Override
    public List<ModelConfig> list() {
        return registrationOrder.stream()
                .map(models::get)
                .filter(Objects::nonNull)
                .toList();
    }

    @Override
    public List<ModelConfig> listActive() {
        return list().stream().filter(ModelConfig::isActive).toList();
    }

    @Override
    public ModelConfig upsert(ModelConfig config) {
        ModelConfig previous = models.put(config.getModelId(), config);
        if (previous == null) {
            registrationOrder.addIfAbsent(config.getModelId());
            log.debug("Registered model: {}", config.getModelId());
        }
        return config;
    }

    @Override
    public Optional<ModelConfig> update(String modelId, UnaryOperator<ModelConfig> updater) {
        return Optional.ofNullable(models.computeIfPresent(modelId, (id, current) -> {
            ModelConfig next = updater.apply(current);
            return next.toBuilder().version(current.getVersion() + 1).build();
        }));
    }
}
