package com.z254.butterfly.prognos.domain.repository;

import com.z254.butterfly.prognos.domain.model.ModelConfig;

import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Repository of model configurations.
 * <p>
 * Entries are immutable values; updates always replace a whole {@link ModelConfig}
 * so concurrent readers see either the previous or the next version.
 */
public interface ModelRegistry {

    Optional<ModelConfig> get(String modelId);

    /**
     * All registered models in registration order.
     */
    List<ModelConfig> list();

    List<ModelConfig> listActive();

    ModelConfig upsert(ModelConfig config);

    /**
     * Atomically replace an existing entry with {@code updater.apply(current)}.
     *
     * @return the new value, or empty when no model with this id exists
     */
    Optional<ModelConfig> update(String modelId, UnaryOperator<ModelConfig> updater);
}
