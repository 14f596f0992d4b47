package com.z254.butterfly.prognos.domain.repository;

import com.z254.butterfly.prognos.domain.model.TrainingJob;

import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Repository of training jobs.
 */
public interface TrainingJobRepository {

    TrainingJob save(TrainingJob job);

    Optional<TrainingJob> findById(String jobId);

    List<TrainingJob> findByModelId(String modelId);

    List<TrainingJob> findAll();

    /**
     * Atomically apply a state change to a stored job.
     */
    Optional<TrainingJob> update(String jobId, UnaryOperator<TrainingJob> updater);
}
