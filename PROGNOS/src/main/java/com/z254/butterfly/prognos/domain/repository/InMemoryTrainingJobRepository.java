package com.z254.butterfly.prognos.domain.repository;

import com.z254.butterfly.prognos.domain.model.TrainingJob;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;

/**
 * In-memory implementation of TrainingJobRepository.
 */
public class InMemoryTrainingJobRepository implements TrainingJobRepository {

    private final Map<String, TrainingJob> jobs = new ConcurrentHashMap<>();

    @Override
    public TrainingJob save(TrainingJob job) {
        jobs.put(job.getJobId(), job);
        return job;
    }

    @Override
    public Optional<TrainingJob> findById(String jobId) {
        return Optional.ofNullable(jobs.get(jobId));
    }

    @Override
    public List<TrainingJob> findByModelId(String modelId) {
        return jobs.values().stream()
                .filter(job -> modelId.equals(job.getModelId()))
                .sorted(Comparator.comparing(TrainingJob::getSubmittedAt))
                .toList();
    }

    @Override
    public List<TrainingJob> findAll() {
        return jobs.values().stream()
                .sorted(Comparator.comparing(TrainingJob::getSubmittedAt))
                .toList();
    }

    @Override
    public Optional<TrainingJob> update(String jobId, UnaryOperator<TrainingJob> updater) {
        return Optional.ofNullable(jobs.computeIfPresent(jobId, (id, current) -> updater.apply(current)));
    }
}
