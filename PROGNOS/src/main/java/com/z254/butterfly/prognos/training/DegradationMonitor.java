package com.z254.butterfly.prognos.training;

import com.z254.butterfly.prognos.config.PrognosProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Rolling window of observed accuracy per model.
 * <p>
 * A model is degraded once the window holds at least the minimum number of observations
 * and their mean falls below the degradation threshold.
 */
@Component
public class DegradationMonitor {

    private final Map<String, Deque<Double>> observations = new ConcurrentHashMap<>();
    private final int window;
    private final int minObservations;
    private final double threshold;

    public DegradationMonitor(PrognosProperties properties) {
        this.window = properties.getTraining().getAccuracyWindow();
        this.minObservations = properties.getTraining().getMinObservations();
        this.threshold = properties.getTraining().getDegradationThreshold();
    }

    public void record(String modelId, double accuracy) {
        Deque<Double> values = observations.computeIfAbsent(modelId, id -> new ArrayDeque<>());
        synchronized (values) {
            values.addLast(accuracy);
            while (values.size() > window) {
                values.removeFirst();
            }
        }
    }

    public OptionalDouble rollingAccuracy(String modelId) {
        Deque<Double> values = observations.get(modelId);
        if (values == null) {
            return OptionalDouble.empty();
        }
        synchronized (values) {
            return values.stream().mapToDouble(Double::doubleValue).average();
        }
    }

    public int observationCount(String modelId) {
        Deque<Double> values = observations.get(modelId);
        if (values == null) {
            return 0;
        }
        synchronized (values) {
            return values.size();
        }
    }

    public boolean isDegraded(String modelId) {
        if (observationCount(modelId) < minObservations) {
            return false;
        }
        return rollingAccuracy(modelId).orElse(1.0) < threshold;
    }

    /**
     * Forget observations, typically after the model was retrained.
     */
    public void reset(String modelId) {
        observations.remove(modelId);
    }
}
