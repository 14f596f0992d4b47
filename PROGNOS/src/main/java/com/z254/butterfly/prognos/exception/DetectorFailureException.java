package com.z254.butterfly.prognos.exception;

import com.z254.butterfly.prognos.domain.model.AnomalyAlgorithm;

/**
 * Wraps an error raised inside a single anomaly detector. Contained by the fusion engine.
 */
public class DetectorFailureException extends PrognosException {

    private final AnomalyAlgorithm algorithm;

    public DetectorFailureException(AnomalyAlgorithm algorithm, Throwable cause) {
        super("Detector " + algorithm + " failed: " + cause.getMessage(), cause);
        this.algorithm = algorithm;
    }

    public AnomalyAlgorithm getAlgorithm() {
        return algorithm;
    }
}
