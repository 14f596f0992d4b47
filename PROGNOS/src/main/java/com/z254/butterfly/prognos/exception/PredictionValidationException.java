package com.z254.butterfly.prognos.exception;

/**
 * Malformed caller input: bad prediction window, too few buffered samples, unknown strategy.
 * Raised before any computation and surfaced to the caller.
 */
public class PredictionValidationException extends PrognosException {

    public PredictionValidationException(String message) {
        super(message);
    }
}
