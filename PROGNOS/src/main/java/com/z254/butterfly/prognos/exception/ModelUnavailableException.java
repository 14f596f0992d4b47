package com.z254.butterfly.prognos.exception;

/**
 * No active model is available, or every model failed in this cycle.
 */
public class ModelUnavailableException extends PrognosException {

    public ModelUnavailableException(String message) {
        super(message);
    }
}
