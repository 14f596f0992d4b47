package com.z254.butterfly.prognos.exception;

public class TrainingFailureException extends PrognosException {

    public TrainingFailureException(String message) {
        super(message);
    }

    public TrainingFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
