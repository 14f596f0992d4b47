package com.z254.butterfly.prognos.exception;

/**
 * Base class of all engine failures.
 */
public class PrognosException extends RuntimeException {

    public PrognosException(String message) {
        super(message);
    }

    public PrognosException(String message, Throwable cause) {
        super(message, cause);
    }
}
