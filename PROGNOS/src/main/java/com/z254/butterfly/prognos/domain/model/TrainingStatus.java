package com.z254.butterfly.prognos.domain.model;

/**
 * Training job lifecycle. Transitions are one-directional; COMPLETED and FAILED are terminal.
 */
public enum TrainingStatus {
    PENDING,
    RUNNING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    public boolean canTransitionTo(TrainingStatus next) {
        return switch (this) {
            case PENDING -> next == RUNNING || next == FAILED;
            case RUNNING -> next == COMPLETED || next == FAILED;
            case COMPLETED, FAILED -> false;
        };
    }
}
