package com.z254.butterfly.prognos.domain.model;

import lombok.Builder;
import lombok.Value;

/**
 * Caller options for an explicit training request.
 */
@Value
@Builder
public class TrainingOptions {

    /** Overrides the model's configured validation split when set */
    Double validationSplit;

    @Builder.Default
    String trigger = "MANUAL";

    public static TrainingOptions defaults() {
        return TrainingOptions.builder().build();
    }
}
