package com.z254.butterfly.prognos.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Rolling performance snapshot of a model, produced by training.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PerformanceMetrics {

    private double accuracy;
    private double precision;
    private double recall;
    private double f1Score;

    /** Mean squared error, when the trainer reports it */
    private Double mse;

    /** Mean absolute error, when the trainer reports it */
    private Double mae;

    public PerformanceMetrics copy() {
        return new PerformanceMetrics(accuracy, precision, recall, f1Score, mse, mae);
    }
}
