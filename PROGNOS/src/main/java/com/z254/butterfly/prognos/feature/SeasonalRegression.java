package com.z254.butterfly.prognos.feature;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.exception.MathIllegalArgumentException;
import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.regression.OLSMultipleLinearRegression;
import org.apache.commons.math3.stat.regression.SimpleRegression;

/**
 * Ordinary least squares fit of {@code y = intercept + slope * t + weekendEffect * weekend}.
 * <p>
 * The weekend term is dropped when the sample has no weekday/weekend contrast, and the
 * slope is dropped when all samples share one timestamp.
 */
@Slf4j
public final class SeasonalRegression {

    private SeasonalRegression() {
    }

    public static Fit fit(double[] t, double[] weekend, double[] y) {
        int n = y.length;
        if (n == 0) {
            return new Fit(0.0, 0.0, 0.0, 0.0);
        }
        boolean hasSlope = RollingStatistics.std(t) > 0.0;
        boolean hasWeekend = RollingStatistics.std(weekend) > 0.0;

        if (hasSlope && hasWeekend) {
            double[][] x = new double[n][];
            for (int i = 0; i < n; i++) {
                x[i] = new double[]{t[i], weekend[i]};
            }
            OLSMultipleLinearRegression ols = new OLSMultipleLinearRegression();
            try {
                ols.newSampleData(y, x);
                double[] beta = ols.estimateRegressionParameters();
                return withResiduals(beta[0], beta[1], beta[2], t, weekend, y);
            } catch (MathIllegalArgumentException e) {
                log.debug("Weekend regression not solvable over {} samples, fitting trend only: {}", n, e.getMessage());
            }
        }
        if (hasSlope) {
            SimpleRegression regression = new SimpleRegression();
            for (int i = 0; i < n; i++) {
                regression.addData(t[i], y[i]);
            }
            return withResiduals(regression.getIntercept(), regression.getSlope(), 0.0, t, weekend, y);
        }
        if (hasWeekend) {
            double weekdayMean = groupMean(weekend, y, false);
            double weekendMean = groupMean(weekend, y, true);
            return withResiduals(weekdayMean, 0.0, weekendMean - weekdayMean, t, weekend, y);
        }
        return withResiduals(RollingStatistics.mean(y), 0.0, 0.0, t, weekend, y);
    }

    private static double groupMean(double[] weekend, double[] y, boolean weekendGroup) {
        Mean mean = new Mean();
        for (int i = 0; i < y.length; i++) {
            if ((weekend[i] > 0.5) == weekendGroup) {
                mean.increment(y[i]);
            }
        }
        return mean.getResult();
    }

    private static Fit withResiduals(double intercept, double slope, double weekendEffect,
                                     double[] t, double[] weekend, double[] y) {
        double meanY = RollingStatistics.mean(y);
        double ssRes = 0.0;
        double ssTot = 0.0;
        for (int i = 0; i < y.length; i++) {
            double predicted = intercept + slope * t[i] + weekendEffect * weekend[i];
            ssRes += (y[i] - predicted) * (y[i] - predicted);
            ssTot += (y[i] - meanY) * (y[i] - meanY);
        }
        double r2 = ssTot == 0.0 ? 1.0 : RollingStatistics.clamp(1.0 - ssRes / ssTot, 0.0, 1.0);
        return new Fit(intercept, slope, weekendEffect, r2);
    }

    /**
     * Fitted coefficients and goodness of fit.
     */
    public record Fit(double intercept, double slope, double weekendEffect, double r2) {

        public double predict(double t, boolean weekend) {
            return intercept + slope * t + (weekend ? weekendEffect : 0.0);
        }

        /** Value with the weekend effect removed. */
        public double deseasonalize(double value, boolean weekend) {
            return weekend ? value - weekendEffect : value;
        }
    }
}
