package com.z254.butterfly.prognos.feature;

import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.stat.correlation.PearsonsCorrelation;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;

import java.util.Arrays;

/**
 * Descriptive statistics over plain value arrays, with empty inputs mapped to 0.
 */
public final class RollingStatistics {

    private RollingStatistics() {
    }

    /**
     * The trailing {@code count} values (or all of them when fewer).
     */
    public static double[] tail(double[] values, int count) {
        int from = Math.max(0, values.length - count);
        return Arrays.copyOfRange(values, from, values.length);
    }

    public static double mean(double[] values) {
        return values.length == 0 ? 0.0 : StatUtils.mean(values);
    }

    /**
     * Population standard deviation.
     */
    public static double std(double[] values) {
        if (values.length < 2) {
            return 0.0;
        }
        return new StandardDeviation(false).evaluate(values);
    }

    /**
     * Percentile with linear interpolation between closest ranks.
     *
     * @param p fraction in [0, 1]
     */
    public static double percentile(double[] values, double p) {
        if (values.length == 0) {
            return 0.0;
        }
        if (p <= 0.0) {
            return StatUtils.min(values);
        }
        return new Percentile()
                .withEstimationType(Percentile.EstimationType.R_7)
                .evaluate(values, Math.min(p, 1.0) * 100.0);
    }

    public static double median(double[] values) {
        return percentile(values, 0.5);
    }

    /**
     * Median absolute deviation from the median.
     */
    public static double mad(double[] values) {
        if (values.length == 0) {
            return 0.0;
        }
        double median = median(values);
        return median(Arrays.stream(values).map(v -> Math.abs(v - median)).toArray());
    }

    /**
     * Coefficient of variation; 0 when the mean is 0.
     */
    public static double volatility(double[] values) {
        double mean = mean(values);
        return mean == 0.0 ? 0.0 : std(values) / Math.abs(mean);
    }

    /**
     * Pearson correlation of the aligned tails of two series; 0 when either is constant.
     */
    public static double pearson(double[] x, double[] y) {
        int n = Math.min(x.length, y.length);
        if (n < 2) {
            return 0.0;
        }
        double r = new PearsonsCorrelation().correlation(tail(x, n), tail(y, n));
        return Double.isNaN(r) ? 0.0 : r;
    }

    public static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }
}
