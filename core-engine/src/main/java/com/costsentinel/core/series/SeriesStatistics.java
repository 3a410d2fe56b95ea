package com.costsentinel.core.series;

import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.apache.commons.math3.stat.descriptive.rank.Median;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import org.apache.commons.math3.stat.descriptive.rank.Percentile.EstimationType;

import java.util.Objects;

/**
 * Descriptive statistics over cost arrays, backed by Commons Math.
 *
 * <p>
 * Percentiles and medians use the R-7 estimator (linear interpolation
 * between closest ranks), which is what most analysis tools default to.
 * </p>
 *
 * @since 1.0.0
 */
public final class SeriesStatistics {

    private SeriesStatistics() {
        // utility class
    }

    public static double mean(double[] values) {
        requireValues(values);
        return StatUtils.mean(values);
    }

    /**
     * @return the bias-corrected (n - 1) standard deviation, {@code 0} for a
     *         single value
     */
    public static double sampleStd(double[] values) {
        requireValues(values);
        return new StandardDeviation(true).evaluate(values);
    }

    /**
     * @return the population (n) standard deviation
     */
    public static double populationStd(double[] values) {
        requireValues(values);
        return new StandardDeviation(false).evaluate(values);
    }

    public static double median(double[] values) {
        requireValues(values);
        return new Median().withEstimationType(EstimationType.R_7).evaluate(values);
    }

    /**
     * @param values     sample
     * @param percentile in (0, 100]
     * @return the interpolated percentile
     */
    public static double percentile(double[] values, double percentile) {
        requireValues(values);
        return new Percentile(percentile).withEstimationType(EstimationType.R_7).evaluate(values);
    }

    /**
     * Z-normalize with the population standard deviation. A constant column
     * maps to all zeros.
     */
    public static double[] standardize(double[] values) {
        requireValues(values);
        double mean = StatUtils.mean(values);
        double std = populationStd(values);
        double[] out = new double[values.length];
        if (std == 0.0 || Double.isNaN(std)) {
            return out;
        }
        for (int i = 0; i < values.length; i++) {
            out[i] = (values[i] - mean) / std;
        }
        return out;
    }

    private static void requireValues(double[] values) {
        Objects.requireNonNull(values, "values must not be null");
        if (values.length == 0) {
            throw new IllegalArgumentException("values must not be empty");
        }
    }
}
