package com.costsentinel.core.detection;

import java.util.Arrays;
import java.util.Objects;

/**
 * Classical additive decomposition {@code x = trend + seasonal + residual}.
 *
 * <ul>
 * <li>Trend: centred moving average over one period. An even period uses the
 * 2×p window with half weights at both ends. The first and last
 * {@code period / 2} points have no trend ({@code NaN}).</li>
 * <li>Seasonal: mean detrended value per phase, centred to sum to zero.</li>
 * <li>Residual: what is left, {@code NaN} where the trend is.</li>
 * </ul>
 *
 * @since 1.0.0
 */
public final class SeasonalDecomposition {

    private final int period;
    private final double[] trend;
    private final double[] seasonal;
    private final double[] residual;

    private SeasonalDecomposition(int period, double[] trend, double[] seasonal, double[] residual) {
        this.period = period;
        this.trend = trend;
        this.seasonal = seasonal;
        this.residual = residual;
    }

    /**
     * @param values evenly spaced observations
     * @param period season length, at least 2
     * @return the decomposition
     * @throws IllegalArgumentException if fewer than two full periods are
     *                                  available
     */
    public static SeasonalDecomposition decompose(double[] values, int period) {
        Objects.requireNonNull(values, "values must not be null");
        if (period < 2) {
            throw new IllegalArgumentException("period must be >= 2, got: " + period);
        }
        if (values.length < 2 * period) {
            throw new IllegalArgumentException("Need two full periods (" + 2 * period
                    + " points), got: " + values.length);
        }

        int n = values.length;
        double[] trend = centredMovingAverage(values, period);

        double[] phaseSum = new double[period];
        int[] phaseCount = new int[period];
        for (int i = 0; i < n; i++) {
            if (!Double.isNaN(trend[i])) {
                phaseSum[i % period] += values[i] - trend[i];
                phaseCount[i % period]++;
            }
        }
        double[] figure = new double[period];
        double figureMean = 0.0;
        for (int p = 0; p < period; p++) {
            figure[p] = phaseCount[p] > 0 ? phaseSum[p] / phaseCount[p] : 0.0;
            figureMean += figure[p];
        }
        figureMean /= period;

        double[] seasonal = new double[n];
        double[] residual = new double[n];
        for (int i = 0; i < n; i++) {
            seasonal[i] = figure[i % period] - figureMean;
            residual[i] = values[i] - trend[i] - seasonal[i];
        }
        return new SeasonalDecomposition(period, trend, seasonal, residual);
    }

    /**
     * Sample autocorrelation at {@code lag}, normalized by the lag-0
     * autocovariance. A constant series has no autocorrelation ({@code 0}).
     */
    public static double autocorrelation(double[] values, int lag) {
        Objects.requireNonNull(values, "values must not be null");
        int n = values.length;
        if (lag < 1 || lag >= n) {
            throw new IllegalArgumentException("lag must be in [1, " + (n - 1) + "], got: " + lag);
        }
        double mean = Arrays.stream(values).average().orElse(0.0);
        double denominator = 0.0;
        for (double v : values) {
            denominator += (v - mean) * (v - mean);
        }
        if (denominator == 0.0) {
            return 0.0;
        }
        double numerator = 0.0;
        for (int t = 0; t + lag < n; t++) {
            numerator += (values[t] - mean) * (values[t + lag] - mean);
        }
        return numerator / denominator;
    }

    private static double[] centredMovingAverage(double[] values, int period) {
        int n = values.length;
        int half = period / 2;
        double[] weights = new double[period % 2 == 0 ? period + 1 : period];
        Arrays.fill(weights, 1.0 / period);
        if (period % 2 == 0) {
            weights[0] = 0.5 / period;
            weights[period] = 0.5 / period;
        }

        double[] trend = new double[n];
        Arrays.fill(trend, Double.NaN);
        for (int i = half; i < n - half; i++) {
            double sum = 0.0;
            for (int k = 0; k < weights.length; k++) {
                sum += weights[k] * values[i - half + k];
            }
            trend[i] = sum;
        }
        return trend;
    }

    public int getPeriod() {
        return period;
    }

    public double[] getTrend() {
        return trend.clone();
    }

    public double[] getSeasonal() {
        return seasonal.clone();
    }

    public double[] getResidual() {
        return residual.clone();
    }
}
