package com.costsentinel.core;

import com.costsentinel.core.config.DetectionConfig;
import com.costsentinel.core.model.CostObservation;
import com.costsentinel.core.series.NormalizedSeries;
import com.costsentinel.core.series.SeriesNormalizer;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Shared cost series for tests.
 */
public final class CostFixtures {

    /** First day of every generated series. */
    public static final LocalDate START = LocalDate.of(2024, 1, 1);

    private CostFixtures() {
    }

    /**
     * One observation per day starting at {@link #START}.
     */
    public static List<CostObservation> daily(String service, String provider, double... costs) {
        List<CostObservation> observations = new ArrayList<>(costs.length);
        for (int i = 0; i < costs.length; i++) {
            observations.add(CostObservation.of(START.plusDays(i), costs[i], service, provider));
        }
        return observations;
    }

    /**
     * Seven EC2 days with a single spike of 500 on 2024-01-05.
     */
    public static List<CostObservation> ec2Spike() {
        return daily("EC2", "AWS", 100, 98, 102, 101, 500, 99, 103);
    }

    /**
     * Four weeks with weekends at 300 and weekdays at 100, plus a spike of
     * 350 on Thursday 2024-01-18.
     */
    public static double[] weeklyWithSpike() {
        double[] costs = new double[28];
        for (int i = 0; i < costs.length; i++) {
            costs[i] = (i % 7 == 5 || i % 7 == 6) ? 300 : 100;
        }
        costs[17] += 250;
        return costs;
    }

    /**
     * {@code n} flat days at 100 with one day at 1000.
     */
    public static double[] flatWithSpike(int n, int spikeIndex) {
        double[] costs = new double[n];
        for (int i = 0; i < n; i++) {
            costs[i] = i == spikeIndex ? 1000 : 100;
        }
        return costs;
    }

    public static NormalizedSeries series(List<CostObservation> observations) {
        return new SeriesNormalizer(DetectionConfig.defaults()).normalize(observations, 1).orElseThrow();
    }

    public static NormalizedSeries series(double... costs) {
        return series(daily("EC2", "AWS", costs));
    }
}
