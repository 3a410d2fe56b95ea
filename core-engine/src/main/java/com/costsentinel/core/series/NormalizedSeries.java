package com.costsentinel.core.series;

import com.costsentinel.core.model.CostObservation;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Date-ordered cost observations with every cost present.
 *
 * <p>
 * Instances are created by {@link SeriesNormalizer} and never change. The
 * cost and day-offset arrays are computed once and copied on access.
 * </p>
 *
 * @since 1.0.0
 */
public final class NormalizedSeries {

    private final List<CostObservation> observations;
    private final double[] costs;
    private final double[] dayOffsets;
    private final boolean dateAxis;

    NormalizedSeries(List<CostObservation> observations) {
        Objects.requireNonNull(observations, "observations must not be null");
        this.observations = List.copyOf(observations);
        this.dateAxis = !this.observations.isEmpty()
                && this.observations.stream().allMatch(o -> o.getDate() != null);

        int n = this.observations.size();
        this.costs = new double[n];
        this.dayOffsets = new double[n];
        LocalDate origin = dateAxis ? this.observations.get(0).getDate() : null;
        for (int i = 0; i < n; i++) {
            CostObservation observation = this.observations.get(i);
            if (!observation.hasCost()) {
                throw new IllegalArgumentException("Normalized observation at index " + i + " has no cost");
            }
            costs[i] = observation.costValue();
            // position stands in for time when any date is missing
            dayOffsets[i] = dateAxis ? ChronoUnit.DAYS.between(origin, observation.getDate()) : i;
        }
    }

    public int size() {
        return observations.size();
    }

    public CostObservation get(int index) {
        return observations.get(index);
    }

    public List<CostObservation> getObservations() {
        return observations;
    }

    public double[] costs() {
        return costs.clone();
    }

    /**
     * @return days since the first observation, or positions when the series
     *         has no date axis
     */
    public double[] dayOffsets() {
        return dayOffsets.clone();
    }

    /**
     * @return {@code true} when every observation carries a date
     */
    public boolean hasDateAxis() {
        return dateAxis;
    }

    /**
     * Split by {@code (provider, service)}, in order of first appearance.
     * Each part keeps the date ordering of this series.
     */
    public Map<EntityKey, NormalizedSeries> groupByEntity() {
        Map<EntityKey, List<CostObservation>> parts = new LinkedHashMap<>();
        for (CostObservation observation : observations) {
            EntityKey key = new EntityKey(observation.getProvider(), observation.getService());
            parts.computeIfAbsent(key, k -> new ArrayList<>()).add(observation);
        }
        Map<EntityKey, NormalizedSeries> grouped = new LinkedHashMap<>();
        parts.forEach((key, part) -> grouped.put(key, new NormalizedSeries(part)));
        return Collections.unmodifiableMap(grouped);
    }

    @Override
    public String toString() {
        return "NormalizedSeries{" +
                "size=" + observations.size() +
                ", dateAxis=" + dateAxis +
                '}';
    }
}
