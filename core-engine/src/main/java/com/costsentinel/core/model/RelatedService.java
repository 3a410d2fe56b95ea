package com.costsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Another service whose cost moved on the same day as an anomaly.
 *
 * @since 1.0.0
 */
public final class RelatedService {

    /** Strength of the co-occurring movement. */
    public enum Correlation {
        @JsonProperty("strong")
        STRONG,
        @JsonProperty("moderate")
        MODERATE
    }

    private final String service;
    private final String provider;
    private final double cost;
    private final double pctChange;
    private final double avgPrevCost;
    private final Correlation correlation;

    public RelatedService(String service, String provider, double cost, double pctChange,
                          double avgPrevCost, Correlation correlation) {
        this.service = Objects.requireNonNull(service, "service must not be null");
        this.provider = provider;
        this.cost = Amounts.round2(cost);
        this.pctChange = Amounts.round2(pctChange);
        this.avgPrevCost = Amounts.round2(avgPrevCost);
        this.correlation = Objects.requireNonNull(correlation, "correlation must not be null");
    }

    public String getService() {
        return service;
    }

    public String getProvider() {
        return provider;
    }

    public double getCost() {
        return cost;
    }

    @JsonProperty("pct_change")
    public double getPctChange() {
        return pctChange;
    }

    @JsonProperty("avg_prev_cost")
    public double getAvgPrevCost() {
        return avgPrevCost;
    }

    public Correlation getCorrelation() {
        return correlation;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof RelatedService that))
            return false;
        return Double.compare(cost, that.cost) == 0
                && Double.compare(pctChange, that.pctChange) == 0
                && Objects.equals(service, that.service)
                && Objects.equals(provider, that.provider)
                && correlation == that.correlation;
    }

    @Override
    public int hashCode() {
        return Objects.hash(service, provider, cost, pctChange, correlation);
    }

    @Override
    public String toString() {
        return "RelatedService{service='" + service + "', pctChange=" + pctChange
                + ", correlation=" + correlation + '}';
    }
}
