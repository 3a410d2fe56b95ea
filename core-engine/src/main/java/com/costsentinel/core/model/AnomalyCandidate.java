package com.costsentinel.core.model;

import java.time.LocalDate;
import java.util.Objects;

/**
 * One point flagged by a single detection method, before the methods are
 * reconciled.
 *
 * <p>
 * {@code baselineCost} is the expected cost under the flagging method's own
 * partition of normal points. The derived {@code costDifference} and
 * {@code percentageIncrease} are computed from the rounded baseline so that
 * the two always agree.
 * </p>
 *
 * @since 1.0.0
 */
public final class AnomalyCandidate {

    private final LocalDate date;
    private final String service;
    private final String provider;
    private final double cost;
    private final double baselineCost;
    private final double costDifference;
    private final double percentageIncrease;
    private final double score;
    private final DetectionMethod method;

    private AnomalyCandidate(CostObservation observation, double baselineCost,
                             double score, DetectionMethod method) {
        this.date = observation.getDate();
        this.service = observation.getService();
        this.provider = observation.getProvider();
        this.cost = Amounts.round2(observation.costValue());
        this.baselineCost = Amounts.round2(baselineCost);
        this.costDifference = Amounts.costDifference(this.cost, this.baselineCost);
        this.percentageIncrease = Amounts.percentageIncrease(this.cost, this.baselineCost);
        this.score = Amounts.round2(score);
        this.method = Objects.requireNonNull(method, "method must not be null");
    }

    /**
     * @param observation  the flagged (normalized) observation
     * @param baselineCost expected cost for that point
     * @param score        method-specific anomaly score, higher is more anomalous
     * @param method       the method slot that flagged the point
     * @return a new candidate
     */
    public static AnomalyCandidate of(CostObservation observation, double baselineCost,
                                      double score, DetectionMethod method) {
        Objects.requireNonNull(observation, "observation must not be null");
        return new AnomalyCandidate(observation, baselineCost, score, method);
    }

    /**
     * @return the same candidate attributed to another method slot
     */
    public AnomalyCandidate attributedTo(DetectionMethod slot) {
        if (slot == method) {
            return this;
        }
        CostObservation observation = CostObservation.builder()
                .date(date)
                .cost(cost)
                .service(service)
                .provider(provider)
                .build();
        return new AnomalyCandidate(observation, baselineCost, score, slot);
    }

    public LocalDate getDate() {
        return date;
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

    public double getBaselineCost() {
        return baselineCost;
    }

    public double getCostDifference() {
        return costDifference;
    }

    public double getPercentageIncrease() {
        return percentageIncrease;
    }

    public double getScore() {
        return score;
    }

    public DetectionMethod getMethod() {
        return method;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof AnomalyCandidate that))
            return false;
        return Double.compare(cost, that.cost) == 0
                && Double.compare(baselineCost, that.baselineCost) == 0
                && Double.compare(score, that.score) == 0
                && Objects.equals(date, that.date)
                && Objects.equals(service, that.service)
                && Objects.equals(provider, that.provider)
                && method == that.method;
    }

    @Override
    public int hashCode() {
        return Objects.hash(date, service, provider, cost, baselineCost, score, method);
    }

    @Override
    public String toString() {
        return "AnomalyCandidate{" +
                "date=" + date +
                ", service='" + service + '\'' +
                ", cost=" + cost +
                ", baseline=" + baselineCost +
                ", score=" + score +
                ", method=" + method +
                '}';
    }
}
