package com.costsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;
import java.util.List;
import java.util.Objects;

/**
 * A confirmed cost anomaly after the detection methods have been reconciled.
 *
 * <p>
 * Records are immutable. Root-cause and cloud-context enrichment produce new
 * instances through {@link #withRootCause(RootCause)} and
 * {@link #withCloudContext(CloudContext)}.
 * </p>
 *
 * <h3>Invariants</h3>
 * <ul>
 * <li>{@code costDifference == cost - baselineCost}</li>
 * <li>{@code percentageIncrease == costDifference / baselineCost * 100},
 * or {@code 0} when the baseline is zero</li>
 * <li>{@code confidence == methodsAgreement / methodsTotal}, in [0, 1]</li>
 * </ul>
 *
 * @since 1.0.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class AnomalyRecord {

    private final LocalDate date;
    private final String service;
    private final String provider;
    private final double cost;
    private final double baselineCost;
    private final double costDifference;
    private final double percentageIncrease;
    private final double anomalyScore;
    private final DetectionMethod detectionMethod;
    private final List<DetectionMethod> detectionMethods;
    private final int methodsAgreement;
    private final int methodsTotal;
    private final double confidence;
    private final RootCause rootCause;
    private final CloudContext cloudContext;

    private AnomalyRecord(Builder b) {
        if (b.methodsTotal < 1) {
            throw new IllegalArgumentException("methodsTotal must be >= 1, got: " + b.methodsTotal);
        }
        if (b.methodsAgreement < 1 || b.methodsAgreement > b.methodsTotal) {
            throw new IllegalArgumentException("methodsAgreement must be in [1, " + b.methodsTotal
                    + "], got: " + b.methodsAgreement);
        }
        this.date = b.date;
        this.service = Objects.requireNonNull(b.service, "service must not be null");
        this.provider = Objects.requireNonNull(b.provider, "provider must not be null");
        this.cost = Amounts.round2(b.cost);
        this.baselineCost = Amounts.round2(b.baselineCost);
        this.costDifference = Amounts.costDifference(this.cost, this.baselineCost);
        this.percentageIncrease = Amounts.percentageIncrease(this.cost, this.baselineCost);
        this.anomalyScore = Amounts.round2(b.anomalyScore);
        this.detectionMethod = Objects.requireNonNull(b.detectionMethod, "detectionMethod must not be null");
        this.detectionMethods = b.detectionMethods != null ? List.copyOf(b.detectionMethods) : List.of(b.detectionMethod);
        this.methodsAgreement = b.methodsAgreement;
        this.methodsTotal = b.methodsTotal;
        this.confidence = (double) b.methodsAgreement / b.methodsTotal;
        this.rootCause = b.rootCause;
        this.cloudContext = b.cloudContext;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return a builder pre-populated with this record's fields
     */
    public Builder toBuilder() {
        return new Builder()
                .date(date)
                .service(service)
                .provider(provider)
                .cost(cost)
                .baselineCost(baselineCost)
                .anomalyScore(anomalyScore)
                .detectionMethod(detectionMethod)
                .detectionMethods(detectionMethods)
                .methodsAgreement(methodsAgreement)
                .methodsTotal(methodsTotal)
                .rootCause(rootCause)
                .cloudContext(cloudContext);
    }

    public AnomalyRecord withRootCause(RootCause cause) {
        return toBuilder().rootCause(cause).build();
    }

    public AnomalyRecord withCloudContext(CloudContext context) {
        return toBuilder().cloudContext(context).build();
    }

    /**
     * Fluent builder. {@code costDifference}, {@code percentageIncrease} and
     * {@code confidence} are derived and cannot be set directly.
     */
    public static class Builder {
        private LocalDate date;
        private String service;
        private String provider;
        private double cost;
        private double baselineCost;
        private double anomalyScore;
        private DetectionMethod detectionMethod;
        private List<DetectionMethod> detectionMethods;
        private int methodsAgreement = 1;
        private int methodsTotal = 1;
        private RootCause rootCause;
        private CloudContext cloudContext;

        public Builder date(LocalDate date) {
            this.date = date;
            return this;
        }

        public Builder service(String service) {
            this.service = service;
            return this;
        }

        public Builder provider(String provider) {
            this.provider = provider;
            return this;
        }

        public Builder cost(double cost) {
            this.cost = cost;
            return this;
        }

        public Builder baselineCost(double baselineCost) {
            this.baselineCost = baselineCost;
            return this;
        }

        public Builder anomalyScore(double anomalyScore) {
            this.anomalyScore = anomalyScore;
            return this;
        }

        public Builder detectionMethod(DetectionMethod detectionMethod) {
            this.detectionMethod = detectionMethod;
            return this;
        }

        public Builder detectionMethods(List<DetectionMethod> detectionMethods) {
            this.detectionMethods = detectionMethods;
            return this;
        }

        public Builder methodsAgreement(int methodsAgreement) {
            this.methodsAgreement = methodsAgreement;
            return this;
        }

        public Builder methodsTotal(int methodsTotal) {
            this.methodsTotal = methodsTotal;
            return this;
        }

        public Builder rootCause(RootCause rootCause) {
            this.rootCause = rootCause;
            return this;
        }

        public Builder cloudContext(CloudContext cloudContext) {
            this.cloudContext = cloudContext;
            return this;
        }

        /**
         * @return a new record
         * @throws IllegalArgumentException if the agreement counts are inconsistent
         * @throws NullPointerException     if service, provider or method is missing
         */
        public AnomalyRecord build() {
            return new AnomalyRecord(this);
        }
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

    @JsonProperty("baseline_cost")
    public double getBaselineCost() {
        return baselineCost;
    }

    @JsonProperty("cost_difference")
    public double getCostDifference() {
        return costDifference;
    }

    @JsonProperty("percentage_increase")
    public double getPercentageIncrease() {
        return percentageIncrease;
    }

    @JsonProperty("anomaly_score")
    public double getAnomalyScore() {
        return anomalyScore;
    }

    @JsonProperty("detection_method")
    public DetectionMethod getDetectionMethod() {
        return detectionMethod;
    }

    @JsonProperty("detection_methods")
    public List<DetectionMethod> getDetectionMethods() {
        return detectionMethods;
    }

    @JsonProperty("methods_agreement")
    public int getMethodsAgreement() {
        return methodsAgreement;
    }

    @JsonProperty("methods_total")
    public int getMethodsTotal() {
        return methodsTotal;
    }

    public double getConfidence() {
        return confidence;
    }

    @JsonProperty("root_cause")
    public RootCause getRootCause() {
        return rootCause;
    }

    @JsonProperty("cloud_context")
    public CloudContext getCloudContext() {
        return cloudContext;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof AnomalyRecord that))
            return false;
        return Double.compare(cost, that.cost) == 0
                && Double.compare(baselineCost, that.baselineCost) == 0
                && Double.compare(anomalyScore, that.anomalyScore) == 0
                && methodsAgreement == that.methodsAgreement
                && methodsTotal == that.methodsTotal
                && Objects.equals(date, that.date)
                && Objects.equals(service, that.service)
                && Objects.equals(provider, that.provider)
                && detectionMethod == that.detectionMethod
                && Objects.equals(detectionMethods, that.detectionMethods)
                && Objects.equals(rootCause, that.rootCause)
                && Objects.equals(cloudContext, that.cloudContext);
    }

    @Override
    public int hashCode() {
        return Objects.hash(date, service, provider, cost, baselineCost, anomalyScore,
                detectionMethod, detectionMethods, methodsAgreement, methodsTotal, rootCause, cloudContext);
    }

    @Override
    public String toString() {
        return "AnomalyRecord{" +
                "date=" + date +
                ", service='" + service + '\'' +
                ", provider='" + provider + '\'' +
                ", cost=" + cost +
                ", baseline=" + baselineCost +
                ", pct=" + percentageIncrease +
                ", method=" + detectionMethod +
                ", agreement=" + methodsAgreement + "/" + methodsTotal +
                '}';
    }
}
