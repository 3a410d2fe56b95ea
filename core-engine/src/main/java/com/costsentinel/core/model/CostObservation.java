package com.costsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Objects;

/**
 * A single billed cost for one service of one provider on one day.
 *
 * <p>
 * Built by the caller from persisted billing rows and consumed read-only by
 * the engine. {@code service} and {@code provider} default to
 * {@value #UNKNOWN} when absent. A missing {@code cost} is allowed and is
 * imputed during normalization; a present cost must be non-negative.
 * </p>
 *
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class CostObservation {

    /** Placeholder for an absent service or provider. */
    public static final String UNKNOWN = "Unknown";

    private final LocalDate date;
    private final BigDecimal cost;
    private final String service;
    private final String provider;
    private final String resourceId;

    private CostObservation(Builder builder) {
        if (builder.cost != null && builder.cost.signum() < 0) {
            throw new IllegalArgumentException("cost must be >= 0, got: " + builder.cost);
        }
        this.date = builder.date;
        this.cost = builder.cost;
        this.service = orUnknown(builder.service);
        this.provider = orUnknown(builder.provider);
        this.resourceId = builder.resourceId;
    }

    @JsonCreator
    static CostObservation fromJson(@JsonProperty("date") LocalDate date,
                                    @JsonProperty("cost") BigDecimal cost,
                                    @JsonProperty("service") String service,
                                    @JsonProperty("provider") String provider,
                                    @JsonProperty("resource_id") String resourceId) {
        return builder()
                .date(date)
                .cost(cost)
                .service(service)
                .provider(provider)
                .resourceId(resourceId)
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Shorthand for the common dated, costed observation.
     */
    public static CostObservation of(LocalDate date, double cost, String service, String provider) {
        return builder().date(date).cost(cost).service(service).provider(provider).build();
    }

    /**
     * Copy of this observation carrying a different cost.
     *
     * @param newCost replacement cost
     * @return a new observation
     */
    public CostObservation withCost(BigDecimal newCost) {
        return builder()
                .date(date)
                .cost(newCost)
                .service(service)
                .provider(provider)
                .resourceId(resourceId)
                .build();
    }

    public static class Builder {
        private LocalDate date;
        private BigDecimal cost;
        private String service;
        private String provider;
        private String resourceId;

        public Builder date(LocalDate date) {
            this.date = date;
            return this;
        }

        public Builder cost(BigDecimal cost) {
            this.cost = cost;
            return this;
        }

        public Builder cost(double cost) {
            this.cost = BigDecimal.valueOf(cost);
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

        public Builder resourceId(String resourceId) {
            this.resourceId = resourceId;
            return this;
        }

        /**
         * @return a new observation
         * @throws IllegalArgumentException if the cost is negative
         */
        public CostObservation build() {
            return new CostObservation(this);
        }
    }

    public LocalDate getDate() {
        return date;
    }

    /**
     * @return the billed cost, or {@code null} when it was not reported
     */
    public BigDecimal getCost() {
        return cost;
    }

    public String getService() {
        return service;
    }

    public String getProvider() {
        return provider;
    }

    @JsonProperty("resource_id")
    public String getResourceId() {
        return resourceId;
    }

    public boolean hasCost() {
        return cost != null;
    }

    /**
     * @return the cost as a {@code double}, {@code NaN} when absent
     */
    public double costValue() {
        return cost != null ? cost.doubleValue() : Double.NaN;
    }

    private static String orUnknown(String value) {
        return (value == null || value.isBlank()) ? UNKNOWN : value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof CostObservation that))
            return false;
        return Objects.equals(date, that.date)
                && sameCost(cost, that.cost)
                && Objects.equals(service, that.service)
                && Objects.equals(provider, that.provider)
                && Objects.equals(resourceId, that.resourceId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(date, cost != null ? cost.stripTrailingZeros() : null,
                service, provider, resourceId);
    }

    // 100.0 and 100.00 are the same cost
    private static boolean sameCost(BigDecimal a, BigDecimal b) {
        return a == null ? b == null : b != null && a.compareTo(b) == 0;
    }

    @Override
    public String toString() {
        return "CostObservation{" +
                "date=" + date +
                ", cost=" + cost +
                ", service='" + service + '\'' +
                ", provider='" + provider + '\'' +
                ", resourceId='" + resourceId + '\'' +
                '}';
    }
}
