package com.costsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Resource utilization sample used to correlate cost anomalies with usage.
 *
 * <p>
 * Besides the well-known {@code date}, {@code service} and
 * {@code resource_id} columns a row carries any number of numeric metrics
 * ({@code instance_count}, {@code storage_gb}, {@code data_transfer_gb}, ...).
 * Unknown JSON properties are collected as metrics when numeric.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Instances are meant to be fully populated before they are handed to the
 * engine and not modified afterwards.
 * </p>
 *
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class UtilizationObservation {

    private LocalDate date;
    private String service;
    private String resourceId;
    private final Map<String, Double> metrics = new LinkedHashMap<>();

    /** No-arg constructor required by Jackson. */
    public UtilizationObservation() {
    }

    public UtilizationObservation(LocalDate date, String service, String resourceId) {
        this.date = date;
        this.service = service;
        this.resourceId = resourceId;
    }

    /**
     * Fluent helper for tests and programmatic construction.
     *
     * @param name  metric name
     * @param value metric value
     * @return this observation
     */
    public UtilizationObservation metric(String name, double value) {
        setMetric(name, value);
        return this;
    }

    /**
     * Record a metric. Called by Jackson for every property not mapped
     * elsewhere; non-numeric values are ignored.
     *
     * @param name  metric name; must not be {@code null}
     * @param value raw value
     */
    @JsonAnySetter
    public void setMetric(String name, Object value) {
        Objects.requireNonNull(name, "Metric name must not be null");
        if (value instanceof Number n) {
            metrics.put(name, n.doubleValue());
        } else if (value instanceof String s) {
            try {
                metrics.put(name, Double.parseDouble(s));
            } catch (NumberFormatException e) {
                // not a metric column
            }
        }
    }

    /**
     * @return unmodifiable view of the metrics
     */
    @JsonAnyGetter
    public Map<String, Double> getMetrics() {
        return Collections.unmodifiableMap(metrics);
    }

    public OptionalDouble getMetric(String name) {
        Double value = metrics.get(name);
        return value == null ? OptionalDouble.empty() : OptionalDouble.of(value);
    }

    public LocalDate getDate() {
        return date;
    }

    public void setDate(LocalDate date) {
        this.date = date;
    }

    public String getService() {
        return service;
    }

    public void setService(String service) {
        this.service = service;
    }

    @JsonProperty("resource_id")
    public String getResourceId() {
        return resourceId;
    }

    @JsonProperty("resource_id")
    public void setResourceId(String resourceId) {
        this.resourceId = resourceId;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof UtilizationObservation that))
            return false;
        return Objects.equals(date, that.date)
                && Objects.equals(service, that.service)
                && Objects.equals(resourceId, that.resourceId)
                && Objects.equals(metrics, that.metrics);
    }

    @Override
    public int hashCode() {
        return Objects.hash(date, service, resourceId, metrics);
    }

    @Override
    public String toString() {
        return "UtilizationObservation{" +
                "date=" + date +
                ", service='" + service + '\'' +
                ", resourceId='" + resourceId + '\'' +
                ", metrics=" + metrics +
                '}';
    }
}
