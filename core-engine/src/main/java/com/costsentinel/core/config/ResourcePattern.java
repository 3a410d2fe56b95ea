package com.costsentinel.core.config;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A group of utilization metrics whose joint excursion points to a resource
 * level cause, e.g. {@code storage_increase} over {@code storage_gb} and
 * {@code storage_operations}.
 *
 * <p>
 * A metric trips when its peak around the anomaly exceeds
 * {@code mean × thresholdMultiplier}.
 * </p>
 *
 * @since 1.0.0
 */
public class ResourcePattern extends LoadedTable {

    private String name;
    private List<String> metrics = new ArrayList<>();
    private double thresholdMultiplier;

    void validate(List<String> errors) {
        if (name == null || name.isBlank()) {
            errors.add("Resource pattern requires 'name'");
        }
        if (metrics.isEmpty()) {
            errors.add("Resource pattern '" + name + "' requires at least one metric");
        }
        if (!(thresholdMultiplier > 0)) {
            errors.add("Resource pattern '" + name + "' requires 'thresholdMultiplier' > 0");
        }
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        checkMutable();
        this.name = name;
    }

    public List<String> getMetrics() {
        return Collections.unmodifiableList(metrics);
    }

    public void setMetrics(List<String> metrics) {
        checkMutable();
        this.metrics = metrics != null ? new ArrayList<>(metrics) : new ArrayList<>();
    }

    public double getThresholdMultiplier() {
        return thresholdMultiplier;
    }

    public void setThresholdMultiplier(double thresholdMultiplier) {
        checkMutable();
        this.thresholdMultiplier = thresholdMultiplier;
    }

    @Override
    public String toString() {
        return "ResourcePattern{name='" + name + "', metrics=" + metrics
                + ", thresholdMultiplier=" + thresholdMultiplier + '}';
    }
}
