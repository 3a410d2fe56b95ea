package com.costsentinel.core.context;

import com.costsentinel.core.config.ResourcePattern;
import com.costsentinel.core.model.CauseConfidence;
import com.costsentinel.core.model.ProbableCause;
import com.costsentinel.core.model.UtilizationObservation;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Explains a cost anomaly with resource utilization around the same date.
 *
 * <p>
 * Rows within one day of the anomaly, for the anomaly's service or for no
 * particular service, form the window. A metric trips when its peak in the
 * window exceeds {@code mean × thresholdMultiplier}, the mean being taken
 * over all rows that report the metric. A resource pattern with at least one
 * tripped metric becomes a cause.
 * </p>
 *
 * @since 1.0.0
 */
public class UtilizationCorrelator {

    static final int WINDOW_DAYS = 1;

    private final List<ResourcePattern> patterns;

    public UtilizationCorrelator(List<ResourcePattern> patterns) {
        this.patterns = List.copyOf(Objects.requireNonNull(patterns, "patterns must not be null"));
    }

    /**
     * Causes and affected resources found for one anomaly.
     */
    public static final class Correlation {

        private static final Correlation NONE = new Correlation(List.of(), List.of());

        private final List<ProbableCause> causes;
        private final List<String> affectedResources;

        Correlation(List<ProbableCause> causes, List<String> affectedResources) {
            this.causes = List.copyOf(causes);
            this.affectedResources = List.copyOf(affectedResources);
        }

        public List<ProbableCause> getCauses() {
            return causes;
        }

        public List<String> getAffectedResources() {
            return affectedResources;
        }
    }

    public Correlation correlate(LocalDate date, String service, List<UtilizationObservation> utilization) {
        if (date == null || utilization == null || utilization.isEmpty()) {
            return Correlation.NONE;
        }
        List<UtilizationObservation> window = utilization.stream()
                .filter(row -> row.getDate() != null)
                .filter(row -> Math.abs(row.getDate().toEpochDay() - date.toEpochDay()) <= WINDOW_DAYS)
                .filter(row -> row.getService() == null || row.getService().equals(service))
                .toList();
        if (window.isEmpty()) {
            return Correlation.NONE;
        }

        List<ProbableCause> causes = new ArrayList<>();
        Set<String> affected = new LinkedHashSet<>();
        for (ResourcePattern pattern : patterns) {
            Map<String, Double> tripped = new LinkedHashMap<>();
            for (String metric : pattern.getMetrics()) {
                OptionalDouble mean = utilization.stream()
                        .map(row -> row.getMetric(metric))
                        .filter(OptionalDouble::isPresent)
                        .mapToDouble(OptionalDouble::getAsDouble)
                        .average();
                if (mean.isEmpty() || mean.getAsDouble() <= 0.0) {
                    continue;
                }
                double limit = mean.getAsDouble() * pattern.getThresholdMultiplier();
                OptionalDouble peak = window.stream()
                        .map(row -> row.getMetric(metric))
                        .filter(OptionalDouble::isPresent)
                        .mapToDouble(OptionalDouble::getAsDouble)
                        .max();
                if (peak.isEmpty() || peak.getAsDouble() <= limit) {
                    continue;
                }
                tripped.put(metric, (peak.getAsDouble() - mean.getAsDouble()) / mean.getAsDouble() * 100.0);
                for (UtilizationObservation row : window) {
                    OptionalDouble value = row.getMetric(metric);
                    if (row.getResourceId() != null && value.isPresent() && value.getAsDouble() > limit) {
                        affected.add(row.getResourceId());
                    }
                }
            }
            if (!tripped.isEmpty()) {
                String metrics = tripped.entrySet().stream()
                        .map(e -> String.format(Locale.ROOT, "%s +%.1f%%", e.getKey(), e.getValue()))
                        .collect(Collectors.joining(", "));
                causes.add(new ProbableCause(
                        pattern.getName(),
                        tripped.size() >= 2 ? CauseConfidence.HIGH : CauseConfidence.MEDIUM,
                        "Detected " + pattern.getName() + " with unusual metrics: " + metrics,
                        ProbableCause.Source.RESOURCE_PATTERN));
            }
        }
        return new Correlation(causes, new ArrayList<>(affected));
    }
}
