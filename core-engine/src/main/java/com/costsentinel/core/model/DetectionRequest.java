package com.costsentinel.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Everything one detection run needs: the cost series, the requested method
 * and threshold, the enrichment switches and the optional side data.
 *
 * <p>
 * The method may be given either as a {@link DetectionMethod} or by name, so
 * that request parameters can be passed through unchanged; unknown names are
 * resolved by the engine.
 * </p>
 *
 * @since 1.0.0
 */
public final class DetectionRequest {

    private final List<CostObservation> observations;
    private final String methodName;
    private final Double threshold;
    private final boolean analyzeRootCause;
    private final boolean analyzeCloudContext;
    private final List<UtilizationObservation> utilization;
    private final List<CustomEvent> customEvents;

    private DetectionRequest(Builder b) {
        this.observations = b.observations != null
                ? Collections.unmodifiableList(new ArrayList<>(b.observations))
                : List.of();
        this.methodName = b.methodName;
        this.threshold = b.threshold;
        this.analyzeRootCause = b.analyzeRootCause;
        this.analyzeCloudContext = b.analyzeCloudContext;
        this.utilization = b.utilization != null
                ? Collections.unmodifiableList(new ArrayList<>(b.utilization))
                : List.of();
        this.customEvents = b.customEvents != null ? List.copyOf(b.customEvents) : List.of();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private List<CostObservation> observations;
        private String methodName = DetectionMethod.ENSEMBLE.getWireName();
        private Double threshold;
        private boolean analyzeRootCause = true;
        private boolean analyzeCloudContext = true;
        private List<UtilizationObservation> utilization;
        private List<CustomEvent> customEvents;

        public Builder observations(List<CostObservation> observations) {
            this.observations = observations;
            return this;
        }

        public Builder method(DetectionMethod method) {
            this.methodName = method != null ? method.getWireName() : null;
            return this;
        }

        public Builder methodName(String methodName) {
            this.methodName = methodName;
            return this;
        }

        public Builder threshold(Double threshold) {
            this.threshold = threshold;
            return this;
        }

        public Builder analyzeRootCause(boolean analyzeRootCause) {
            this.analyzeRootCause = analyzeRootCause;
            return this;
        }

        public Builder analyzeCloudContext(boolean analyzeCloudContext) {
            this.analyzeCloudContext = analyzeCloudContext;
            return this;
        }

        public Builder utilization(List<UtilizationObservation> utilization) {
            this.utilization = utilization;
            return this;
        }

        public Builder customEvents(List<CustomEvent> customEvents) {
            this.customEvents = customEvents;
            return this;
        }

        public DetectionRequest build() {
            return new DetectionRequest(this);
        }
    }

    public List<CostObservation> getObservations() {
        return observations;
    }

    /**
     * @return the raw method name as supplied by the caller
     */
    public String getMethodName() {
        return methodName;
    }

    /**
     * @return the resolved method, empty when the name is missing or unknown
     */
    public Optional<DetectionMethod> getMethod() {
        return DetectionMethod.fromName(methodName);
    }

    public OptionalDouble getThreshold() {
        return threshold != null ? OptionalDouble.of(threshold) : OptionalDouble.empty();
    }

    public boolean isAnalyzeRootCause() {
        return analyzeRootCause;
    }

    /**
     * Cloud context is only attached when root-cause analysis is requested too.
     */
    public boolean isAnalyzeCloudContext() {
        return analyzeRootCause && analyzeCloudContext;
    }

    public List<UtilizationObservation> getUtilization() {
        return utilization;
    }

    public List<CustomEvent> getCustomEvents() {
        return customEvents;
    }

    @Override
    public String toString() {
        return "DetectionRequest{" +
                "observations=" + observations.size() +
                ", method='" + methodName + '\'' +
                ", threshold=" + threshold +
                ", analyzeRootCause=" + analyzeRootCause +
                ", analyzeCloudContext=" + analyzeCloudContext +
                ", utilization=" + utilization.size() +
                ", customEvents=" + customEvents.size() +
                '}';
    }
}
