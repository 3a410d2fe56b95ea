package com.costsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Uniform response envelope of a detection run.
 *
 * <p>
 * Every run produces one, including runs with too little data, runs that
 * fell back to z-score and runs that failed outright. A failed run carries
 * an {@code error} and no anomalies; a degraded but successful run may carry
 * an explanatory {@code note}.
 * </p>
 *
 * @since 1.0.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class DetectionResult {

    private final List<AnomalyRecord> anomalies;
    private final DetectionMethod detectionMethod;
    private final double threshold;
    private final int dataPoints;
    private final List<DetectionMethod> methodsRun;
    private final Instant detectionTimestamp;
    private final boolean cloudContextApplied;
    private final String note;
    private final String error;

    private DetectionResult(Builder b) {
        this.anomalies = b.anomalies != null ? List.copyOf(b.anomalies) : List.of();
        this.detectionMethod = Objects.requireNonNull(b.detectionMethod, "detectionMethod must not be null");
        this.threshold = b.threshold;
        this.dataPoints = b.dataPoints;
        this.methodsRun = b.methodsRun != null ? List.copyOf(b.methodsRun) : List.of();
        this.detectionTimestamp = Objects.requireNonNull(b.detectionTimestamp, "detectionTimestamp must not be null");
        this.cloudContextApplied = b.cloudContextApplied;
        this.note = b.note;
        this.error = b.error;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private List<AnomalyRecord> anomalies;
        private DetectionMethod detectionMethod;
        private double threshold;
        private int dataPoints;
        private List<DetectionMethod> methodsRun;
        private Instant detectionTimestamp;
        private boolean cloudContextApplied;
        private String note;
        private String error;

        public Builder anomalies(List<AnomalyRecord> anomalies) {
            this.anomalies = anomalies;
            return this;
        }

        public Builder detectionMethod(DetectionMethod detectionMethod) {
            this.detectionMethod = detectionMethod;
            return this;
        }

        public Builder threshold(double threshold) {
            this.threshold = threshold;
            return this;
        }

        public Builder dataPoints(int dataPoints) {
            this.dataPoints = dataPoints;
            return this;
        }

        public Builder methodsRun(List<DetectionMethod> methodsRun) {
            this.methodsRun = methodsRun;
            return this;
        }

        public Builder detectionTimestamp(Instant detectionTimestamp) {
            this.detectionTimestamp = detectionTimestamp;
            return this;
        }

        public Builder cloudContextApplied(boolean cloudContextApplied) {
            this.cloudContextApplied = cloudContextApplied;
            return this;
        }

        public Builder note(String note) {
            this.note = note;
            return this;
        }

        public Builder error(String error) {
            this.error = error;
            return this;
        }

        public DetectionResult build() {
            return new DetectionResult(this);
        }
    }

    public List<AnomalyRecord> getAnomalies() {
        return anomalies;
    }

    @JsonProperty("detection_method")
    public DetectionMethod getDetectionMethod() {
        return detectionMethod;
    }

    @JsonProperty("method_name")
    public String getMethodName() {
        return detectionMethod.getDisplayName();
    }

    public double getThreshold() {
        return threshold;
    }

    @JsonProperty("data_points")
    public int getDataPoints() {
        return dataPoints;
    }

    @JsonProperty("anomaly_count")
    public int getAnomalyCount() {
        return anomalies.size();
    }

    @JsonProperty("methods_run")
    public List<DetectionMethod> getMethodsRun() {
        return methodsRun;
    }

    @JsonProperty("detection_timestamp")
    public Instant getDetectionTimestamp() {
        return detectionTimestamp;
    }

    @JsonProperty("cloud_context_applied")
    public boolean isCloudContextApplied() {
        return cloudContextApplied;
    }

    public String getNote() {
        return note;
    }

    public String getError() {
        return error;
    }

    @JsonProperty("success")
    public boolean isSuccess() {
        return error == null;
    }

    @Override
    public String toString() {
        return "DetectionResult{" +
                "anomalies=" + anomalies.size() +
                ", detectionMethod=" + detectionMethod +
                ", threshold=" + threshold +
                ", dataPoints=" + dataPoints +
                ", methodsRun=" + methodsRun +
                ", timestamp=" + detectionTimestamp +
                (note != null ? ", note='" + note + '\'' : "") +
                (error != null ? ", error='" + error + '\'' : "") +
                '}';
    }
}
