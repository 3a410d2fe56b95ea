package com.costsentinel.core.engine;

import com.costsentinel.core.ensemble.AggregationOutcome;
import com.costsentinel.core.model.AnomalyRecord;
import com.costsentinel.core.model.DetectionMethod;
import com.costsentinel.core.model.DetectionResult;

import java.time.Clock;
import java.util.List;
import java.util.Objects;

/**
 * Builds the uniform {@link DetectionResult} envelope for every way a run
 * can end, stamped with the injected clock.
 *
 * @since 1.0.0
 */
public class ResultAssembler {

    private final Clock clock;

    public ResultAssembler(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "Clock must not be null");
    }

    /**
     * Too few points to analyze: a successful, empty result with a note.
     */
    public DetectionResult insufficientData(DetectionMethod method, double threshold,
                                            int dataPoints, int requiredPoints) {
        return base(method, threshold, dataPoints)
                .note("Insufficient data for analysis: " + dataPoints + " point(s), at least "
                        + requiredPoints + " required")
                .build();
    }

    /**
     * Detection ran. Fallbacks and failed slots are reported in the note.
     */
    public DetectionResult success(DetectionMethod method, double threshold, int dataPoints,
                                   AggregationOutcome outcome, List<AnomalyRecord> records,
                                   boolean cloudContextApplied) {
        return base(method, threshold, dataPoints)
                .anomalies(records)
                .methodsRun(outcome.getMethodsRun())
                .cloudContextApplied(cloudContextApplied)
                .note(outcome.getNote().orElse(null))
                .build();
    }

    /**
     * Nothing could be detected: an error result with empty anomalies.
     */
    public DetectionResult failure(DetectionMethod method, double threshold, int dataPoints,
                                   List<DetectionMethod> methodsRun, String error) {
        return base(method, threshold, dataPoints)
                .methodsRun(methodsRun)
                .error(Objects.requireNonNull(error, "error must not be null"))
                .build();
    }

    private DetectionResult.Builder base(DetectionMethod method, double threshold, int dataPoints) {
        return DetectionResult.builder()
                .detectionMethod(method)
                .threshold(threshold)
                .dataPoints(dataPoints)
                .detectionTimestamp(clock.instant());
    }
}
