package com.costsentinel.core.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * The candidates produced by one method slot in one detection run.
 *
 * <p>
 * {@link Outcome} makes the fallback policy visible: a slot either ran its
 * own method, substituted the z-score method after a failure, or produced
 * nothing because even the substitute failed.
 * </p>
 *
 * @since 1.0.0
 */
public final class MethodResult {

    /** How the slot's candidates were obtained. */
    public enum Outcome {
        /** The requested method ran to completion. */
        PRIMARY,
        /** The requested method failed and z-score ran in its place. */
        FALLBACK,
        /** Neither the method nor the z-score substitute produced a result. */
        FAILED
    }

    private final DetectionMethod method;
    private final List<AnomalyCandidate> anomalies;
    private final Outcome outcome;
    private final String message;

    private MethodResult(DetectionMethod method, List<AnomalyCandidate> anomalies,
                         Outcome outcome, String message) {
        this.method = Objects.requireNonNull(method, "method must not be null");
        this.anomalies = List.copyOf(anomalies);
        this.outcome = Objects.requireNonNull(outcome, "outcome must not be null");
        this.message = message;
    }

    public static MethodResult primary(DetectionMethod method, List<AnomalyCandidate> anomalies) {
        return new MethodResult(method, anomalies, Outcome.PRIMARY, null);
    }

    /**
     * Wrap a z-score result as the substitute for {@code slot}. Candidates are
     * re-attributed to the slot so agreement is counted per slot.
     */
    public static MethodResult fallback(DetectionMethod slot, MethodResult substitute, String reason) {
        List<AnomalyCandidate> attributed = substitute.getAnomalies().stream()
                .map(candidate -> candidate.attributedTo(slot))
                .toList();
        return new MethodResult(slot, attributed, Outcome.FALLBACK, reason);
    }

    public static MethodResult failed(DetectionMethod method, String reason) {
        return new MethodResult(method, List.of(), Outcome.FAILED, reason);
    }

    public DetectionMethod getMethod() {
        return method;
    }

    public List<AnomalyCandidate> getAnomalies() {
        return anomalies;
    }

    public Outcome getOutcome() {
        return outcome;
    }

    public Optional<String> getMessage() {
        return Optional.ofNullable(message);
    }

    public boolean isFailed() {
        return outcome == Outcome.FAILED;
    }

    @Override
    public String toString() {
        return "MethodResult{" +
                "method=" + method +
                ", anomalies=" + anomalies.size() +
                ", outcome=" + outcome +
                (message != null ? ", message='" + message + '\'' : "") +
                '}';
    }
}
