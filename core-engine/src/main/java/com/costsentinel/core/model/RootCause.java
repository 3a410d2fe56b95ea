package com.costsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * Service-level root-cause hypothesis for an anomaly.
 *
 * @since 1.0.0
 */
public final class RootCause {

    private final String primaryCause;
    private final List<String> potentialCauses;
    private final CauseConfidence confidence;

    public RootCause(String primaryCause, List<String> potentialCauses, CauseConfidence confidence) {
        this.primaryCause = Objects.requireNonNull(primaryCause, "primaryCause must not be null");
        this.potentialCauses = List.copyOf(potentialCauses);
        this.confidence = Objects.requireNonNull(confidence, "confidence must not be null");
    }

    @JsonProperty("primary_cause")
    public String getPrimaryCause() {
        return primaryCause;
    }

    @JsonProperty("potential_causes")
    public List<String> getPotentialCauses() {
        return potentialCauses;
    }

    public CauseConfidence getConfidence() {
        return confidence;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof RootCause that))
            return false;
        return Objects.equals(primaryCause, that.primaryCause)
                && Objects.equals(potentialCauses, that.potentialCauses)
                && confidence == that.confidence;
    }

    @Override
    public int hashCode() {
        return Objects.hash(primaryCause, potentialCauses, confidence);
    }

    @Override
    public String toString() {
        return "RootCause{primaryCause='" + primaryCause + "', confidence=" + confidence + '}';
    }
}
