package com.costsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A ranked explanation for a cost anomaly.
 *
 * @since 1.0.0
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public final class ProbableCause {

    /** Where a cause came from. */
    public enum Source {
        @JsonProperty("custom_event")
        CUSTOM_EVENT,
        @JsonProperty("cloud_event")
        CLOUD_EVENT,
        @JsonProperty("resource_pattern")
        RESOURCE_PATTERN
    }

    private final String cause;
    private final CauseConfidence confidence;
    private final String description;
    private final Source source;
    private final Map<String, Object> eventInfo;

    public ProbableCause(String cause, CauseConfidence confidence, String description,
                         Source source, Map<String, Object> eventInfo) {
        this.cause = Objects.requireNonNull(cause, "cause must not be null");
        this.confidence = Objects.requireNonNull(confidence, "confidence must not be null");
        this.description = description;
        this.source = Objects.requireNonNull(source, "source must not be null");
        this.eventInfo = eventInfo != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(eventInfo))
                : Map.of();
    }

    public ProbableCause(String cause, CauseConfidence confidence, String description, Source source) {
        this(cause, confidence, description, source, null);
    }

    public String getCause() {
        return cause;
    }

    public CauseConfidence getConfidence() {
        return confidence;
    }

    public String getDescription() {
        return description;
    }

    public Source getSource() {
        return source;
    }

    @JsonProperty("event_info")
    public Map<String, Object> getEventInfo() {
        return eventInfo;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ProbableCause that))
            return false;
        return Objects.equals(cause, that.cause)
                && confidence == that.confidence
                && Objects.equals(description, that.description)
                && source == that.source;
    }

    @Override
    public int hashCode() {
        return Objects.hash(cause, confidence, description, source);
    }

    @Override
    public String toString() {
        return "ProbableCause{cause='" + cause + "', confidence=" + confidence + ", source=" + source + '}';
    }
}
