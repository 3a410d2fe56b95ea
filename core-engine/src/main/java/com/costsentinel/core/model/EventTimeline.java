package com.costsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * How long the cost effect of a taxonomy event is expected to last.
 *
 * @since 1.0.0
 */
public enum EventTimeline {

    TEMPORARY("temporary"),
    PERSISTENT("persistent"),
    RECURRING("recurring");

    private final String value;

    EventTimeline(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * @param value taxonomy spelling
     * @return the matching timeline
     * @throws IllegalArgumentException if the value is not a known timeline
     */
    public static EventTimeline fromValue(String value) {
        if (value != null) {
            String normalized = value.trim().toLowerCase(Locale.ROOT);
            for (EventTimeline timeline : values()) {
                if (timeline.value.equals(normalized)) {
                    return timeline;
                }
            }
        }
        throw new IllegalArgumentException("Unknown event timeline: '" + value + "'");
    }

    @Override
    public String toString() {
        return value;
    }
}
