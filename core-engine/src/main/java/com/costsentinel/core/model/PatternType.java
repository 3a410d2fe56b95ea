package com.costsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Shapes of cost change recognised by the cloud context analysis.
 *
 * @since 1.0.0
 */
public enum PatternType {

    SUDDEN_INCREASE("sudden_increase"),
    STEP_INCREASE("step_increase"),
    TEMPORARY_SPIKE("temporary_spike"),
    CYCLICAL_SPIKE("cyclical_spike"),
    UNKNOWN("unknown");

    private final String value;

    PatternType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * @param value taxonomy spelling, e.g. {@code step_increase}
     * @return the matching pattern type
     * @throws IllegalArgumentException if the value is not a known pattern
     */
    public static PatternType fromValue(String value) {
        if (value != null) {
            String normalized = value.trim().toLowerCase(Locale.ROOT);
            for (PatternType type : values()) {
                if (type.value.equals(normalized)) {
                    return type;
                }
            }
        }
        throw new IllegalArgumentException("Unknown pattern type: '" + value + "'");
    }

    @Override
    public String toString() {
        return value;
    }
}
