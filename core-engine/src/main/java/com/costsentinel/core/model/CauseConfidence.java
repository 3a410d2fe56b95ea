package com.costsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Qualitative confidence attached to a probable cause or root cause.
 *
 * <p>
 * Declared from strongest to weakest; {@link #rank()} is used to order
 * causes.
 * </p>
 *
 * @since 1.0.0
 */
public enum CauseConfidence {

    VERY_HIGH("very high", 4),
    HIGH("high", 3),
    MEDIUM("medium", 2),
    LOW("low", 1);

    private final String label;
    private final int rank;

    CauseConfidence(String label, int rank) {
        this.label = label;
        this.rank = rank;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    public int rank() {
        return rank;
    }

    @Override
    public String toString() {
        return label;
    }
}
