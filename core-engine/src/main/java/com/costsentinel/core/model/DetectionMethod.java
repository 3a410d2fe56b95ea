package com.costsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

/**
 * Detection strategies understood by the engine.
 *
 * <p>
 * Each constant carries its wire name (used in requests and results) and a
 * human-readable display name. {@link #fromName(String)} also accepts the
 * legacy aliases {@code z_score}, {@code isolation_forest}, {@code dbscan}
 * and {@code seasonal_decompose}.
 * </p>
 *
 * @since 1.0.0
 */
public enum DetectionMethod {

    ZSCORE("zscore", "Z-Score Statistical"),
    ISOLATION("isolation", "Isolation Forest (ML)"),
    DENSITY("density", "DBSCAN Clustering"),
    DECOMPOSITION("decomposition", "Seasonal Decomposition"),
    ENSEMBLE("ensemble", "Ensemble Method");

    private final String wireName;
    private final String displayName;

    DetectionMethod(String wireName, String displayName) {
        this.wireName = wireName;
        this.displayName = displayName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Resolve a method from its wire name or one of its aliases.
     *
     * @param name method name, case-insensitive; may be {@code null}
     * @return the matching method, or empty if the name is unknown
     */
    public static Optional<DetectionMethod> fromName(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        return switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "zscore", "z_score" -> Optional.of(ZSCORE);
            case "isolation", "isolation_forest" -> Optional.of(ISOLATION);
            case "density", "dbscan" -> Optional.of(DENSITY);
            case "decomposition", "seasonal_decompose", "time_series" -> Optional.of(DECOMPOSITION);
            case "ensemble" -> Optional.of(ENSEMBLE);
            default -> Optional.empty();
        };
    }

    @Override
    public String toString() {
        return wireName;
    }
}
