package com.costsentinel.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link DetectionMethod} name resolution.
 */
class DetectionMethodTest {

    @Test
    @DisplayName("Should resolve wire names case-insensitively")
    void shouldResolveWireNames() {
        assertThat(DetectionMethod.fromName("zscore")).contains(DetectionMethod.ZSCORE);
        assertThat(DetectionMethod.fromName("ISOLATION")).contains(DetectionMethod.ISOLATION);
        assertThat(DetectionMethod.fromName(" density ")).contains(DetectionMethod.DENSITY);
        assertThat(DetectionMethod.fromName("decomposition")).contains(DetectionMethod.DECOMPOSITION);
        assertThat(DetectionMethod.fromName("ensemble")).contains(DetectionMethod.ENSEMBLE);
    }

    @Test
    @DisplayName("Should resolve the legacy aliases")
    void shouldResolveAliases() {
        assertThat(DetectionMethod.fromName("z_score")).contains(DetectionMethod.ZSCORE);
        assertThat(DetectionMethod.fromName("isolation_forest")).contains(DetectionMethod.ISOLATION);
        assertThat(DetectionMethod.fromName("dbscan")).contains(DetectionMethod.DENSITY);
        assertThat(DetectionMethod.fromName("seasonal_decompose")).contains(DetectionMethod.DECOMPOSITION);
    }

    @Test
    @DisplayName("Should not resolve unknown or missing names")
    void shouldRejectUnknownNames() {
        assertThat(DetectionMethod.fromName("prophet")).isEmpty();
        assertThat(DetectionMethod.fromName("")).isEmpty();
        assertThat(DetectionMethod.fromName(null)).isEmpty();
    }

    @Test
    @DisplayName("Should expose human-readable names")
    void shouldExposeDisplayNames() {
        assertThat(DetectionMethod.ISOLATION.getDisplayName()).isEqualTo("Isolation Forest (ML)");
        assertThat(DetectionMethod.ENSEMBLE.getDisplayName()).isEqualTo("Ensemble Method");
    }
}
