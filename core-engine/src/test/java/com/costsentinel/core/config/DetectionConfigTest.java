package com.costsentinel.core.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link DetectionConfig}.
 */
class DetectionConfigTest {

    @Test
    @DisplayName("Should expose the documented defaults")
    void shouldExposeDefaults() {
        DetectionConfig config = DetectionConfig.defaults();

        assertThat(config.getDefaultThreshold()).isEqualTo(2.0);
        assertThat(config.getMinDataPoints()).isEqualTo(5);
        assertThat(config.getMinContextDataPoints()).isEqualTo(7);
        assertThat(config.getMinDistancePoints()).isEqualTo(10);
        assertThat(config.getMinDecompositionPoints()).isEqualTo(14);
        assertThat(config.getIsolationTrees()).isEqualTo(100);
        assertThat(config.getIsolationSampleSize()).isEqualTo(256);
        assertThat(config.getIsolationSeed()).isEqualTo(42L);
        assertThat(config.getSeasonalityThreshold()).isEqualTo(0.3);
        assertThat(config.isPartitionByEntity()).isFalse();
        assertThat(config.getTaxonomyPath()).isEmpty();
    }

    @Test
    @DisplayName("Should require more points when context analysis is requested")
    void shouldRequireContextPoints() {
        DetectionConfig config = DetectionConfig.defaults();

        assertThat(config.requiredDataPoints(false)).isEqualTo(5);
        assertThat(config.requiredDataPoints(true)).isEqualTo(7);
    }

    @Test
    @DisplayName("Density neighbour count should grow with the series above the floor")
    void shouldScaleDensityNeighbors() {
        DetectionConfig config = DetectionConfig.defaults();

        assertThat(config.densityMinNeighbors(10)).isEqualTo(3);
        assertThat(config.densityMinNeighbors(60)).isEqualTo(3);
        assertThat(config.densityMinNeighbors(200)).isEqualTo(10);
    }

    @Test
    @DisplayName("Should reject a non-positive threshold")
    void shouldRejectNonPositiveThreshold() {
        assertThatThrownBy(() -> new DetectionConfig.Builder().defaultThreshold(0).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("defaultThreshold");
    }

    @Test
    @DisplayName("Should reject point minimums that are out of order")
    void shouldRejectInconsistentMinimums() {
        assertThatThrownBy(() -> new DetectionConfig.Builder()
                .minDistancePoints(20)
                .minDecompositionPoints(14)
                .build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("minDecompositionPoints");
    }

    @Test
    @DisplayName("Should reject a neighbour fraction outside [0, 1]")
    void shouldRejectBadFraction() {
        assertThatThrownBy(() -> new DetectionConfig.Builder().densityMinNeighborsFraction(1.5).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("densityMinNeighborsFraction");
    }
}
