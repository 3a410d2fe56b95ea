package com.costsentinel.core.detection.isolation;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link IsolationForest}.
 */
class IsolationForestTest {

    private static double[][] clusterWithOutlier() {
        double[][] rows = new double[32][];
        for (int i = 0; i < 31; i++) {
            rows[i] = new double[] { (i % 5) * 0.01, (i % 3) * 0.01 };
        }
        rows[31] = new double[] { 5.0, 5.0 };
        return rows;
    }

    @Test
    @DisplayName("The isolated row should score higher than every clustered row")
    void shouldScoreOutlierHighest() {
        double[][] rows = clusterWithOutlier();
        double[] scores = IsolationForest.train(rows, 100, 256, 7L).scoreAll(rows);

        for (int i = 0; i < 31; i++) {
            assertThat(scores[31]).isGreaterThan(scores[i]);
        }
        assertThat(scores[31]).isGreaterThan(0.5).isLessThanOrEqualTo(1.0);
    }

    @Test
    @DisplayName("The same seed should grow the same forest")
    void shouldBeReproducible() {
        double[][] rows = clusterWithOutlier();

        double[] first = IsolationForest.train(rows, 50, 16, 99L).scoreAll(rows);
        double[] second = IsolationForest.train(rows, 50, 16, 99L).scoreAll(rows);

        assertThat(first).containsExactly(second);
    }

    @Test
    @DisplayName("Average path length should follow the harmonic approximation")
    void shouldComputeAveragePathLength() {
        assertThat(IsolationNode.averagePathLength(1)).isZero();
        assertThat(IsolationNode.averagePathLength(2)).isEqualTo(1.0);
        assertThat(IsolationNode.averagePathLength(256)).isCloseTo(10.24, within(0.01));
    }

    @Test
    @DisplayName("Should reject empty training data")
    void shouldRejectEmptyRows() {
        assertThatThrownBy(() -> IsolationForest.train(new double[0][], 10, 10, 1L))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(IsolationForest.train(clusterWithOutlier(), 3, 8, 1L).getTreeCount()).isEqualTo(3);
    }
}
