package com.costsentinel.core.detection;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link SeasonalDecomposition}.
 */
class SeasonalDecompositionTest {

    private static double[] weekly(int weeks) {
        double[] values = new double[weeks * 7];
        for (int i = 0; i < values.length; i++) {
            values[i] = (i % 7 == 5 || i % 7 == 6) ? 300 : 100;
        }
        return values;
    }

    @Test
    @DisplayName("A pure weekly pattern should decompose into trend and season only")
    void shouldSeparateSeason() {
        SeasonalDecomposition decomposition = SeasonalDecomposition.decompose(weekly(4), 7);

        double[] trend = decomposition.getTrend();
        double[] residual = decomposition.getResidual();
        assertThat(trend[0]).isNaN();
        assertThat(trend[27]).isNaN();
        for (int i = 3; i < 25; i++) {
            assertThat(trend[i]).isCloseTo(1100.0 / 7, within(1e-9));
            assertThat(residual[i]).isCloseTo(0.0, within(1e-9));
        }
        assertThat(decomposition.getSeasonal()[5]).isCloseTo(300 - 1100.0 / 7, within(1e-9));
    }

    @Test
    @DisplayName("Autocorrelation should be one period apart strongly positive")
    void shouldMeasureAutocorrelation() {
        assertThat(SeasonalDecomposition.autocorrelation(weekly(4), 7)).isGreaterThan(0.7);
        assertThat(SeasonalDecomposition.autocorrelation(new double[] { 5, 5, 5, 5 }, 1)).isZero();
    }

    @Test
    @DisplayName("Should require two full periods")
    void shouldRejectShortInput() {
        assertThatThrownBy(() -> SeasonalDecomposition.decompose(new double[13], 7))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("two full periods");
    }
}
