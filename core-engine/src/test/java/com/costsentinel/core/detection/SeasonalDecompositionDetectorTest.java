package com.costsentinel.core.detection;

import com.costsentinel.core.config.DetectionConfig;
import com.costsentinel.core.model.AnomalyCandidate;
import com.costsentinel.core.model.CostObservation;
import com.costsentinel.core.model.MethodResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import static com.costsentinel.core.CostFixtures.START;
import static com.costsentinel.core.CostFixtures.daily;
import static com.costsentinel.core.CostFixtures.series;
import static com.costsentinel.core.CostFixtures.weeklyWithSpike;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link SeasonalDecompositionDetector}.
 */
class SeasonalDecompositionDetectorTest {

    private SeasonalDecompositionDetector detector;

    /**
     * Four 30-day cycles at 100 with the last two days of each cycle billed at
     * 400, plus a one-off 400 on day 75.
     */
    private static double[] monthEndBillingWithSpike() {
        double[] costs = new double[120];
        for (int i = 0; i < costs.length; i++) {
            costs[i] = i % 30 >= 28 ? 400 : 100;
        }
        costs[75] = 400;
        return costs;
    }

    @BeforeEach
    void setUp() {
        detector = new SeasonalDecompositionDetector(DetectionConfig.defaults());
    }

    @Test
    @DisplayName("Should flag the mid-week spike against the weekly pattern")
    void shouldFlagResidualOutlier() {
        MethodResult result = detector.detect(series(weeklyWithSpike()), 2.0);

        assertThat(result.getAnomalies()).hasSize(1);
        AnomalyCandidate candidate = result.getAnomalies().get(0);
        assertThat(candidate.getDate()).isEqualTo(LocalDate.of(2024, 1, 18));
        assertThat(candidate.getCost()).isEqualTo(350.0);
        assertThat(candidate.getScore()).isCloseTo(3.73, within(0.001));
        assertThat(candidate.getBaselineCost()).isEqualTo(192.86);
    }

    @Test
    @DisplayName("Weekend peaks should not be flagged")
    void shouldNotFlagSeasonalPeaks() {
        MethodResult result = detector.detect(series(weeklyWithSpike()), 2.0);

        assertThat(result.getAnomalies())
                .extracting(AnomalyCandidate::getCost)
                .doesNotContain(300.0);
    }

    @Test
    @DisplayName("Should fail on a series without significant seasonality")
    void shouldFailWithoutSeasonality() {
        double[] flat = new double[28];
        java.util.Arrays.fill(flat, 100);

        assertThatThrownBy(() -> detector.detect(series(flat), 2.0))
                .isInstanceOf(DetectionException.class)
                .hasMessageContaining("No significant seasonality");
    }

    @Test
    @DisplayName("Should only apply to dated series of at least fourteen points")
    void shouldRequireDateAxis() {
        List<CostObservation> observations = new ArrayList<>(daily("EC2", "AWS", weeklyWithSpike()));
        assertThat(detector.isApplicable(series(observations))).isTrue();
        assertThat(detector.isApplicable(series(new double[13]))).isFalse();

        observations.add(CostObservation.builder().cost(100.0).service("EC2").provider("AWS").build());
        assertThat(detector.isApplicable(series(observations))).isFalse();
    }

    @Test
    @DisplayName("Should pick the monthly cycle when it correlates better than the weekly one")
    void shouldSelectMonthlyPeriod() {
        double[] costs = monthEndBillingWithSpike();
        assertThat(SeasonalDecomposition.autocorrelation(costs, 30))
                .isGreaterThan(0.3)
                .isGreaterThan(SeasonalDecomposition.autocorrelation(costs, 7));

        MethodResult result = detector.detect(series(costs), 5.0);

        assertThat(result.getAnomalies()).hasSize(1);
        AnomalyCandidate candidate = result.getAnomalies().get(0);
        assertThat(candidate.getDate()).isEqualTo(START.plusDays(75));
        // 30-day centred trend; a weekly window would give 142.86
        assertThat(candidate.getBaselineCost()).isEqualTo(130.0);
        assertThat(candidate.getScore()).isEqualTo(7.62);
    }
}
