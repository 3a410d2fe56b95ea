package com.costsentinel.core.detection;

import com.costsentinel.core.config.DetectionConfig;
import com.costsentinel.core.model.AnomalyCandidate;
import com.costsentinel.core.model.DetectionMethod;
import com.costsentinel.core.model.MethodResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static com.costsentinel.core.CostFixtures.ec2Spike;
import static com.costsentinel.core.CostFixtures.series;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link ZScoreDetector}.
 */
class ZScoreDetectorTest {

    private ZScoreDetector detector;

    @BeforeEach
    void setUp() {
        detector = new ZScoreDetector(DetectionConfig.defaults());
    }

    @Test
    @DisplayName("Should flag the single spike with the median of the normal points as baseline")
    void shouldFlagSpike() {
        MethodResult result = detector.detect(series(ec2Spike()), 2.0);

        assertThat(result.getOutcome()).isEqualTo(MethodResult.Outcome.PRIMARY);
        assertThat(result.getAnomalies()).hasSize(1);
        AnomalyCandidate candidate = result.getAnomalies().get(0);
        assertThat(candidate.getDate()).isEqualTo(LocalDate.of(2024, 1, 5));
        assertThat(candidate.getCost()).isEqualTo(500.0);
        assertThat(candidate.getBaselineCost()).isEqualTo(100.5);
        assertThat(candidate.getCostDifference()).isEqualTo(399.5);
        assertThat(candidate.getPercentageIncrease()).isEqualTo(397.51);
        assertThat(candidate.getScore()).isEqualTo(2.27);
        assertThat(candidate.getMethod()).isEqualTo(DetectionMethod.ZSCORE);
    }

    @Test
    @DisplayName("A higher threshold should not flag a score below it")
    void shouldRespectThreshold() {
        assertThat(detector.detect(series(ec2Spike()), 2.5).getAnomalies()).isEmpty();
    }

    @Test
    @DisplayName("A constant series should produce no anomalies")
    void shouldHandleZeroVariance() {
        MethodResult result = detector.detect(series(50, 50, 50, 50, 50), 2.0);

        assertThat(result.getAnomalies()).isEmpty();
        assertThat(result.isFailed()).isFalse();
    }

    @Test
    @DisplayName("Should accept series from the configured minimum size")
    void shouldUseConfiguredMinimum() {
        assertThat(detector.getMinimumPoints()).isEqualTo(5);
        assertThat(detector.isApplicable(series(1, 2, 3, 4))).isFalse();
        assertThat(detector.isApplicable(series(1, 2, 3, 4, 5))).isTrue();
    }
}
