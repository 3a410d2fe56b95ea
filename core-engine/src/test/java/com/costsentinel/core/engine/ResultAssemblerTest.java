package com.costsentinel.core.engine;

import com.costsentinel.core.config.DetectionConfig;
import com.costsentinel.core.detection.DetectorRegistry;
import com.costsentinel.core.ensemble.AggregationOutcome;
import com.costsentinel.core.ensemble.EnsembleAggregator;
import com.costsentinel.core.model.DetectionMethod;
import com.costsentinel.core.model.DetectionResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static com.costsentinel.core.CostFixtures.ec2Spike;
import static com.costsentinel.core.CostFixtures.series;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link ResultAssembler}.
 */
class ResultAssemblerTest {

    private static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");

    private ResultAssembler assembler;

    @BeforeEach
    void setUp() {
        assembler = new ResultAssembler(Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("Insufficient data should be a successful empty result")
    void shouldAssembleInsufficientData() {
        DetectionResult result = assembler.insufficientData(DetectionMethod.ENSEMBLE, 2.0, 3, 7);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getAnomalyCount()).isZero();
        assertThat(result.getDataPoints()).isEqualTo(3);
        assertThat(result.getDetectionTimestamp()).isEqualTo(NOW);
        assertThat(result.getNote()).isEqualTo("Insufficient data for analysis: 3 point(s), at least 7 required");
    }

    @Test
    @DisplayName("Failure should carry the error and no anomalies")
    void shouldAssembleFailure() {
        DetectionResult result = assembler.failure(DetectionMethod.ISOLATION, 3.0, 12,
                List.of(DetectionMethod.ISOLATION), "isolation failed");

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getError()).isEqualTo("isolation failed");
        assertThat(result.getAnomalies()).isEmpty();
        assertThat(result.getMethodsRun()).containsExactly(DetectionMethod.ISOLATION);
        assertThat(result.getMethodName()).isEqualTo("Isolation Forest (ML)");
    }

    @Test
    @DisplayName("Success should expose the outcome's methods and records")
    void shouldAssembleSuccess() {
        DetectionConfig config = DetectionConfig.defaults();
        AggregationOutcome outcome = new EnsembleAggregator(DetectorRegistry.standard(config), config)
                .aggregate(DetectionMethod.ZSCORE, series(ec2Spike()), 2.0);

        DetectionResult result = assembler.success(DetectionMethod.ZSCORE, 2.0, 7, outcome,
                outcome.getRecords(), false);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getAnomalyCount()).isEqualTo(1);
        assertThat(result.getMethodsRun()).containsExactly(DetectionMethod.ZSCORE);
        assertThat(result.getNote()).isNull();
        assertThat(result.getThreshold()).isEqualTo(2.0);
    }
}
