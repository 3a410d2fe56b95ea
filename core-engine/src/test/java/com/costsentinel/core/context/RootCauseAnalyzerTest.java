package com.costsentinel.core.context;

import com.costsentinel.core.config.TaxonomyLoader;
import com.costsentinel.core.model.AnomalyRecord;
import com.costsentinel.core.model.CauseConfidence;
import com.costsentinel.core.model.DetectionMethod;
import com.costsentinel.core.model.RootCause;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static com.costsentinel.core.CostFixtures.daily;
import static com.costsentinel.core.CostFixtures.ec2Spike;
import static com.costsentinel.core.CostFixtures.series;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link RootCauseAnalyzer}.
 */
class RootCauseAnalyzerTest {

    private static final LocalDate FRIDAY = LocalDate.of(2024, 1, 5);

    private RootCauseAnalyzer analyzer;

    @BeforeEach
    void setUp() {
        analyzer = new RootCauseAnalyzer(TaxonomyLoader.bundled());
    }

    private static AnomalyRecord record(String service, LocalDate date, double cost) {
        return AnomalyRecord.builder()
                .date(date)
                .service(service)
                .provider("AWS")
                .cost(cost)
                .baselineCost(100)
                .anomalyScore(2.5)
                .detectionMethod(DetectionMethod.ZSCORE)
                .build();
    }

    private static ServiceHistory history(String service, double... costs) {
        return ServiceHistory.of(series(daily(service, "AWS", costs)));
    }

    @Test
    @DisplayName("A large day-over-day jump should be an extreme spike")
    void shouldReportExtremeSpike() {
        RootCause cause = analyzer.analyze(record("EC2", FRIDAY, 500), ServiceHistory.of(series(ec2Spike())));

        assertThat(cause.getPrimaryCause()).isEqualTo("Extreme cost spike (+395.0%)");
        assertThat(cause.getConfidence()).isEqualTo(CauseConfidence.HIGH);
        assertThat(cause.getPotentialCauses()).containsExactly(
                "Increase in running instances or workload spikes", "Reserved instance expiration");
    }

    @Test
    @DisplayName("A moderate jump should be a significant increase")
    void shouldReportSignificantIncrease() {
        RootCause cause = analyzer.analyze(record("RDS", FRIDAY, 140),
                history("RDS", 100, 100, 100, 100, 140, 100, 100));

        assertThat(cause.getPrimaryCause()).isEqualTo("Significant cost increase (+40.0%)");
        assertThat(cause.getConfidence()).isEqualTo(CauseConfidence.MEDIUM);
        assertThat(cause.getPotentialCauses()).containsExactly("Unexpected database queries", "Connection spikes");
    }

    @Test
    @DisplayName("Higher spend afterwards should read as a sustained increase")
    void shouldReportSustainedIncrease() {
        RootCause cause = analyzer.analyze(record("EC2", FRIDAY, 200),
                history("EC2", 100, 100, 100, 100, 200, 200, 200));

        assertThat(cause.getPrimaryCause()).isEqualTo(RootCauseAnalyzer.SUSTAINED_CAUSE);
        assertThat(cause.getConfidence()).isEqualTo(CauseConfidence.HIGH);
        assertThat(cause.getPotentialCauses()).hasSize(3).endsWith(RootCauseAnalyzer.PERMANENT_CHANGE);
    }

    @Test
    @DisplayName("Without usable history the default cause and taxonomy defaults should be used")
    void shouldFallBackToDefaults() {
        RootCause cause = analyzer.analyze(record("Lambda", FRIDAY, 50), history("Lambda", 50));

        assertThat(cause.getPrimaryCause()).isEqualTo(RootCauseAnalyzer.DEFAULT_CAUSE);
        assertThat(cause.getConfidence()).isEqualTo(CauseConfidence.MEDIUM);
        assertThat(cause.getPotentialCauses()).containsExactly("Unknown cause");
    }
}
