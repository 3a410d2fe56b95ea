package com.costsentinel.core.context;

import com.costsentinel.core.config.TaxonomyLoader;
import com.costsentinel.core.model.AnomalyRecord;
import com.costsentinel.core.model.CauseConfidence;
import com.costsentinel.core.model.CloudContext;
import com.costsentinel.core.model.CostObservation;
import com.costsentinel.core.model.CustomEvent;
import com.costsentinel.core.model.DetectionMethod;
import com.costsentinel.core.model.PatternType;
import com.costsentinel.core.model.ProbableCause;
import com.costsentinel.core.model.UtilizationObservation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import static com.costsentinel.core.CostFixtures.daily;
import static com.costsentinel.core.CostFixtures.ec2Spike;
import static com.costsentinel.core.CostFixtures.series;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link CloudContextAnalyzer}.
 */
class CloudContextAnalyzerTest {

    private static final LocalDate FRIDAY = LocalDate.of(2024, 1, 5);

    private CloudContextAnalyzer analyzer;
    private AnomalyRecord spike;

    @BeforeEach
    void setUp() {
        analyzer = new CloudContextAnalyzer(TaxonomyLoader.bundled());
        spike = AnomalyRecord.builder()
                .date(FRIDAY)
                .service("EC2")
                .provider("AWS")
                .cost(500)
                .baselineCost(100.5)
                .anomalyScore(2.27)
                .detectionMethod(DetectionMethod.ZSCORE)
                .build();
    }

    @Test
    @DisplayName("Custom events should rank ahead of taxonomy events")
    void shouldRankCustomEventsFirst() {
        CustomEvent release = CustomEvent.builder()
                .name("fleet-rollout")
                .date(FRIDAY.minusDays(1))
                .services(List.of("EC2"))
                .build();

        CloudContext context = analyzer.analyze(spike, ServiceHistory.of(series(ec2Spike())),
                List.of(), List.of(release));

        assertThat(context.getPatternType()).isEqualTo(PatternType.TEMPORARY_SPIKE);
        assertThat(context.getProbableCauses()).extracting(ProbableCause::getCause).containsExactly(
                "fleet-rollout", "new_region_deployment", "data_transfer_spike",
                "autoscaling_event", "end_of_month_billing");
        assertThat(context.getProbableCauses()).extracting(ProbableCause::getConfidence)
                .isSortedAccordingTo((a, b) -> Integer.compare(b.rank(), a.rank()));
        assertThat(context.getProbableCauses().get(0).getConfidence()).isEqualTo(CauseConfidence.VERY_HIGH);
        assertThat(context.getMitigationSuggestions()).containsExactly(
                "Review instance rightsizing opportunities",
                "Check for unintended auto-scaling events",
                "Optimize network traffic patterns and data transfer routes",
                "Review CDN or caching strategies to reduce data transfer");
        assertThat(context.getRelatedServices()).isEmpty();
        assertThat(context.getAffectedResources()).isEmpty();
    }

    @Test
    @DisplayName("Utilization causes should be ranked among the event causes")
    void shouldIncludeUtilizationCauses() {
        List<UtilizationObservation> utilization = new ArrayList<>();
        for (int i = 0; i < 7; i++) {
            boolean peak = i == 4;
            utilization.add(new UtilizationObservation(FRIDAY.minusDays(4).plusDays(i), "EC2", peak ? "i-9" : "i-0")
                    .metric("instance_count", peak ? 30 : 10)
                    .metric("cpu_hours", peak ? 300 : 100));
        }

        CloudContext context = analyzer.analyze(spike, ServiceHistory.of(series(ec2Spike())), utilization, List.of());

        assertThat(context.getProbableCauses()).extracting(ProbableCause::getCause)
                .contains("instance_count_increase");
        assertThat(context.getAffectedResources()).containsExactly("i-9");
        assertThat(context.getMitigationSuggestions())
                .contains("Review auto-scaling policies and thresholds");
    }

    @Test
    @DisplayName("Should report other services that moved on the same day")
    void shouldIncludeRelatedServices() {
        List<CostObservation> observations = new ArrayList<>(ec2Spike());
        observations.addAll(daily("S3", "AWS", 10, 10, 10, 10, 30, 10, 10));

        CloudContext context = analyzer.analyze(spike, ServiceHistory.of(series(observations)), List.of(), List.of());

        assertThat(context.getRelatedServices()).hasSize(1);
        assertThat(context.getRelatedServices().get(0).getService()).isEqualTo("S3");
    }

    @Test
    @DisplayName("A failing analysis should degrade to an empty context")
    void shouldDegradeToEmptyContext() {
        CloudContext context = analyzer.analyze(spike, null, List.of(), List.of());

        assertThat(context.isEmpty()).isTrue();
    }
}
