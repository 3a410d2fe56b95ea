package com.costsentinel.core.context;

import com.costsentinel.core.model.CostObservation;
import com.costsentinel.core.model.RelatedService;
import com.costsentinel.core.series.EntityKey;
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
 * Unit tests for {@link RelatedServiceFinder}.
 */
class RelatedServiceFinderTest {

    private static final LocalDate SPIKE = LocalDate.of(2024, 1, 5);
    private static final EntityKey EC2 = new EntityKey("AWS", "EC2");

    private static ServiceHistory history() {
        List<CostObservation> observations = new ArrayList<>(ec2Spike());
        observations.addAll(daily("S3", "AWS", 10, 10, 10, 10, 16, 10, 10));
        observations.addAll(daily("RDS", "AWS", 50, 50, 50, 50, 62, 50, 50));
        observations.addAll(daily("Lambda", "AWS", 5, 5, 5, 5, 5.5));
        observations.addAll(daily("EC2", "Azure", 20, 20, 20, 20, 40));
        observations.addAll(daily("EBS", "AWS", 1, 1, 1));
        return ServiceHistory.of(series(observations));
    }

    @Test
    @DisplayName("Should list other services that moved by at least 20% on the anomaly date")
    void shouldFindRelatedServices() {
        List<RelatedService> related = new RelatedServiceFinder().find(SPIKE, EC2, history());

        assertThat(related).extracting(r -> r.getProvider() + "/" + r.getService())
                .containsExactly("AWS/S3", "AWS/RDS");
        assertThat(related).extracting(RelatedService::getCorrelation).containsExactly(
                RelatedService.Correlation.STRONG, RelatedService.Correlation.MODERATE);
        RelatedService s3 = related.get(0);
        assertThat(s3.getCost()).isEqualTo(16.0);
        assertThat(s3.getAvgPrevCost()).isEqualTo(10.0);
        assertThat(s3.getPctChange()).isEqualTo(60.0);
    }

    @Test
    @DisplayName("Should not report the anomalous service billed by another provider")
    void shouldSkipSameServiceOfOtherProviders() {
        List<RelatedService> related = new RelatedServiceFinder().find(SPIKE, new EntityKey("Azure", "EC2"), history());

        assertThat(related).extracting(RelatedService::getService).doesNotContain("EC2");
        assertThat(related).extracting(RelatedService::getService).containsExactly("S3", "RDS");
    }

    @Test
    @DisplayName("Should find nothing for an undated anomaly")
    void shouldSkipUndated() {
        assertThat(new RelatedServiceFinder().find(null, EC2, history())).isEmpty();
    }
}
