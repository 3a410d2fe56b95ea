package com.costsentinel.core.context;

import com.costsentinel.core.config.TaxonomyLoader;
import com.costsentinel.core.model.CauseConfidence;
import com.costsentinel.core.model.PatternType;
import com.costsentinel.core.model.ProbableCause;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link MitigationAdvisor}.
 */
class MitigationAdvisorTest {

    private MitigationAdvisor advisor;

    @BeforeEach
    void setUp() {
        advisor = new MitigationAdvisor(TaxonomyLoader.bundled());
    }

    private static ProbableCause cause(String name) {
        return new ProbableCause(name, CauseConfidence.HIGH, name, ProbableCause.Source.CLOUD_EVENT);
    }

    @Test
    @DisplayName("Should combine category, pattern and cause advice in that order")
    void shouldCombineAdvice() {
        List<String> advice = advisor.advise("EC2", PatternType.STEP_INCREASE,
                List.of(cause("reserved_instance_expiration")));

        assertThat(advice).containsExactly(
                "Review instance rightsizing opportunities",
                "Check for unintended auto-scaling events",
                "Verify if reserved instances or committed use discounts have expired",
                "Check if instances have switched from spot/preemptible to on-demand pricing",
                "Renew or purchase new reserved instances/committed use discounts",
                "Evaluate on-demand vs. reserved instance mix");
    }

    @Test
    @DisplayName("Should not repeat advice shared by several causes")
    void shouldDeduplicate() {
        List<String> advice = advisor.advise("S3", PatternType.TEMPORARY_SPIKE,
                List.of(cause("data_transfer_spike"), cause("network_traffic_spike")));

        assertThat(advice).hasSize(5).doesNotHaveDuplicates();
        assertThat(advice.get(0)).startsWith("Implement lifecycle policies");
        assertThat(advice).endsWith(
                "Optimize network traffic patterns and data transfer routes",
                "Review CDN or caching strategies to reduce data transfer");
    }

    @Test
    @DisplayName("An uncategorized service without known causes should get no advice")
    void shouldReturnNothingForUnknownService() {
        assertThat(advisor.advise("Lambda", PatternType.UNKNOWN, List.of(cause("release")))).isEmpty();
    }
}
