package com.costsentinel.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link CostObservation}.
 */
class CostObservationTest {

    @Test
    @DisplayName("Should default service and provider to Unknown")
    void shouldDefaultNames() {
        CostObservation observation = CostObservation.builder()
                .date(LocalDate.of(2024, 1, 1))
                .cost(BigDecimal.TEN)
                .build();

        assertThat(observation.getService()).isEqualTo(CostObservation.UNKNOWN);
        assertThat(observation.getProvider()).isEqualTo(CostObservation.UNKNOWN);
    }

    @Test
    @DisplayName("Should allow a missing cost")
    void shouldAllowMissingCost() {
        CostObservation observation = CostObservation.builder().service("S3").build();

        assertThat(observation.hasCost()).isFalse();
        assertThat(observation.costValue()).isNaN();
        assertThat(observation.withCost(BigDecimal.ONE).costValue()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should reject a negative cost")
    void shouldRejectNegativeCost() {
        assertThatThrownBy(() -> CostObservation.of(LocalDate.of(2024, 1, 1), -1, "EC2", "AWS"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("cost");
    }

    @Test
    @DisplayName("Should treat costs differing only in scale as equal")
    void shouldCompareCostsByValue() {
        LocalDate day = LocalDate.of(2024, 1, 1);
        CostObservation oneDecimal = CostObservation.builder()
                .date(day).cost(new BigDecimal("100.0")).service("EC2").provider("AWS").build();
        CostObservation twoDecimals = CostObservation.builder()
                .date(day).cost(new BigDecimal("100.00")).service("EC2").provider("AWS").build();

        assertThat(oneDecimal).isEqualTo(twoDecimals);
        assertThat(oneDecimal).hasSameHashCodeAs(twoDecimals);
        assertThat(oneDecimal).isNotEqualTo(oneDecimal.withCost(new BigDecimal("100.01")));
        assertThat(CostObservation.builder().date(day).build())
                .isEqualTo(CostObservation.builder().date(day).build())
                .isNotEqualTo(CostObservation.builder().date(day).cost(BigDecimal.ZERO).build());
    }
}
