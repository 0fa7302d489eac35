package com.nosota.splitpay.service;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;

class SplitCalculatorTest {

    @Test
    void splitsEvenlyWithTwoDecimals() {
        assertThat(SplitCalculator.split(new BigDecimal("300"), 1)).isEqualTo(new BigDecimal("300.00"));
        assertThat(SplitCalculator.split(new BigDecimal("300"), 2)).isEqualTo(new BigDecimal("150.00"));
        assertThat(SplitCalculator.split(new BigDecimal("100"), 3)).isEqualTo(new BigDecimal("33.33"));
    }

    @Test
    void roundsHalfUp() {
        assertThat(SplitCalculator.split(new BigDecimal("0.05"), 2)).isEqualTo(new BigDecimal("0.03"));
        assertThat(SplitCalculator.split(new BigDecimal("200"), 3)).isEqualTo(new BigDecimal("66.67"));
    }

    @Test
    void emptyGroupCarriesWholeBudget() {
        assertThat(SplitCalculator.split(new BigDecimal("250.50"), 0)).isEqualTo(new BigDecimal("250.50"));
    }

    @Test
    void splitTimesMembersStaysWithinRoundingOfBudget() {
        BigDecimal budget = new BigDecimal("1000.01");
        for (int members = 1; members <= 50; members++) {
            BigDecimal split = SplitCalculator.split(budget, members);
            BigDecimal drift = split.multiply(BigDecimal.valueOf(members)).subtract(budget).abs();
            BigDecimal tolerance = new BigDecimal("0.005").multiply(BigDecimal.valueOf(members));

            assertThat(drift).as("members=%d", members).isLessThanOrEqualTo(tolerance);
        }
    }
}
