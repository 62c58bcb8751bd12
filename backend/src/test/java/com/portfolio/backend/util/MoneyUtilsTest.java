package com.portfolio.backend.util;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;

class MoneyUtilsTest {

    @Test
    void percentChangeRoundsHalfUpToTwoDecimals() {
        assertThat(MoneyUtils.percentChange(new BigDecimal("101.005"), new BigDecimal("100")))
                .isEqualByComparingTo("1.01");
        assertThat(MoneyUtils.percentChange(new BigDecimal("97"), new BigDecimal("100")))
                .isEqualByComparingTo("-3.00");
    }

    @Test
    void percentChangeIsZeroWithoutUsableBase() {
        assertThat(MoneyUtils.percentChange(new BigDecimal("10"), null)).isEqualByComparingTo("0");
        assertThat(MoneyUtils.percentChange(new BigDecimal("10"), BigDecimal.ZERO)).isEqualByComparingTo("0");
    }

    @Test
    void round2KeepsTwoDecimals() {
        assertThat(MoneyUtils.round2(new BigDecimal("192.4951")).toPlainString()).isEqualTo("192.50");
        assertThat(MoneyUtils.round2(null).toPlainString()).isEqualTo("0.00");
    }
}
