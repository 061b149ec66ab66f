package com.fintech.supply.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SupplyUnitsTest {

    @Test
    @DisplayName("Should convert smallest units to whole tokens without rounding")
    void shouldConvertExactly() {
        assertThat(SupplyUnits.fromWei("1")).isEqualByComparingTo("0.000000000000000001");
        assertThat(SupplyUnits.fromWei("10000000000000000000000000000")).isEqualByComparingTo("10000000000");
        assertThat(SupplyUnits.fromWei("-2500000000000000000")).isEqualByComparingTo("-2.5");
    }

    @Test
    @DisplayName("Should reject amounts that are not base-10 integers")
    void shouldRejectNonIntegers() {
        assertThatThrownBy(() -> SupplyUnits.parseWei("1.5")).isInstanceOf(NumberFormatException.class);
        assertThatThrownBy(() -> SupplyUnits.parseWei("abc")).isInstanceOf(NumberFormatException.class);
        assertThatThrownBy(() -> SupplyUnits.parseWei(" ")).isInstanceOf(NumberFormatException.class);
        assertThatThrownBy(() -> SupplyUnits.parseWei(null)).isInstanceOf(NumberFormatException.class);
    }

    @Test
    @DisplayName("Should compare differences against a tolerance relative to the reference")
    void shouldApplyRelativeTolerance() {
        BigDecimal tolerance = new BigDecimal("0.001");

        assertThat(SupplyUnits.exceedsTolerance(new BigDecimal("1000"), new BigDecimal("1001"),
                new BigDecimal("1000"), tolerance)).isFalse();
        assertThat(SupplyUnits.exceedsTolerance(new BigDecimal("1000"), new BigDecimal("1002"),
                new BigDecimal("1000"), tolerance)).isTrue();
    }
}
