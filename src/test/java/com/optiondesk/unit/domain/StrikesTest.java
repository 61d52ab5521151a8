package com.optiondesk.unit.domain;

import static org.assertj.core.api.Assertions.assertThat;

import com.optiondesk.domain.model.Strikes;
import java.math.BigDecimal;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class StrikesTest {

    @Test
    @DisplayName("Normalized strikes compare equal regardless of input scale")
    void normalize_dropsScale() {
        assertThat(Strikes.normalize(new BigDecimal("590.00"))).isEqualTo(Strikes.normalize(new BigDecimal("590")));
        assertThat(Strikes.normalize(new BigDecimal("600")).scale()).isZero();
    }

    @Test
    @DisplayName("Format renders plain numbers")
    void format() {
        assertThat(Strikes.format(new BigDecimal("590.0"))).isEqualTo("590");
        assertThat(Strikes.format(new BigDecimal("592.50"))).isEqualTo("592.5");
        assertThat(Strikes.format(new BigDecimal("1000"))).isEqualTo("1000");
    }

    @Test
    @DisplayName("Only whole and half-dollar strikes are standard")
    void isStandard() {
        assertThat(Strikes.isStandard(new BigDecimal("590"))).isTrue();
        assertThat(Strikes.isStandard(new BigDecimal("592.5"))).isTrue();
        assertThat(Strikes.isStandard(new BigDecimal("591.33"))).isFalse();
    }
}
