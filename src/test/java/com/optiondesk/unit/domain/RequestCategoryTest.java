package com.optiondesk.unit.domain;

import static org.assertj.core.api.Assertions.assertThat;

import com.optiondesk.domain.enums.RequestCategory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class RequestCategoryTest {

    @Test
    @DisplayName("Id ranges are disjoint")
    void rangesAreDisjoint() {
        for (RequestCategory a : RequestCategory.values()) {
            for (RequestCategory b : RequestCategory.values()) {
                if (a != b) {
                    assertThat(b.contains(a.getRangeStart()))
                            .as("%s start inside %s", a, b)
                            .isFalse();
                }
            }
        }
    }

    @Test
    @DisplayName("Upper bound is exclusive")
    void upperBoundExclusive() {
        assertThat(RequestCategory.STOCK_QUOTE.contains(RequestCategory.STOCK_QUOTE.getRangeEnd() - 1)).isTrue();
        assertThat(RequestCategory.STOCK_QUOTE.contains(RequestCategory.STOCK_QUOTE.getRangeEnd())).isFalse();
    }
}
