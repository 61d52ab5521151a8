package com.optiondesk.unit.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.optiondesk.service.StockPriceCache;
import java.math.BigDecimal;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class StockPriceCacheTest {

    private final StockPriceCache cache = new StockPriceCache();

    @Test
    @DisplayName("A non-positive price never replaces a known one")
    void put_ignoresNonPositive() {
        cache.put("QQQ", new BigDecimal("590.10"));
        cache.put("qqq", BigDecimal.ZERO);
        cache.put("QQQ", null);

        assertThat(cache.get("qqq")).contains(new BigDecimal("590.10"));
        assertThat(cache.get("SPY")).isEmpty();
    }
}
