package com.optiondesk.service;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.math.BigDecimal;
import java.util.Locale;
import java.util.Optional;
import org.springframework.stereotype.Component;

/** Last known price per underlying, written by the preloader. Reads never block. */
@Component
public class StockPriceCache {

    private final Cache<String, BigDecimal> prices =
            Caffeine.newBuilder().maximumSize(1_000).build();

    public Optional<BigDecimal> get(String symbol) {
        return Optional.ofNullable(prices.getIfPresent(key(symbol)));
    }

    /** Ignores non-positive prices so a failed lookup never replaces a known one. */
    public void put(String symbol, BigDecimal price) {
        if (price != null && price.signum() > 0) {
            prices.put(key(symbol), price);
        }
    }

    private static String key(String symbol) {
        return symbol.trim().toUpperCase(Locale.ROOT);
    }
}
