package com.optiondesk.service;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.optiondesk.config.GatewayProperties;
import com.optiondesk.domain.model.CachedGreeks;
import com.optiondesk.domain.model.OptionGreek;
import java.time.Clock;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Latest greeks per (underlying, expiry), merged field by field across fetches.
 *
 * <p>Entries are bounded by count, not age: readers decide whether an entry is fresh
 * ({@link #isFresh}) and may still serve a stale one. Merges go through
 * {@code asMap().compute} so two batches finishing at once cannot lose each other's strikes.
 */
@Component
public class GreeksCache {

    private final Cache<String, CachedGreeks> entries;
    private final GatewayProperties gatewayProperties;
    private final Clock clock;

    public GreeksCache(GatewayProperties gatewayProperties, Clock clock) {
        this.gatewayProperties = gatewayProperties;
        this.clock = clock;
        this.entries = Caffeine.newBuilder()
                .maximumSize(gatewayProperties.getGreeks().getMaxCachedKeys())
                .build();
    }

    public Optional<CachedGreeks> get(String symbol, String expiry) {
        return Optional.ofNullable(entries.getIfPresent(key(symbol, expiry)));
    }

    public boolean isFresh(CachedGreeks cached) {
        return cached.isFresh(clock.instant(), gatewayProperties.getGreeks().getCacheTtl());
    }

    public CachedGreeks merge(String symbol, String expiry, Collection<OptionGreek> records) {
        String key = key(symbol, expiry);
        return entries.asMap().compute(key, (k, existing) -> existing == null
                ? CachedGreeks.of(normalize(symbol), expiry, records, clock.instant())
                : existing.mergedWith(records, clock.instant()));
    }

    /** Every cached record for the key, strike ascending, calls before puts. Empty when unknown. */
    public List<OptionGreek> getCachedGreeks(String symbol, String expiry) {
        return get(symbol, expiry).map(CachedGreeks::all).orElse(List.of());
    }

    public long size() {
        return entries.estimatedSize();
    }

    static String key(String symbol, String expiry) {
        return normalize(symbol) + "|" + expiry;
    }

    private static String normalize(String symbol) {
        return symbol.trim().toUpperCase(Locale.ROOT);
    }
}
