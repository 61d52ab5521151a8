package com.optiondesk.service;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.optiondesk.config.GatewayProperties;
import com.optiondesk.domain.model.CachedChain;
import com.optiondesk.domain.model.ChainParams;
import java.math.BigDecimal;
import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Chain parameters per underlying. Entries are never evicted by age: a stale chain is still
 * good enough to pick a trading class or to answer while the gateway is down, so freshness is
 * decided by the reader against {@code optiondesk.gateway.chain-cache-ttl}.
 *
 * <p>Written only by {@link OptionChainService}.
 */
@Component
public class OptionChainCache {

    private static final String PREFERRED_EXCHANGE = "SMART";

    private final Cache<String, CachedChain> chains;
    private final GatewayProperties gatewayProperties;
    private final Clock clock;

    public OptionChainCache(GatewayProperties gatewayProperties, Clock clock) {
        this.gatewayProperties = gatewayProperties;
        this.clock = clock;
        this.chains = Caffeine.newBuilder()
                .maximumSize(gatewayProperties.getMaxCachedChains())
                .build();
    }

    /** Entry younger than the chain TTL. */
    public Optional<CachedChain> getFresh(String symbol) {
        return peek(symbol).filter(chain -> chain.isFresh(clock.instant(), gatewayProperties.getChainCacheTtl()));
    }

    /** Entry of any age. */
    public Optional<CachedChain> peek(String symbol) {
        return Optional.ofNullable(chains.getIfPresent(key(symbol)));
    }

    public CachedChain put(String symbol, List<ChainParams> params) {
        CachedChain chain = new CachedChain(key(symbol), List.copyOf(params), clock.instant());
        chains.put(chain.getUnderlying(), chain);
        return chain;
    }

    /**
     * Trading class of the series that lists {@code expiry}, using chain data of any age.
     * Series that also list the strike win, then the SMART exchange.
     */
    public Optional<String> findTradingClass(String symbol, String expiry, BigDecimal strike) {
        return peek(symbol).flatMap(chain -> chain.getParams().stream()
                .filter(params -> params.hasExpiry(expiry))
                .filter(params -> params.getTradingClass() != null && !params.getTradingClass().isEmpty())
                .min(Comparator.comparing((ChainParams params) -> !params.hasStrike(strike))
                        .thenComparing(params -> !PREFERRED_EXCHANGE.equals(params.getExchange())))
                .map(ChainParams::getTradingClass));
    }

    private static String key(String symbol) {
        return symbol.trim().toUpperCase(Locale.ROOT);
    }
}
