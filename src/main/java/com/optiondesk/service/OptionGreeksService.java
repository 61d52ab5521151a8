package com.optiondesk.service;

import com.optiondesk.broker.FutureAwaits;
import com.optiondesk.broker.GatewayTransport;
import com.optiondesk.broker.RequestCorrelator;
import com.optiondesk.config.GatewayProperties;
import com.optiondesk.domain.enums.OptionRight;
import com.optiondesk.domain.model.CachedGreeks;
import com.optiondesk.domain.model.ContractSpec;
import com.optiondesk.domain.model.OptionGreek;
import com.optiondesk.domain.model.Strikes;
import com.optiondesk.exception.NotConnectedException;
import com.optiondesk.observability.MarketDataMetrics;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Cache-first access to option greeks for (underlying, expiry, strikes).
 *
 * <p>Lookup rules:
 * <ul>
 *   <li>not forced and the key is cached: the cached records for the requested strikes are
 *       returned as they are, fresh or stale, without waiting on the gateway. A stale entry
 *       (older than {@code greeks.cache-ttl}) also starts a background refresh of those strikes.
 *       Strikes never fetched for the key are fetched first.</li>
 *   <li>forced, or nothing cached: a {@link GreeksBatch} fetches calls and puts for every
 *       strike and the batch's own records are returned.</li>
 * </ul>
 * Concurrent fetches for one key share the running batch when it covers their strikes; other
 * strikes are fetched right after it finishes. Callers that give up waiting leave the batch
 * running, it still fills the cache.
 */
@Slf4j
@Service
public class OptionGreeksService {

    private final GatewayTransport transport;
    private final RequestCorrelator correlator;
    private final ScheduledExecutorService scheduler;
    private final GreeksCache greeksCache;
    private final OptionChainCache chainCache;
    private final MarketDataMetrics metrics;
    private final GatewayProperties gatewayProperties;

    private final ConcurrentHashMap<String, InFlightBatch> inFlight = new ConcurrentHashMap<>();

    public OptionGreeksService(
            GatewayTransport transport,
            RequestCorrelator correlator,
            @Qualifier("gatewayScheduler") ScheduledExecutorService scheduler,
            GreeksCache greeksCache,
            OptionChainCache chainCache,
            MarketDataMetrics metrics,
            GatewayProperties gatewayProperties) {
        this.transport = transport;
        this.correlator = correlator;
        this.scheduler = scheduler;
        this.greeksCache = greeksCache;
        this.chainCache = chainCache;
        this.metrics = metrics;
        this.gatewayProperties = gatewayProperties;
    }

    /**
     * @param expiry yyyyMMdd
     * @return one record per (strike, right) requested, strike ascending, calls before puts
     * @throws NotConnectedException when the gateway is offline and nothing is cached for the key
     */
    public List<OptionGreek> getOptionGreeks(
            String symbol, String expiry, Collection<BigDecimal> strikes, boolean forceRefresh) {
        String underlying = symbol.trim().toUpperCase(Locale.ROOT);
        List<BigDecimal> wanted = distinctStrikes(strikes);
        if (wanted.isEmpty()) {
            return List.of();
        }

        Optional<CachedGreeks> cached = greeksCache.get(underlying, expiry);
        if (!forceRefresh && cached.isPresent()) {
            List<BigDecimal> missing = cached.get().missingStrikes(wanted);
            if (!transport.isConnected()) {
                return cached.get().subset(wanted);
            }
            if (missing.isEmpty()) {
                if (!greeksCache.isFresh(cached.get())) {
                    refreshInBackground(underlying, expiry, wanted);
                }
                return cached.get().subset(wanted);
            }
            log.debug("Fetching {} new strikes for {} {}", missing.size(), underlying, expiry);
            awaitBatch(fetch(underlying, expiry, missing), List::of);
            return greeksCache
                    .get(underlying, expiry)
                    .map(entry -> entry.subset(wanted))
                    .orElse(List.of());
        }

        if (!transport.isConnected()) {
            if (cached.isPresent()) {
                return cached.get().subset(wanted);
            }
            throw new NotConnectedException("option greeks " + underlying + " " + expiry);
        }

        return awaitBatch(fetch(underlying, expiry, wanted), () -> {
            log.warn("Option greeks for {} {} still loading, answering from cache", underlying, expiry);
            return greeksCache
                    .get(underlying, expiry)
                    .map(entry -> entry.subset(wanted))
                    .orElse(List.of());
        });
    }

    /**
     * Fetches greeks without blocking. Used by the preloader and by callers that want to chain
     * further work on the result.
     */
    public CompletableFuture<List<OptionGreek>> refreshAsync(String symbol, String expiry, Collection<BigDecimal> strikes) {
        if (!transport.isConnected()) {
            return CompletableFuture.failedFuture(new NotConnectedException("option greeks " + symbol + " " + expiry));
        }
        List<BigDecimal> wanted = distinctStrikes(strikes);
        if (wanted.isEmpty()) {
            return CompletableFuture.completedFuture(List.of());
        }
        return fetch(symbol.trim().toUpperCase(Locale.ROOT), expiry, wanted);
    }

    /** Everything cached for the key. Never touches the gateway. */
    public List<OptionGreek> getCachedGreeks(String symbol, String expiry) {
        return greeksCache.getCachedGreeks(symbol, expiry);
    }

    private void refreshInBackground(String symbol, String expiry, List<BigDecimal> strikes) {
        log.debug("Serving stale greeks for {} {}, refreshing {} strikes", symbol, expiry, strikes.size());
        fetch(symbol, expiry, strikes).whenComplete((records, error) -> {
            if (error != null) {
                log.warn("Background greeks refresh of {} {} failed: {}", symbol, expiry, error.getMessage());
            }
        });
    }

    private List<OptionGreek> awaitBatch(
            CompletableFuture<List<OptionGreek>> batch, Supplier<List<OptionGreek>> onTimeout) {
        // a caller may be queued behind one running batch before its own starts
        Duration ceiling = gatewayProperties.getGreeks().getHardTimeout().multipliedBy(2).plusSeconds(1);
        return FutureAwaits.await(batch, ceiling, onTimeout);
    }

    private CompletableFuture<List<OptionGreek>> fetch(String symbol, String expiry, List<BigDecimal> strikes) {
        String key = GreeksCache.key(symbol, expiry);
        while (true) {
            InFlightBatch current = inFlight.get(key);
            if (current != null && current.result().isDone()) {
                inFlight.remove(key, current);
                continue;
            }

            if (current != null) {
                if (current.covers(strikes)) {
                    log.debug("Joining in-flight greeks batch for {}", key);
                    return current.result().thenApply(records -> onlyStrikes(records, strikes));
                }
                List<BigDecimal> uncovered = current.uncovered(strikes);
                log.debug("Queueing {} strikes for {} behind the running batch", uncovered.size(), key);
                return current.result()
                        .handle((records, error) -> records == null ? List.<OptionGreek>of() : onlyStrikes(records, strikes))
                        .thenCompose(shared -> fetch(symbol, expiry, uncovered)
                                .thenApply(rest -> combine(shared, rest)));
            }

            GreeksBatch batch = newBatch(symbol, expiry, strikes);
            InFlightBatch entry = new InFlightBatch(Set.copyOf(strikes), batch.getResult());
            if (inFlight.putIfAbsent(key, entry) == null) {
                batch.getResult().whenComplete((records, error) -> inFlight.remove(key, entry));
                batch.start();
                return batch.getResult();
            }
        }
    }

    private GreeksBatch newBatch(String symbol, String expiry, List<BigDecimal> strikes) {
        List<ContractSpec> contracts = new ArrayList<>(strikes.size() * 2);
        for (BigDecimal strike : strikes) {
            Optional<String> tradingClass = chainCache.findTradingClass(symbol, expiry, strike);
            for (OptionRight right : OptionRight.values()) {
                ContractSpec contract = ContractSpec.option(
                        symbol,
                        expiry,
                        strike,
                        right,
                        gatewayProperties.getExchange(),
                        gatewayProperties.getCurrency());
                tradingClass.ifPresent(contract::setTradingClass);
                contracts.add(contract);
            }
        }
        return new GreeksBatch(
                symbol,
                expiry,
                contracts,
                transport,
                correlator,
                scheduler,
                greeksCache,
                metrics,
                gatewayProperties.getGreeks());
    }

    private static List<BigDecimal> distinctStrikes(Collection<BigDecimal> strikes) {
        if (strikes == null) {
            return List.of();
        }
        Set<BigDecimal> distinct = new LinkedHashSet<>();
        strikes.forEach(strike -> distinct.add(Strikes.normalize(strike)));
        return List.copyOf(distinct);
    }

    private static List<OptionGreek> onlyStrikes(List<OptionGreek> records, Collection<BigDecimal> strikes) {
        Set<BigDecimal> wanted = new HashSet<>(strikes);
        return records.stream()
                .filter(record -> wanted.contains(record.getStrike()))
                .collect(Collectors.toList());
    }

    private static List<OptionGreek> combine(List<OptionGreek> first, List<OptionGreek> second) {
        List<OptionGreek> combined = new ArrayList<>(first);
        combined.addAll(second);
        combined.sort(OptionGreek.CHAIN_ORDER);
        return combined;
    }

    /** A running batch and the strikes it was started for. */
    private record InFlightBatch(Set<BigDecimal> strikes, CompletableFuture<List<OptionGreek>> result) {

        boolean covers(Collection<BigDecimal> requested) {
            return strikes.containsAll(requested);
        }

        List<BigDecimal> uncovered(Collection<BigDecimal> requested) {
            return requested.stream().filter(strike -> !strikes.contains(strike)).collect(Collectors.toList());
        }
    }
}
