package com.optiondesk.broker;

import com.optiondesk.broker.event.ContractDetailsEndEvent;
import com.optiondesk.broker.event.ContractDetailsEvent;
import com.optiondesk.broker.event.GatewayErrorEvent;
import com.optiondesk.broker.event.GatewayEvent;
import com.optiondesk.config.GatewayProperties;
import com.optiondesk.domain.enums.OptionRight;
import com.optiondesk.domain.enums.RequestCategory;
import com.optiondesk.domain.model.ContractSpec;
import com.optiondesk.domain.model.Strikes;
import com.optiondesk.exception.ContractNotFoundException;
import com.optiondesk.exception.NotConnectedException;
import com.optiondesk.exception.ResolutionTimeoutException;
import com.optiondesk.service.OptionChainCache;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Resolves stocks and options to gateway contract ids.
 *
 * <p>Resolved ids never change for a listed contract, so they are cached for the life of the
 * process and a key costs at most one contract-details request. Concurrent lookups of one key
 * share a single in-flight future.
 *
 * <p>Options are looked up with the trading class taken from any chain data already cached
 * for the underlying. Without it the gateway reports ambiguity for underlyings listing several
 * series on one expiry (SPX vs SPXW); with no chain data at all the lookup goes out without one.
 */
@Slf4j
@Component
public class ContractResolver {

    private final GatewayTransport transport;
    private final RequestCorrelator correlator;
    private final OptionChainCache chainCache;
    private final GatewayProperties gatewayProperties;

    /** Key: "QQQ" or "QQQ|20260220|590|P". Append-only. */
    private final ConcurrentHashMap<String, Long> conIds = new ConcurrentHashMap<>();

    private final ConcurrentHashMap<String, CompletableFuture<Long>> inFlight = new ConcurrentHashMap<>();

    public ContractResolver(
            GatewayTransport transport,
            RequestCorrelator correlator,
            OptionChainCache chainCache,
            GatewayProperties gatewayProperties) {
        this.transport = transport;
        this.correlator = correlator;
        this.chainCache = chainCache;
        this.gatewayProperties = gatewayProperties;
    }

    public long resolveUnderlying(String symbol) {
        return awaitResolution(resolveUnderlyingAsync(symbol), underlyingKey(symbol));
    }

    public CompletableFuture<Long> resolveUnderlyingAsync(String symbol) {
        ContractSpec stock =
                ContractSpec.stock(normalize(symbol), gatewayProperties.getExchange(), gatewayProperties.getCurrency());
        return resolveAsync(underlyingKey(symbol), stock, RequestCategory.CONTRACT);
    }

    public long resolveOption(String symbol, String expiry, BigDecimal strike, OptionRight right) {
        return awaitResolution(
                resolveOptionAsync(symbol, expiry, strike, right, RequestCategory.CONTRACT),
                optionKey(symbol, expiry, strike, right));
    }

    /**
     * @param category id range for the lookup, so roll resolutions can be told apart from
     *                 ordinary ones in gateway logs
     */
    public CompletableFuture<Long> resolveOptionAsync(
            String symbol, String expiry, BigDecimal strike, OptionRight right, RequestCategory category) {
        ContractSpec option = ContractSpec.option(
                normalize(symbol),
                expiry,
                strike,
                right,
                gatewayProperties.getExchange(),
                gatewayProperties.getCurrency());
        chainCache.findTradingClass(normalize(symbol), expiry, strike).ifPresent(option::setTradingClass);
        return resolveAsync(optionKey(symbol, expiry, strike, right), option, category);
    }

    /** Cached id, without touching the gateway. */
    public Optional<Long> getCachedOption(String symbol, String expiry, BigDecimal strike, OptionRight right) {
        return Optional.ofNullable(conIds.get(optionKey(symbol, expiry, strike, right)));
    }

    private CompletableFuture<Long> resolveAsync(String key, ContractSpec contract, RequestCategory category) {
        Long cached = conIds.get(key);
        if (cached != null) {
            return CompletableFuture.completedFuture(cached);
        }
        if (!transport.isConnected()) {
            return CompletableFuture.failedFuture(new NotConnectedException("resolve " + key));
        }

        CompletableFuture<Long> created = new CompletableFuture<>();
        CompletableFuture<Long> existing = inFlight.putIfAbsent(key, created);
        if (existing != null) {
            return existing;
        }
        created.whenComplete((conId, error) -> inFlight.remove(key, created));

        // a lookup may have finished between the cache read and claiming the in-flight slot
        cached = conIds.get(key);
        if (cached != null) {
            created.complete(cached);
            return created;
        }

        int requestId = correlator.allocateId(category);
        correlator.register(
                requestId, category, gatewayProperties.getContractTimeout(), new ContractLookup(requestId, key, created));
        log.debug("Resolving contract {} (request {})", key, requestId);
        try {
            transport.requestContractDetails(requestId, contract);
        } catch (RuntimeException e) {
            correlator.complete(requestId);
            created.completeExceptionally(e);
        }
        return created;
    }

    private long awaitResolution(CompletableFuture<Long> future, String key) {
        Duration timeout = gatewayProperties.getContractTimeout();
        // the correlator fires first; the extra second only guards against a stalled scheduler
        return FutureAwaits.await(future, timeout.plusSeconds(1), () -> {
            throw new ResolutionTimeoutException(key, timeout);
        });
    }

    static String underlyingKey(String symbol) {
        return normalize(symbol);
    }

    static String optionKey(String symbol, String expiry, BigDecimal strike, OptionRight right) {
        return normalize(symbol) + "|" + expiry + "|" + Strikes.format(strike) + "|" + right.getCode();
    }

    private static String normalize(String symbol) {
        return symbol.trim().toUpperCase(Locale.ROOT);
    }

    /** Completes the shared future from the first conclusive event for one request. */
    private class ContractLookup implements RequestHandler {

        private final int requestId;
        private final String key;
        private final CompletableFuture<Long> future;

        ContractLookup(int requestId, String key, CompletableFuture<Long> future) {
            this.requestId = requestId;
            this.key = key;
            this.future = future;
        }

        @Override
        public void onEvent(GatewayEvent event) {
            if (event instanceof ContractDetailsEvent details) {
                if (details.getConId() > 0 && correlator.complete(requestId)) {
                    conIds.put(key, details.getConId());
                    log.debug("Resolved {} -> conId {}", key, details.getConId());
                    future.complete(details.getConId());
                }
            } else if (event instanceof ContractDetailsEndEvent) {
                if (correlator.complete(requestId)) {
                    future.completeExceptionally(new ContractNotFoundException(key, "no contract details returned"));
                }
            } else if (event instanceof GatewayErrorEvent error) {
                if (correlator.complete(requestId)) {
                    log.info("Contract lookup for {} failed: [{}] {}", key, error.getCode(), error.getMessage());
                    future.completeExceptionally(new ContractNotFoundException(
                            key, "gateway error " + error.getCode() + ": " + error.getMessage()));
                }
            }
        }

        @Override
        public void onTimeout(int id) {
            log.warn("Contract lookup for {} timed out after {}", key, gatewayProperties.getContractTimeout());
            future.completeExceptionally(new ResolutionTimeoutException(key, gatewayProperties.getContractTimeout()));
        }
    }
}
