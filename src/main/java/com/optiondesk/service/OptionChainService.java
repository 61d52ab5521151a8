package com.optiondesk.service;

import com.optiondesk.broker.ContractResolver;
import com.optiondesk.broker.FutureAwaits;
import com.optiondesk.broker.GatewayTransport;
import com.optiondesk.broker.RequestCorrelator;
import com.optiondesk.broker.RequestHandler;
import com.optiondesk.broker.event.GatewayErrorEvent;
import com.optiondesk.broker.event.GatewayEvent;
import com.optiondesk.broker.event.OptionParameterEndEvent;
import com.optiondesk.broker.event.OptionParameterEvent;
import com.optiondesk.config.GatewayProperties;
import com.optiondesk.domain.enums.RequestCategory;
import com.optiondesk.domain.enums.SecurityType;
import com.optiondesk.domain.model.CachedChain;
import com.optiondesk.domain.model.ChainParams;
import com.optiondesk.domain.model.Strikes;
import com.optiondesk.exception.BaseException;
import com.optiondesk.exception.NotConnectedException;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Option chain parameters (expirations, strikes, trading classes) per underlying.
 *
 * <p>A fetch resolves the underlying's contract id, then collects every parameter record of one
 * option-parameter request until the gateway's end marker. Results are cached in
 * {@link OptionChainCache} for the chain TTL. Empty results are never cached.
 *
 * <p>Degraded answers instead of errors: a fetch that times out returns what arrived so far,
 * or the stale cached chain, or an empty list.
 */
@Slf4j
@Service
public class OptionChainService {

    private final GatewayTransport transport;
    private final RequestCorrelator correlator;
    private final ContractResolver contractResolver;
    private final OptionChainCache chainCache;
    private final GatewayProperties gatewayProperties;

    private final ConcurrentHashMap<String, CompletableFuture<List<ChainParams>>> inFlight =
            new ConcurrentHashMap<>();

    public OptionChainService(
            GatewayTransport transport,
            RequestCorrelator correlator,
            ContractResolver contractResolver,
            OptionChainCache chainCache,
            GatewayProperties gatewayProperties) {
        this.transport = transport;
        this.correlator = correlator;
        this.contractResolver = contractResolver;
        this.chainCache = chainCache;
        this.gatewayProperties = gatewayProperties;
    }

    /**
     * Returns the chain parameters of {@code symbol}, fetching them when the cached entry is
     * missing or older than the chain TTL.
     *
     * @throws NotConnectedException when offline and nothing is cached
     */
    public List<ChainParams> getOptionChain(String symbol) {
        String key = symbol.trim().toUpperCase(Locale.ROOT);
        Optional<CachedChain> fresh = chainCache.getFresh(key);
        if (fresh.isPresent()) {
            return fresh.get().getParams();
        }

        Optional<CachedChain> stale = chainCache.peek(key);
        if (!transport.isConnected()) {
            if (stale.isPresent()) {
                log.debug("Gateway offline, serving stale chain for {}", key);
                return stale.get().getParams();
            }
            throw new NotConnectedException("option chain " + key);
        }

        Duration ceiling = gatewayProperties
                .getContractTimeout()
                .plus(gatewayProperties.getChainTimeout())
                .plusSeconds(1);
        try {
            return FutureAwaits.await(fetch(key), ceiling, () -> {
                log.warn("Option chain for {} not received within {}", key, ceiling);
                return stale.map(CachedChain::getParams).orElse(List.of());
            });
        } catch (BaseException e) {
            if (stale.isPresent()) {
                log.warn("Option chain fetch for {} failed, serving stale chain: {}", key, e.getMessage());
                return stale.get().getParams();
            }
            throw e;
        }
    }

    private CompletableFuture<List<ChainParams>> fetch(String key) {
        CompletableFuture<List<ChainParams>> created = new CompletableFuture<>();
        CompletableFuture<List<ChainParams>> existing = inFlight.putIfAbsent(key, created);
        if (existing != null) {
            log.debug("Joining in-flight chain fetch for {}", key);
            return existing;
        }
        created.whenComplete((params, error) -> inFlight.remove(key, created));

        contractResolver
                .resolveUnderlyingAsync(key)
                .thenAccept(conId -> requestParameters(key, conId, created))
                .exceptionally(error -> {
                    created.completeExceptionally(FutureAwaits.unwrapCompletion(error));
                    return null;
                });
        return created;
    }

    private void requestParameters(String key, long underlyingConId, CompletableFuture<List<ChainParams>> result) {
        int requestId = correlator.allocateId(RequestCategory.CHAIN);
        ChainCollector collector = new ChainCollector(requestId, key, result);
        correlator.register(requestId, RequestCategory.CHAIN, gatewayProperties.getChainTimeout(), collector);
        log.debug("Requesting option parameters for {} (conId {}, request {})", key, underlyingConId, requestId);
        try {
            transport.requestOptionParameters(requestId, key, SecurityType.STK.name(), underlyingConId);
        } catch (RuntimeException e) {
            correlator.complete(requestId);
            result.completeExceptionally(e);
        }
    }

    static ChainParams toChainParams(OptionParameterEvent event) {
        List<String> expirations = new ArrayList<>(event.getExpirations());
        Collections.sort(expirations);
        List<BigDecimal> strikes = new ArrayList<>();
        event.getStrikes().forEach(strike -> strikes.add(Strikes.normalize(strike)));
        Collections.sort(strikes);
        return ChainParams.builder()
                .exchange(event.getExchange())
                .underlyingConId(event.getUnderlyingConId())
                .tradingClass(event.getTradingClass())
                .multiplier(event.getMultiplier())
                .expirations(List.copyOf(expirations))
                .strikes(List.copyOf(strikes))
                .build();
    }

    /** Accumulates parameter records for one request until the end marker, an error or the timeout. */
    private class ChainCollector implements RequestHandler {

        private final int requestId;
        private final String key;
        private final CompletableFuture<List<ChainParams>> result;
        private final List<ChainParams> received = Collections.synchronizedList(new ArrayList<>());

        ChainCollector(int requestId, String key, CompletableFuture<List<ChainParams>> result) {
            this.requestId = requestId;
            this.key = key;
            this.result = result;
        }

        @Override
        public void onEvent(GatewayEvent event) {
            if (event instanceof OptionParameterEvent parameters) {
                received.add(toChainParams(parameters));
            } else if (event instanceof OptionParameterEndEvent) {
                if (correlator.complete(requestId)) {
                    List<ChainParams> params = snapshot();
                    if (params.isEmpty()) {
                        log.info("Gateway returned no option parameters for {}", key);
                        result.complete(fallback());
                    } else {
                        chainCache.put(key, params);
                        log.info("Option chain for {} loaded: {} series", key, params.size());
                        result.complete(params);
                    }
                }
            } else if (event instanceof GatewayErrorEvent error) {
                if (correlator.complete(requestId)) {
                    log.warn("Option parameter request for {} failed: [{}] {}", key, error.getCode(), error.getMessage());
                    List<ChainParams> params = snapshot();
                    result.complete(params.isEmpty() ? fallback() : params);
                }
            }
        }

        @Override
        public void onTimeout(int id) {
            List<ChainParams> params = snapshot();
            log.warn(
                    "Option parameter request for {} timed out after {} with {} series",
                    key,
                    gatewayProperties.getChainTimeout(),
                    params.size());
            result.complete(params.isEmpty() ? fallback() : params);
        }

        private List<ChainParams> snapshot() {
            synchronized (received) {
                return List.copyOf(received);
            }
        }

        private List<ChainParams> fallback() {
            return chainCache.peek(key).map(CachedChain::getParams).orElse(List.of());
        }
    }
}
