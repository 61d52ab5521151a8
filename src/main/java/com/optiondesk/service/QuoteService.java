package com.optiondesk.service;

import com.optiondesk.broker.FutureAwaits;
import com.optiondesk.broker.GatewayTransport;
import com.optiondesk.broker.RequestCorrelator;
import com.optiondesk.broker.RequestHandler;
import com.optiondesk.broker.event.GatewayErrorEvent;
import com.optiondesk.broker.event.GatewayEvent;
import com.optiondesk.broker.event.TickPriceEvent;
import com.optiondesk.broker.event.TickSnapshotEndEvent;
import com.optiondesk.config.GatewayProperties;
import com.optiondesk.domain.enums.MarketDataType;
import com.optiondesk.domain.enums.RequestCategory;
import com.optiondesk.domain.model.ContractSpec;
import com.optiondesk.domain.model.OptionContractRef;
import com.optiondesk.domain.model.OptionQuote;
import com.optiondesk.domain.model.StockQuote;
import com.optiondesk.exception.NotConnectedException;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Snapshot quotes for stocks and single option contracts.
 *
 * <p>Quotes are best effort: a snapshot that has not finished within its timeout is returned
 * with whatever prices arrived, zeros for the rest. Only a missing gateway connection is an
 * error.
 *
 * <p>Stocks are requested as delayed-frozen data so accounts without a live subscription still
 * get a price; option quotes use frozen data like the greeks batches.
 */
@Slf4j
@Service
public class QuoteService {

    private final GatewayTransport transport;
    private final RequestCorrelator correlator;
    private final GatewayProperties gatewayProperties;

    public QuoteService(GatewayTransport transport, RequestCorrelator correlator, GatewayProperties gatewayProperties) {
        this.transport = transport;
        this.correlator = correlator;
        this.gatewayProperties = gatewayProperties;
    }

    public StockQuote getStockQuote(String symbol) {
        ensureConnected("stock quote " + symbol);
        StockQuote quote = await(getStockQuoteAsync(symbol), gatewayProperties.getQuoteTimeout());
        return quote != null
                ? quote
                : StockQuote.builder().symbol(symbol.trim().toUpperCase(Locale.ROOT)).build();
    }

    /**
     * Completes with the quote once the snapshot ends, the gateway reports an error for it, or
     * the quote timeout passes. Never completes exceptionally for gateway-side reasons.
     */
    public CompletableFuture<StockQuote> getStockQuoteAsync(String symbol) {
        String normalized = symbol.trim().toUpperCase(Locale.ROOT);
        ContractSpec stock =
                ContractSpec.stock(normalized, gatewayProperties.getExchange(), gatewayProperties.getCurrency());
        return snapshot(
                        RequestCategory.STOCK_QUOTE,
                        MarketDataType.DELAYED_FROZEN,
                        stock,
                        gatewayProperties.getQuoteTimeout())
                .thenApply(prices -> StockQuote.builder()
                        .symbol(normalized)
                        .bid(prices.getBid())
                        .ask(prices.getAsk())
                        .last(prices.getLast())
                        .build());
    }

    /**
     * One price per symbol, requested in parallel: last, else bid, else ask, else zero.
     * Keeps the order of {@code symbols}.
     */
    public Map<String, BigDecimal> getQuotes(List<String> symbols) {
        ensureConnected("quotes");
        Map<String, CompletableFuture<StockQuote>> pending = new LinkedHashMap<>();
        for (String symbol : symbols) {
            pending.computeIfAbsent(symbol.trim().toUpperCase(Locale.ROOT), key -> getStockQuoteAsync(symbol));
        }

        Map<String, BigDecimal> prices = new LinkedHashMap<>();
        pending.forEach((symbol, future) -> {
            StockQuote quote = await(future, gatewayProperties.getQuoteTimeout());
            prices.put(symbol, quote == null ? BigDecimal.ZERO : displayPrice(quote));
        });
        return prices;
    }

    /** Snapshot bid/ask/last for each contract, in request order. */
    public List<OptionQuote> getOptionQuotes(List<OptionContractRef> contracts) {
        ensureConnected("option quotes");
        Duration timeout = gatewayProperties.getOptionQuoteTimeout();
        List<CompletableFuture<PriceTickAccumulator>> pending = new ArrayList<>(contracts.size());
        for (OptionContractRef ref : contracts) {
            ContractSpec option = ContractSpec.option(
                    ref.symbol().trim().toUpperCase(Locale.ROOT),
                    ref.expiry(),
                    ref.strike(),
                    ref.right(),
                    gatewayProperties.getExchange(),
                    gatewayProperties.getCurrency());
            pending.add(snapshot(RequestCategory.OPTION_QUOTE, MarketDataType.FROZEN, option, timeout));
        }

        List<OptionQuote> quotes = new ArrayList<>(contracts.size());
        for (int i = 0; i < contracts.size(); i++) {
            OptionContractRef ref = contracts.get(i);
            PriceTickAccumulator prices = await(pending.get(i), timeout);
            OptionQuote.OptionQuoteBuilder quote = OptionQuote.builder()
                    .symbol(ref.symbol().trim().toUpperCase(Locale.ROOT))
                    .expiry(ref.expiry())
                    .strike(ref.strike())
                    .right(ref.right());
            if (prices != null) {
                quote.bid(prices.getBid()).ask(prices.getAsk()).last(prices.getLast());
            }
            quotes.add(quote.build());
        }
        return quotes;
    }

    static BigDecimal displayPrice(StockQuote quote) {
        if (quote.getLast().signum() > 0) {
            return quote.getLast();
        }
        if (quote.getBid().signum() > 0) {
            return quote.getBid();
        }
        if (quote.getAsk().signum() > 0) {
            return quote.getAsk();
        }
        return BigDecimal.ZERO;
    }

    private CompletableFuture<PriceTickAccumulator> snapshot(
            RequestCategory category, MarketDataType dataType, ContractSpec contract, Duration timeout) {
        int requestId = correlator.allocateId(category);
        SnapshotQuote handler = new SnapshotQuote(requestId, contract.getSymbol());
        correlator.register(requestId, category, timeout, handler);
        try {
            transport.requestMarketDataType(dataType);
            transport.requestMarketData(requestId, contract, true);
        } catch (RuntimeException e) {
            correlator.complete(requestId);
            handler.result.completeExceptionally(e);
        }
        return handler.result;
    }

    private <T> T await(CompletableFuture<T> future, Duration timeout) {
        // the correlator timeout completes the future; the margin covers scheduler lag
        return FutureAwaits.await(future, timeout.plusSeconds(1), () -> null);
    }

    private void ensureConnected(String operation) {
        if (!transport.isConnected()) {
            throw new NotConnectedException(operation);
        }
    }

    /** Collects price ticks for one snapshot; done on snapshot end, error, all sides known, or timeout. */
    private class SnapshotQuote implements RequestHandler {

        private final int requestId;
        private final String symbol;
        private final PriceTickAccumulator prices = new PriceTickAccumulator();
        private final CompletableFuture<PriceTickAccumulator> result = new CompletableFuture<>();

        SnapshotQuote(int requestId, String symbol) {
            this.requestId = requestId;
            this.symbol = symbol;
        }

        @Override
        public void onEvent(GatewayEvent event) {
            if (event instanceof TickPriceEvent tick) {
                prices.applyPrice(tick.getField(), tick.getPrice());
                if (prices.getBid().signum() > 0 && prices.getAsk().signum() > 0 && prices.getLast().signum() > 0) {
                    finish();
                }
            } else if (event instanceof TickSnapshotEndEvent) {
                finish();
            } else if (event instanceof GatewayErrorEvent error) {
                log.info("Quote request {} for {} failed: [{}] {}", requestId, symbol, error.getCode(), error.getMessage());
                finish();
            }
        }

        @Override
        public void onTimeout(int id) {
            log.warn("Quote for {} incomplete after timeout, returning partial prices", symbol);
            cancelSubscription();
            result.complete(prices);
        }

        private void finish() {
            if (correlator.complete(requestId)) {
                cancelSubscription();
                result.complete(prices);
            }
        }

        private void cancelSubscription() {
            try {
                transport.cancelMarketData(requestId);
            } catch (RuntimeException e) {
                log.debug("Cancel of quote request {} failed: {}", requestId, e.getMessage());
            }
        }
    }
}
