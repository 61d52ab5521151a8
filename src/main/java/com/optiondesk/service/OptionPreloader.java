package com.optiondesk.service;

import com.optiondesk.config.PreloaderProperties;
import com.optiondesk.domain.model.ChainParams;
import com.optiondesk.domain.model.OptionGreek;
import com.optiondesk.domain.model.Strikes;
import com.optiondesk.event.ConnectionStatusEvent;
import jakarta.annotation.PreDestroy;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

/**
 * Keeps near-the-money greeks of the watch-list warm so interactive reads hit the cache.
 *
 * <p>Each cycle, per symbol: load the chain, look up the stock price (remembered in
 * {@link StockPriceCache}), take the nearest expirations and a window of standard strikes
 * around the price, then force-refresh greeks one expiration at a time. Expirations are never
 * fetched in parallel, which keeps the gateway under its request rate limit.
 *
 * <p>Cycles never overlap: a trigger that fires while a cycle is still running is dropped,
 * not queued. The preloader follows the gateway connection through {@link ConnectionStatusEvent}s.
 */
@Slf4j
@Service
public class OptionPreloader {

    private final OptionChainService optionChainService;
    private final QuoteService quoteService;
    private final OptionGreeksService optionGreeksService;
    private final StockPriceCache stockPriceCache;
    private final PreloaderProperties preloaderProperties;
    private final ScheduledExecutorService scheduler;
    private final Clock clock;

    private final Object lifecycleLock = new Object();
    private final AtomicBoolean cycleRunning = new AtomicBoolean();
    private ScheduledFuture<?> trigger;
    private volatile Instant lastCycleCompletedAt;

    public OptionPreloader(
            OptionChainService optionChainService,
            QuoteService quoteService,
            OptionGreeksService optionGreeksService,
            StockPriceCache stockPriceCache,
            PreloaderProperties preloaderProperties,
            @Qualifier("preloaderScheduler") ScheduledExecutorService scheduler,
            Clock clock) {
        this.optionChainService = optionChainService;
        this.quoteService = quoteService;
        this.optionGreeksService = optionGreeksService;
        this.stockPriceCache = stockPriceCache;
        this.preloaderProperties = preloaderProperties;
        this.scheduler = scheduler;
        this.clock = clock;
    }

    public void start() {
        synchronized (lifecycleLock) {
            if (trigger != null) {
                return;
            }
            trigger = scheduler.scheduleAtFixedRate(
                    this::triggerCycle,
                    preloaderProperties.getInitialDelay().toMillis(),
                    preloaderProperties.getInterval().toMillis(),
                    TimeUnit.MILLISECONDS);
        }
        log.info(
                "Greeks preloader started: symbols={}, interval={}",
                preloaderProperties.getSymbols(),
                preloaderProperties.getInterval());
    }

    /** Stops future cycles. A cycle already running finishes its current symbol list. */
    @PreDestroy
    public void stop() {
        synchronized (lifecycleLock) {
            if (trigger == null) {
                return;
            }
            trigger.cancel(false);
            trigger = null;
        }
        log.info("Greeks preloader stopped");
    }

    public boolean isRunning() {
        synchronized (lifecycleLock) {
            return trigger != null;
        }
    }

    public boolean isCycleRunning() {
        return cycleRunning.get();
    }

    public Instant getLastCycleCompletedAt() {
        return lastCycleCompletedAt;
    }

    @EventListener
    public void onConnectionStatus(ConnectionStatusEvent event) {
        if (!preloaderProperties.isEnabled()) {
            return;
        }
        switch (event.getStatus()) {
            case CONNECTED -> start();
            case DISCONNECTED, ERROR -> stop();
            default -> {}
        }
    }

    /**
     * Refreshes one key right away, outside the periodic schedule. Never completes
     * exceptionally: failures are logged and produce an empty list.
     */
    public CompletableFuture<List<OptionGreek>> requestPreload(
            String symbol, String expiry, Collection<BigDecimal> strikes) {
        log.info("On-demand preload: {} {} ({} strikes)", symbol, expiry, strikes.size());
        CompletableFuture<List<OptionGreek>> refresh;
        try {
            refresh = optionGreeksService.refreshAsync(symbol, expiry, strikes);
        } catch (RuntimeException e) {
            refresh = CompletableFuture.failedFuture(e);
        }
        return refresh.handle((records, error) -> {
            if (error != null) {
                log.warn("On-demand preload of {} {} failed: {}", symbol, expiry, error.getMessage());
                return List.of();
            }
            return records;
        });
    }

    public Optional<BigDecimal> getCachedStockPrice(String symbol) {
        return stockPriceCache.get(symbol);
    }

    /**
     * Submits a cycle unless one is already running.
     *
     * @return false when the trigger was dropped
     */
    public boolean triggerCycle() {
        if (!cycleRunning.compareAndSet(false, true)) {
            log.debug("Preload cycle still running, skipping this trigger");
            return false;
        }
        try {
            scheduler.execute(() -> {
                try {
                    runCycle();
                } finally {
                    cycleRunning.set(false);
                }
            });
        } catch (RejectedExecutionException e) {
            cycleRunning.set(false);
            log.debug("Preload cycle rejected, scheduler shut down");
            return false;
        }
        return true;
    }

    /** One pass over the watch-list on the calling thread. */
    public void runCycle() {
        long startedAt = System.currentTimeMillis();
        for (String symbol : preloaderProperties.getSymbols()) {
            try {
                preloadSymbol(symbol);
            } catch (RuntimeException e) {
                log.warn("Preload of {} failed: {}", symbol, e.getMessage());
            }
        }
        lastCycleCompletedAt = clock.instant();
        log.debug("Preload cycle finished in {} ms", System.currentTimeMillis() - startedAt);
    }

    private void preloadSymbol(String symbol) {
        List<ChainParams> chain = optionChainService.getOptionChain(symbol);
        if (chain.isEmpty()) {
            log.info("No option chain for {}, nothing to preload", symbol);
            return;
        }

        BigDecimal price = lookUpPrice(symbol);
        List<String> expirations = selectExpirations(
                chain.stream().flatMap(params -> params.getExpirations().stream()).collect(Collectors.toList()),
                preloaderProperties.getExpirations());

        for (String expiry : expirations) {
            List<BigDecimal> strikes = standardStrikes(chain, expiry);
            List<BigDecimal> window = selectStrikeWindow(strikes, price);
            if (window.isEmpty()) {
                continue;
            }
            preloadSymbolExpiry(symbol, expiry, window);
        }
    }

    private void preloadSymbolExpiry(String symbol, String expiry, List<BigDecimal> strikes) {
        try {
            optionGreeksService.getOptionGreeks(symbol, expiry, strikes, true);
        } catch (RuntimeException e) {
            log.warn("Preload of {} {} failed: {}", symbol, expiry, e.getMessage());
        }
    }

    /** Current price, else the last known one, else null. */
    private BigDecimal lookUpPrice(String symbol) {
        try {
            BigDecimal price = quoteService.getStockQuote(symbol).referencePrice();
            if (price.signum() > 0) {
                stockPriceCache.put(symbol, price);
                return price;
            }
        } catch (RuntimeException e) {
            log.debug("Price lookup for {} failed: {}", symbol, e.getMessage());
        }
        return stockPriceCache.get(symbol).orElse(null);
    }

    /** Nearest {@code count} expirations from today on, ascending. */
    public List<String> selectExpirations(Collection<String> expirations, int count) {
        String today = LocalDate.now(clock).format(DateTimeFormatter.BASIC_ISO_DATE);
        return new TreeSet<>(expirations)
                .tailSet(today, true).stream().limit(count).collect(Collectors.toList());
    }

    /**
     * Window of strikes centred on the first strike at or above {@code price}, with the
     * configured radius on each side. Without a price the middle of the chain is used.
     *
     * @param strikes sorted ascending
     */
    public List<BigDecimal> selectStrikeWindow(List<BigDecimal> strikes, BigDecimal price) {
        if (strikes.isEmpty()) {
            return List.of();
        }
        int center;
        int radius;
        if (price == null || price.signum() <= 0) {
            center = strikes.size() / 2;
            radius = preloaderProperties.getFallbackHalfWidth();
        } else {
            center = strikes.size() - 1;
            for (int i = 0; i < strikes.size(); i++) {
                if (strikes.get(i).compareTo(price) >= 0) {
                    center = i;
                    break;
                }
            }
            radius = preloaderProperties.getStrikeRadius();
        }
        int from = Math.max(0, center - radius);
        int to = Math.min(strikes.size(), center + radius + 1);
        return List.copyOf(strikes.subList(from, to));
    }

    /** Whole and half-dollar strikes listed for {@code expiry}, ascending. */
    static List<BigDecimal> standardStrikes(List<ChainParams> chain, String expiry) {
        TreeSet<BigDecimal> strikes = new TreeSet<>();
        for (ChainParams params : chain) {
            if (params.hasExpiry(expiry)) {
                params.getStrikes().stream().filter(Strikes::isStandard).forEach(strikes::add);
            }
        }
        return new ArrayList<>(strikes);
    }
}
