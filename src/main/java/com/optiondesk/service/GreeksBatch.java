package com.optiondesk.service;

import com.optiondesk.broker.GatewayTransport;
import com.optiondesk.broker.RequestCorrelator;
import com.optiondesk.broker.RequestHandler;
import com.optiondesk.broker.event.GatewayErrorEvent;
import com.optiondesk.broker.event.GatewayEvent;
import com.optiondesk.broker.event.TickOptionComputationEvent;
import com.optiondesk.broker.event.TickPriceEvent;
import com.optiondesk.broker.event.TickSizeEvent;
import com.optiondesk.broker.event.TickSnapshotEndEvent;
import com.optiondesk.config.GatewayProperties;
import com.optiondesk.domain.enums.BatchFinishReason;
import com.optiondesk.domain.enums.MarketDataType;
import com.optiondesk.domain.enums.RequestCategory;
import com.optiondesk.domain.model.ContractSpec;
import com.optiondesk.domain.model.OptionGreek;
import com.optiondesk.observability.MarketDataMetrics;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One snapshot fetch of greeks for a set of option contracts of a single (underlying, expiry).
 *
 * <p>The gateway does not reliably send snapshot-end when many snapshots overlap, so the batch
 * ends on whichever comes first:
 * <ul>
 *   <li>every request answered with snapshot-end or an error ({@code ALL_COMPLETED})</li>
 *   <li>no tick for the settle delay, counted from the latest tick ({@code SETTLED})</li>
 *   <li>the hard timeout, counted from batch start ({@code HARD_TIMEOUT})</li>
 * </ul>
 * The settle timer only starts once the first tick arrives. Finishing runs exactly once: it
 * cancels every subscription, releases every request id, merges the records into the
 * {@link GreeksCache} and completes {@link #getResult()} with one record per contract, zeros
 * included.
 *
 * <p>Requests go out in bursts on the gateway scheduler, each burst preceded by a frozen
 * market data type request so closed markets still answer with the last values.
 */
class GreeksBatch implements RequestHandler {

    private static final Logger log = LoggerFactory.getLogger(GreeksBatch.class);

    private final String symbol;
    private final String expiry;
    private final List<ContractSpec> contracts;
    private final GatewayTransport transport;
    private final RequestCorrelator correlator;
    private final ScheduledExecutorService scheduler;
    private final GreeksCache greeksCache;
    private final MarketDataMetrics metrics;
    private final GatewayProperties.Greeks settings;

    private final Map<Integer, OptionGreekAccumulator> accumulators = new LinkedHashMap<>();
    private final Map<Integer, ContractSpec> requests = new LinkedHashMap<>();
    private final Set<Integer> completedIds = ConcurrentHashMap.newKeySet();
    private final AtomicBoolean finished = new AtomicBoolean();
    private final AtomicInteger errorCount = new AtomicInteger();
    private final CompletableFuture<List<OptionGreek>> result = new CompletableFuture<>();

    private final Object timerLock = new Object();
    private final List<ScheduledFuture<?>> burstTasks = new ArrayList<>();
    private ScheduledFuture<?> settleTimer;
    private ScheduledFuture<?> hardTimer;

    GreeksBatch(
            String symbol,
            String expiry,
            List<ContractSpec> contracts,
            GatewayTransport transport,
            RequestCorrelator correlator,
            ScheduledExecutorService scheduler,
            GreeksCache greeksCache,
            MarketDataMetrics metrics,
            GatewayProperties.Greeks settings) {
        this.symbol = symbol;
        this.expiry = expiry;
        this.contracts = List.copyOf(contracts);
        this.transport = transport;
        this.correlator = correlator;
        this.scheduler = scheduler;
        this.greeksCache = greeksCache;
        this.metrics = metrics;
        this.settings = settings;
    }

    CompletableFuture<List<OptionGreek>> getResult() {
        return result;
    }

    /** Registers every request, arms the hard timer and schedules the bursts. Call once. */
    void start() {
        try {
            Duration registrationTimeout = settings.getHardTimeout().plusSeconds(2);
            for (ContractSpec contract : contracts) {
                int requestId = correlator.allocateId(RequestCategory.GREEKS);
                accumulators.put(
                        requestId,
                        new OptionGreekAccumulator(contract.getStrike(), contract.getRight(), contract.getLastTradeDate()));
                requests.put(requestId, contract);
                correlator.register(requestId, RequestCategory.GREEKS, registrationTimeout, this);
            }

            log.debug("Option greeks batch {} {}: {} contracts", symbol, expiry, contracts.size());
            synchronized (timerLock) {
                hardTimer = scheduler.schedule(
                        () -> finish(BatchFinishReason.HARD_TIMEOUT),
                        settings.getHardTimeout().toMillis(),
                        TimeUnit.MILLISECONDS);
                scheduleBursts();
            }
        } catch (RuntimeException e) {
            requests.keySet().forEach(correlator::complete);
            result.completeExceptionally(e);
        }
    }

    private void scheduleBursts() {
        List<Integer> ids = new ArrayList<>(requests.keySet());
        int burstSize = Math.max(1, settings.getBurstSize());
        long burstDelayMs = settings.getBurstDelay().toMillis();
        for (int from = 0, burst = 0; from < ids.size(); from += burstSize, burst++) {
            List<Integer> chunk = ids.subList(from, Math.min(from + burstSize, ids.size()));
            burstTasks.add(scheduler.schedule(() -> sendBurst(chunk), burst * burstDelayMs, TimeUnit.MILLISECONDS));
        }
    }

    private void sendBurst(List<Integer> ids) {
        if (finished.get()) {
            return;
        }
        try {
            transport.requestMarketDataType(MarketDataType.FROZEN);
        } catch (RuntimeException e) {
            log.debug("Market data type request failed before burst: {}", e.getMessage());
        }
        for (Integer requestId : ids) {
            try {
                transport.requestMarketData(requestId, requests.get(requestId), true);
            } catch (RuntimeException e) {
                recordError(requestId, -1, e.getMessage());
            }
        }
    }

    @Override
    public void onEvent(GatewayEvent event) {
        if (finished.get()) {
            return;
        }
        int requestId = event.getRequestId();
        OptionGreekAccumulator accumulator = accumulators.get(requestId);
        if (accumulator == null) {
            return;
        }

        if (event instanceof TickPriceEvent price) {
            accumulator.applyPrice(price.getField(), price.getPrice());
            onTick();
        } else if (event instanceof TickOptionComputationEvent computation) {
            accumulator.applyComputation(computation);
            onTick();
        } else if (event instanceof TickSizeEvent size) {
            accumulator.applySize(size.getField(), size.getSize());
            onTick();
        } else if (event instanceof TickSnapshotEndEvent) {
            markCompleted(requestId);
        } else if (event instanceof GatewayErrorEvent error) {
            recordError(requestId, error.getCode(), error.getMessage());
        }
    }

    private void onTick() {
        synchronized (timerLock) {
            if (finished.get()) {
                return;
            }
            if (settleTimer != null) {
                settleTimer.cancel(false);
            }
            settleTimer = scheduler.schedule(
                    () -> finish(BatchFinishReason.SETTLED),
                    settings.getSettleDelay().toMillis(),
                    TimeUnit.MILLISECONDS);
        }
    }

    /** A contract the gateway refused counts as answered with no data. */
    private void recordError(int requestId, int code, String message) {
        int errors = errorCount.incrementAndGet();
        ContractSpec contract = requests.get(requestId);
        if (errors <= settings.getLoggedErrors()) {
            log.info(
                    "Option greeks request {} {} {}{} failed: [{}] {}",
                    requestId,
                    symbol,
                    contract.getStrike().toPlainString(),
                    contract.getRight().getCode(),
                    code,
                    message);
        } else {
            log.debug("Option greeks request {} failed: [{}] {}", requestId, code, message);
        }
        markCompleted(requestId);
    }

    private void markCompleted(int requestId) {
        if (completedIds.add(requestId) && completedIds.size() == accumulators.size()) {
            finish(BatchFinishReason.ALL_COMPLETED);
        }
    }

    private void finish(BatchFinishReason reason) {
        if (!finished.compareAndSet(false, true)) {
            return;
        }
        synchronized (timerLock) {
            if (settleTimer != null) {
                settleTimer.cancel(false);
            }
            if (hardTimer != null) {
                hardTimer.cancel(false);
            }
            burstTasks.forEach(task -> task.cancel(false));
        }

        try {
            for (Integer requestId : accumulators.keySet()) {
                correlator.complete(requestId);
                try {
                    transport.cancelMarketData(requestId);
                } catch (RuntimeException e) {
                    log.debug("Cancel of market data {} failed: {}", requestId, e.getMessage());
                }
            }

            List<OptionGreek> records = new ArrayList<>(accumulators.size());
            accumulators.values().forEach(accumulator -> records.add(accumulator.toOptionGreek()));
            records.sort(OptionGreek.CHAIN_ORDER);
            greeksCache.merge(symbol, expiry, records);
            metrics.recordGreeksBatch(reason);

            long withData = records.stream().filter(OptionGreek::hasData).count();
            log.info(
                    "Option greeks finished: {}/{} have data ({} {}, {}, {} errors)",
                    withData,
                    records.size(),
                    symbol,
                    expiry,
                    reason,
                    errorCount.get());
            result.complete(records);
        } catch (RuntimeException e) {
            log.error("Option greeks batch {} {} failed while finishing", symbol, expiry, e);
            result.completeExceptionally(e);
        }
    }
}
