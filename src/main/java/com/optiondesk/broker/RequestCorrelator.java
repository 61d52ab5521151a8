package com.optiondesk.broker;

import com.optiondesk.broker.event.GatewayEvent;
import com.optiondesk.domain.enums.PendingOutcome;
import com.optiondesk.domain.enums.RequestCategory;
import com.optiondesk.observability.MarketDataMetrics;
import java.time.Clock;
import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Owns request ids and routes gateway events back to whoever issued the request.
 *
 * <p><b>Usage pattern:</b>
 * <ol>
 *   <li>{@link #allocateId} from the caller's category range</li>
 *   <li>{@link #register} a handler with a finite timeout BEFORE sending the request, so an
 *       answer that arrives immediately is not lost</li>
 *   <li>send through {@link GatewayTransport}</li>
 *   <li>the handler calls {@link #complete} when it has what it needs; otherwise the timeout
 *       removes the entry and calls {@link RequestHandler#onTimeout}</li>
 * </ol>
 *
 * <p>Each entry is removed exactly once, by whichever of complete/timeout wins. Events for ids
 * that are no longer pending (late ticks after a batch finished) are dropped.
 *
 * <p><b>Thread safety:</b> all state is in ConcurrentHashMap and atomics. {@link #dispatch} runs
 * on the transport thread; timeouts run on the gateway scheduler.
 */
@Component
public class RequestCorrelator {

    private static final Logger log = LoggerFactory.getLogger(RequestCorrelator.class);

    private final ScheduledExecutorService scheduler;
    private final Clock clock;
    private final MarketDataMetrics metrics;

    private final Map<RequestCategory, AtomicInteger> nextIds = new EnumMap<>(RequestCategory.class);
    private final ConcurrentHashMap<Integer, PendingRequest> pending = new ConcurrentHashMap<>();

    public RequestCorrelator(
            GatewayTransport transport,
            @Qualifier("gatewayScheduler") ScheduledExecutorService scheduler,
            Clock clock,
            MarketDataMetrics metrics) {
        this.scheduler = scheduler;
        this.clock = clock;
        this.metrics = metrics;
        for (RequestCategory category : RequestCategory.values()) {
            nextIds.put(category, new AtomicInteger(category.getRangeStart()));
        }
        transport.addListener(this::dispatch);
    }

    /**
     * Returns the next id of the category's range. Ids are strictly increasing per category and
     * never reused for the lifetime of the process.
     *
     * @throws IllegalStateException when the range is exhausted
     */
    public int allocateId(RequestCategory category) {
        int rangeEnd = category.getRangeEnd();
        int id = nextIds.get(category).getAndUpdate(current -> current < rangeEnd ? current + 1 : current);
        if (id >= rangeEnd) {
            throw new IllegalStateException("Request id range exhausted for " + category);
        }
        metrics.recordRequest(category);
        return id;
    }

    /**
     * Moves the ORDER range forward to the gateway's next valid order id. Values behind the
     * current position, or outside the range, are ignored.
     */
    public void advanceOrderIds(int nextValidOrderId) {
        if (!RequestCategory.ORDER.contains(nextValidOrderId)) {
            log.debug("Ignoring next valid order id {} outside the order id range", nextValidOrderId);
            return;
        }
        int current = nextIds.get(RequestCategory.ORDER).accumulateAndGet(nextValidOrderId, Math::max);
        log.debug("Order ids advanced: next={}", current);
    }

    /**
     * Attaches a handler to {@code id} and arms its timeout.
     *
     * @throws IllegalArgumentException if the id is outside the category's range or the timeout is not positive
     * @throws IllegalStateException if the id is already pending
     */
    public PendingRequest register(int id, RequestCategory category, Duration timeout, RequestHandler handler) {
        if (!category.contains(id)) {
            throw new IllegalArgumentException("Request id " + id + " is outside the " + category + " range");
        }
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("Request " + id + " needs a positive timeout");
        }

        PendingRequest request = new PendingRequest(id, category, clock.instant(), handler);
        if (pending.putIfAbsent(id, request) != null) {
            throw new IllegalStateException("Request id " + id + " is already pending");
        }
        request.setTimeoutTask(
                scheduler.schedule(() -> expire(request), timeout.toMillis(), TimeUnit.MILLISECONDS));
        return request;
    }

    /**
     * Removes the entry and cancels its timeout.
     *
     * @return true if this call removed it; false for unknown or already finished ids
     */
    public boolean complete(int id) {
        PendingRequest request = pending.remove(id);
        if (request == null) {
            return false;
        }
        request.cancelTimeout();
        request.getCompletion().complete(PendingOutcome.COMPLETED);
        return true;
    }

    public boolean isPending(int id) {
        return pending.containsKey(id);
    }

    public int pendingCount() {
        return pending.size();
    }

    /** Routes one transport event to the handler registered for its request id. */
    public void dispatch(GatewayEvent event) {
        if (!event.hasRequestId()) {
            return;
        }
        PendingRequest request = pending.get(event.getRequestId());
        if (request == null) {
            log.debug(
                    "Dropping {} for request {} (not pending)",
                    event.getClass().getSimpleName(),
                    event.getRequestId());
            return;
        }
        try {
            request.getHandler().onEvent(event);
        } catch (RuntimeException e) {
            log.warn(
                    "Handler for request {} ({}) failed on {}: {}",
                    request.getId(),
                    request.getCategory(),
                    event.getClass().getSimpleName(),
                    e.getMessage(),
                    e);
        }
    }

    private void expire(PendingRequest request) {
        if (!pending.remove(request.getId(), request)) {
            return;
        }
        request.getCompletion().complete(PendingOutcome.TIMED_OUT);
        log.debug("Request {} ({}) timed out", request.getId(), request.getCategory());
        try {
            request.getHandler().onTimeout(request.getId());
        } catch (RuntimeException e) {
            log.warn("Timeout handler for request {} failed: {}", request.getId(), e.getMessage(), e);
        }
    }
}
