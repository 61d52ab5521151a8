package com.optiondesk.observability;

import com.optiondesk.domain.enums.BatchFinishReason;
import com.optiondesk.domain.enums.RequestCategory;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.stereotype.Service;

/**
 * Micrometer counters for gateway traffic:
 * <ul>
 *   <li><b>optiondesk.gateway.requests</b> (counter, tag {@code category}): request ids allocated</li>
 *   <li><b>optiondesk.greeks.batches</b> (counter, tag {@code reason}): finished greeks batches</li>
 *   <li><b>optiondesk.orders.placed</b> (counter, tag {@code kind}): orders handed to the gateway</li>
 * </ul>
 *
 * <p>Meters for the enum-tagged counters are registered eagerly so they show up at zero on
 * the actuator endpoint before the first request.
 */
@Service
public class MarketDataMetrics {

    private final MeterRegistry meterRegistry;
    private final Map<RequestCategory, Counter> requestCounters = new EnumMap<>(RequestCategory.class);
    private final Map<BatchFinishReason, Counter> batchCounters = new EnumMap<>(BatchFinishReason.class);
    private final Map<String, Counter> orderCounters = new ConcurrentHashMap<>();

    public MarketDataMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        for (RequestCategory category : RequestCategory.values()) {
            requestCounters.put(
                    category,
                    Counter.builder("optiondesk.gateway.requests")
                            .description("Gateway request ids allocated")
                            .tag("category", category.name())
                            .register(meterRegistry));
        }
        for (BatchFinishReason reason : BatchFinishReason.values()) {
            batchCounters.put(
                    reason,
                    Counter.builder("optiondesk.greeks.batches")
                            .description("Greeks snapshot batches finished")
                            .tag("reason", reason.name())
                            .register(meterRegistry));
        }
    }

    public void recordRequest(RequestCategory category) {
        requestCounters.get(category).increment();
    }

    public void recordGreeksBatch(BatchFinishReason reason) {
        batchCounters.get(reason).increment();
    }

    /** @param kind roll, stock or option */
    public void recordOrderPlaced(String kind) {
        orderCounters
                .computeIfAbsent(kind, k -> Counter.builder("optiondesk.orders.placed")
                        .description("Orders handed to the gateway")
                        .tag("kind", k)
                        .register(meterRegistry))
                .increment();
    }
}
