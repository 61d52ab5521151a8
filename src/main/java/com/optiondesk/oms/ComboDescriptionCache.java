package com.optiondesk.oms;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import org.springframework.stereotype.Component;

/**
 * Human-readable label per combo order id, e.g. "+Mar7 590P → -Mar14 585P". Order status
 * reports from the gateway only carry the id, so this is what lets them be shown by leg.
 */
@Component
public class ComboDescriptionCache {

    /** Combo orders are day orders; a day is enough to label every status report. */
    private final Cache<Integer, String> descriptions = Caffeine.newBuilder()
            .expireAfterWrite(1, TimeUnit.DAYS)
            .maximumSize(10_000)
            .build();

    public void put(int orderId, String description) {
        descriptions.put(orderId, description);
    }

    public Optional<String> get(int orderId) {
        return Optional.ofNullable(descriptions.getIfPresent(orderId));
    }
}
