package com.optiondesk.domain.model;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.Value;

/**
 * Latest merged greeks for every strike/right ever fetched for one (underlying, expiry).
 * Immutable: {@link #mergedWith} returns a new instance.
 */
@Value
public class CachedGreeks {

    String symbol;
    String expiry;
    Map<StrikeRight, OptionGreek> greeks;
    Instant fetchedAt;

    public static CachedGreeks of(String symbol, String expiry, Collection<OptionGreek> records, Instant fetchedAt) {
        return new CachedGreeks(symbol, expiry, Map.of(), fetchedAt).mergedWith(records, fetchedAt);
    }

    public CachedGreeks mergedWith(Collection<OptionGreek> records, Instant now) {
        Map<StrikeRight, OptionGreek> merged = new HashMap<>(greeks);
        for (OptionGreek record : records) {
            merged.merge(record.key(), record, OptionGreek::mergedWith);
        }
        return new CachedGreeks(symbol, expiry, Collections.unmodifiableMap(merged), now);
    }

    public boolean isFresh(Instant now, Duration ttl) {
        return Duration.between(fetchedAt, now).compareTo(ttl) < 0;
    }

    /** Every record, strike ascending, calls before puts. */
    public List<OptionGreek> all() {
        List<OptionGreek> records = new ArrayList<>(greeks.values());
        records.sort(OptionGreek.CHAIN_ORDER);
        return records;
    }

    /** Records whose strike is in {@code strikes}, strike ascending, calls before puts. */
    public List<OptionGreek> subset(Collection<BigDecimal> strikes) {
        Set<BigDecimal> wanted = normalizedSet(strikes);
        List<OptionGreek> records = new ArrayList<>();
        for (OptionGreek record : greeks.values()) {
            if (wanted.contains(record.getStrike())) {
                records.add(record);
            }
        }
        records.sort(OptionGreek.CHAIN_ORDER);
        return records;
    }

    /** Strikes from {@code strikes} that have never been fetched for this key. */
    public List<BigDecimal> missingStrikes(Collection<BigDecimal> strikes) {
        Set<BigDecimal> known = new HashSet<>();
        greeks.keySet().forEach(key -> known.add(key.strike()));
        List<BigDecimal> missing = new ArrayList<>();
        for (BigDecimal strike : strikes) {
            BigDecimal normalized = Strikes.normalize(strike);
            if (!known.contains(normalized)) {
                missing.add(normalized);
            }
        }
        return missing;
    }

    private static Set<BigDecimal> normalizedSet(Collection<BigDecimal> strikes) {
        Set<BigDecimal> set = new HashSet<>();
        strikes.forEach(s -> set.add(Strikes.normalize(s)));
        return set;
    }
}
