package com.optiondesk.domain.model;

import java.math.BigDecimal;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * One option series of an underlying as reported by the gateway's option-parameter request.
 * An underlying usually has several: one per (exchange, trading class) pair, e.g. SPX and SPXW.
 */
@Value
@Builder
public class ChainParams {

    String exchange;
    long underlyingConId;
    String tradingClass;
    String multiplier;

    /** Sorted ascending, yyyyMMdd. */
    List<String> expirations;

    /** Sorted ascending. */
    List<BigDecimal> strikes;

    public boolean hasExpiry(String expiry) {
        return expirations != null && expirations.contains(expiry);
    }

    public boolean hasStrike(BigDecimal strike) {
        return strikes != null && strikes.stream().anyMatch(s -> s.compareTo(strike) == 0);
    }
}
