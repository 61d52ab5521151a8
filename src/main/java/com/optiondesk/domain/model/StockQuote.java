package com.optiondesk.domain.model;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/** Snapshot quote for one stock. Fields the gateway did not report in time stay at zero. */
@Value
@Builder
public class StockQuote {

    String symbol;

    @Builder.Default
    BigDecimal bid = BigDecimal.ZERO;

    @Builder.Default
    BigDecimal ask = BigDecimal.ZERO;

    @Builder.Default
    BigDecimal last = BigDecimal.ZERO;

    /** Last if known, otherwise the bid/ask midpoint when both sides are present, otherwise zero. */
    public BigDecimal referencePrice() {
        if (last.signum() > 0) {
            return last;
        }
        if (bid.signum() > 0 && ask.signum() > 0) {
            return bid.add(ask).divide(BigDecimal.valueOf(2));
        }
        return BigDecimal.ZERO;
    }
}
