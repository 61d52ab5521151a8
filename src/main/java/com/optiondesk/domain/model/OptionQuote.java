package com.optiondesk.domain.model;

import com.optiondesk.domain.enums.OptionRight;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/** Snapshot bid/ask/last for one option contract, no greeks. */
@Value
@Builder
public class OptionQuote {

    String symbol;
    String expiry;
    BigDecimal strike;
    OptionRight right;

    @Builder.Default
    BigDecimal bid = BigDecimal.ZERO;

    @Builder.Default
    BigDecimal ask = BigDecimal.ZERO;

    @Builder.Default
    BigDecimal last = BigDecimal.ZERO;
}
