package com.optiondesk.broker.event;

import java.math.BigDecimal;
import java.util.Set;
import lombok.Getter;
import lombok.ToString;

/** One option series (exchange + trading class) of an underlying. Several arrive per request. */
@Getter
@ToString
public class OptionParameterEvent extends GatewayEvent {

    private final String exchange;
    private final long underlyingConId;
    private final String tradingClass;
    private final String multiplier;
    private final Set<String> expirations;
    private final Set<BigDecimal> strikes;

    public OptionParameterEvent(
            int requestId,
            String exchange,
            long underlyingConId,
            String tradingClass,
            String multiplier,
            Set<String> expirations,
            Set<BigDecimal> strikes) {
        super(requestId);
        this.exchange = exchange;
        this.underlyingConId = underlyingConId;
        this.tradingClass = tradingClass;
        this.multiplier = multiplier;
        this.expirations = expirations;
        this.strikes = strikes;
    }
}
