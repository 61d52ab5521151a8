package com.optiondesk.broker.event;

import lombok.Getter;
import lombok.ToString;

@Getter
@ToString
public class ContractDetailsEvent extends GatewayEvent {

    private final long conId;
    private final String symbol;
    private final String tradingClass;

    public ContractDetailsEvent(int requestId, long conId, String symbol, String tradingClass) {
        super(requestId);
        this.conId = conId;
        this.symbol = symbol;
        this.tradingClass = tradingClass;
    }
}
