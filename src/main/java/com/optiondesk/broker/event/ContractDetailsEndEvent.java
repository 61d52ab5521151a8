package com.optiondesk.broker.event;

public class ContractDetailsEndEvent extends GatewayEvent {

    public ContractDetailsEndEvent(int requestId) {
        super(requestId);
    }
}
