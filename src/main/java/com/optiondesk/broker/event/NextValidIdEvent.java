package com.optiondesk.broker.event;

import lombok.Getter;

/** Sent on connect and on request: the lowest order id the gateway will still accept. */
@Getter
public class NextValidIdEvent extends GatewayEvent {

    private final int orderId;

    public NextValidIdEvent(int orderId) {
        super(NO_REQUEST);
        this.orderId = orderId;
    }
}
