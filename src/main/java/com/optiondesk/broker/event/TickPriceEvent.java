package com.optiondesk.broker.event;

import com.optiondesk.domain.enums.TickType;
import lombok.Getter;
import lombok.ToString;

@Getter
@ToString
public class TickPriceEvent extends GatewayEvent {

    private final TickType field;
    private final double price;

    public TickPriceEvent(int requestId, TickType field, double price) {
        super(requestId);
        this.field = field;
        this.price = price;
    }
}
