package com.optiondesk.broker.event;

import java.math.BigDecimal;
import lombok.Getter;
import lombok.ToString;

@Getter
@ToString
public class OrderStatusEvent extends GatewayEvent {

    private final int orderId;
    private final String status;
    private final BigDecimal filled;
    private final BigDecimal remaining;
    private final BigDecimal avgFillPrice;

    public OrderStatusEvent(
            int orderId, String status, BigDecimal filled, BigDecimal remaining, BigDecimal avgFillPrice) {
        super(NO_REQUEST);
        this.orderId = orderId;
        this.status = status;
        this.filled = filled;
        this.remaining = remaining;
        this.avgFillPrice = avgFillPrice;
    }
}
