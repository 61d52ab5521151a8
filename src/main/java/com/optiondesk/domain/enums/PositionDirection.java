package com.optiondesk.domain.enums;

/**
 * Direction of an existing option position.
 *
 * <p>Closing a position trades against its direction: a short is bought back, a long is sold.
 */
public enum PositionDirection {
    LONG,
    SHORT;

    public OrderSide closingSide() {
        return this == SHORT ? OrderSide.BUY : OrderSide.SELL;
    }
}
