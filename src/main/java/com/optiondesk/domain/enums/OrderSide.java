package com.optiondesk.domain.enums;

/** Buy or sell action of an order or combo leg. Maps to the gateway's order action field. */
public enum OrderSide {
    BUY,
    SELL;

    /** Returns the opposite side: BUY -> SELL, SELL -> BUY. Used to derive closing and opening legs. */
    public OrderSide opposite() {
        return this == BUY ? SELL : BUY;
    }
}
