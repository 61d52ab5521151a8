package com.optiondesk.service;

import com.optiondesk.domain.enums.TickType;
import java.math.BigDecimal;

/**
 * Bid/ask/last collected from price ticks of one market data request. Live and delayed ticks
 * feed the same fields. A close tick stands in for last only until a real last arrives.
 */
public class PriceTickAccumulator {

    private BigDecimal bid = BigDecimal.ZERO;
    private BigDecimal ask = BigDecimal.ZERO;
    private BigDecimal last = BigDecimal.ZERO;
    private boolean lastFromClose;

    /** @return true if the tick changed a field */
    public synchronized boolean applyPrice(TickType field, double price) {
        if (!Double.isFinite(price) || price <= 0) {
            return false;
        }
        BigDecimal value = BigDecimal.valueOf(price);
        if (field.isBid()) {
            bid = value;
        } else if (field.isAsk()) {
            ask = value;
        } else if (field.isLast()) {
            last = value;
            lastFromClose = false;
        } else if (field.isClose()) {
            if (last.signum() != 0 && !lastFromClose) {
                return false;
            }
            last = value;
            lastFromClose = true;
        } else {
            return false;
        }
        return true;
    }

    public synchronized BigDecimal getBid() {
        return bid;
    }

    public synchronized BigDecimal getAsk() {
        return ask;
    }

    public synchronized BigDecimal getLast() {
        return last;
    }
}
