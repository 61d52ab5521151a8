package com.optiondesk.service;

import com.optiondesk.broker.event.TickOptionComputationEvent;
import com.optiondesk.domain.enums.OptionRight;
import com.optiondesk.domain.enums.TickType;
import com.optiondesk.domain.model.OptionGreek;
import java.math.BigDecimal;

/**
 * Everything received for one contract during one greeks batch.
 *
 * <p>The gateway sends up to four computations per option (bid, ask, last and model). The
 * model computation is the one to trust: it always overwrites, while the bid/ask/last
 * computations only fill values nothing has set yet. A zero greek never overwrites anything.
 */
public class OptionGreekAccumulator extends PriceTickAccumulator {

    private final BigDecimal strike;
    private final OptionRight right;
    private final String expiry;

    private double delta;
    private double gamma;
    private double theta;
    private double vega;
    private double impliedVol;
    private long openInterest;

    public OptionGreekAccumulator(BigDecimal strike, OptionRight right, String expiry) {
        this.strike = strike;
        this.right = right;
        this.expiry = expiry;
    }

    public synchronized void applyComputation(TickOptionComputationEvent event) {
        boolean model = event.getField().isModelComputation();
        if (isValidVolatility(event.getImpliedVol()) && (model || impliedVol == 0)) {
            impliedVol = event.getImpliedVol();
        }
        if (isValidGreek(event.getDelta()) && (model || delta == 0)) {
            delta = event.getDelta();
        }
        if (isValidGreek(event.getGamma()) && (model || gamma == 0)) {
            gamma = event.getGamma();
        }
        if (isValidGreek(event.getTheta()) && (model || theta == 0)) {
            theta = event.getTheta();
        }
        if (isValidGreek(event.getVega()) && (model || vega == 0)) {
            vega = event.getVega();
        }
    }

    /** Open interest arrives as a size tick; call and put interest use separate tick types. */
    public synchronized void applySize(TickType field, long size) {
        if (size <= 0) {
            return;
        }
        if ((field == TickType.OPTION_CALL_OPEN_INTEREST && right == OptionRight.CALL)
                || (field == TickType.OPTION_PUT_OPEN_INTEREST && right == OptionRight.PUT)) {
            openInterest = size;
        }
    }

    public synchronized OptionGreek toOptionGreek() {
        return OptionGreek.builder()
                .strike(strike)
                .right(right)
                .expiry(expiry)
                .bid(getBid())
                .ask(getAsk())
                .last(getLast())
                .delta(delta)
                .gamma(gamma)
                .theta(theta)
                .vega(vega)
                .impliedVol(impliedVol)
                .openInterest(openInterest)
                .build();
    }

    private static boolean isValidVolatility(double value) {
        return Double.isFinite(value) && value > 0 && value != Double.MAX_VALUE;
    }

    private static boolean isValidGreek(double value) {
        return value != 0 && Double.isFinite(value) && Math.abs(value) != Double.MAX_VALUE;
    }
}
