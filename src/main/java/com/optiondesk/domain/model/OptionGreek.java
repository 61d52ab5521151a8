package com.optiondesk.domain.model;

import com.optiondesk.domain.enums.OptionRight;
import java.math.BigDecimal;
import java.util.Comparator;
import lombok.Builder;
import lombok.Value;

/**
 * Quote and greeks for one option contract at one point in time.
 *
 * <p>Zero means "unknown" for every numeric field. Records are combined with
 * {@link #mergedWith(OptionGreek)}, which only lets meaningful incoming values replace stored ones:
 * prices above zero, greeks that are non-zero and finite, IV above zero, open interest above zero.
 * A refresh that came back empty therefore never wipes a previously known quote.
 */
@Value
@Builder(toBuilder = true)
public class OptionGreek {

    /** Strike ascending, calls before puts at equal strike. */
    public static final Comparator<OptionGreek> CHAIN_ORDER =
            Comparator.comparing(OptionGreek::key, StrikeRight.CHAIN_ORDER);

    BigDecimal strike;
    OptionRight right;

    /** Expiry as yyyyMMdd, the gateway's lastTradeDateOrContractMonth format. */
    String expiry;

    @Builder.Default
    BigDecimal bid = BigDecimal.ZERO;

    @Builder.Default
    BigDecimal ask = BigDecimal.ZERO;

    @Builder.Default
    BigDecimal last = BigDecimal.ZERO;

    double delta;
    double gamma;
    double theta;
    double vega;
    double impliedVol;
    long openInterest;

    /** An all-unknown record, the starting point for every contract in a batch. */
    public static OptionGreek empty(BigDecimal strike, OptionRight right, String expiry) {
        return OptionGreek.builder()
                .strike(Strikes.normalize(strike))
                .right(right)
                .expiry(expiry)
                .build();
    }

    public StrikeRight key() {
        return new StrikeRight(strike, right);
    }

    /** True when the gateway reported at least a price or a greek for this contract. */
    public boolean hasData() {
        return isPresent(bid) || isPresent(ask) || isPresent(last) || isPresent(delta) || impliedVol > 0;
    }

    /**
     * Returns a record holding this record's values overlaid with every meaningful value
     * from {@code incoming}. Merging a record with itself, or with an all-zero record, yields
     * an equal record.
     */
    public OptionGreek mergedWith(OptionGreek incoming) {
        if (incoming == null) {
            return this;
        }
        return toBuilder()
                .bid(isPresent(incoming.bid) ? incoming.bid : bid)
                .ask(isPresent(incoming.ask) ? incoming.ask : ask)
                .last(isPresent(incoming.last) ? incoming.last : last)
                .delta(isPresent(incoming.delta) ? incoming.delta : delta)
                .gamma(isPresent(incoming.gamma) ? incoming.gamma : gamma)
                .theta(isPresent(incoming.theta) ? incoming.theta : theta)
                .vega(isPresent(incoming.vega) ? incoming.vega : vega)
                .impliedVol(incoming.impliedVol > 0 && Double.isFinite(incoming.impliedVol)
                        ? incoming.impliedVol
                        : impliedVol)
                .openInterest(incoming.openInterest > 0 ? incoming.openInterest : openInterest)
                .build();
    }

    private static boolean isPresent(BigDecimal price) {
        return price != null && price.signum() > 0;
    }

    private static boolean isPresent(double greek) {
        return greek != 0 && Double.isFinite(greek);
    }
}
