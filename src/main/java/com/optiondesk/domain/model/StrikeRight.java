package com.optiondesk.domain.model;

import com.optiondesk.domain.enums.OptionRight;
import java.math.BigDecimal;
import java.util.Comparator;

/**
 * Identifies one contract inside an (underlying, expiry) chain. The strike is normalised on
 * construction so keys built from 590 and 590.00 collide.
 */
public record StrikeRight(BigDecimal strike, OptionRight right) {

    /** Strike ascending, calls before puts at equal strike. */
    public static final Comparator<StrikeRight> CHAIN_ORDER =
            Comparator.comparing(StrikeRight::strike).thenComparing(StrikeRight::right);

    public StrikeRight {
        strike = Strikes.normalize(strike);
    }
}
