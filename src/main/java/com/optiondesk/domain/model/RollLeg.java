package com.optiondesk.domain.model;

import com.optiondesk.domain.enums.OptionRight;
import java.math.BigDecimal;

/** One side of a roll: the option being closed or the option being opened. */
public record RollLeg(String expiry, BigDecimal strike, OptionRight right) {

    public RollLeg {
        strike = Strikes.normalize(strike);
    }
}
