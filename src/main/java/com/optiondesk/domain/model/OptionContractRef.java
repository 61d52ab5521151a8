package com.optiondesk.domain.model;

import com.optiondesk.domain.enums.OptionRight;
import java.math.BigDecimal;

/** Minimal option identity used by option quote requests. */
public record OptionContractRef(String symbol, String expiry, BigDecimal strike, OptionRight right) {

    public OptionContractRef {
        strike = Strikes.normalize(strike);
    }
}
