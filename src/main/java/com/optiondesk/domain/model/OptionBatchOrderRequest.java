package com.optiondesk.domain.model;

import com.optiondesk.domain.enums.OptionRight;
import com.optiondesk.domain.enums.OrderSide;
import com.optiondesk.domain.enums.OrderType;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/** Same single-leg option order replicated across accounts. */
@Value
@Builder
public class OptionBatchOrderRequest {
    String symbol;
    String expiry;
    BigDecimal strike;
    OptionRight right;
    OrderSide action;
    OrderType orderType;

    /** Required for LIMIT orders. */
    BigDecimal limitPrice;
}
