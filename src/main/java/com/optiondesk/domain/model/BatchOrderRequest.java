package com.optiondesk.domain.model;

import com.optiondesk.domain.enums.OrderSide;
import com.optiondesk.domain.enums.OrderType;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/** Same stock order replicated across accounts. */
@Value
@Builder
public class BatchOrderRequest {
    String symbol;
    OrderSide action;
    OrderType orderType;

    /** Required for LIMIT orders. */
    BigDecimal limitPrice;
}
