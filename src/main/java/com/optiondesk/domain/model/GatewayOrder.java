package com.optiondesk.domain.model;

import com.optiondesk.domain.enums.OrderSide;
import com.optiondesk.domain.enums.OrderType;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/** Order ticket as sent to the gateway alongside a {@link ContractSpec}. */
@Value
@Builder
public class GatewayOrder {
    OrderSide action;
    OrderType orderType;
    int totalQuantity;

    /** Null for market orders. May be negative for combos (net credit). */
    BigDecimal limitPrice;

    String account;

    @Builder.Default
    boolean transmit = true;
}
