package com.optiondesk.domain.model;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/**
 * Order state as last known to this process: the initial PendingSubmit acknowledgement returned
 * when an order is handed to the gateway, or a status report relayed from the gateway.
 */
@Value
@Builder(toBuilder = true)
public class OrderStatusUpdate {

    public static final String PENDING_SUBMIT = "PendingSubmit";

    int orderId;
    String account;
    String symbol;
    String status;

    @Builder.Default
    BigDecimal filled = BigDecimal.ZERO;

    BigDecimal remaining;

    @Builder.Default
    BigDecimal avgFillPrice = BigDecimal.ZERO;

    /** Combo description such as "+Mar7 590P → -Mar14 585P", null for single-leg orders. */
    String description;
}
