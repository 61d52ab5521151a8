package com.optiondesk.domain.model;

import com.optiondesk.domain.enums.PositionDirection;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/**
 * Close one option position and open another on the same underlying as a single two-leg combo.
 *
 * <p>{@code direction} is the direction of the position being closed. {@code netLimitPrice} is
 * signed: positive pays a net debit, negative asks for a net credit.
 */
@Value
@Builder(toBuilder = true)
public class RollOrderRequest {
    String symbol;
    RollLeg closeLeg;
    RollLeg openLeg;
    PositionDirection direction;
    BigDecimal netLimitPrice;
}
