package com.optiondesk.domain.model;

import com.optiondesk.domain.enums.OrderSide;
import lombok.Builder;
import lombok.Value;

/** One leg of a BAG contract, referencing an already-resolved option by contract id. */
@Value
@Builder
public class ComboLeg {
    long conId;
    int ratio;
    OrderSide action;
    String exchange;
}
