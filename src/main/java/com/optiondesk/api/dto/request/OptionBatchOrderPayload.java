package com.optiondesk.api.dto.request;

import com.optiondesk.domain.enums.OrderSide;
import com.optiondesk.domain.enums.OrderType;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Data;

/** Same single-leg option order for several accounts. */
@Data
public class OptionBatchOrderPayload {

    @NotBlank(message = "symbol is required")
    private String symbol;

    @Valid
    @NotNull(message = "option is required")
    private OptionLegRequest option;

    @NotNull(message = "action is required")
    private OrderSide action;

    @NotNull(message = "orderType is required")
    private OrderType orderType;

    private BigDecimal limitPrice;

    @NotEmpty(message = "accounts must not be empty")
    private Map<String, Integer> accounts = new LinkedHashMap<>();
}
