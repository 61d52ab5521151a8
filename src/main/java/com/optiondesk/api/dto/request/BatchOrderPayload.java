package com.optiondesk.api.dto.request;

import com.optiondesk.domain.enums.OrderSide;
import com.optiondesk.domain.enums.OrderType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Data;

/** Same stock order for several accounts. */
@Data
public class BatchOrderPayload {

    @NotBlank(message = "symbol is required")
    private String symbol;

    @NotNull(message = "action is required")
    private OrderSide action;

    @NotNull(message = "orderType is required")
    private OrderType orderType;

    /** Required when orderType is LIMIT. */
    private BigDecimal limitPrice;

    @NotEmpty(message = "accounts must not be empty")
    private Map<String, Integer> accounts = new LinkedHashMap<>();
}
