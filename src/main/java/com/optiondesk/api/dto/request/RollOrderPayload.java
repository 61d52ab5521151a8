package com.optiondesk.api.dto.request;

import com.optiondesk.domain.enums.PositionDirection;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Data;

/**
 * Roll one option position into another across accounts.
 *
 * <p>{@code netLimitPrice} is signed: negative asks for a net credit.
 */
@Data
public class RollOrderPayload {

    @NotBlank(message = "symbol is required")
    private String symbol;

    @Valid
    @NotNull(message = "closeLeg is required")
    private OptionLegRequest closeLeg;

    @Valid
    @NotNull(message = "openLeg is required")
    private OptionLegRequest openLeg;

    /** Direction of the position being closed. */
    @NotNull(message = "direction is required")
    private PositionDirection direction;

    @NotNull(message = "netLimitPrice is required")
    private BigDecimal netLimitPrice;

    /** Contracts per account; zero quantities are skipped. */
    @NotEmpty(message = "accounts must not be empty")
    private Map<String, Integer> accounts = new LinkedHashMap<>();
}
