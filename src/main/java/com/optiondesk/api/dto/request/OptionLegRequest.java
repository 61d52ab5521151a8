package com.optiondesk.api.dto.request;

import com.optiondesk.domain.enums.OptionRight;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Positive;
import java.math.BigDecimal;
import lombok.Data;

/** One option contract of an underlying given elsewhere in the request. */
@Data
public class OptionLegRequest {

    /** yyyyMMdd */
    @NotNull(message = "expiry is required")
    @Pattern(regexp = "\\d{8}", message = "expiry must be yyyyMMdd")
    private String expiry;

    @NotNull(message = "strike is required")
    @Positive(message = "strike must be positive")
    private BigDecimal strike;

    @NotNull(message = "right is required")
    private OptionRight right;
}
