package com.optiondesk.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import java.math.BigDecimal;
import java.util.List;
import lombok.Data;

@Data
public class PreloadRequest {

    @NotBlank(message = "symbol is required")
    private String symbol;

    @NotNull(message = "expiry is required")
    @Pattern(regexp = "\\d{8}", message = "expiry must be yyyyMMdd")
    private String expiry;

    @NotEmpty(message = "strikes must not be empty")
    private List<BigDecimal> strikes;
}
