package com.optiondesk.api.dto.request;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;
import java.util.List;
import lombok.Data;

/** Snapshot quotes for a batch of option contracts of one underlying. */
@Data
public class OptionQuotesRequest {

    @NotBlank(message = "symbol is required")
    private String symbol;

    @Valid
    @NotEmpty(message = "contracts must not be empty")
    @Size(max = 100, message = "contracts must not exceed 100")
    private List<OptionLegRequest> contracts;
}
