package com.optiondesk.api.dto.response;

import java.math.BigDecimal;
import lombok.AllArgsConstructor;
import lombok.Data;

/** Last known stock price; {@code price} is null when nothing is cached yet. */
@Data
@AllArgsConstructor
public class CachedPriceResponse {
    private String symbol;
    private BigDecimal price;
}
