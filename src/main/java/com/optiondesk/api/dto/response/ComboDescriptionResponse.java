package com.optiondesk.api.dto.response;

import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class ComboDescriptionResponse {
    private int orderId;
    private String description;
}
