package com.optiondesk.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    VALIDATION_ERROR("VALIDATION_ERROR", 400),
    BAD_REQUEST("BAD_REQUEST", 400),
    NOT_FOUND("NOT_FOUND", 404),
    CONTRACT_NOT_FOUND("CONTRACT_NOT_FOUND", 404),
    LEG_RESOLUTION_FAILED("LEG_RESOLUTION_FAILED", 422),
    INTERNAL_ERROR("INTERNAL_ERROR", 500),
    GATEWAY_ERROR("GATEWAY_ERROR", 502),
    GATEWAY_NOT_CONNECTED("GATEWAY_NOT_CONNECTED", 503),
    RESOLUTION_TIMEOUT("RESOLUTION_TIMEOUT", 504);

    private final String code;
    private final int httpStatus;
}
