package com.optiondesk.exception;

import java.time.Duration;
import java.util.Map;

public class ResolutionTimeoutException extends BaseException {

    public ResolutionTimeoutException(String contractKey, Duration timeout) {
        super(
                ErrorCode.RESOLUTION_TIMEOUT,
                String.format("Contract resolution timed out after %d ms: %s", timeout.toMillis(), contractKey),
                Map.of("contract", contractKey));
    }
}
