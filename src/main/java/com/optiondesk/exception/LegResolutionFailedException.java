package com.optiondesk.exception;

import java.util.Map;

/** One or both legs of a combo could not be resolved to a contract id. No order was placed. */
public class LegResolutionFailedException extends BaseException {

    public LegResolutionFailedException(String symbol, Throwable cause) {
        super(
                ErrorCode.LEG_RESOLUTION_FAILED,
                "Failed to resolve combo legs for " + symbol + ": " + cause.getMessage(),
                Map.of("symbol", symbol),
                cause);
    }
}
