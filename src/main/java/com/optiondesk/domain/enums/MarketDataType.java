package com.optiondesk.domain.enums;

/**
 * Market data flavour requested from the gateway before snapshot requests.
 *
 * <p>LIVE returns -1 outside market hours; FROZEN returns the last snapshot taken at the close;
 * DELAYED_FROZEN falls back to delayed data when the account has no live subscription.
 */
public enum MarketDataType {
    LIVE(1),
    FROZEN(2),
    DELAYED(3),
    DELAYED_FROZEN(4);

    private final int code;

    MarketDataType(int code) {
        this.code = code;
    }

    public int getCode() {
        return code;
    }
}
