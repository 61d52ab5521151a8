package com.optiondesk.domain.enums;

/** Order execution type and its gateway wire code. */
public enum OrderType {
    MARKET("MKT"),
    LIMIT("LMT");

    private final String gatewayCode;

    OrderType(String gatewayCode) {
        this.gatewayCode = gatewayCode;
    }

    public String getGatewayCode() {
        return gatewayCode;
    }
}
