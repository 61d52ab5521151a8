package com.optiondesk.exception;

/** Raised when an operation needs the gateway and there is no live connection. Not retried. */
public class NotConnectedException extends BaseException {

    public NotConnectedException() {
        super(ErrorCode.GATEWAY_NOT_CONNECTED, "Not connected to the brokerage gateway");
    }

    public NotConnectedException(String operation) {
        super(ErrorCode.GATEWAY_NOT_CONNECTED, "Not connected to the brokerage gateway: " + operation);
    }
}
