package com.optiondesk.broker.event;

import lombok.Getter;
import lombok.ToString;

/** Gateway error or notice. A request id of {@link #NO_REQUEST} marks a session-level notice. */
@Getter
@ToString
public class GatewayErrorEvent extends GatewayEvent {

    private final int code;
    private final String message;

    public GatewayErrorEvent(int requestId, int code, String message) {
        super(requestId);
        this.code = code;
        this.message = message;
    }
}
