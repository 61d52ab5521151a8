package com.optiondesk.broker.event;

import lombok.Getter;

/**
 * Base type of everything the gateway transport delivers. Events that answer a numbered request
 * carry its id; session-level events (next valid id, order status, connection state, errors
 * not tied to a request) carry {@link #NO_REQUEST}.
 */
@Getter
public abstract class GatewayEvent {

    public static final int NO_REQUEST = -1;

    private final int requestId;

    protected GatewayEvent(int requestId) {
        this.requestId = requestId;
    }

    public boolean hasRequestId() {
        return requestId != NO_REQUEST;
    }
}
