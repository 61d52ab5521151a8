package com.optiondesk.broker;

import com.optiondesk.broker.event.GatewayEvent;

/** Callback registered with the {@link RequestCorrelator} for one request id. */
public interface RequestHandler {

    /** Called on the transport thread for every event carrying the handler's request id. */
    void onEvent(GatewayEvent event);

    /** Called once if the request was neither completed nor cancelled before its timeout. */
    default void onTimeout(int requestId) {}
}
