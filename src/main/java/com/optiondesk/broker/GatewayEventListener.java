package com.optiondesk.broker;

import com.optiondesk.broker.event.GatewayEvent;

/** Receives every event the transport decodes, on the transport's reader thread. */
@FunctionalInterface
public interface GatewayEventListener {

    void onGatewayEvent(GatewayEvent event);
}
