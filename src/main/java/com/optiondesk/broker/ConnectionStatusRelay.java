package com.optiondesk.broker;

import com.optiondesk.broker.event.ConnectionStateEvent;
import com.optiondesk.event.EventPublisherHelper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Republishes transport connection changes as application {@code ConnectionStatusEvent}s. */
@Slf4j
@Component
public class ConnectionStatusRelay {

    private final EventPublisherHelper eventPublisherHelper;

    public ConnectionStatusRelay(GatewayTransport transport, EventPublisherHelper eventPublisherHelper) {
        this.eventPublisherHelper = eventPublisherHelper;
        transport.addListener(event -> {
            if (event instanceof ConnectionStateEvent state) {
                log.info("Gateway connection {}: {}", state.getStatus(), state.getMessage());
                eventPublisherHelper.publishConnectionStatus(this, state.getStatus(), state.getMessage());
            }
        });
    }
}
