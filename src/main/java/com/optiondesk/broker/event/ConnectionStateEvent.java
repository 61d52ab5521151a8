package com.optiondesk.broker.event;

import com.optiondesk.domain.enums.ConnectionStatus;
import lombok.Getter;

@Getter
public class ConnectionStateEvent extends GatewayEvent {

    private final ConnectionStatus status;
    private final String message;

    public ConnectionStateEvent(ConnectionStatus status, String message) {
        super(NO_REQUEST);
        this.status = status;
        this.message = message;
    }
}
