package com.optiondesk.event;

import com.optiondesk.domain.enums.ConnectionStatus;
import org.springframework.context.ApplicationEvent;

/**
 * Published by the gateway session owner whenever the connection state changes.
 * The preloader starts on CONNECTED and stops on DISCONNECTED or ERROR.
 */
public class ConnectionStatusEvent extends ApplicationEvent {

    private final ConnectionStatus status;
    private final String message;

    public ConnectionStatusEvent(Object source, ConnectionStatus status, String message) {
        super(source);
        this.status = status;
        this.message = message;
    }

    public ConnectionStatus getStatus() {
        return status;
    }

    public String getMessage() {
        return message;
    }
}
