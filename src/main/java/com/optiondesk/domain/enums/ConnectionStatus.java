package com.optiondesk.domain.enums;

/** Gateway connection status as reported by the transport. */
public enum ConnectionStatus {
    DISCONNECTED,
    CONNECTING,
    CONNECTED,
    ERROR
}
