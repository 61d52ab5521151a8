package com.optiondesk.broker.event;

public class OptionParameterEndEvent extends GatewayEvent {

    public OptionParameterEndEvent(int requestId) {
        super(requestId);
    }
}
