package com.optiondesk.broker.event;

import com.optiondesk.domain.enums.TickType;
import lombok.Getter;
import lombok.ToString;

@Getter
@ToString
public class TickSizeEvent extends GatewayEvent {

    private final TickType field;
    private final long size;

    public TickSizeEvent(int requestId, TickType field, long size) {
        super(requestId);
        this.field = field;
        this.size = size;
    }
}
