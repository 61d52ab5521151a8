package com.optiondesk.event;

import com.optiondesk.domain.model.OrderStatusUpdate;
import org.springframework.context.ApplicationEvent;

/** A gateway order status report, labelled with the combo description when one is known. */
public class OrderStatusChangedEvent extends ApplicationEvent {

    private final OrderStatusUpdate update;

    public OrderStatusChangedEvent(Object source, OrderStatusUpdate update) {
        super(source);
        this.update = update;
    }

    public OrderStatusUpdate getUpdate() {
        return update;
    }
}
