package com.optiondesk.event;

import com.optiondesk.domain.enums.ConnectionStatus;
import com.optiondesk.domain.model.OrderStatusUpdate;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Typed factory methods over Spring's {@link ApplicationEventPublisher}.
 *
 * <p>Delivery is synchronous unless the listener is {@code @Async}.
 */
@Component
public class EventPublisherHelper {

    private final ApplicationEventPublisher applicationEventPublisher;

    public EventPublisherHelper(ApplicationEventPublisher applicationEventPublisher) {
        this.applicationEventPublisher = applicationEventPublisher;
    }

    public void publishConnectionStatus(Object source, ConnectionStatus status, String message) {
        applicationEventPublisher.publishEvent(new ConnectionStatusEvent(source, status, message));
    }

    public void publishOrderStatus(Object source, OrderStatusUpdate update) {
        applicationEventPublisher.publishEvent(new OrderStatusChangedEvent(source, update));
    }
}
