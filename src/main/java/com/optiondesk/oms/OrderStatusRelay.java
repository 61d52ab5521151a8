package com.optiondesk.oms;

import com.optiondesk.broker.GatewayTransport;
import com.optiondesk.broker.RequestCorrelator;
import com.optiondesk.broker.event.GatewayEvent;
import com.optiondesk.broker.event.NextValidIdEvent;
import com.optiondesk.broker.event.OrderStatusEvent;
import com.optiondesk.domain.model.OrderStatusUpdate;
import com.optiondesk.event.EventPublisherHelper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Turns gateway order traffic into application events: order status reports become
 * {@code OrderStatusChangedEvent}s labelled with the combo description, next-valid-id notices
 * move the ORDER id range forward.
 */
@Slf4j
@Component
public class OrderStatusRelay {

    private final RequestCorrelator correlator;
    private final ComboDescriptionCache comboDescriptionCache;
    private final EventPublisherHelper eventPublisherHelper;

    public OrderStatusRelay(
            GatewayTransport transport,
            RequestCorrelator correlator,
            ComboDescriptionCache comboDescriptionCache,
            EventPublisherHelper eventPublisherHelper) {
        this.correlator = correlator;
        this.comboDescriptionCache = comboDescriptionCache;
        this.eventPublisherHelper = eventPublisherHelper;
        transport.addListener(this::onGatewayEvent);
    }

    void onGatewayEvent(GatewayEvent event) {
        if (event instanceof OrderStatusEvent status) {
            OrderStatusUpdate update = OrderStatusUpdate.builder()
                    .orderId(status.getOrderId())
                    .status(status.getStatus())
                    .filled(status.getFilled())
                    .remaining(status.getRemaining())
                    .avgFillPrice(status.getAvgFillPrice())
                    .description(comboDescriptionCache.get(status.getOrderId()).orElse(null))
                    .build();
            log.debug("Order {} status {}", update.getOrderId(), update.getStatus());
            eventPublisherHelper.publishOrderStatus(this, update);
        } else if (event instanceof NextValidIdEvent nextValidId) {
            correlator.advanceOrderIds(nextValidId.getOrderId());
        }
    }
}
