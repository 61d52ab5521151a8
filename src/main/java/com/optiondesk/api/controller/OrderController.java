package com.optiondesk.api.controller;

import com.optiondesk.api.dto.request.BatchOrderPayload;
import com.optiondesk.api.dto.request.OptionBatchOrderPayload;
import com.optiondesk.api.dto.request.OptionLegRequest;
import com.optiondesk.api.dto.request.RollOrderPayload;
import com.optiondesk.api.dto.response.ComboDescriptionResponse;
import com.optiondesk.domain.model.BatchOrderRequest;
import com.optiondesk.domain.model.OptionBatchOrderRequest;
import com.optiondesk.domain.model.OrderStatusUpdate;
import com.optiondesk.domain.model.RollLeg;
import com.optiondesk.domain.model.RollOrderRequest;
import com.optiondesk.oms.BatchOrderService;
import com.optiondesk.oms.RollOrderService;
import jakarta.validation.Valid;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST endpoints for multi-account order placement.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>POST /api/orders/roll -- two-leg roll combo, one order per account</li>
 *   <li>POST /api/orders/batch -- stock order, one per account</li>
 *   <li>POST /api/orders/option-batch -- single-leg option order, one per account</li>
 *   <li>GET /api/orders/{orderId}/description -- leg label of a combo order</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/orders")
public class OrderController {

    private static final Logger log = LoggerFactory.getLogger(OrderController.class);

    private final RollOrderService rollOrderService;
    private final BatchOrderService batchOrderService;

    public OrderController(RollOrderService rollOrderService, BatchOrderService batchOrderService) {
        this.rollOrderService = rollOrderService;
        this.batchOrderService = batchOrderService;
    }

    @PostMapping("/roll")
    public ResponseEntity<List<OrderStatusUpdate>> placeRollOrder(@Valid @RequestBody RollOrderPayload payload) {
        log.info(
                "Roll order request: {} {} {} -> {} accounts={}",
                payload.getSymbol(),
                payload.getDirection(),
                payload.getCloseLeg(),
                payload.getOpenLeg(),
                payload.getAccounts().size());
        RollOrderRequest request = RollOrderRequest.builder()
                .symbol(payload.getSymbol())
                .closeLeg(toRollLeg(payload.getCloseLeg()))
                .openLeg(toRollLeg(payload.getOpenLeg()))
                .direction(payload.getDirection())
                .netLimitPrice(payload.getNetLimitPrice())
                .build();
        return ResponseEntity.ok(rollOrderService.placeRollOrder(request, payload.getAccounts()));
    }

    @PostMapping("/batch")
    public ResponseEntity<List<OrderStatusUpdate>> placeBatchOrders(@Valid @RequestBody BatchOrderPayload payload) {
        BatchOrderRequest request = BatchOrderRequest.builder()
                .symbol(payload.getSymbol())
                .action(payload.getAction())
                .orderType(payload.getOrderType())
                .limitPrice(payload.getLimitPrice())
                .build();
        return ResponseEntity.ok(batchOrderService.placeBatchOrders(request, payload.getAccounts()));
    }

    @PostMapping("/option-batch")
    public ResponseEntity<List<OrderStatusUpdate>> placeOptionBatchOrders(
            @Valid @RequestBody OptionBatchOrderPayload payload) {
        OptionLegRequest option = payload.getOption();
        OptionBatchOrderRequest request = OptionBatchOrderRequest.builder()
                .symbol(payload.getSymbol())
                .expiry(option.getExpiry())
                .strike(option.getStrike())
                .right(option.getRight())
                .action(payload.getAction())
                .orderType(payload.getOrderType())
                .limitPrice(payload.getLimitPrice())
                .build();
        return ResponseEntity.ok(batchOrderService.placeOptionBatchOrders(request, payload.getAccounts()));
    }

    @GetMapping("/{orderId}/description")
    public ResponseEntity<ComboDescriptionResponse> getComboDescription(@PathVariable int orderId) {
        return ResponseEntity.ok(new ComboDescriptionResponse(orderId, rollOrderService.getComboDescription(orderId)));
    }

    private static RollLeg toRollLeg(OptionLegRequest leg) {
        return new RollLeg(leg.getExpiry(), leg.getStrike(), leg.getRight());
    }
}
