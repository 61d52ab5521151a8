package com.optiondesk.oms;

import com.optiondesk.broker.GatewayTransport;
import com.optiondesk.broker.RequestCorrelator;
import com.optiondesk.config.GatewayProperties;
import com.optiondesk.domain.enums.OrderSide;
import com.optiondesk.domain.enums.OrderType;
import com.optiondesk.domain.enums.RequestCategory;
import com.optiondesk.domain.model.BatchOrderRequest;
import com.optiondesk.domain.model.ContractSpec;
import com.optiondesk.domain.model.GatewayOrder;
import com.optiondesk.domain.model.OptionBatchOrderRequest;
import com.optiondesk.domain.model.OrderStatusUpdate;
import com.optiondesk.exception.BusinessException;
import com.optiondesk.exception.NotConnectedException;
import com.optiondesk.observability.MarketDataMetrics;
import com.optiondesk.service.OptionChainCache;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Replicates one single-leg stock or option order across accounts: one order per account with
 * a positive quantity, ids from the ORDER range.
 */
@Slf4j
@Service
public class BatchOrderService {

    private final GatewayTransport transport;
    private final RequestCorrelator correlator;
    private final OptionChainCache chainCache;
    private final MarketDataMetrics metrics;
    private final GatewayProperties gatewayProperties;

    public BatchOrderService(
            GatewayTransport transport,
            RequestCorrelator correlator,
            OptionChainCache chainCache,
            MarketDataMetrics metrics,
            GatewayProperties gatewayProperties) {
        this.transport = transport;
        this.correlator = correlator;
        this.chainCache = chainCache;
        this.metrics = metrics;
        this.gatewayProperties = gatewayProperties;
    }

    public List<OrderStatusUpdate> placeBatchOrders(BatchOrderRequest request, Map<String, Integer> accountQuantities) {
        validate(request.getSymbol(), request.getAction(), request.getOrderType(), request.getLimitPrice());
        String symbol = request.getSymbol().trim().toUpperCase(Locale.ROOT);
        ContractSpec stock = ContractSpec.stock(symbol, gatewayProperties.getExchange(), gatewayProperties.getCurrency());
        return placeAll(
                "stock", symbol, stock, request.getAction(), request.getOrderType(), request.getLimitPrice(), accountQuantities);
    }

    public List<OrderStatusUpdate> placeOptionBatchOrders(
            OptionBatchOrderRequest request, Map<String, Integer> accountQuantities) {
        validate(request.getSymbol(), request.getAction(), request.getOrderType(), request.getLimitPrice());
        if (request.getExpiry() == null || request.getStrike() == null || request.getRight() == null) {
            throw new BusinessException("Option order needs expiry, strike and right");
        }
        String symbol = request.getSymbol().trim().toUpperCase(Locale.ROOT);
        ContractSpec option = ContractSpec.option(
                symbol,
                request.getExpiry(),
                request.getStrike(),
                request.getRight(),
                gatewayProperties.getExchange(),
                gatewayProperties.getCurrency());
        chainCache
                .findTradingClass(symbol, request.getExpiry(), request.getStrike())
                .ifPresent(option::setTradingClass);
        return placeAll(
                "option", symbol, option, request.getAction(), request.getOrderType(), request.getLimitPrice(), accountQuantities);
    }

    private List<OrderStatusUpdate> placeAll(
            String kind,
            String symbol,
            ContractSpec contract,
            OrderSide action,
            OrderType orderType,
            BigDecimal limitPrice,
            Map<String, Integer> accountQuantities) {
        if (!transport.isConnected()) {
            throw new NotConnectedException(kind + " batch order " + symbol);
        }

        List<OrderStatusUpdate> placed = new ArrayList<>();
        for (Map.Entry<String, Integer> allocation : accountQuantities.entrySet()) {
            Integer quantity = allocation.getValue();
            if (quantity == null || quantity <= 0) {
                continue;
            }
            int orderId = correlator.allocateId(RequestCategory.ORDER);
            GatewayOrder order = GatewayOrder.builder()
                    .action(action)
                    .orderType(orderType)
                    .totalQuantity(quantity)
                    .limitPrice(orderType == OrderType.LIMIT ? limitPrice : null)
                    .account(allocation.getKey())
                    .transmit(true)
                    .build();
            transport.placeOrder(orderId, contract, order);
            metrics.recordOrderPlaced(kind);
            placed.add(OrderStatusUpdate.builder()
                    .orderId(orderId)
                    .account(allocation.getKey())
                    .symbol(symbol)
                    .status(OrderStatusUpdate.PENDING_SUBMIT)
                    .remaining(BigDecimal.valueOf(quantity))
                    .build());
        }
        log.info("{} batch order {} {} {} placed for {} accounts", kind, action, symbol, orderType, placed.size());
        return placed;
    }

    private static void validate(String symbol, OrderSide action, OrderType orderType, BigDecimal limitPrice) {
        if (symbol == null || symbol.isBlank()) {
            throw new BusinessException("Batch order needs a symbol");
        }
        if (action == null || orderType == null) {
            throw new BusinessException("Batch order needs an action and an order type");
        }
        if (orderType == OrderType.LIMIT && (limitPrice == null || limitPrice.signum() <= 0)) {
            throw new BusinessException("LIMIT orders need a positive limit price");
        }
    }
}
