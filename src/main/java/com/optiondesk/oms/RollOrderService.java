package com.optiondesk.oms;

import com.optiondesk.broker.ContractResolver;
import com.optiondesk.broker.FutureAwaits;
import com.optiondesk.broker.GatewayTransport;
import com.optiondesk.broker.RequestCorrelator;
import com.optiondesk.config.GatewayProperties;
import com.optiondesk.domain.enums.OrderSide;
import com.optiondesk.domain.enums.OrderType;
import com.optiondesk.domain.enums.RequestCategory;
import com.optiondesk.domain.model.ComboLeg;
import com.optiondesk.domain.model.ContractSpec;
import com.optiondesk.domain.model.GatewayOrder;
import com.optiondesk.domain.model.OrderStatusUpdate;
import com.optiondesk.domain.model.RollLeg;
import com.optiondesk.domain.model.RollOrderRequest;
import com.optiondesk.domain.model.Strikes;
import com.optiondesk.exception.BusinessException;
import com.optiondesk.exception.LegResolutionFailedException;
import com.optiondesk.exception.NotConnectedException;
import com.optiondesk.exception.ResolutionTimeoutException;
import com.optiondesk.exception.ResourceNotFoundException;
import com.optiondesk.observability.MarketDataMetrics;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Places a roll (close one option, open another on the same underlying) as one two-leg combo
 * order per account.
 *
 * <p><b>Flow:</b>
 * <ol>
 *   <li>both legs are resolved to contract ids concurrently, in the ROLL_RESOLUTION id range</li>
 *   <li>if either leg fails to resolve nothing is sent: {@link LegResolutionFailedException}</li>
 *   <li>the BAG contract holds the close leg (inverse of the position direction) and the open
 *       leg (inverse of the close leg), ratio 1 each</li>
 *   <li>every account with a positive quantity gets a BUY LMT order at the signed net price</li>
 * </ol>
 *
 * <p>Each order id is labelled in {@link ComboDescriptionCache} for later status reports.
 */
@Service
public class RollOrderService {

    private static final Logger log = LoggerFactory.getLogger(RollOrderService.class);

    private static final DateTimeFormatter EXPIRY_FORMAT = DateTimeFormatter.BASIC_ISO_DATE;
    private static final DateTimeFormatter LABEL_FORMAT = DateTimeFormatter.ofPattern("MMMd", Locale.ENGLISH);

    private final GatewayTransport transport;
    private final RequestCorrelator correlator;
    private final ContractResolver contractResolver;
    private final ComboDescriptionCache comboDescriptionCache;
    private final MarketDataMetrics metrics;
    private final GatewayProperties gatewayProperties;

    public RollOrderService(
            GatewayTransport transport,
            RequestCorrelator correlator,
            ContractResolver contractResolver,
            ComboDescriptionCache comboDescriptionCache,
            MarketDataMetrics metrics,
            GatewayProperties gatewayProperties) {
        this.transport = transport;
        this.correlator = correlator;
        this.contractResolver = contractResolver;
        this.comboDescriptionCache = comboDescriptionCache;
        this.metrics = metrics;
        this.gatewayProperties = gatewayProperties;
    }

    /**
     * @param accountQuantities contracts per account; accounts with zero or negative quantity are skipped
     * @return one PendingSubmit entry per order sent, in account order
     */
    public List<OrderStatusUpdate> placeRollOrder(RollOrderRequest request, Map<String, Integer> accountQuantities) {
        validate(request, accountQuantities);
        if (!transport.isConnected()) {
            throw new NotConnectedException("roll order " + request.getSymbol());
        }

        String symbol = request.getSymbol().trim().toUpperCase(Locale.ROOT);
        RollLeg closeLeg = request.getCloseLeg();
        RollLeg openLeg = request.getOpenLeg();

        CompletableFuture<Long> closeConId = contractResolver.resolveOptionAsync(
                symbol, closeLeg.expiry(), closeLeg.strike(), closeLeg.right(), RequestCategory.ROLL_RESOLUTION);
        CompletableFuture<Long> openConId = contractResolver.resolveOptionAsync(
                symbol, openLeg.expiry(), openLeg.strike(), openLeg.right(), RequestCategory.ROLL_RESOLUTION);

        long closeId;
        long openId;
        try {
            closeId = awaitLeg(closeConId, symbol);
            openId = awaitLeg(openConId, symbol);
        } catch (RuntimeException e) {
            log.warn("Roll order for {} aborted, leg resolution failed: {}", symbol, e.getMessage());
            throw new LegResolutionFailedException(symbol, e);
        }

        OrderSide closeAction = request.getDirection().closingSide();
        OrderSide openAction = closeAction.opposite();
        ContractSpec combo = ContractSpec.combo(
                symbol,
                List.of(
                        comboLeg(closeId, closeAction),
                        comboLeg(openId, openAction)),
                gatewayProperties.getExchange(),
                gatewayProperties.getCurrency());
        String description = describe(closeLeg, closeAction, openLeg, openAction);

        List<OrderStatusUpdate> placed = new ArrayList<>();
        for (Map.Entry<String, Integer> allocation : accountQuantities.entrySet()) {
            Integer quantity = allocation.getValue();
            if (quantity == null || quantity <= 0) {
                continue;
            }
            placed.add(placeComboOrder(symbol, combo, allocation.getKey(), quantity, request.getNetLimitPrice(), description));
        }
        log.info("Roll order {} {} placed for {} accounts at {}", symbol, description, placed.size(), request.getNetLimitPrice());
        return placed;
    }

    /** @throws ResourceNotFoundException when no combo order with that id was placed recently */
    public String getComboDescription(int orderId) {
        return comboDescriptionCache
                .get(orderId)
                .orElseThrow(() -> new ResourceNotFoundException("Combo order", String.valueOf(orderId)));
    }

    private OrderStatusUpdate placeComboOrder(
            String symbol, ContractSpec combo, String account, int quantity, BigDecimal netLimitPrice, String description) {
        int orderId = correlator.allocateId(RequestCategory.ORDER);
        GatewayOrder order = GatewayOrder.builder()
                .action(OrderSide.BUY)
                .orderType(OrderType.LIMIT)
                .totalQuantity(quantity)
                .limitPrice(netLimitPrice)
                .account(account)
                .transmit(true)
                .build();

        transport.placeOrder(orderId, combo, order);
        comboDescriptionCache.put(orderId, description);
        metrics.recordOrderPlaced("roll");
        log.debug("Combo order {} sent: account={}, qty={}, limit={}", orderId, account, quantity, netLimitPrice);

        return OrderStatusUpdate.builder()
                .orderId(orderId)
                .account(account)
                .symbol(symbol)
                .status(OrderStatusUpdate.PENDING_SUBMIT)
                .remaining(BigDecimal.valueOf(quantity))
                .description(description)
                .build();
    }

    private long awaitLeg(CompletableFuture<Long> leg, String symbol) {
        Duration timeout = gatewayProperties.getContractTimeout();
        return FutureAwaits.await(leg, timeout.plusSeconds(1), () -> {
            throw new ResolutionTimeoutException(symbol + " roll leg", timeout);
        });
    }

    private ComboLeg comboLeg(long conId, OrderSide action) {
        return ComboLeg.builder()
                .conId(conId)
                .ratio(1)
                .action(action)
                .exchange(gatewayProperties.getExchange())
                .build();
    }

    /** "+Mar7 590P → -Mar14 585P": sign from the leg action, expiry as month and day. */
    static String describe(RollLeg closeLeg, OrderSide closeAction, RollLeg openLeg, OrderSide openAction) {
        return describeLeg(closeLeg, closeAction) + " → " + describeLeg(openLeg, openAction);
    }

    private static String describeLeg(RollLeg leg, OrderSide action) {
        String sign = action == OrderSide.BUY ? "+" : "-";
        String expiry = LocalDate.parse(leg.expiry(), EXPIRY_FORMAT).format(LABEL_FORMAT);
        return sign + expiry + " " + Strikes.format(leg.strike()) + leg.right().getCode();
    }

    private static void validate(RollOrderRequest request, Map<String, Integer> accountQuantities) {
        if (request.getSymbol() == null || request.getSymbol().isBlank()) {
            throw new BusinessException("Roll order needs a symbol");
        }
        if (request.getCloseLeg() == null || request.getOpenLeg() == null) {
            throw new BusinessException("Roll order needs both a close leg and an open leg");
        }
        for (RollLeg leg : List.of(request.getCloseLeg(), request.getOpenLeg())) {
            if (leg.expiry() == null || leg.right() == null) {
                throw new BusinessException("Roll leg needs an expiry and a right");
            }
            try {
                LocalDate.parse(leg.expiry(), EXPIRY_FORMAT);
            } catch (DateTimeParseException e) {
                throw new BusinessException("Roll leg expiry must be yyyyMMdd: " + leg.expiry());
            }
        }
        if (request.getDirection() == null) {
            throw new BusinessException("Roll order needs the direction of the position being closed");
        }
        if (request.getNetLimitPrice() == null) {
            throw new BusinessException("Roll order needs a net limit price");
        }
        boolean anyQuantity = accountQuantities != null
                && accountQuantities.values().stream().anyMatch(quantity -> quantity != null && quantity > 0);
        if (!anyQuantity) {
            throw new BusinessException("Roll order needs at least one account with a positive quantity");
        }
    }
}
