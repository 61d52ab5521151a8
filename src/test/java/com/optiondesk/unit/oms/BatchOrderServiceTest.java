package com.optiondesk.unit.oms;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.optiondesk.domain.enums.OptionRight;
import com.optiondesk.domain.enums.OrderSide;
import com.optiondesk.domain.enums.OrderType;
import com.optiondesk.domain.enums.SecurityType;
import com.optiondesk.domain.model.BatchOrderRequest;
import com.optiondesk.domain.model.ChainParams;
import com.optiondesk.domain.model.OptionBatchOrderRequest;
import com.optiondesk.domain.model.OrderStatusUpdate;
import com.optiondesk.exception.BusinessException;
import com.optiondesk.exception.GatewayException;
import com.optiondesk.exception.NotConnectedException;
import com.optiondesk.oms.BatchOrderService;
import com.optiondesk.service.OptionChainCache;
import com.optiondesk.unit.support.FakeGatewayTransport.PlacedOrder;
import com.optiondesk.unit.support.TestGateway;
import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class BatchOrderServiceTest {

    private TestGateway gateway;
    private OptionChainCache chainCache;
    private BatchOrderService service;

    @BeforeEach
    void setUp() {
        gateway = new TestGateway();
        chainCache = new OptionChainCache(gateway.properties, gateway.clock);
        service = new BatchOrderService(
                gateway.transport, gateway.correlator, chainCache, gateway.metrics, gateway.properties);
    }

    @AfterEach
    void tearDown() {
        gateway.close();
    }

    private static Map<String, Integer> accounts() {
        Map<String, Integer> accounts = new LinkedHashMap<>();
        accounts.put("U100", 10);
        accounts.put("U200", 0);
        accounts.put("U300", 25);
        return accounts;
    }

    @Test
    @DisplayName("One stock order per account with a positive quantity")
    void placeBatchOrders_onePerAccount() {
        BatchOrderRequest request = BatchOrderRequest.builder()
                .symbol("tqqq")
                .action(OrderSide.SELL)
                .orderType(OrderType.LIMIT)
                .limitPrice(new BigDecimal("81.50"))
                .build();

        List<OrderStatusUpdate> placed = service.placeBatchOrders(request, accounts());

        assertThat(placed).extracting(OrderStatusUpdate::getAccount).containsExactly("U100", "U300");
        assertThat(placed).allSatisfy(update -> assertThat(update.getSymbol()).isEqualTo("TQQQ"));
        List<PlacedOrder> orders = gateway.transport.getPlacedOrders();
        assertThat(orders).hasSize(2);
        assertThat(orders.get(0).contract().getSecType()).isEqualTo(SecurityType.STK);
        assertThat(orders.get(1).order().getTotalQuantity()).isEqualTo(25);
        assertThat(orders.get(1).order().getLimitPrice()).isEqualByComparingTo("81.50");
        assertThat(orders.get(1).order().getAccount()).isEqualTo("U300");
    }

    @Test
    @DisplayName("Market orders carry no limit price")
    void placeBatchOrders_marketOrder() {
        BatchOrderRequest request = BatchOrderRequest.builder()
                .symbol("QQQ")
                .action(OrderSide.BUY)
                .orderType(OrderType.MARKET)
                .limitPrice(new BigDecimal("590"))
                .build();

        service.placeBatchOrders(request, Map.of("U100", 1));

        assertThat(gateway.transport.getPlacedOrders().get(0).order().getLimitPrice()).isNull();
    }

    @Test
    @DisplayName("Limit orders need a positive limit price")
    void placeBatchOrders_limitWithoutPrice() {
        BatchOrderRequest request = BatchOrderRequest.builder()
                .symbol("QQQ")
                .action(OrderSide.BUY)
                .orderType(OrderType.LIMIT)
                .build();

        assertThatThrownBy(() -> service.placeBatchOrders(request, Map.of("U100", 1)))
                .isInstanceOf(BusinessException.class);
        assertThat(gateway.transport.getPlacedOrders()).isEmpty();
    }

    @Test
    @DisplayName("Offline batches fail before any order")
    void placeBatchOrders_offline() {
        gateway.transport.setConnected(false);
        BatchOrderRequest request = BatchOrderRequest.builder()
                .symbol("QQQ")
                .action(OrderSide.BUY)
                .orderType(OrderType.MARKET)
                .build();

        assertThatThrownBy(() -> service.placeBatchOrders(request, Map.of("U100", 1)))
                .isInstanceOf(NotConnectedException.class);
    }

    @Test
    @DisplayName("A gateway failure stops the batch at the failing account")
    void placeBatchOrders_gatewayFailure() {
        gateway.transport.failPlaceOrder(new GatewayException("order rejected by gateway"));
        BatchOrderRequest request = BatchOrderRequest.builder()
                .symbol("QQQ")
                .action(OrderSide.BUY)
                .orderType(OrderType.MARKET)
                .build();

        assertThatThrownBy(() -> service.placeBatchOrders(request, accounts())).isInstanceOf(GatewayException.class);
    }

    @Test
    @DisplayName("Option orders use the chain's trading class and are counted")
    void placeOptionBatchOrders() {
        chainCache.put("QQQ", List.of(ChainParams.builder()
                .exchange("SMART")
                .tradingClass("QQQ")
                .multiplier("100")
                .expirations(List.of("20260220"))
                .strikes(List.of(new BigDecimal("590")))
                .build()));
        OptionBatchOrderRequest request = OptionBatchOrderRequest.builder()
                .symbol("QQQ")
                .expiry("20260220")
                .strike(new BigDecimal("590.0"))
                .right(OptionRight.PUT)
                .action(OrderSide.BUY)
                .orderType(OrderType.LIMIT)
                .limitPrice(new BigDecimal("4.20"))
                .build();

        service.placeOptionBatchOrders(request, accounts());

        PlacedOrder order = gateway.transport.getPlacedOrders().get(0);
        assertThat(order.contract().getSecType()).isEqualTo(SecurityType.OPT);
        assertThat(order.contract().getTradingClass()).isEqualTo("QQQ");
        assertThat(order.contract().getStrike()).isEqualTo(new BigDecimal("590"));
        double count = gateway.meterRegistry
                .get("optiondesk.orders.placed")
                .tag("kind", "option")
                .counter()
                .count();
        assertThat(count).isEqualTo(2.0);
    }

    @Test
    @DisplayName("Option orders need expiry, strike and right")
    void placeOptionBatchOrders_missingContract() {
        OptionBatchOrderRequest request = OptionBatchOrderRequest.builder()
                .symbol("QQQ")
                .action(OrderSide.BUY)
                .orderType(OrderType.MARKET)
                .build();

        assertThatThrownBy(() -> service.placeOptionBatchOrders(request, accounts()))
                .isInstanceOf(BusinessException.class);
    }
}
