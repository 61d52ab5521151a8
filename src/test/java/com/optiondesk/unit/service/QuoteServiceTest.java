package com.optiondesk.unit.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.optiondesk.broker.event.GatewayErrorEvent;
import com.optiondesk.broker.event.TickPriceEvent;
import com.optiondesk.broker.event.TickSnapshotEndEvent;
import com.optiondesk.domain.enums.MarketDataType;
import com.optiondesk.domain.enums.OptionRight;
import com.optiondesk.domain.enums.RequestCategory;
import com.optiondesk.domain.enums.SecurityType;
import com.optiondesk.domain.enums.TickType;
import com.optiondesk.domain.model.OptionContractRef;
import com.optiondesk.domain.model.OptionQuote;
import com.optiondesk.domain.model.StockQuote;
import com.optiondesk.exception.NotConnectedException;
import com.optiondesk.service.QuoteService;
import com.optiondesk.unit.support.TestGateway;
import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class QuoteServiceTest {

    private TestGateway gateway;
    private QuoteService quoteService;

    @BeforeEach
    void setUp() {
        gateway = new TestGateway();
        quoteService = new QuoteService(gateway.transport, gateway.correlator, gateway.properties);
    }

    @AfterEach
    void tearDown() {
        gateway.close();
    }

    @Nested
    @DisplayName("Stock quotes")
    class StockQuotes {

        @Test
        @DisplayName("Returns bid/ask/last once the snapshot ends")
        void getStockQuote_completesOnSnapshotEnd() {
            gateway.transport.respondToMarketData((id, contract) -> {
                gateway.transport.emit(new TickPriceEvent(id, TickType.DELAYED_BID, 589.9));
                gateway.transport.emit(new TickPriceEvent(id, TickType.DELAYED_ASK, 590.1));
                gateway.transport.emit(new TickSnapshotEndEvent(id));
            });

            StockQuote quote = quoteService.getStockQuote("qqq");

            assertThat(quote.getSymbol()).isEqualTo("QQQ");
            assertThat(quote.getBid()).isEqualByComparingTo("589.9");
            assertThat(quote.getAsk()).isEqualByComparingTo("590.1");
            assertThat(quote.getLast()).isEqualByComparingTo("0");
            assertThat(quote.referencePrice()).isEqualByComparingTo("590.0");
            assertThat(gateway.transport.getMarketDataTypes()).containsExactly(MarketDataType.DELAYED_FROZEN);
            assertThat(gateway.transport.getMarketDataRequests().values())
                    .allSatisfy(contract -> assertThat(contract.getSecType()).isEqualTo(SecurityType.STK));
        }

        @Test
        @DisplayName("Returns partial prices after the quote timeout")
        void getStockQuote_partialOnTimeout() {
            gateway.transport.respondToMarketData(
                    (id, contract) -> gateway.transport.emit(new TickPriceEvent(id, TickType.LAST, 590.25)));

            StockQuote quote = quoteService.getStockQuote("QQQ");

            assertThat(quote.getLast()).isEqualByComparingTo("590.25");
            assertThat(quote.getBid()).isEqualByComparingTo("0");
            int id = gateway.transport.getMarketDataRequests().keySet().iterator().next();
            assertThat(gateway.transport.getCancelledRequests()).contains(id);
            assertThat(gateway.correlator.pendingCount()).isZero();
        }

        @Test
        @DisplayName("A gateway error ends the quote with what arrived")
        void getStockQuote_errorEndsQuote() {
            gateway.transport.respondToMarketData(
                    (id, contract) -> gateway.transport.emit(new GatewayErrorEvent(id, 354, "Not subscribed")));

            StockQuote quote = quoteService.getStockQuote("QQQ");

            assertThat(quote.referencePrice()).isEqualByComparingTo("0");
        }

        @Test
        @DisplayName("Offline is an error")
        void getStockQuote_offline() {
            gateway.transport.setConnected(false);

            assertThatThrownBy(() -> quoteService.getStockQuote("QQQ")).isInstanceOf(NotConnectedException.class);
        }

        @Test
        @DisplayName("Quotes map keeps request order and prefers last, then bid, then ask")
        void getQuotes_displayPrice() {
            gateway.transport.respondToMarketData((id, contract) -> {
                switch (contract.getSymbol()) {
                    case "QQQ" -> {
                        gateway.transport.emit(new TickPriceEvent(id, TickType.BID, 589.9));
                        gateway.transport.emit(new TickPriceEvent(id, TickType.LAST, 590.0));
                    }
                    case "TQQQ" -> gateway.transport.emit(new TickPriceEvent(id, TickType.ASK, 81.5));
                    default -> {}
                }
                gateway.transport.emit(new TickSnapshotEndEvent(id));
            });

            Map<String, BigDecimal> quotes = quoteService.getQuotes(List.of("TQQQ", "qqq", "NONE"));

            assertThat(quotes.keySet()).containsExactly("TQQQ", "QQQ", "NONE");
            assertThat(quotes.get("QQQ")).isEqualByComparingTo("590.0");
            assertThat(quotes.get("TQQQ")).isEqualByComparingTo("81.5");
            assertThat(quotes.get("NONE")).isEqualByComparingTo("0");
        }

        @Test
        @DisplayName("Repeated symbols in the quotes map are requested once")
        void getQuotes_duplicateSymbolsRequestedOnce() {
            gateway.transport.respondToMarketData((id, contract) -> {
                gateway.transport.emit(new TickPriceEvent(id, TickType.LAST, 590.0));
                gateway.transport.emit(new TickSnapshotEndEvent(id));
            });

            Map<String, BigDecimal> quotes = quoteService.getQuotes(List.of("QQQ", " qqq", "QQQ"));

            assertThat(quotes).containsOnlyKeys("QQQ");
            assertThat(gateway.transport.getMarketDataRequests()).hasSize(1);
        }
    }

    @Nested
    @DisplayName("Option quotes")
    class OptionQuotes {

        @Test
        @DisplayName("One quote per contract in request order, from frozen snapshots")
        void getOptionQuotes() {
            gateway.transport.respondToMarketData((id, contract) -> {
                if (contract.getRight() == OptionRight.PUT) {
                    gateway.transport.emit(new TickPriceEvent(id, TickType.BID, 4.1));
                    gateway.transport.emit(new TickPriceEvent(id, TickType.ASK, 4.3));
                    gateway.transport.emit(new TickPriceEvent(id, TickType.LAST, 4.2));
                } else {
                    gateway.transport.emit(new TickSnapshotEndEvent(id));
                }
            });

            List<OptionQuote> quotes = quoteService.getOptionQuotes(List.of(
                    new OptionContractRef("QQQ", "20260220", new BigDecimal("590"), OptionRight.PUT),
                    new OptionContractRef("QQQ", "20260220", new BigDecimal("600"), OptionRight.CALL)));

            assertThat(quotes).hasSize(2);
            assertThat(quotes.get(0).getRight()).isEqualTo(OptionRight.PUT);
            assertThat(quotes.get(0).getLast()).isEqualByComparingTo("4.2");
            assertThat(quotes.get(1).getBid()).isEqualByComparingTo("0");
            assertThat(gateway.transport.getMarketDataTypes()).containsOnly(MarketDataType.FROZEN);
            assertThat(gateway.transport.getMarketDataRequests().keySet())
                    .allSatisfy(id -> assertThat(RequestCategory.OPTION_QUOTE.contains(id)).isTrue());
        }
    }
}
