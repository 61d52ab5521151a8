package com.optiondesk.unit.broker;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.optiondesk.broker.ContractResolver;
import com.optiondesk.broker.event.ContractDetailsEndEvent;
import com.optiondesk.broker.event.ContractDetailsEvent;
import com.optiondesk.broker.event.GatewayErrorEvent;
import com.optiondesk.domain.enums.OptionRight;
import com.optiondesk.domain.enums.RequestCategory;
import com.optiondesk.domain.enums.SecurityType;
import com.optiondesk.domain.model.ChainParams;
import com.optiondesk.domain.model.ContractSpec;
import com.optiondesk.exception.ContractNotFoundException;
import com.optiondesk.exception.NotConnectedException;
import com.optiondesk.exception.ResolutionTimeoutException;
import com.optiondesk.service.OptionChainCache;
import com.optiondesk.unit.support.TestGateway;
import java.math.BigDecimal;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for {@link ContractResolver}: caching, coalescing of concurrent lookups and the
 * failure modes of a contract-details request.
 */
class ContractResolverTest {

    private static final String EXPIRY = "20260220";

    private TestGateway gateway;
    private OptionChainCache chainCache;
    private ContractResolver resolver;

    @BeforeEach
    void setUp() {
        gateway = new TestGateway();
        chainCache = new OptionChainCache(gateway.properties, gateway.clock);
        resolver = new ContractResolver(gateway.transport, gateway.correlator, chainCache, gateway.properties);
    }

    @AfterEach
    void tearDown() {
        gateway.close();
    }

    private void answerWithConId(long conId) {
        gateway.transport.respondToContractDetails((id, contract) -> {
            gateway.transport.emit(new ContractDetailsEvent(id, conId, contract.getSymbol(), contract.getSymbol()));
            gateway.transport.emit(new ContractDetailsEndEvent(id));
        });
    }

    @Nested
    @DisplayName("Successful resolution")
    class Successful {

        @Test
        @DisplayName("Resolves an underlying as a SMART/USD stock")
        void resolveUnderlying_sendsStockContract() {
            answerWithConId(320227571L);

            long conId = resolver.resolveUnderlying("qqq");

            assertThat(conId).isEqualTo(320227571L);
            ContractSpec sent = gateway.transport.getContractDetailsRequests().values().iterator().next();
            assertThat(sent.getSymbol()).isEqualTo("QQQ");
            assertThat(sent.getSecType()).isEqualTo(SecurityType.STK);
            assertThat(sent.getExchange()).isEqualTo("SMART");
            assertThat(sent.getCurrency()).isEqualTo("USD");
        }

        @Test
        @DisplayName("Second lookup of the same key is served from cache")
        void resolveOption_cachesResult() {
            answerWithConId(700001L);

            long first = resolver.resolveOption("QQQ", EXPIRY, new BigDecimal("590"), OptionRight.PUT);
            long second = resolver.resolveOption("QQQ", EXPIRY, new BigDecimal("590.0"), OptionRight.PUT);

            assertThat(first).isEqualTo(700001L);
            assertThat(second).isEqualTo(700001L);
            assertThat(gateway.transport.getContractDetailsRequests()).hasSize(1);
            assertThat(resolver.getCachedOption("QQQ", EXPIRY, new BigDecimal("590"), OptionRight.PUT))
                    .contains(700001L);
        }

        @Test
        @DisplayName("Cached ids are returned even while offline")
        void resolveOption_cachedWhileOffline() {
            answerWithConId(700001L);
            resolver.resolveOption("QQQ", EXPIRY, new BigDecimal("590"), OptionRight.PUT);
            gateway.transport.setConnected(false);

            assertThat(resolver.resolveOption("QQQ", EXPIRY, new BigDecimal("590"), OptionRight.PUT))
                    .isEqualTo(700001L);
        }

        @Test
        @DisplayName("Concurrent lookups of one key share a single request")
        void resolveOptionAsync_coalescesConcurrentLookups() throws Exception {
            CountDownLatch release = new CountDownLatch(1);
            gateway.transport.respondToContractDetails((id, contract) -> {
                try {
                    release.await(2, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                gateway.transport.emit(new ContractDetailsEvent(id, 555L, "QQQ", "QQQ"));
            });

            CompletableFuture<Long> first = resolver.resolveOptionAsync(
                    "QQQ", EXPIRY, new BigDecimal("595"), OptionRight.CALL, RequestCategory.CONTRACT);
            CompletableFuture<Long> second = resolver.resolveOptionAsync(
                    "QQQ", EXPIRY, new BigDecimal("595"), OptionRight.CALL, RequestCategory.CONTRACT);
            release.countDown();

            assertThat(first.get(2, TimeUnit.SECONDS)).isEqualTo(555L);
            assertThat(second.get(2, TimeUnit.SECONDS)).isEqualTo(555L);
            assertThat(gateway.transport.getContractDetailsRequests()).hasSize(1);
        }

        @Test
        @DisplayName("Roll resolutions use the ROLL_RESOLUTION id range")
        void resolveOptionAsync_usesRequestedCategory() throws Exception {
            answerWithConId(1L);

            resolver.resolveOptionAsync("QQQ", EXPIRY, new BigDecimal("590"), OptionRight.PUT, RequestCategory.ROLL_RESOLUTION)
                    .get(2, TimeUnit.SECONDS);

            int id = gateway.transport.getContractDetailsRequests().keySet().iterator().next();
            assertThat(RequestCategory.ROLL_RESOLUTION.contains(id)).isTrue();
        }

        @Test
        @DisplayName("Option lookups carry the trading class from cached chain data")
        void resolveOption_usesTradingClassFromChain() {
            chainCache.put("SPX", List.of(
                    ChainParams.builder()
                            .exchange("SMART")
                            .tradingClass("SPX")
                            .multiplier("100")
                            .expirations(List.of("20260320"))
                            .strikes(List.of(new BigDecimal("5800")))
                            .build(),
                    ChainParams.builder()
                            .exchange("SMART")
                            .tradingClass("SPXW")
                            .multiplier("100")
                            .expirations(List.of(EXPIRY))
                            .strikes(List.of(new BigDecimal("5800")))
                            .build()));
            answerWithConId(42L);

            resolver.resolveOption("SPX", EXPIRY, new BigDecimal("5800"), OptionRight.CALL);

            ContractSpec sent = gateway.transport.getContractDetailsRequests().values().iterator().next();
            assertThat(sent.getTradingClass()).isEqualTo("SPXW");
            assertThat(sent.getSecType()).isEqualTo(SecurityType.OPT);
            assertThat(sent.getLastTradeDate()).isEqualTo(EXPIRY);
        }

        @Test
        @DisplayName("Untrimmed lower-case symbols still find the cached chain's trading class")
        void resolveOption_tradingClassForUnnormalizedSymbol() {
            chainCache.put("SPX", List.of(ChainParams.builder()
                    .exchange("SMART")
                    .tradingClass("SPXW")
                    .multiplier("100")
                    .expirations(List.of(EXPIRY))
                    .strikes(List.of(new BigDecimal("5800")))
                    .build()));
            answerWithConId(42L);

            resolver.resolveOption(" spx ", EXPIRY, new BigDecimal("5800"), OptionRight.PUT);

            ContractSpec sent = gateway.transport.getContractDetailsRequests().values().iterator().next();
            assertThat(sent.getSymbol()).isEqualTo("SPX");
            assertThat(sent.getTradingClass()).isEqualTo("SPXW");
        }
    }

    @Nested
    @DisplayName("Failures")
    class Failures {

        @Test
        @DisplayName("End marker without details means the contract does not exist")
        void resolveOption_notFoundOnEmptyAnswer() {
            gateway.transport.respondToContractDetails(
                    (id, contract) -> gateway.transport.emit(new ContractDetailsEndEvent(id)));

            assertThatThrownBy(() -> resolver.resolveOption("QQQ", EXPIRY, new BigDecimal("1234"), OptionRight.CALL))
                    .isInstanceOf(ContractNotFoundException.class)
                    .hasMessageContaining("QQQ|20260220|1234|C");
        }

        @Test
        @DisplayName("Gateway error fails the lookup and is not cached")
        void resolveOption_errorIsNotCached() {
            gateway.transport.respondToContractDetails((id, contract) ->
                    gateway.transport.emit(new GatewayErrorEvent(id, 200, "No security definition has been found")));

            assertThatThrownBy(() -> resolver.resolveOption("QQQ", EXPIRY, new BigDecimal("590"), OptionRight.PUT))
                    .isInstanceOf(ContractNotFoundException.class)
                    .hasMessageContaining("200");
            assertThat(resolver.getCachedOption("QQQ", EXPIRY, new BigDecimal("590"), OptionRight.PUT))
                    .isEmpty();
        }

        @Test
        @DisplayName("No answer within the contract timeout is a resolution timeout")
        void resolveOption_timesOut() {
            assertThatThrownBy(() -> resolver.resolveOption("QQQ", EXPIRY, new BigDecimal("590"), OptionRight.PUT))
                    .isInstanceOf(ResolutionTimeoutException.class);
            assertThat(gateway.correlator.pendingCount()).isZero();
        }

        @Test
        @DisplayName("Uncached lookup while offline fails without a request")
        void resolveOptionAsync_offline() {
            gateway.transport.setConnected(false);

            CompletableFuture<Long> future = resolver.resolveOptionAsync(
                    "QQQ", EXPIRY, new BigDecimal("590"), OptionRight.PUT, RequestCategory.CONTRACT);

            assertThatThrownBy(() -> future.get(1, TimeUnit.SECONDS))
                    .isInstanceOf(ExecutionException.class)
                    .hasCauseInstanceOf(NotConnectedException.class);
            assertThat(gateway.transport.getContractDetailsRequests()).isEmpty();
        }
    }
}
