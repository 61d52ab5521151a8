package com.optiondesk.unit.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.optiondesk.broker.ContractResolver;
import com.optiondesk.broker.event.ContractDetailsEndEvent;
import com.optiondesk.broker.event.ContractDetailsEvent;
import com.optiondesk.broker.event.OptionParameterEndEvent;
import com.optiondesk.broker.event.OptionParameterEvent;
import com.optiondesk.domain.model.ChainParams;
import com.optiondesk.exception.ContractNotFoundException;
import com.optiondesk.exception.NotConnectedException;
import com.optiondesk.service.OptionChainCache;
import com.optiondesk.service.OptionChainService;
import com.optiondesk.unit.support.TestGateway;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class OptionChainServiceTest {

    private static final long QQQ_CON_ID = 320227571L;

    private TestGateway gateway;
    private OptionChainCache chainCache;
    private OptionChainService service;

    @BeforeEach
    void setUp() {
        gateway = new TestGateway();
        chainCache = new OptionChainCache(gateway.properties, gateway.clock);
        ContractResolver resolver =
                new ContractResolver(gateway.transport, gateway.correlator, chainCache, gateway.properties);
        service = new OptionChainService(
                gateway.transport, gateway.correlator, resolver, chainCache, gateway.properties);
        gateway.transport.respondToContractDetails((id, contract) -> {
            gateway.transport.emit(new ContractDetailsEvent(id, QQQ_CON_ID, contract.getSymbol(), contract.getSymbol()));
            gateway.transport.emit(new ContractDetailsEndEvent(id));
        });
    }

    @AfterEach
    void tearDown() {
        gateway.close();
    }

    private OptionParameterEvent series(int id, String exchange) {
        Set<String> expirations = new LinkedHashSet<>(List.of("20260227", "20260220"));
        Set<BigDecimal> strikes =
                new LinkedHashSet<>(List.of(new BigDecimal("595.0"), new BigDecimal("590"), new BigDecimal("592.5")));
        return new OptionParameterEvent(id, exchange, QQQ_CON_ID, "QQQ", "100", expirations, strikes);
    }

    private void answerWithTwoSeries() {
        gateway.transport.respondToOptionParameters((id, conId) -> {
            gateway.transport.emit(series(id, "SMART"));
            gateway.transport.emit(series(id, "CBOE"));
            gateway.transport.emit(new OptionParameterEndEvent(id));
        });
    }

    @Nested
    @DisplayName("Fetching")
    class Fetching {

        @Test
        @DisplayName("Collects every series until the end marker, sorted and normalized")
        void getOptionChain_collectsSeries() {
            answerWithTwoSeries();

            List<ChainParams> chain = service.getOptionChain("qqq");

            assertThat(chain).hasSize(2);
            ChainParams smart = chain.get(0);
            assertThat(smart.getExchange()).isEqualTo("SMART");
            assertThat(smart.getTradingClass()).isEqualTo("QQQ");
            assertThat(smart.getExpirations()).containsExactly("20260220", "20260227");
            assertThat(smart.getStrikes())
                    .containsExactly(new BigDecimal("590"), new BigDecimal("592.5"), new BigDecimal("595"));
            assertThat(gateway.transport.getOptionParameterRequests().values()).containsOnly(QQQ_CON_ID);
        }

        @Test
        @DisplayName("A fresh chain is served from cache")
        void getOptionChain_servesFreshFromCache() {
            answerWithTwoSeries();
            service.getOptionChain("QQQ");

            service.getOptionChain("QQQ");

            assertThat(gateway.transport.getOptionParameterRequests()).hasSize(1);
            assertThat(gateway.transport.getContractDetailsRequests()).hasSize(1);
        }

        @Test
        @DisplayName("A chain older than the TTL is fetched again")
        void getOptionChain_refetchesAfterTtl() {
            answerWithTwoSeries();
            service.getOptionChain("QQQ");
            gateway.clock.advance(gateway.properties.getChainCacheTtl().plusSeconds(1));

            service.getOptionChain("QQQ");

            assertThat(gateway.transport.getOptionParameterRequests()).hasSize(2);
            assertThat(gateway.transport.getContractDetailsRequests()).hasSize(1);
        }

        @Test
        @DisplayName("An empty answer is returned but not cached")
        void getOptionChain_doesNotCacheEmpty() {
            gateway.transport.respondToOptionParameters(
                    (id, conId) -> gateway.transport.emit(new OptionParameterEndEvent(id)));

            assertThat(service.getOptionChain("QQQ")).isEmpty();
            assertThat(chainCache.peek("QQQ")).isEmpty();
        }

        @Test
        @DisplayName("Series received before the chain timeout are returned when the end marker never comes")
        void getOptionChain_partialOnTimeout() {
            gateway.transport.respondToOptionParameters((id, conId) -> gateway.transport.emit(series(id, "SMART")));

            List<ChainParams> chain = service.getOptionChain("QQQ");

            assertThat(chain).hasSize(1);
            assertThat(gateway.correlator.pendingCount()).isZero();
        }
    }

    @Nested
    @DisplayName("Degraded answers")
    class Degraded {

        @Test
        @DisplayName("Offline without a cached chain is an error")
        void offlineWithoutCache() {
            gateway.transport.setConnected(false);

            assertThatThrownBy(() -> service.getOptionChain("QQQ")).isInstanceOf(NotConnectedException.class);
        }

        @Test
        @DisplayName("Offline with a stale chain serves it")
        void offlineServesStale() {
            answerWithTwoSeries();
            service.getOptionChain("QQQ");
            gateway.clock.advance(Duration.ofHours(1));
            gateway.transport.setConnected(false);

            assertThat(service.getOptionChain("QQQ")).hasSize(2);
        }

        @Test
        @DisplayName("An unknown underlying fails when nothing is cached")
        void unknownUnderlying() {
            gateway.transport.respondToContractDetails(
                    (id, contract) -> gateway.transport.emit(new ContractDetailsEndEvent(id)));

            assertThatThrownBy(() -> service.getOptionChain("NOPE")).isInstanceOf(ContractNotFoundException.class);
        }

        @Test
        @DisplayName("A failed refresh of a stale chain serves the stale chain")
        void failedRefreshServesStale() {
            chainCache.put("QQQ", List.of(ChainParams.builder()
                    .exchange("SMART")
                    .tradingClass("QQQ")
                    .multiplier("100")
                    .expirations(List.of("20260220"))
                    .strikes(List.of(new BigDecimal("590")))
                    .build()));
            gateway.clock.advance(Duration.ofHours(1));
            gateway.transport.respondToContractDetails(
                    (id, contract) -> gateway.transport.emit(new ContractDetailsEndEvent(id)));

            assertThat(service.getOptionChain("QQQ")).hasSize(1);
        }
    }
}
