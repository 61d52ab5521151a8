package com.optiondesk.config;

import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Timeouts, burst pacing and cache lifetimes for gateway requests.
 *
 * <p>Binds to {@code optiondesk.gateway.*}. Defaults match what the gateway tolerates in
 * practice: snapshots for a few dozen contracts normally arrive within a second of the last
 * request, contract lookups take up to several seconds when the gateway is cold.
 */
@Configuration
@ConfigurationProperties(prefix = "optiondesk.gateway")
@Getter
@Setter
public class GatewayProperties {

    /** Best-effort wait for a stock snapshot quote. Partial data is returned after this. */
    private Duration quoteTimeout = Duration.ofSeconds(3);

    /** Best-effort wait for a batch of single-option snapshot quotes. */
    private Duration optionQuoteTimeout = Duration.ofSeconds(8);

    /** Contract id resolution. */
    private Duration contractTimeout = Duration.ofSeconds(10);

    /** Option chain parameter fetch. */
    private Duration chainTimeout = Duration.ofSeconds(15);

    private Duration chainCacheTtl = Duration.ofMinutes(5);

    private int maxCachedChains = 200;

    /** Threads of the shared timer/burst scheduler. */
    private int schedulerThreads = 4;

    private String exchange = "SMART";

    private String currency = "USD";

    private Greeks greeks = new Greeks();

    @Getter
    @Setter
    public static class Greeks {

        /** Ceiling for one batch, measured from batch start. */
        private Duration hardTimeout = Duration.ofSeconds(8);

        /** Quiet period after the latest tick before a batch is considered settled. */
        private Duration settleDelay = Duration.ofMillis(1500);

        private int burstSize = 10;

        private Duration burstDelay = Duration.ofMillis(50);

        private Duration cacheTtl = Duration.ofSeconds(30);

        private int maxCachedKeys = 500;

        /** Per-batch count of contract errors written at INFO; the rest go to DEBUG. */
        private int loggedErrors = 3;
    }
}
