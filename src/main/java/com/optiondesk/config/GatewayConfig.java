package com.optiondesk.config;

import com.optiondesk.broker.GatewayTransport;
import com.optiondesk.broker.OfflineGatewayTransport;
import java.time.Clock;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Schedulers, clock and the fallback transport.
 *
 * <p>The real gateway session lives outside this service; a deployment registers its own
 * {@link GatewayTransport} bean. Without one the {@link OfflineGatewayTransport} is used, so
 * cached endpoints keep answering and everything else reports the gateway as not connected.
 */
@Configuration
public class GatewayConfig {

    private static final Logger log = LoggerFactory.getLogger(GatewayConfig.class);

    /** Request timeouts, batch timers and burst pacing. Never blocks on gateway I/O. */
    @Bean(name = "gatewayScheduler", destroyMethod = "shutdownNow")
    public ScheduledExecutorService gatewayScheduler(GatewayProperties gatewayProperties) {
        return Executors.newScheduledThreadPool(
                gatewayProperties.getSchedulerThreads(), daemonThreads("gateway-timer-"));
    }

    /**
     * Preloader cycles. Two threads: one runs the cycle, the other fires the periodic trigger
     * so a long cycle can be detected and skipped instead of queued.
     */
    @Bean(name = "preloaderScheduler", destroyMethod = "shutdownNow")
    public ScheduledExecutorService preloaderScheduler() {
        return Executors.newScheduledThreadPool(2, daemonThreads("greeks-preloader-"));
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean(GatewayTransport.class)
    public GatewayTransport offlineGatewayTransport() {
        log.warn("No gateway transport registered, running with the offline transport");
        return new OfflineGatewayTransport();
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
