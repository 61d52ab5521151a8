package com.optiondesk.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Background greeks preloading, bound to {@code optiondesk.preloader.*}. */
@Configuration
@ConfigurationProperties(prefix = "optiondesk.preloader")
@Getter
@Setter
public class PreloaderProperties {

    /** When false the preloader ignores connection events; manual start still works. */
    private boolean enabled = true;

    private List<String> symbols = new ArrayList<>(List.of("QQQ", "TQQQ"));

    private Duration interval = Duration.ofSeconds(30);

    private Duration initialDelay = Duration.ofSeconds(3);

    /** Nearest expirations refreshed per symbol. */
    private int expirations = 3;

    /** Strikes kept on each side of the at-the-money strike. */
    private int strikeRadius = 40;

    /** Half width of the middle-of-chain window used when no stock price is known. */
    private int fallbackHalfWidth = 5;
}
