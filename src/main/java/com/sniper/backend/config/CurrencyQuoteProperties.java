package com.sniper.backend.config;

import java.math.BigDecimal;
import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "sniper.quotes")
public record CurrencyQuoteProperties(
        String url,
        Duration timeout,
        BigDecimal fallbackRate
) {
    public CurrencyQuoteProperties {
        if (url == null || url.isBlank()) {
            url = "https://economia.awesomeapi.com.br/json/last/USD-BRL";
        }
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            timeout = Duration.ofSeconds(10);
        }
        if (fallbackRate == null) {
            fallbackRate = new BigDecimal("5.50");
        }
    }

    public static CurrencyQuoteProperties defaults() {
        return new CurrencyQuoteProperties(null, null, null);
    }
}
