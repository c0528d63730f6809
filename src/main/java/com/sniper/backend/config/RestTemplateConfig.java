package com.sniper.backend.config;

import java.time.Duration;

import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

/**
 * RestTemplate usado na consulta de cotação. O timeout é sempre limitado:
 * uma cotação lenta cai no valor de fallback em vez de bloquear a requisição.
 */
@Configuration
public class RestTemplateConfig {

    @Bean
    public RestTemplate quoteRestTemplate(RestTemplateBuilder builder, CurrencyQuoteProperties quoteProperties) {
        Duration timeout = quoteProperties.timeout();

        return builder
                .setConnectTimeout(timeout)
                .setReadTimeout(timeout)
                .build();
    }
}
