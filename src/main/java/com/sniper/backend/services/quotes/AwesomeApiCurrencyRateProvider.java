package com.sniper.backend.services.quotes;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Map;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpMethod;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.sniper.backend.config.CurrencyQuoteProperties;

import lombok.extern.slf4j.Slf4j;

/**
 * Cotação USD-BRL via AwesomeAPI (economia.awesomeapi.com.br).
 *
 * Resposta esperada: {@code {"USDBRL": {"bid": "5.1234", "create_date": "2024-05-10 14:59:58"}}}.
 */
@Component
@Slf4j
public class AwesomeApiCurrencyRateProvider implements CurrencyRateProvider {

    static final String PAIR_KEY = "USDBRL";
    static final String SOURCE = "AwesomeAPI";

    private static final DateTimeFormatter CREATE_DATE_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private static final ParameterizedTypeReference<Map<String, AwesomeQuote>> RESPONSE_TYPE =
            new ParameterizedTypeReference<>() {
            };

    private final RestTemplate restTemplate;
    private final CurrencyQuoteProperties properties;
    private final Clock clock;

    @Autowired
    public AwesomeApiCurrencyRateProvider(RestTemplate quoteRestTemplate, CurrencyQuoteProperties properties) {
        this(quoteRestTemplate, properties, Clock.systemDefaultZone());
    }

    AwesomeApiCurrencyRateProvider(RestTemplate restTemplate, CurrencyQuoteProperties properties, Clock clock) {
        this.restTemplate = restTemplate;
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public CurrencyQuote getCurrentRate() {
        try {
            ResponseEntity<Map<String, AwesomeQuote>> response = restTemplate.exchange(
                    properties.url(), HttpMethod.GET, null, RESPONSE_TYPE);

            Map<String, AwesomeQuote> body = response.getBody();
            AwesomeQuote quote = body != null ? body.get(PAIR_KEY) : null;
            if (quote == null || quote.bid() == null || quote.bid().isBlank()) {
                log.warn("[AwesomeAPI] Resposta sem {}.bid; usando fallback {}", PAIR_KEY, properties.fallbackRate());
                return fallback();
            }

            BigDecimal rate = new BigDecimal(quote.bid().trim());
            if (rate.signum() <= 0) {
                log.warn("[AwesomeAPI] Cotação inválida recebida: {}; usando fallback {}", rate, properties.fallbackRate());
                return fallback();
            }

            LocalDateTime asOf = parseCreateDate(quote.createDate());
            log.info("[AwesomeAPI] Cotação atualizada: 1 USD = {} BRL (asOf={})", rate, asOf);
            return CurrencyQuote.usdBrl(rate, asOf, SOURCE);
        } catch (RuntimeException e) {
            log.warn("[AwesomeAPI] Falha ao obter cotação ({}); usando fallback {}", e.toString(), properties.fallbackRate());
            return fallback();
        }
    }

    private CurrencyQuote fallback() {
        return CurrencyQuote.fallback(properties.fallbackRate(), LocalDateTime.now(clock));
    }

    private LocalDateTime parseCreateDate(String raw) {
        if (raw == null || raw.isBlank()) {
            return LocalDateTime.now(clock);
        }
        try {
            return LocalDateTime.parse(raw.trim(), CREATE_DATE_FORMAT);
        } catch (DateTimeParseException e) {
            log.debug("[AwesomeAPI] create_date fora do formato esperado: {}", raw);
            return LocalDateTime.now(clock);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record AwesomeQuote(
            @JsonProperty("bid") String bid,
            @JsonProperty("create_date") String createDate
    ) {
    }
}
