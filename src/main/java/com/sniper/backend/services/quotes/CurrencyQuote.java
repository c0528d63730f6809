package com.sniper.backend.services.quotes;

import java.math.BigDecimal;
import java.time.LocalDateTime;

import com.sniper.backend.enums.Currency;
import com.sniper.backend.services.finance.MoneyUtils;

/**
 * Cotação USD -> BRL com o instante a que se refere.
 * {@code fallback} indica que a consulta falhou e o valor padrão foi usado.
 */
public record CurrencyQuote(
        BigDecimal rate,
        LocalDateTime asOf,
        boolean fallback,
        String source,
        Currency baseCurrency,
        Currency quoteCurrency
) {
    public static final String FALLBACK_SOURCE = "fallback";

    public static CurrencyQuote usdBrl(BigDecimal rate, LocalDateTime asOf, String source) {
        return new CurrencyQuote(rate, asOf, false, source, Currency.USD, Currency.BRL);
    }

    public static CurrencyQuote fallback(BigDecimal rate, LocalDateTime asOf) {
        return new CurrencyQuote(rate, asOf, true, FALLBACK_SOURCE, Currency.USD, Currency.BRL);
    }

    public String formatted() {
        return MoneyUtils.formatRate(rate);
    }
}
