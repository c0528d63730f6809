package com.sniper.backend.services.finance.model;

import java.math.BigDecimal;
import java.time.LocalDateTime;

import com.sniper.backend.enums.Currency;

import lombok.Builder;

/**
 * Custo de importação em reais. Campos monetários arredondados (HALF_UP, 2 casas)
 * apenas aqui, na saída.
 */
@Builder
public record ImportCostBreakdown(
        BigDecimal priceUsd,
        BigDecimal shippingUsd,
        BigDecimal totalUsd,
        BigDecimal dollarRate,
        LocalDateTime rateTimestamp,
        boolean rateFallback,
        BigDecimal baseBrl,
        BigDecimal importTaxRate,
        BigDecimal importTaxBrl,
        BigDecimal subtotalBrl,
        BigDecimal icmsRate,
        BigDecimal icmsBrl,
        BigDecimal totalBrl,
        boolean remessaConforme,
        Currency sourceCurrency,
        Currency targetCurrency
) {
}
