package com.sniper.backend.services.finance.model;

import java.math.BigDecimal;

import com.sniper.backend.enums.Currency;

import lombok.Builder;

/**
 * Oferta anotada com a análise de acessibilidade e o score (0-100, uma casa decimal).
 */
@Builder
public record ScoredOffer(
        String store,
        BigDecimal cashPrice,
        BigDecimal installmentPrice,
        int installmentCount,
        BigDecimal monthlyInstallment,
        boolean interestFree,
        boolean canAffordCash,
        boolean canAffordInstallment,
        BigDecimal cashDiscount,
        BigDecimal cashDiscountPct,
        BigDecimal commitmentPct,
        BigDecimal score,
        String url,
        Currency currency
) {
}
