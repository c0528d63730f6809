package com.sniper.backend.services.finance.model;

import java.math.BigDecimal;

import com.sniper.backend.enums.Currency;

import lombok.Builder;

/**
 * Capacidade de pagamento calculada a partir de um {@link FinancialProfile}.
 * Valores em precisão cheia; podem ser negativos quando o perfil está comprometido além do fluxo.
 */
@Builder
public record CapacitySnapshot(
        BigDecimal monthlyIncome,
        BigDecimal fixedExpenses,
        BigDecimal safetyMarginPct,
        BigDecimal safetyMargin,
        BigDecimal freeCashFlow,
        BigDecimal currentCommitments,
        BigDecimal availableForNew,
        BigDecimal safeInstallmentCapacity,
        BigDecimal maxInstallmentCapacity,
        BigDecimal commitmentPercentage,
        boolean overCommitted,
        Currency currency
) {
}
