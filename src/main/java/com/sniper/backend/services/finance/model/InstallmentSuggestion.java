package com.sniper.backend.services.finance.model;

import java.math.BigDecimal;

import lombok.Builder;

/**
 * Sugestão de número de parcelas. Sem orçamento disponível as contagens ficam nulas.
 */
@Builder
public record InstallmentSuggestion(
        String suggestion,
        Integer minInstallments,
        Integer comfortableInstallments,
        BigDecimal itemPrice,
        BigDecimal userBudget
) {
}
