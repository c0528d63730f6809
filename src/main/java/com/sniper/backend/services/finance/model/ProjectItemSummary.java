package com.sniper.backend.services.finance.model;

import java.math.BigDecimal;

import lombok.Builder;

@Builder
public record ProjectItemSummary(
        String name,
        String store,
        int quantity,
        BigDecimal totalCashPrice,
        BigDecimal totalInstallmentPrice,
        BigDecimal monthlyInstallment,
        BigDecimal savingsIfCash,
        boolean hasSavings
) {
}
