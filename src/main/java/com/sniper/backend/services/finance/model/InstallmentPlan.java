package com.sniper.backend.services.finance.model;

import java.math.BigDecimal;

import com.sniper.backend.enums.Currency;

import lombok.Builder;

@Builder
public record InstallmentPlan(
        BigDecimal originalPrice,
        int numInstallments,
        BigDecimal interestRateMonthlyPct,
        BigDecimal installmentValue,
        BigDecimal totalWithInterest,
        BigDecimal interestPaid,
        boolean interestFree,
        Currency currency
) {
}
