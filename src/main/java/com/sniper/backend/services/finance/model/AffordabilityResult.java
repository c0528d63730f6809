package com.sniper.backend.services.finance.model;

import java.math.BigDecimal;

import com.sniper.backend.enums.AffordabilityStrategy;
import com.sniper.backend.enums.Currency;
import com.sniper.backend.enums.RiskLevel;

import lombok.Builder;

@Builder
public record AffordabilityResult(
        BigDecimal monthlyIncome,
        BigDecimal fixedExpenses,
        BigDecimal freeCashFlow,
        BigDecimal availableBudget,
        BigDecimal currentCommitments,
        BigDecimal itemPriceCash,
        BigDecimal itemPriceInstallment,
        int installmentCount,
        BigDecimal monthlyInstallment,
        boolean canAffordCash,
        boolean canAffordInstallment,
        BigDecimal newCommitmentPct,
        BigDecimal installmentAsIncomePct,
        BigDecimal cashDiscount,
        BigDecimal cashDiscountPct,
        int monthsToSaveCash,
        AffordabilityStrategy recommendation,
        String strategy,
        String reason,
        RiskLevel riskLevel,
        Currency currency
) {
}
