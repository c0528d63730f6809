package com.sniper.backend.services.finance.model;

import java.math.BigDecimal;
import java.util.List;

import com.sniper.backend.enums.Currency;
import com.sniper.backend.enums.ProjectType;

import lombok.Builder;

@Builder(toBuilder = true)
public record ProjectSummary(
        String name,
        ProjectType projectType,
        List<ProjectItemSummary> items,
        BigDecimal totalCashPrice,
        BigDecimal totalInstallmentPrice,
        BigDecimal totalMonthlyInstallment,
        BigDecimal savingsIfCash,
        BigDecimal monthlyBudget,
        boolean overBudget,
        BigDecimal budgetPercentageUsed,
        BudgetAlert budgetAlert,
        ProjectSuggestions suggestions,
        Currency currency
) {
}
