package com.sniper.backend.services.finance.model;

import java.math.BigDecimal;

import com.sniper.backend.services.finance.FinanceValidation;

/**
 * Perfil financeiro mensal do usuário. Valor imutável: as grandezas derivadas
 * (margem, fluxo livre, disponível) são calculadas pelo {@code CapacityCalculator}.
 */
public record FinancialProfile(
        BigDecimal monthlyIncome,
        BigDecimal fixedExpenses,
        BigDecimal safetyMarginPct,
        BigDecimal currentCommitments
) {
    public static final BigDecimal DEFAULT_SAFETY_MARGIN_PCT = new BigDecimal("10");

    public FinancialProfile {
        FinanceValidation.requireNonNegative(monthlyIncome, "Renda mensal");
        FinanceValidation.requireNonNegative(fixedExpenses, "Gastos fixos");
        safetyMarginPct = safetyMarginPct == null
                ? DEFAULT_SAFETY_MARGIN_PCT
                : FinanceValidation.requirePercentage(safetyMarginPct, "Margem de segurança");
        currentCommitments = FinanceValidation.nonNegativeOrZero(currentCommitments, "Compromissos atuais");
    }

    public static FinancialProfile of(BigDecimal monthlyIncome, BigDecimal fixedExpenses) {
        return new FinancialProfile(monthlyIncome, fixedExpenses, null, null);
    }

    public FinancialProfile withCommitments(BigDecimal commitments) {
        return new FinancialProfile(monthlyIncome, fixedExpenses, safetyMarginPct, commitments);
    }
}
